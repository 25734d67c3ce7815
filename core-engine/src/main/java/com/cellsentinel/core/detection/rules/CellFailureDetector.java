package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.metrics.CyclePoint;
import com.cellsentinel.core.model.CycleRange;
import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Early cell failure detector.
 *
 * <p>
 * Fires on the first cycle within the failure window (the first 50 cycles by
 * default) whose retention falls below half of the initial capacity. A cell
 * that only reaches that point later is aging, not failing early.
 * </p>
 *
 * @since 1.0.0
 */
public class CellFailureDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CellFailureDetector.class);

    static final double CONFIDENCE = 98.0;

    private final double failureRetention;
    private final int cycleWindow;

    public CellFailureDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.failureRetention = thresholds.getFailureRetention();
        this.cycleWindow = thresholds.getFailureCycleWindow();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        for (CyclePoint p : context.getMetrics().getRetention()) {
            if (p.getCycle() > cycleWindow) {
                break;
            }
            if (p.getValue() < failureRetention) {
                LOG.debug("[{}] {} fired: retention={} at cycle {}",
                        context.getCellIdentifier(), getName(), p.getValue(), p.getCycle());
                return List.of(Flag.builder()
                        .type(FlagType.CELL_FAILURE)
                        .severity(Severity.CRITICAL)
                        .confidence(CONFIDENCE)
                        .message(String.format(Locale.ROOT,
                                "Cell failure detected: capacity dropped to %.1f%% of initial value at cycle %d",
                                p.getValue() * 100, p.getCycle()))
                        .recommendation("Cell has failed. Check for internal short, dendrite formation, or "
                                + "severe degradation. Data may not be reliable.")
                        .cycleRange(CycleRange.single(p.getCycle()))
                        .metricValue(p.getValue())
                        .thresholdValue(failureRetention)
                        .build());
            }
        }
        return List.of();
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.CELL_FAILURE;
    }
}
