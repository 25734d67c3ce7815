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
 * Rapid capacity fade detector.
 *
 * <p>
 * Compares the retention at the fade cycle (cycle 10 by default, or the last
 * valid cycle before it when the series is shorter) with the first valid
 * cycle. Fires when more than 20 % of the initial capacity is gone.
 * </p>
 *
 * @since 1.0.0
 */
public class RapidCapacityFadeDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RapidCapacityFadeDetector.class);

    static final double CRITICAL_CONFIDENCE = 95.0;
    static final double WARNING_CONFIDENCE = 85.0;

    private final int fadeCycle;
    private final double retentionLimit;
    private final double criticalRetention;

    /**
     * @param thresholds detector limits
     * @throws NullPointerException if {@code thresholds} is {@code null}
     */
    public RapidCapacityFadeDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.fadeCycle = thresholds.getRapidFadeCycle();
        this.retentionLimit = thresholds.getRapidFadeRetention();
        this.criticalRetention = thresholds.getRapidFadeCriticalRetention();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        List<CyclePoint> retention = context.getMetrics().getRetention();
        CyclePoint reference = retention.isEmpty() ? null : retention.get(0);
        CyclePoint evaluated = null;
        for (int i = 1; i < retention.size() && retention.get(i).getCycle() <= fadeCycle; i++) {
            evaluated = retention.get(i);
        }

        if (evaluated == null) {
            LOG.trace("[{}] {}: no retention point up to cycle {} – skipping",
                    context.getCellIdentifier(), getName(), fadeCycle);
            return List.of();
        }

        double value = evaluated.getValue();
        if (value >= retentionLimit) {
            return List.of();
        }

        boolean critical = value < criticalRetention;
        LOG.debug("[{}] {} fired: retention={} at cycle {}",
                context.getCellIdentifier(), getName(), value, evaluated.getCycle());

        return List.of(Flag.builder()
                .type(FlagType.RAPID_CAPACITY_FADE)
                .severity(critical ? Severity.CRITICAL : Severity.WARNING)
                .confidence(critical ? CRITICAL_CONFIDENCE : WARNING_CONFIDENCE)
                .message(String.format(Locale.ROOT,
                        "Cell shows rapid capacity loss: %.1f%% retention at cycle %d",
                        value * 100, evaluated.getCycle()))
                .recommendation("Check electrode processing quality, electrolyte compatibility, and cycling "
                        + "conditions. Consider cell manufacturing defects.")
                .cycleRange(CycleRange.of(reference.getCycle(), evaluated.getCycle()))
                .metricValue(value)
                .thresholdValue(retentionLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.RAPID_CAPACITY_FADE;
    }
}
