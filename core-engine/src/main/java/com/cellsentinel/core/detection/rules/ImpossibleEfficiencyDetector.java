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
 * Coulombic efficiency above what a real cell can deliver.
 *
 * <p>
 * Values above 105 % point at a measurement or processing error. The flag
 * reports the largest offending value and the cycle it occurred on.
 * </p>
 *
 * @since 1.0.0
 */
public class ImpossibleEfficiencyDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ImpossibleEfficiencyDetector.class);

    static final double CONFIDENCE = 99.0;

    private final double efficiencyLimit;

    public ImpossibleEfficiencyDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.efficiencyLimit = thresholds.getImpossibleEfficiency();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        CyclePoint worst = null;
        int firstCycle = 0;
        int lastCycle = 0;
        for (CyclePoint p : context.getMetrics().getEfficiencies()) {
            if (p.getValue() <= efficiencyLimit) {
                continue;
            }
            if (worst == null) {
                firstCycle = p.getCycle();
                worst = p;
            } else if (p.getValue() > worst.getValue()) {
                worst = p;
            }
            lastCycle = p.getCycle();
        }

        if (worst == null) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: maxCe={} at cycle {}",
                context.getCellIdentifier(), getName(), worst.getValue(), worst.getCycle());
        return List.of(Flag.builder()
                .type(FlagType.IMPOSSIBLE_EFFICIENCY)
                .severity(Severity.CRITICAL)
                .confidence(CONFIDENCE)
                .message(String.format(Locale.ROOT,
                        "Impossible coulombic efficiency detected: %.1f%% at cycle %d",
                        worst.getValue() * 100, worst.getCycle()))
                .recommendation("CE > 105% indicates measurement error or data processing issue. "
                        + "Check current measurement calibration.")
                .cycleRange(CycleRange.of(firstCycle, lastCycle))
                .metricValue(worst.getValue())
                .thresholdValue(efficiencyLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.IMPOSSIBLE_EFFICIENCY;
    }
}
