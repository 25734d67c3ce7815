package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.ConfidenceScale;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.model.CycleRange;
import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Poor efficiency on the first recorded cycle.
 *
 * @since 1.0.0
 */
public class PoorFirstCycleEfficiencyDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PoorFirstCycleEfficiencyDetector.class);

    static final double SATURATION = 0.40;
    static final double MIN_CONFIDENCE = 75.0;
    static final double MAX_CONFIDENCE = 95.0;

    private final double efficiencyLimit;
    private final double criticalEfficiency;

    public PoorFirstCycleEfficiencyDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.efficiencyLimit = thresholds.getFirstCycleEfficiency();
        this.criticalEfficiency = thresholds.getFirstCycleCriticalEfficiency();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        Optional<Double> first = context.getMetrics().getFirstCycleEfficiency();
        if (first.isEmpty()) {
            LOG.trace("[{}] {}: first cycle has no efficiency – skipping", context.getCellIdentifier(), getName());
            return List.of();
        }

        double ce = first.get();
        if (ce >= efficiencyLimit) {
            return List.of();
        }

        int cycle = context.getSeries().getRecords().get(0).getCycleNumber();
        LOG.debug("[{}] {} fired: firstCycleCe={}", context.getCellIdentifier(), getName(), ce);
        return List.of(Flag.builder()
                .type(FlagType.POOR_FIRST_CYCLE_EFFICIENCY)
                .severity(ce < criticalEfficiency ? Severity.CRITICAL : Severity.WARNING)
                .confidence(ConfidenceScale.linear(efficiencyLimit - ce, SATURATION, MIN_CONFIDENCE, MAX_CONFIDENCE))
                .message(String.format(Locale.ROOT, "Poor first cycle efficiency: %.1f%%", ce * 100))
                .recommendation("Low first cycle efficiency indicates excessive SEI formation or irreversible "
                        + "capacity loss. Check electrode surface area and electrolyte additives.")
                .cycleRange(CycleRange.single(cycle))
                .metricValue(ce)
                .thresholdValue(efficiencyLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.POOR_FIRST_CYCLE_EFFICIENCY;
    }
}
