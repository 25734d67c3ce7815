package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.ConfidenceScale;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.metrics.CellMetrics;
import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Consistently low coulombic efficiency over the stable cycling window.
 *
 * <p>
 * Confidence grows linearly from 75 at the threshold to 95 once the mean is
 * ten points below it.
 * </p>
 *
 * @since 1.0.0
 */
public class LowCoulombicEfficiencyDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LowCoulombicEfficiencyDetector.class);

    static final double SATURATION = 0.10;
    static final double MIN_CONFIDENCE = 75.0;
    static final double MAX_CONFIDENCE = 95.0;

    private final int minPoints;
    private final double meanLimit;
    private final double criticalMean;

    public LowCoulombicEfficiencyDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.minPoints = thresholds.getMinStableEfficiencyPoints();
        this.meanLimit = thresholds.getLowCeMean();
        this.criticalMean = thresholds.getLowCeCriticalMean();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        CellMetrics metrics = context.getMetrics();
        if (metrics.getStableEfficiencies().size() < minPoints || metrics.getCeMean().isEmpty()) {
            LOG.trace("[{}] {}: {} stable efficiency value(s) – skipping",
                    context.getCellIdentifier(), getName(), metrics.getStableEfficiencies().size());
            return List.of();
        }

        double mean = metrics.getCeMean().get();
        if (mean >= meanLimit) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: ceMean={}", context.getCellIdentifier(), getName(), mean);
        return List.of(Flag.builder()
                .type(FlagType.LOW_COULOMBIC_EFFICIENCY)
                .severity(mean < criticalMean ? Severity.CRITICAL : Severity.WARNING)
                .confidence(ConfidenceScale.linear(meanLimit - mean, SATURATION, MIN_CONFIDENCE, MAX_CONFIDENCE))
                .message(String.format(Locale.ROOT,
                        "Consistently low coulombic efficiency: %.2f%% average after cycle %d",
                        mean * 100, context.getSeries().getFormationCycleCount()))
                .recommendation("Low CE indicates side reactions or active material loss. Check electrolyte "
                        + "stability and electrode-electrolyte interface.")
                .metricValue(mean)
                .thresholdValue(meanLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.LOW_COULOMBIC_EFFICIENCY;
    }
}
