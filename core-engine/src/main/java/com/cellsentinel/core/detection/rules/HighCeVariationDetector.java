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
 * High spread of coulombic efficiency over the stable cycling window.
 *
 * @since 1.0.0
 */
public class HighCeVariationDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(HighCeVariationDetector.class);

    static final double SATURATION = 0.10;
    static final double MIN_CONFIDENCE = 75.0;
    static final double MAX_CONFIDENCE = 95.0;

    private final int minPoints;
    private final double stdLimit;
    private final double criticalStd;

    public HighCeVariationDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.minPoints = thresholds.getMinStableEfficiencyPoints();
        this.stdLimit = thresholds.getCeStdWarning();
        this.criticalStd = thresholds.getCeStdCritical();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        CellMetrics metrics = context.getMetrics();
        if (metrics.getStableEfficiencies().size() < minPoints || metrics.getCeStd().isEmpty()) {
            LOG.trace("[{}] {}: {} stable efficiency value(s) – skipping",
                    context.getCellIdentifier(), getName(), metrics.getStableEfficiencies().size());
            return List.of();
        }

        double std = metrics.getCeStd().get();
        if (std <= stdLimit) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: ceStd={}", context.getCellIdentifier(), getName(), std);
        return List.of(Flag.builder()
                .type(FlagType.HIGH_CE_VARIATION)
                .severity(std > criticalStd ? Severity.CRITICAL : Severity.WARNING)
                .confidence(ConfidenceScale.linear(std - stdLimit, SATURATION, MIN_CONFIDENCE, MAX_CONFIDENCE))
                .message(String.format(Locale.ROOT,
                        "High coulombic efficiency variation: %.1f%% std dev (mean: %.1f%%)",
                        std * 100, metrics.getCeMean().orElse(Double.NaN) * 100))
                .recommendation("Check for inconsistent cycling conditions, temperature fluctuations, or "
                        + "electrode stability issues.")
                .metricValue(std)
                .thresholdValue(stdLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.HIGH_CE_VARIATION;
    }
}
