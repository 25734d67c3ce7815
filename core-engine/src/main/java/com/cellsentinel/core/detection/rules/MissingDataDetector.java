package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.ConfidenceScale;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.metrics.SeriesMetrics;
import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.CycleColumn;
import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Missing-value detector.
 *
 * <p>
 * Inspects every column the series carries at all. A single flag lists all
 * columns whose missing fraction exceeds the limit; confidence scales with the
 * worst of them.
 * </p>
 *
 * @since 1.0.0
 */
public class MissingDataDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MissingDataDetector.class);

    static final double SATURATION = 0.80;
    static final double MIN_CONFIDENCE = 60.0;
    static final double MAX_CONFIDENCE = 100.0;

    private final double fractionLimit;

    public MissingDataDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.fractionLimit = thresholds.getMissingFraction();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        CellSeries series = context.getSeries();
        List<String> offending = new ArrayList<>();
        double worst = 0.0;
        for (CycleColumn column : CycleColumn.values()) {
            if (!series.hasColumn(column)) {
                continue;
            }
            double fraction = SeriesMetrics.missingFraction(series, column);
            if (fraction > fractionLimit) {
                offending.add(String.format(Locale.ROOT, "%s: %.1f%%", column.getLabel(), fraction * 100));
                worst = Math.max(worst, fraction);
            }
        }

        if (offending.isEmpty()) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: {}", context.getCellIdentifier(), getName(), offending);
        return List.of(Flag.builder()
                .type(FlagType.MISSING_DATA)
                .severity(Severity.WARNING)
                .confidence(ConfidenceScale.linear(worst - fractionLimit, SATURATION, MIN_CONFIDENCE, MAX_CONFIDENCE))
                .message("Significant missing data detected: " + String.join(", ", offending))
                .recommendation("Check data acquisition system and ensure complete data collection.")
                .metricValue(worst)
                .thresholdValue(fractionLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.MISSING_DATA;
    }
}
