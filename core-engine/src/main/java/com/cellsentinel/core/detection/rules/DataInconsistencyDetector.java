package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.metrics.CyclePoint;
import com.cellsentinel.core.metrics.SeriesMetrics;
import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.CycleColumn;
import com.cellsentinel.core.model.CycleRange;
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
 * Physically inconsistent capacity values.
 *
 * <p>
 * Negative capacities in any capacity column, and discharge columns that are
 * mostly zero, are reported together in one flag.
 * </p>
 *
 * @since 1.0.0
 */
public class DataInconsistencyDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DataInconsistencyDetector.class);

    static final double CONFIDENCE = 80.0;

    private final double zeroFractionLimit;

    public DataInconsistencyDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.zeroFractionLimit = thresholds.getZeroFraction();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        CellSeries series = context.getSeries();
        List<String> issues = new ArrayList<>();
        int firstCycle = Integer.MAX_VALUE;
        int lastCycle = Integer.MIN_VALUE;

        for (CycleColumn column : CycleColumn.values()) {
            if (!column.isCapacity()) {
                continue;
            }
            List<CyclePoint> points = SeriesMetrics.points(series, column);
            int negatives = 0;
            int zeros = 0;
            for (CyclePoint p : points) {
                if (p.getValue() < 0) {
                    negatives++;
                    firstCycle = Math.min(firstCycle, p.getCycle());
                    lastCycle = Math.max(lastCycle, p.getCycle());
                } else if (p.getValue() == 0) {
                    zeros++;
                }
            }
            if (negatives > 0) {
                issues.add(String.format(Locale.ROOT, "Negative values in %s: %d", column.getLabel(), negatives));
            }
            if (isDischarge(column) && !series.isEmpty()) {
                double zeroFraction = (double) zeros / series.size();
                if (zeroFraction > zeroFractionLimit) {
                    issues.add(String.format(Locale.ROOT,
                            "Excessive zero values in %s: %.1f%%", column.getLabel(), zeroFraction * 100));
                }
            }
        }

        if (issues.isEmpty()) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: {}", context.getCellIdentifier(), getName(), issues);
        Flag.Builder flag = Flag.builder()
                .type(FlagType.DATA_INCONSISTENCY)
                .severity(Severity.WARNING)
                .confidence(CONFIDENCE)
                .message("Data inconsistencies detected: " + String.join("; ", issues))
                .recommendation("Review data collection procedures and check for measurement errors.");
        if (firstCycle <= lastCycle) {
            flag.cycleRange(CycleRange.of(firstCycle, lastCycle));
        }
        return List.of(flag.build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.DATA_INCONSISTENCY;
    }

    private static boolean isDischarge(CycleColumn column) {
        return column == CycleColumn.DISCHARGE_CAPACITY || column == CycleColumn.SPECIFIC_DISCHARGE_CAPACITY;
    }
}
