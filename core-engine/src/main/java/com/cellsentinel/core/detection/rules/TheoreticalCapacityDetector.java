package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.metrics.CyclePoint;
import com.cellsentinel.core.metrics.SeriesMetrics;
import com.cellsentinel.core.model.CycleColumn;
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
 * Specific discharge capacity above the theoretical ceiling.
 *
 * @since 1.0.0
 */
public class TheoreticalCapacityDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TheoreticalCapacityDetector.class);

    static final double CONFIDENCE = 80.0;

    private final double capacityLimit;

    public TheoreticalCapacityDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.capacityLimit = thresholds.getTheoreticalCapacity();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        List<CyclePoint> excess = SeriesMetrics.points(context.getSeries(), CycleColumn.SPECIFIC_DISCHARGE_CAPACITY)
                .stream()
                .filter(p -> p.getValue() > capacityLimit)
                .toList();
        if (excess.isEmpty()) {
            return List.of();
        }

        double max = excess.stream().mapToDouble(CyclePoint::getValue).max().orElseThrow();
        LOG.debug("[{}] {} fired: {} value(s) above {}, max={}",
                context.getCellIdentifier(), getName(), excess.size(), capacityLimit, max);
        return List.of(Flag.builder()
                .type(FlagType.EXCEEDS_THEORETICAL_CAPACITY)
                .severity(Severity.WARNING)
                .confidence(CONFIDENCE)
                .message(String.format(Locale.ROOT,
                        "Capacity exceeds theoretical maximum: %.1f mAh/g (max: %.0f mAh/g)", max, capacityLimit))
                .recommendation("Check active material mass calculation and capacity measurement calibration.")
                .cycleRange(CycleRange.of(excess.get(0).getCycle(), excess.get(excess.size() - 1).getCycle()))
                .metricValue(max)
                .thresholdValue(capacityLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.EXCEEDS_THEORETICAL_CAPACITY;
    }
}
