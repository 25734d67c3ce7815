package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.metrics.CellMetrics;
import com.cellsentinel.core.metrics.CyclePoint;
import com.cellsentinel.core.metrics.SeriesMetrics;
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
 * Test stopped while the cell was still stable.
 *
 * <p>
 * Looks at the last few capacity values; a coefficient of variation under
 * 5 % together with good final retention means the cell had not reached
 * end of life.
 * </p>
 *
 * @since 1.0.0
 */
public class PrematureTerminationDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PrematureTerminationDetector.class);

    static final double CONFIDENCE = 70.0;

    private final int minPoints;
    private final int window;
    private final double variationLimit;
    private final double retentionLimit;

    public PrematureTerminationDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.minPoints = thresholds.getTerminationMinPoints();
        this.window = thresholds.getTerminationWindow();
        this.variationLimit = thresholds.getTerminationVariation();
        this.retentionLimit = thresholds.getTerminationRetention();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        CellMetrics metrics = context.getMetrics();
        List<CyclePoint> capacity = metrics.getCapacity();
        Optional<CyclePoint> last = metrics.finalRetention();
        if (capacity.size() < minPoints || last.isEmpty()) {
            LOG.trace("[{}] {}: {} capacity point(s), need {} – skipping",
                    context.getCellIdentifier(), getName(), capacity.size(), minPoints);
            return List.of();
        }

        List<CyclePoint> tail = capacity.subList(capacity.size() - window, capacity.size());
        List<Double> values = SeriesMetrics.values(tail);
        Optional<Double> mean = SeriesMetrics.mean(values);
        Optional<Double> std = SeriesMetrics.sampleStd(values);
        if (mean.isEmpty() || std.isEmpty() || mean.get() <= 0) {
            return List.of();
        }

        double variation = std.get() / mean.get();
        if (variation >= variationLimit || last.get().getValue() <= retentionLimit) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: tailVariation={} finalRetention={}",
                context.getCellIdentifier(), getName(), variation, last.get().getValue());
        return List.of(Flag.builder()
                .type(FlagType.PREMATURE_TERMINATION)
                .severity(Severity.INFO)
                .confidence(CONFIDENCE)
                .message(String.format(Locale.ROOT,
                        "Test may have been terminated prematurely: stable performance at %.1f%% retention",
                        last.get().getValue() * 100))
                .recommendation("Cell appears stable. Consider extending test duration to observe "
                        + "long-term degradation.")
                .cycleRange(CycleRange.of(tail.get(0).getCycle(), tail.get(tail.size() - 1).getCycle()))
                .metricValue(variation)
                .thresholdValue(variationLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.PREMATURE_TERMINATION;
    }
}
