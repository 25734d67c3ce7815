package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.DetectionContext;
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
 * Accelerating degradation detector.
 *
 * <p>
 * Splits the retention curve at its midpoint and compares the degradation
 * rate of the two halves. Fires when the late half fades more than twice as
 * fast as the early half and the late rate is itself non-trivial.
 * </p>
 *
 * @since 1.0.0
 */
public class AcceleratingDegradationDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AcceleratingDegradationDetector.class);

    static final double CONFIDENCE = 75.0;

    private final int minPoints;
    private final double factor;
    private final double minRate;

    public AcceleratingDegradationDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.minPoints = thresholds.getAccelerationMinPoints();
        this.factor = thresholds.getAccelerationFactor();
        this.minRate = thresholds.getAccelerationMinRate();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        List<CyclePoint> retention = context.getMetrics().getRetention();
        if (retention.size() < minPoints) {
            LOG.trace("[{}] {}: {} retention point(s), need {} – skipping",
                    context.getCellIdentifier(), getName(), retention.size(), minPoints);
            return List.of();
        }

        int mid = retention.size() / 2;
        List<CyclePoint> late = retention.subList(mid, retention.size());
        Optional<Double> earlyRate = SeriesMetrics.degradationRate(retention.subList(0, mid));
        Optional<Double> lateRate = SeriesMetrics.degradationRate(late);
        if (earlyRate.isEmpty() || lateRate.isEmpty()) {
            return List.of();
        }

        double early = earlyRate.get();
        double recent = lateRate.get();
        if (recent <= factor * early || recent <= minRate) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: earlyRate={} lateRate={}",
                context.getCellIdentifier(), getName(), early, recent);
        return List.of(Flag.builder()
                .type(FlagType.ACCELERATING_DEGRADATION)
                .severity(Severity.WARNING)
                .confidence(CONFIDENCE)
                .message(String.format(Locale.ROOT,
                        "Accelerating degradation detected: %.3f%%/cycle late vs %.3f%%/cycle early",
                        recent * 100, early * 100))
                .recommendation("Degradation is accelerating. Check for lithium plating, SEI growth, or "
                        + "mechanical degradation.")
                .cycleRange(CycleRange.of(late.get(0).getCycle(), late.get(late.size() - 1).getCycle()))
                .metricValue(recent)
                .thresholdValue(factor * early)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.ACCELERATING_DEGRADATION;
    }
}
