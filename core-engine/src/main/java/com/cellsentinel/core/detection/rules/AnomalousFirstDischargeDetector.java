package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.ConfidenceScale;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.detection.SiblingPopulation;
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
 * Statistical outlier detector for the first discharge capacity.
 *
 * <p>
 * Scores the cell's first discharge against its siblings in the same
 * experiment, leaving the cell itself out of the reference population. Needs
 * at least three cells in total and a population with non-zero spread.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalousFirstDischargeDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalousFirstDischargeDetector.class);

    static final double SATURATION = 3.0;
    static final double MIN_CONFIDENCE = 80.0;
    static final double MAX_CONFIDENCE = 95.0;

    private final double zLimit;
    private final double criticalZ;

    public AnomalousFirstDischargeDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.zLimit = thresholds.getOutlierZScore();
        this.criticalZ = thresholds.getOutlierCriticalZScore();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        SiblingPopulation population = context.getPopulation();
        Optional<Double> own = context.getMetrics().getFirstDischarge();
        if (population.size() < SeriesMetrics.MIN_Z_POPULATION || own.isEmpty()) {
            LOG.trace("[{}] {}: population of {} – skipping", context.getCellIdentifier(), getName(), population.size());
            return List.of();
        }

        List<Double> peers = population.peersOf(context.getCellIdentifier(), own.get());
        Optional<Double> z = SeriesMetrics.zScore(own.get(), peers);
        if (z.isEmpty()) {
            LOG.trace("[{}] {}: z-score undefined for {} peer(s) – skipping",
                    context.getCellIdentifier(), getName(), peers.size());
            return List.of();
        }

        double absZ = Math.abs(z.get());
        if (absZ <= zLimit) {
            return List.of();
        }

        double peerMean = SeriesMetrics.mean(peers).orElseThrow();
        LOG.debug("[{}] {} fired: firstDischarge={} peerMean={} z={}",
                context.getCellIdentifier(), getName(), own.get(), peerMean, z.get());
        return List.of(Flag.builder()
                .type(FlagType.ANOMALOUS_FIRST_DISCHARGE)
                .severity(absZ > criticalZ ? Severity.CRITICAL : Severity.WARNING)
                .confidence(ConfidenceScale.linear(absZ - zLimit, SATURATION, MIN_CONFIDENCE, MAX_CONFIDENCE))
                .message(String.format(Locale.ROOT,
                        "Anomalous first discharge capacity: %.1f (%s than sibling mean %.1f, z-score %.1f)",
                        own.get(), z.get() > 0 ? "higher" : "lower", peerMean, z.get()))
                .recommendation("Cell performance significantly differs from siblings in the same experiment. "
                        + "Check for manufacturing variations or testing issues.")
                .cycleRange(CycleRange.single(context.getSeries().getRecords().get(0).getCycleNumber()))
                .metricValue(z.get())
                .thresholdValue(zLimit)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.ANOMALOUS_FIRST_DISCHARGE;
    }
}
