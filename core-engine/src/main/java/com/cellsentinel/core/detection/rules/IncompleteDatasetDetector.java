package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.CellDetector;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.metrics.CellMetrics;
import com.cellsentinel.core.metrics.CyclePoint;
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
 * A healthy cell that stopped short of a useful cycle count.
 *
 * @since 1.0.0
 */
public class IncompleteDatasetDetector implements CellDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IncompleteDatasetDetector.class);

    static final double CONFIDENCE = 70.0;

    private final int minPoints;
    private final int maxCycles;
    private final double retentionLimit;

    public IncompleteDatasetDetector(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        this.minPoints = thresholds.getIncompleteMinPoints();
        this.maxCycles = thresholds.getIncompleteMaxCycles();
        this.retentionLimit = thresholds.getIncompleteRetention();
    }

    @Override
    public List<Flag> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "DetectionContext must not be null");

        CellMetrics metrics = context.getMetrics();
        Optional<CyclePoint> last = metrics.finalRetention();
        if (metrics.getCapacity().size() < minPoints || last.isEmpty()) {
            LOG.trace("[{}] {}: {} capacity point(s) – skipping",
                    context.getCellIdentifier(), getName(), metrics.getCapacity().size());
            return List.of();
        }

        int records = context.getSeries().size();
        if (last.get().getValue() <= retentionLimit || records >= maxCycles) {
            return List.of();
        }

        LOG.debug("[{}] {} fired: records={} finalRetention={}",
                context.getCellIdentifier(), getName(), records, last.get().getValue());
        return List.of(Flag.builder()
                .type(FlagType.INCOMPLETE_DATASET)
                .severity(Severity.INFO)
                .confidence(CONFIDENCE)
                .message(String.format(Locale.ROOT,
                        "Test may be incomplete: only %d cycles with %.1f%% retention",
                        records, last.get().getValue() * 100))
                .recommendation("Consider continuing the test to gather more long-term performance data.")
                .metricValue((double) records)
                .thresholdValue((double) maxCycles)
                .build());
    }

    @Override
    public FlagType getFlagType() {
        return FlagType.INCOMPLETE_DATASET;
    }
}
