package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every configured detector against a cell series and collects the
 * results into a sorted {@link FlagSet}.
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A detector that throws is logged and skipped; the remaining detectors still
 * run and the cell still gets a flag set.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Detectors are stateless, so one aggregator may evaluate many series
 * concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class FlagAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(FlagAggregator.class);

    private final List<CellDetector> detectors;

    /**
     * @param detectors detectors to run, in registry order; must not be
     *                  {@code null} or empty
     * @throws NullPointerException     if {@code detectors} is {@code null}
     * @throws IllegalArgumentException if {@code detectors} is empty
     */
    public FlagAggregator(List<CellDetector> detectors) {
        Objects.requireNonNull(detectors, "Detector list must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("Detector list must not be empty");
        }
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
    }

    /**
     * @param thresholds detector limits; must not be {@code null}
     * @return an aggregator running the standard detector set
     */
    public static FlagAggregator withStandardDetectors(DetectorThresholds thresholds) {
        return new FlagAggregator(DetectorRegistry.standardDetectors(thresholds));
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate one cell.
     *
     * @param series     the cell series; must not be {@code null}
     * @param population sibling first-discharge capacities, or {@code null}
     *                   when the cell is evaluated on its own
     * @return sorted flags of the cell
     */
    public FlagSet aggregate(CellSeries series, SiblingPopulation population) {
        Objects.requireNonNull(series, "CellSeries must not be null");
        DetectionContext context = DetectionContext.of(series, population);

        List<Flag> flags = new ArrayList<>();
        for (CellDetector detector : detectors) {
            try {
                flags.addAll(detector.evaluate(context));
            } catch (RuntimeException e) {
                LOG.warn("[{}] Detector [{}] threw an exception – continuing with next detector",
                        series.getCellIdentifier(), detector.getName(), e);
            }
        }

        FlagSet result = FlagSet.of(series.getCellIdentifier(), flags);
        if (!result.isEmpty()) {
            LOG.info("[{}] {} flag(s): {}", series.getCellIdentifier(), result.size(),
                    result.getSummary().compactLabel());
        }
        return result;
    }

    /**
     * Evaluate one cell without sibling context.
     *
     * @param series the cell series
     * @return sorted flags of the cell
     */
    public FlagSet aggregate(CellSeries series) {
        return aggregate(series, SiblingPopulation.empty());
    }

    /**
     * Evaluate every cell of an experiment against its siblings.
     *
     * @param experiment cells of one experiment; must not be {@code null}
     * @return flag sets keyed by cell identifier, in input order
     * @throws IllegalArgumentException if two cells share an identifier
     */
    public Map<String, FlagSet> aggregateAll(List<CellSeries> experiment) {
        Objects.requireNonNull(experiment, "Experiment must not be null");
        SiblingPopulation population = SiblingPopulation.fromSeries(experiment);
        Map<String, FlagSet> out = new LinkedHashMap<>();
        for (CellSeries series : experiment) {
            if (out.containsKey(series.getCellIdentifier())) {
                throw new IllegalArgumentException(
                        "Duplicate cell identifier in experiment: '" + series.getCellIdentifier() + "'");
            }
            out.put(series.getCellIdentifier(), aggregate(series, population));
        }
        return out;
    }

    /**
     * @return the detectors run by this aggregator, in order
     */
    public List<CellDetector> getDetectors() {
        return detectors;
    }
}
