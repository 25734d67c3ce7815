package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.rules.AcceleratingDegradationDetector;
import com.cellsentinel.core.detection.rules.AnomalousFirstDischargeDetector;
import com.cellsentinel.core.detection.rules.CellFailureDetector;
import com.cellsentinel.core.detection.rules.DataInconsistencyDetector;
import com.cellsentinel.core.detection.rules.HighCeVariationDetector;
import com.cellsentinel.core.detection.rules.ImpossibleEfficiencyDetector;
import com.cellsentinel.core.detection.rules.IncompleteDatasetDetector;
import com.cellsentinel.core.detection.rules.LowCoulombicEfficiencyDetector;
import com.cellsentinel.core.detection.rules.MissingDataDetector;
import com.cellsentinel.core.detection.rules.PoorFirstCycleEfficiencyDetector;
import com.cellsentinel.core.detection.rules.PrematureTerminationDetector;
import com.cellsentinel.core.detection.rules.RapidCapacityFadeDetector;
import com.cellsentinel.core.detection.rules.TheoreticalCapacityDetector;
import com.cellsentinel.core.model.FlagType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Registry of the built-in {@link CellDetector}s.
 *
 * <p>
 * This is the single point of extension when adding a new flag type: add the
 * {@link FlagType} constant and map it to its detector here. The standard set
 * follows {@link FlagType} declaration order, which is also the order used to
 * break ties when flags are sorted.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRegistry.class);

    private DetectorRegistry() {
        // utility class, not instantiable
    }

    /**
     * Create the detector for a flag type.
     *
     * @param type       the flag type; must not be {@code null}
     * @param thresholds detector limits; must not be {@code null}
     * @return the detector producing flags of that type
     * @throws NullPointerException if an argument is {@code null}
     */
    public static CellDetector create(FlagType type, DetectorThresholds thresholds) {
        Objects.requireNonNull(type, "FlagType must not be null");
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");

        return switch (type) {
            case RAPID_CAPACITY_FADE -> new RapidCapacityFadeDetector(thresholds);
            case CELL_FAILURE -> new CellFailureDetector(thresholds);
            case LOW_COULOMBIC_EFFICIENCY -> new LowCoulombicEfficiencyDetector(thresholds);
            case HIGH_CE_VARIATION -> new HighCeVariationDetector(thresholds);
            case ACCELERATING_DEGRADATION -> new AcceleratingDegradationDetector(thresholds);
            case POOR_FIRST_CYCLE_EFFICIENCY -> new PoorFirstCycleEfficiencyDetector(thresholds);
            case INCOMPLETE_DATASET -> new IncompleteDatasetDetector(thresholds);
            case PREMATURE_TERMINATION -> new PrematureTerminationDetector(thresholds);
            case MISSING_DATA -> new MissingDataDetector(thresholds);
            case DATA_INCONSISTENCY -> new DataInconsistencyDetector(thresholds);
            case IMPOSSIBLE_EFFICIENCY -> new ImpossibleEfficiencyDetector(thresholds);
            case EXCEEDS_THEORETICAL_CAPACITY -> new TheoreticalCapacityDetector(thresholds);
            case ANOMALOUS_FIRST_DISCHARGE -> new AnomalousFirstDischargeDetector(thresholds);
        };
    }

    /**
     * Create one detector per {@link FlagType}, in declaration order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param thresholds detector limits; must not be {@code null}
     * @return unmodifiable list of the standard detectors
     * @throws IllegalStateException if {@code thresholds} fail validation
     */
    public static List<CellDetector> standardDetectors(DetectorThresholds thresholds) {
        Objects.requireNonNull(thresholds, "DetectorThresholds must not be null");
        thresholds.validate();
        LOG.info("Creating {} standard detector(s)", FlagType.values().length);
        List<CellDetector> detectors = Arrays.stream(FlagType.values())
                .map(type -> create(type, thresholds))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
