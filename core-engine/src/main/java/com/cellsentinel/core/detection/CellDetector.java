package com.cellsentinel.core.detection;

import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagType;

import java.util.List;

/**
 * Contract for all cell detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: the outcome depends only on
 * the supplied {@link DetectionContext} and the limits fixed at construction.
 * One instance may therefore evaluate any number of cells, concurrently.
 * </p>
 * <p>
 * A detector that lacks the data it needs (too few cycles, missing columns,
 * zero spread) abstains by returning an empty list. It never throws for data
 * reasons.
 * </p>
 */
public interface CellDetector {

    /**
     * Evaluate one cell.
     *
     * @param context series, shared metrics and sibling population of the cell
     * @return zero or more flags, never {@code null}
     */
    List<Flag> evaluate(DetectionContext context);

    /**
     * Return the type of flag this detector emits.
     *
     * @return flag type
     */
    FlagType getFlagType();

    /**
     * @return stable detector name used in logs
     */
    default String getName() {
        return getFlagType().getId();
    }
}
