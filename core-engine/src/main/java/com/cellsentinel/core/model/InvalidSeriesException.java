package com.cellsentinel.core.model;

/**
 * Thrown when a cycle series violates the {@link CellSeries} invariant:
 * cycle numbers must be positive, unique and strictly increasing.
 *
 * <p>
 * This is the only error the detection engine propagates to its caller.
 * Every other data problem makes the affected detectors abstain.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidSeriesException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String cellIdentifier;

    public InvalidSeriesException(String cellIdentifier, String message) {
        super("Invalid series '" + cellIdentifier + "': " + message);
        this.cellIdentifier = cellIdentifier;
    }

    /**
     * @return identifier of the offending cell, may be {@code null} when the
     *         identifier itself was missing
     */
    public String getCellIdentifier() {
        return cellIdentifier;
    }
}
