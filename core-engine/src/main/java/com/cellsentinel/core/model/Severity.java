package com.cellsentinel.core.model;

import java.util.Comparator;

/**
 * Three-level urgency of a {@link Flag}: {@code CRITICAL > WARNING > INFO}.
 *
 * <p>
 * Severity only drives ordering and display. It never stops the remaining
 * detectors from running.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL(0, "Critical"),
    WARNING(1, "Warning"),
    INFO(2, "Info");

    /** Most urgent first. */
    public static final Comparator<Severity> MOST_URGENT_FIRST = Comparator.comparingInt(Severity::rank);

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    /**
     * @return sort rank, 0 being the most urgent
     */
    public int rank() {
        return rank;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param other severity to compare with
     * @return {@code true} if this severity is strictly more urgent
     */
    public boolean isMoreUrgentThan(Severity other) {
        return rank < other.rank;
    }
}
