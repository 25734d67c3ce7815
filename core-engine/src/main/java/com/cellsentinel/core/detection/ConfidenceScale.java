package com.cellsentinel.core.detection;

/**
 * Maps how far a metric lies beyond its threshold onto a confidence score.
 *
 * <p>
 * The mapping is linear and monotonic: a deviation of {@code 0} yields
 * {@code floor}, a deviation of {@code saturation} or more yields
 * {@code ceiling}. Scores are rounded to one decimal so that identical inputs
 * always produce identical flags.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfidenceScale {

    private ConfidenceScale() {
        // utility class: not instantiable
    }

    /**
     * @param deviation  distance beyond the threshold (negative is treated as 0)
     * @param saturation deviation at which the ceiling is reached; must be &gt; 0
     * @param floor      confidence right at the threshold
     * @param ceiling    maximum confidence
     * @return confidence in {@code [floor, ceiling]}
     * @throws IllegalArgumentException if {@code saturation <= 0} or
     *                                  {@code floor > ceiling}
     */
    public static double linear(double deviation, double saturation, double floor, double ceiling) {
        if (!(saturation > 0)) {
            throw new IllegalArgumentException("saturation must be > 0, got: " + saturation);
        }
        if (floor > ceiling) {
            throw new IllegalArgumentException("floor must be <= ceiling, got: " + floor + " > " + ceiling);
        }
        double fraction = Math.max(0.0, Math.min(1.0, deviation / saturation));
        return round(floor + (ceiling - floor) * fraction);
    }

    static double round(double confidence) {
        return Math.round(confidence * 10.0) / 10.0;
    }
}
