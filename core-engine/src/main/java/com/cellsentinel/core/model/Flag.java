package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Single finding emitted by a detector for one cell.
 *
 * <p>
 * Flags are immutable value objects. Category and algorithm identifier are
 * derived from the {@link FlagType}. Confidence is a detector-local certainty
 * score in {@code [0, 100]}; values outside that range are clamped.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type}, {@code severity} and
 * {@code message} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Flag implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Confidence at or above which a flag is shown as high confidence. */
    public static final double HIGH_CONFIDENCE = 90.0;

    /** Severity first (most urgent first), then descending confidence. */
    public static final Comparator<Flag> BY_SEVERITY_THEN_CONFIDENCE = Comparator
            .comparing(Flag::getSeverity, Severity.MOST_URGENT_FIRST)
            .thenComparing(Comparator.comparingDouble(Flag::getConfidence).reversed());

    private final FlagType type;
    private final Severity severity;
    private final double confidence;
    private final String message;
    private final String recommendation;
    private final CycleRange cycleRange;
    private final Double metricValue;
    private final Double thresholdValue;

    private Flag(Builder b) {
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.message = Objects.requireNonNull(b.message, "message must not be null");
        this.confidence = Math.max(0.0, Math.min(100.0, b.confidence));
        this.recommendation = b.recommendation != null ? b.recommendation : "";
        this.cycleRange = b.cycleRange;
        this.metricValue = b.metricValue;
        this.thresholdValue = b.thresholdValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Flag} instances.
     */
    public static class Builder {
        private FlagType type;
        private Severity severity;
        private double confidence;
        private String message;
        private String recommendation;
        private CycleRange cycleRange;
        private Double metricValue;
        private Double thresholdValue;

        public Builder type(FlagType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder cycleRange(CycleRange cycleRange) {
            this.cycleRange = cycleRange;
            return this;
        }

        public Builder metricValue(Double metricValue) {
            this.metricValue = metricValue;
            return this;
        }

        public Builder thresholdValue(Double thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        /**
         * Build the flag.
         *
         * @return a new {@link Flag}
         * @throws NullPointerException if {@code type}, {@code severity} or
         *                              {@code message} is {@code null}
         */
        public Flag build() {
            return new Flag(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public FlagType getType() {
        return type;
    }

    public FlagCategory getCategory() {
        return type.getCategory();
    }

    public String getAlgorithm() {
        return type.getAlgorithm();
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isHighConfidence() {
        return confidence >= HIGH_CONFIDENCE;
    }

    public String getMessage() {
        return message;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public Optional<CycleRange> getCycleRange() {
        return Optional.ofNullable(cycleRange);
    }

    public Optional<Double> getMetricValue() {
        return Optional.ofNullable(metricValue);
    }

    public Optional<Double> getThresholdValue() {
        return Optional.ofNullable(thresholdValue);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Flag flag))
            return false;
        return Double.compare(confidence, flag.confidence) == 0
                && type == flag.type
                && severity == flag.severity
                && Objects.equals(message, flag.message)
                && Objects.equals(recommendation, flag.recommendation)
                && Objects.equals(cycleRange, flag.cycleRange)
                && Objects.equals(metricValue, flag.metricValue)
                && Objects.equals(thresholdValue, flag.thresholdValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, severity, confidence, message, recommendation, cycleRange,
                metricValue, thresholdValue);
    }

    @Override
    public String toString() {
        return "Flag{" +
                "type=" + type +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", message='" + message + '\'' +
                (cycleRange != null ? ", " + cycleRange : "") +
                '}';
    }
}
