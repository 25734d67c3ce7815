package com.cellsentinel.runner;

import com.cellsentinel.core.model.CycleRange;
import com.cellsentinel.core.model.Flag;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON shape of one flag in the output document.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlagDocument {

    private final String type;
    private final String displayName;
    private final String category;
    private final String algorithm;
    private final String severity;
    private final double confidence;
    private final String message;
    private final String recommendation;
    private final Integer firstCycle;
    private final Integer lastCycle;
    private final Double metricValue;
    private final Double thresholdValue;

    FlagDocument(Flag flag) {
        this.type = flag.getType().getId();
        this.displayName = flag.getType().getDisplayName();
        this.category = flag.getCategory().name();
        this.algorithm = flag.getAlgorithm();
        this.severity = flag.getSeverity().name();
        this.confidence = flag.getConfidence();
        this.message = flag.getMessage();
        this.recommendation = flag.getRecommendation();
        this.firstCycle = flag.getCycleRange().map(CycleRange::getFirst).orElse(null);
        this.lastCycle = flag.getCycleRange().map(CycleRange::getLast).orElse(null);
        this.metricValue = flag.getMetricValue().orElse(null);
        this.thresholdValue = flag.getThresholdValue().orElse(null);
    }

    public String getType() {
        return type;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getCategory() {
        return category;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getMessage() {
        return message;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public Integer getFirstCycle() {
        return firstCycle;
    }

    public Integer getLastCycle() {
        return lastCycle;
    }

    public Double getMetricValue() {
        return metricValue;
    }

    public Double getThresholdValue() {
        return thresholdValue;
    }
}
