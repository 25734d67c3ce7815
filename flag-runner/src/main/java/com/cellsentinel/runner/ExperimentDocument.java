package com.cellsentinel.runner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of an experiment input document.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExperimentDocument {

    private String experimentId;
    private List<CellDocument> cells = new ArrayList<>();

    public ExperimentDocument() {
    }

    public String getExperimentId() {
        return experimentId;
    }

    public void setExperimentId(String experimentId) {
        this.experimentId = experimentId;
    }

    public List<CellDocument> getCells() {
        return cells;
    }

    public void setCells(List<CellDocument> cells) {
        this.cells = cells;
    }
}
