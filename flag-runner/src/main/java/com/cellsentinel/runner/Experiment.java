package com.cellsentinel.runner;

import com.cellsentinel.core.model.CellSeries;

import java.util.List;
import java.util.Objects;

/**
 * Validated experiment: an identifier and the series of its cells, in input
 * order.
 *
 * @since 1.0.0
 */
public final class Experiment {

    private final String experimentId;
    private final List<CellSeries> cells;

    public Experiment(String experimentId, List<CellSeries> cells) {
        this.experimentId = experimentId == null ? "" : experimentId;
        this.cells = List.copyOf(Objects.requireNonNull(cells, "cells must not be null"));
    }

    public String getExperimentId() {
        return experimentId;
    }

    public List<CellSeries> getCells() {
        return cells;
    }

    @Override
    public String toString() {
        return "Experiment{id='" + experimentId + "', cells=" + cells.size() + '}';
    }
}
