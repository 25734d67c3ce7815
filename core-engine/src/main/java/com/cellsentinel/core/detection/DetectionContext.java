package com.cellsentinel.core.detection;

import com.cellsentinel.core.metrics.CellMetrics;
import com.cellsentinel.core.model.CellSeries;

import java.util.Objects;

/**
 * Everything a detector may read for one cell: the series, the metrics
 * derived from it once per pass, and the sibling population of its
 * experiment.
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final CellSeries series;
    private final CellMetrics metrics;
    private final SiblingPopulation population;

    private DetectionContext(CellSeries series, CellMetrics metrics, SiblingPopulation population) {
        this.series = series;
        this.metrics = metrics;
        this.population = population;
    }

    /**
     * @param series     the cell's series; must not be {@code null}
     * @param population sibling population; {@code null} means none
     * @return context with freshly computed metrics
     */
    public static DetectionContext of(CellSeries series, SiblingPopulation population) {
        Objects.requireNonNull(series, "CellSeries must not be null");
        return new DetectionContext(series, CellMetrics.of(series),
                population != null ? population : SiblingPopulation.empty());
    }

    public static DetectionContext of(CellSeries series) {
        return of(series, SiblingPopulation.empty());
    }

    public CellSeries getSeries() {
        return series;
    }

    public CellMetrics getMetrics() {
        return metrics;
    }

    public SiblingPopulation getPopulation() {
        return population;
    }

    public String getCellIdentifier() {
        return series.getCellIdentifier();
    }
}
