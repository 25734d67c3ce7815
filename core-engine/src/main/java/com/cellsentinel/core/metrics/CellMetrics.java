package com.cellsentinel.core.metrics;

import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.CycleColumn;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared intermediates of one detection pass, computed once from a
 * {@link CellSeries} via {@link SeriesMetrics} and read by every detector.
 *
 * <p>
 * Immutable; safe to share between detectors running on different threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class CellMetrics {

    private final CycleColumn capacityColumn;
    private final List<CyclePoint> capacity;
    private final List<CyclePoint> retention;
    private final List<CyclePoint> efficiencies;
    private final List<Double> stableEfficiencies;
    private final Double ceMean;
    private final Double ceStd;
    private final Double firstCycleEfficiency;
    private final Double firstDischarge;

    private CellMetrics(CellSeries series) {
        this.capacityColumn = SeriesMetrics.capacityColumn(series);
        this.capacity = List.copyOf(SeriesMetrics.points(series, capacityColumn));
        this.retention = List.copyOf(SeriesMetrics.retentionCurve(capacity));
        this.efficiencies = List.copyOf(SeriesMetrics.efficiencies(series));
        this.stableEfficiencies = List.copyOf(SeriesMetrics.stableEfficiencies(series));
        this.ceMean = SeriesMetrics.mean(stableEfficiencies).orElse(null);
        this.ceStd = SeriesMetrics.sampleStd(stableEfficiencies).orElse(null);
        this.firstCycleEfficiency = series.firstRecord()
                .flatMap(r -> SeriesMetrics.effectiveEfficiency(series.getProjectKind(), r))
                .orElse(null);
        this.firstDischarge = SeriesMetrics.firstDischarge(series).orElse(null);
    }

    /**
     * Compute the metrics of a series.
     *
     * @param series the series; must not be {@code null}
     * @return computed metrics
     */
    public static CellMetrics of(CellSeries series) {
        Objects.requireNonNull(series, "CellSeries must not be null");
        return new CellMetrics(series);
    }

    /**
     * @return column the capacity and retention values were read from
     */
    public CycleColumn getCapacityColumn() {
        return capacityColumn;
    }

    /**
     * @return present capacity values in cycle order
     */
    public List<CyclePoint> getCapacity() {
        return capacity;
    }

    /**
     * @return retention from the first valid cycle onwards
     */
    public List<CyclePoint> getRetention() {
        return retention;
    }

    public Optional<CyclePoint> finalRetention() {
        return retention.isEmpty() ? Optional.empty() : Optional.of(retention.get(retention.size() - 1));
    }

    /**
     * @return effective coulombic efficiency of every record that has one
     */
    public List<CyclePoint> getEfficiencies() {
        return efficiencies;
    }

    public List<Double> getStableEfficiencies() {
        return stableEfficiencies;
    }

    public Optional<Double> getCeMean() {
        return Optional.ofNullable(ceMean);
    }

    public Optional<Double> getCeStd() {
        return Optional.ofNullable(ceStd);
    }

    /**
     * @return effective efficiency of the first record, if it has one
     */
    public Optional<Double> getFirstCycleEfficiency() {
        return Optional.ofNullable(firstCycleEfficiency);
    }

    public Optional<Double> getFirstDischarge() {
        return Optional.ofNullable(firstDischarge);
    }

    @Override
    public String toString() {
        return "CellMetrics{" +
                "capacityColumn=" + capacityColumn +
                ", capacityPoints=" + capacity.size() +
                ", ceMean=" + ceMean +
                ", ceStd=" + ceStd +
                ", firstCycleEfficiency=" + firstCycleEfficiency +
                ", firstDischarge=" + firstDischarge +
                '}';
    }
}
