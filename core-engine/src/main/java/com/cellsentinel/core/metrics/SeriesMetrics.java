package com.cellsentinel.core.metrics;

import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.CycleColumn;
import com.cellsentinel.core.model.CycleRecord;
import com.cellsentinel.core.model.ProjectKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure, stateless metric extractors over a {@link CellSeries}.
 *
 * <p>
 * Every function that needs a minimum amount of data returns
 * {@link Optional#empty()} ("undefined") instead of throwing when that data is
 * not available. Absent values are skipped, never read as zero.
 * </p>
 *
 * <h3>Conventions</h3>
 * <ul>
 * <li>Standard deviation of a sample ({@link #sampleStd}) divides by
 * {@code n - 1}; the z-score uses the population form ({@link #populationStd},
 * divides by {@code n}).</li>
 * <li>Retention is read from specific discharge capacity when the series has
 * it, otherwise from absolute discharge capacity. The two are never mixed
 * within one series.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SeriesMetrics {

    /** Minimum population size for a defined z-score. */
    public static final int MIN_Z_POPULATION = 3;

    /** Number of leading records considered for the first discharge capacity. */
    static final int FIRST_DISCHARGE_RECORDS = 3;

    private SeriesMetrics() {
        // utility class: not instantiable
    }

    // ---------------------------------------------------------------
    // Capacity & retention
    // ---------------------------------------------------------------

    /**
     * Column used for retention and fade analysis.
     *
     * @param series the series
     * @return specific discharge capacity if any record carries it, otherwise
     *         absolute discharge capacity
     */
    public static CycleColumn capacityColumn(CellSeries series) {
        Objects.requireNonNull(series, "CellSeries must not be null");
        return series.hasColumn(CycleColumn.SPECIFIC_DISCHARGE_CAPACITY)
                ? CycleColumn.SPECIFIC_DISCHARGE_CAPACITY
                : CycleColumn.DISCHARGE_CAPACITY;
    }

    /**
     * @param series the series
     * @param column the column to extract
     * @return present values of the column, in cycle order
     */
    public static List<CyclePoint> points(CellSeries series, CycleColumn column) {
        Objects.requireNonNull(series, "CellSeries must not be null");
        List<CyclePoint> out = new ArrayList<>(series.size());
        for (CycleRecord r : series.getRecords()) {
            r.get(column).ifPresent(v -> out.add(new CyclePoint(r.getCycleNumber(), v)));
        }
        return out;
    }

    /**
     * Retention curve: each present capacity divided by the capacity of the
     * first valid cycle (first present, strictly positive value).
     *
     * @param capacity capacity points in cycle order
     * @return retention points from the first valid cycle onwards (the first
     *         point is always {@code 1.0}); empty if there is no valid cycle
     */
    public static List<CyclePoint> retentionCurve(List<CyclePoint> capacity) {
        Objects.requireNonNull(capacity, "Capacity points must not be null");
        int start = -1;
        for (int i = 0; i < capacity.size(); i++) {
            if (capacity.get(i).getValue() > 0) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return List.of();
        }
        double reference = capacity.get(start).getValue();
        List<CyclePoint> out = new ArrayList<>(capacity.size() - start);
        for (int i = start; i < capacity.size(); i++) {
            CyclePoint p = capacity.get(i);
            out.add(new CyclePoint(p.getCycle(), p.getValue() / reference));
        }
        return out;
    }

    /**
     * {@code retention(cycle) = discharge(cycle) / discharge(first valid cycle)}.
     *
     * @param series the series
     * @param cycle  cycle number
     * @return retention at that cycle, or empty if the cycle has no capacity
     *         or precedes the first valid cycle
     */
    public static Optional<Double> retention(CellSeries series, int cycle) {
        for (CyclePoint p : retentionCurve(points(series, capacityColumn(series)))) {
            if (p.getCycle() == cycle) {
                return Optional.of(p.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * First discharge capacity: the largest of the first three records'
     * values in the capacity column.
     *
     * @param series the series
     * @return first discharge capacity, or empty if none of those records has a
     *         value
     */
    public static Optional<Double> firstDischarge(CellSeries series) {
        CycleColumn column = capacityColumn(series);
        List<CycleRecord> records = series.getRecords();
        Double best = null;
        for (int i = 0; i < Math.min(FIRST_DISCHARGE_RECORDS, records.size()); i++) {
            Optional<Double> v = records.get(i).get(column);
            if (v.isPresent() && (best == null || v.get() > best)) {
                best = v.get();
            }
        }
        return Optional.ofNullable(best);
    }

    // ---------------------------------------------------------------
    // Coulombic efficiency
    // ---------------------------------------------------------------

    /**
     * Efficiency of a record as interpreted for the series' project kind.
     *
     * <p>
     * For {@link ProjectKind#ANODE} records carrying both absolute capacities,
     * efficiency is charge over discharge. Otherwise the supplied ratio is
     * used.
     * </p>
     *
     * @param kind   project kind of the owning series
     * @param record the record
     * @return efficiency ratio, or empty if it cannot be determined
     */
    public static Optional<Double> effectiveEfficiency(ProjectKind kind, CycleRecord record) {
        if (kind == ProjectKind.ANODE) {
            Optional<Double> charge = record.getChargeCapacityMah();
            Optional<Double> discharge = record.getDischargeCapacityMah();
            if (charge.isPresent() && discharge.isPresent() && discharge.get() > 0) {
                return Optional.of(charge.get() / discharge.get());
            }
        }
        return record.getCoulombicEfficiency();
    }

    /**
     * @param series the series
     * @return effective efficiency of every record that has one
     */
    public static List<CyclePoint> efficiencies(CellSeries series) {
        List<CyclePoint> out = new ArrayList<>(series.size());
        for (CycleRecord r : series.getRecords()) {
            effectiveEfficiency(series.getProjectKind(), r)
                    .ifPresent(v -> out.add(new CyclePoint(r.getCycleNumber(), v)));
        }
        return out;
    }

    /**
     * Stable cycling window: records strictly after the formation cycles.
     *
     * @param series the series
     * @return records whose cycle number exceeds the formation cycle count
     */
    public static List<CycleRecord> stableWindow(CellSeries series) {
        int formation = series.getFormationCycleCount();
        return series.getRecords().stream()
                .filter(r -> r.getCycleNumber() > formation)
                .toList();
    }

    /**
     * @param series the series
     * @return effective efficiencies within the stable cycling window
     */
    public static List<Double> stableEfficiencies(CellSeries series) {
        List<Double> out = new ArrayList<>();
        for (CycleRecord r : stableWindow(series)) {
            effectiveEfficiency(series.getProjectKind(), r).ifPresent(out::add);
        }
        return out;
    }

    public static Optional<Double> ceMean(CellSeries series) {
        return mean(stableEfficiencies(series));
    }

    public static Optional<Double> ceStd(CellSeries series) {
        return sampleStd(stableEfficiencies(series));
    }

    // ---------------------------------------------------------------
    // Degradation & data completeness
    // ---------------------------------------------------------------

    /**
     * Mean fractional capacity loss per cycle over a window, taken as the
     * negated least-squares slope of retention against cycle number.
     *
     * @param retention retention points of the window
     * @return loss per cycle (positive means fading), or empty for fewer than
     *         two points
     */
    public static Optional<Double> degradationRate(List<CyclePoint> retention) {
        return slope(retention).map(s -> -s);
    }

    /**
     * @param series the series
     * @param column the column to inspect
     * @return fraction of records missing the column; {@code 0} for an empty
     *         series
     */
    public static double missingFraction(CellSeries series, CycleColumn column) {
        if (series.isEmpty()) {
            return 0.0;
        }
        long missing = series.getRecords().stream().filter(r -> r.get(column).isEmpty()).count();
        return (double) missing / series.size();
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    /**
     * {@code (value - mean(population)) / std(population)}.
     *
     * @param value      the value to score
     * @param population reference population
     * @return the z-score, or empty when the population has fewer than
     *         {@value #MIN_Z_POPULATION} members or zero spread
     */
    public static Optional<Double> zScore(double value, Collection<Double> population) {
        if (population.size() < MIN_Z_POPULATION) {
            return Optional.empty();
        }
        double mean = mean(population).orElseThrow();
        double std = populationStd(population).orElseThrow();
        if (std == 0) {
            return Optional.empty();
        }
        return Optional.of((value - mean) / std);
    }

    public static Optional<Double> mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return Optional.of(sum / values.size());
    }

    /**
     * @param values sample values
     * @return sample standard deviation ({@code n - 1}), or empty for fewer
     *         than two values
     */
    public static Optional<Double> sampleStd(Collection<Double> values) {
        if (values.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(Math.sqrt(sumSquaredDiff(values) / (values.size() - 1)));
    }

    /**
     * @param values population values
     * @return population standard deviation ({@code n}), or empty when empty
     */
    public static Optional<Double> populationStd(Collection<Double> values) {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Math.sqrt(sumSquaredDiff(values) / values.size()));
    }

    /**
     * Least-squares slope of value against cycle number.
     *
     * @param points the points
     * @return the slope, or empty for fewer than two points or a single
     *         distinct cycle
     */
    public static Optional<Double> slope(List<CyclePoint> points) {
        int n = points.size();
        if (n < 2) {
            return Optional.empty();
        }
        double meanX = 0;
        double meanY = 0;
        for (CyclePoint p : points) {
            meanX += p.getCycle();
            meanY += p.getValue();
        }
        meanX /= n;
        meanY /= n;

        double sxy = 0;
        double sxx = 0;
        for (CyclePoint p : points) {
            double dx = p.getCycle() - meanX;
            sxy += dx * (p.getValue() - meanY);
            sxx += dx * dx;
        }
        return sxx == 0 ? Optional.empty() : Optional.of(sxy / sxx);
    }

    public static List<Double> values(List<CyclePoint> points) {
        return points.stream().map(CyclePoint::getValue).toList();
    }

    private static double sumSquaredDiff(Collection<Double> values) {
        double mean = mean(values).orElseThrow();
        double sum = 0;
        for (double v : values) {
            double diff = v - mean;
            sum += diff * diff;
        }
        return sum;
    }
}
