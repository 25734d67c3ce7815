package com.cellsentinel.core.detection;

import com.cellsentinel.core.metrics.SeriesMetrics;
import com.cellsentinel.core.model.CellSeries;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * First-discharge capacities of all cells in one experiment, used by
 * cross-cell detectors.
 *
 * <p>
 * A cell is always compared against its <em>peers</em>: its own value is left
 * out of the reference population. Keyed populations drop the entry with the
 * cell's identifier; anonymous populations drop one value equal to the cell's
 * own first discharge.
 * </p>
 *
 * <p>
 * Immutable; read-only for the duration of a detection pass.
 * </p>
 *
 * @since 1.0.0
 */
public final class SiblingPopulation {

    private static final SiblingPopulation EMPTY = new SiblingPopulation(Map.of(), List.of());

    private final Map<String, Double> byCell;
    private final List<Double> anonymous;

    private SiblingPopulation(Map<String, Double> byCell, List<Double> anonymous) {
        this.byCell = byCell;
        this.anonymous = anonymous;
    }

    public static SiblingPopulation empty() {
        return EMPTY;
    }

    /**
     * @param firstDischargeByCell first discharge capacity per cell identifier;
     *                             {@code null} values are skipped
     * @return keyed population
     */
    public static SiblingPopulation of(Map<String, Double> firstDischargeByCell) {
        Objects.requireNonNull(firstDischargeByCell, "Population map must not be null");
        Map<String, Double> copy = new LinkedHashMap<>();
        firstDischargeByCell.forEach((cell, value) -> {
            if (cell != null && value != null && !value.isNaN()) {
                copy.put(cell, value);
            }
        });
        return new SiblingPopulation(Collections.unmodifiableMap(copy), List.of());
    }

    /**
     * @param firstDischargeValues first discharge capacities of every cell in
     *                             the experiment; {@code null} values are
     *                             skipped
     * @return anonymous population
     */
    public static SiblingPopulation ofValues(Collection<Double> firstDischargeValues) {
        Objects.requireNonNull(firstDischargeValues, "Population values must not be null");
        List<Double> copy = new ArrayList<>();
        for (Double v : firstDischargeValues) {
            if (v != null && !v.isNaN()) {
                copy.add(v);
            }
        }
        return new SiblingPopulation(Map.of(), Collections.unmodifiableList(copy));
    }

    /**
     * Build a keyed population from the cells of one experiment. Cells without
     * a first discharge capacity are left out.
     *
     * @param experiment every series of the experiment
     * @return keyed population
     */
    public static SiblingPopulation fromSeries(Collection<CellSeries> experiment) {
        Objects.requireNonNull(experiment, "Experiment series must not be null");
        Map<String, Double> values = new LinkedHashMap<>();
        for (CellSeries series : experiment) {
            SeriesMetrics.firstDischarge(series)
                    .ifPresent(v -> values.put(series.getCellIdentifier(), v));
        }
        return of(values);
    }

    /**
     * @return number of members supplied, the evaluated cell included
     */
    public int size() {
        return byCell.size() + anonymous.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Reference population for one cell.
     *
     * @param cellIdentifier identifier of the evaluated cell
     * @param ownValue       the cell's own first discharge capacity
     * @return every member except the evaluated cell
     */
    public List<Double> peersOf(String cellIdentifier, double ownValue) {
        List<Double> peers = new ArrayList<>(size());
        byCell.forEach((cell, value) -> {
            if (!cell.equals(cellIdentifier)) {
                peers.add(value);
            }
        });
        boolean ownSkipped = false;
        for (Double v : anonymous) {
            if (!ownSkipped && Double.compare(v, ownValue) == 0) {
                ownSkipped = true;
            } else {
                peers.add(v);
            }
        }
        return peers;
    }

    @Override
    public String toString() {
        return "SiblingPopulation{size=" + size() + '}';
    }
}
