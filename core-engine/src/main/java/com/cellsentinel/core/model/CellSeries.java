package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable cycling history of one physical cell plus its cell-level
 * metadata.
 *
 * <p>
 * A series is the sole input of a detection pass. It is built once by the
 * ingestion side and never mutated afterwards; the engine keeps no reference
 * to it once a pass has returned.
 * </p>
 *
 * <h3>Invariant</h3>
 * <p>
 * Cycle numbers are positive, unique and strictly increasing. The
 * {@link Builder} enforces this at {@link Builder#build()} time and throws
 * {@link InvalidSeriesException} otherwise, so every existing instance is
 * valid. No invariant is imposed on capacity magnitudes.
 * </p>
 *
 * @since 1.0.0
 */
public final class CellSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Formation cycles assumed when none are configured. */
    public static final int DEFAULT_FORMATION_CYCLES = 4;

    private final String cellIdentifier;
    private final Double loadingMg;
    private final Double activeMaterialPercent;
    private final ProjectKind projectKind;
    private final int formationCycleCount;
    private final List<CycleRecord> records;

    private CellSeries(Builder b) {
        this.cellIdentifier = b.cellIdentifier;
        this.loadingMg = b.loadingMg;
        this.activeMaterialPercent = b.activeMaterialPercent;
        this.projectKind = b.projectKind;
        this.formationCycleCount = b.formationCycleCount;
        this.records = Collections.unmodifiableList(new ArrayList<>(b.records));
    }

    /**
     * Create a builder for the given cell.
     *
     * @param cellIdentifier unique cell identifier (e.g. test number)
     * @return builder instance
     */
    public static Builder builder(String cellIdentifier) {
        return new Builder(cellIdentifier);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getCellIdentifier() {
        return cellIdentifier;
    }

    public Optional<Double> getLoadingMg() {
        return Optional.ofNullable(loadingMg);
    }

    public Optional<Double> getActiveMaterialPercent() {
        return Optional.ofNullable(activeMaterialPercent);
    }

    public ProjectKind getProjectKind() {
        return projectKind;
    }

    public int getFormationCycleCount() {
        return formationCycleCount;
    }

    /**
     * @return unmodifiable list of records in cycle order
     */
    public List<CycleRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Optional<CycleRecord> firstRecord() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    /**
     * @param column the column to inspect
     * @return {@code true} if at least one record carries a value for it
     */
    public boolean hasColumn(CycleColumn column) {
        for (CycleRecord r : records) {
            if (r.get(column).isPresent()) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link CellSeries}.
     *
     * <p>
     * {@link #build()} validates the cycle-number invariant and the metadata,
     * throwing {@link InvalidSeriesException} with every violation found.
     * </p>
     */
    public static class Builder {
        private final String cellIdentifier;
        private Double loadingMg;
        private Double activeMaterialPercent;
        private ProjectKind projectKind = ProjectKind.FULL_CELL;
        private int formationCycleCount = DEFAULT_FORMATION_CYCLES;
        private final List<CycleRecord> records = new ArrayList<>();

        private Builder(String cellIdentifier) {
            this.cellIdentifier = cellIdentifier;
        }

        public Builder loadingMg(Double v) {
            this.loadingMg = v;
            return this;
        }

        public Builder activeMaterialPercent(Double v) {
            this.activeMaterialPercent = v;
            return this;
        }

        public Builder projectKind(ProjectKind v) {
            this.projectKind = v != null ? v : ProjectKind.FULL_CELL;
            return this;
        }

        public Builder formationCycleCount(int v) {
            this.formationCycleCount = v;
            return this;
        }

        public Builder addRecord(CycleRecord record) {
            records.add(Objects.requireNonNull(record, "CycleRecord must not be null"));
            return this;
        }

        public Builder records(List<CycleRecord> values) {
            Objects.requireNonNull(values, "Records list must not be null");
            values.forEach(this::addRecord);
            return this;
        }

        /**
         * Validate and build the series.
         *
         * @return an immutable {@link CellSeries}
         * @throws InvalidSeriesException if the identifier is blank, the
         *                                formation count is negative, or cycle
         *                                numbers are not positive and strictly
         *                                increasing
         */
        public CellSeries build() {
            List<String> errors = new ArrayList<>();

            if (cellIdentifier == null || cellIdentifier.isBlank()) {
                errors.add("cell identifier is required");
            }
            if (formationCycleCount < 0) {
                errors.add("formationCycleCount must be >= 0, got: " + formationCycleCount);
            }

            int previous = 0;
            for (CycleRecord r : records) {
                int cycle = r.getCycleNumber();
                if (cycle <= 0) {
                    errors.add("cycle number must be positive, got: " + cycle);
                } else if (cycle == previous) {
                    errors.add("duplicate cycle number " + cycle);
                } else if (cycle < previous) {
                    errors.add("cycle " + cycle + " follows cycle " + previous);
                }
                previous = Math.max(previous, cycle);
            }

            if (!errors.isEmpty()) {
                throw new InvalidSeriesException(cellIdentifier, String.join("; ", errors));
            }
            return new CellSeries(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CellSeries that))
            return false;
        return formationCycleCount == that.formationCycleCount
                && Objects.equals(cellIdentifier, that.cellIdentifier)
                && Objects.equals(loadingMg, that.loadingMg)
                && Objects.equals(activeMaterialPercent, that.activeMaterialPercent)
                && projectKind == that.projectKind
                && Objects.equals(records, that.records);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellIdentifier, loadingMg, activeMaterialPercent, projectKind,
                formationCycleCount, records);
    }

    @Override
    public String toString() {
        return "CellSeries{" +
                "cell='" + cellIdentifier + '\'' +
                ", projectKind=" + projectKind +
                ", formationCycles=" + formationCycleCount +
                ", cycles=" + records.size() +
                '}';
    }
}
