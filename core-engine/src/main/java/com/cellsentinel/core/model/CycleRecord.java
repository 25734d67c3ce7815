package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of cycling data for one cell.
 *
 * <p>
 * Every measured value is optional. An absent value is reported as
 * {@link Optional#empty()} and is never treated as zero by the detectors.
 * Capacities are expected in mAh (absolute) and mAh/g (specific); coulombic
 * efficiency is a ratio, not a percentage.
 * </p>
 *
 * <p>
 * Instances are immutable. Use {@link #builder(int)} to construct them.
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int cycleNumber;
    private final Double chargeCapacityMah;
    private final Double dischargeCapacityMah;
    private final Double specificChargeCapacity;
    private final Double specificDischargeCapacity;
    private final Double coulombicEfficiency;

    private CycleRecord(Builder b) {
        this.cycleNumber = b.cycleNumber;
        this.chargeCapacityMah = b.chargeCapacityMah;
        this.dischargeCapacityMah = b.dischargeCapacityMah;
        this.specificChargeCapacity = b.specificChargeCapacity;
        this.specificDischargeCapacity = b.specificDischargeCapacity;
        this.coulombicEfficiency = b.coulombicEfficiency;
    }

    /**
     * Create a builder for the given cycle.
     *
     * @param cycleNumber the cycle number (validated when the owning
     *                    {@link CellSeries} is built)
     * @return builder instance
     */
    public static Builder builder(int cycleNumber) {
        return new Builder(cycleNumber);
    }

    /**
     * Look up a value by column.
     *
     * @param column the column to read
     * @return the value, or empty when absent
     */
    public Optional<Double> get(CycleColumn column) {
        Objects.requireNonNull(column, "Column must not be null");
        return switch (column) {
            case CHARGE_CAPACITY -> getChargeCapacityMah();
            case DISCHARGE_CAPACITY -> getDischargeCapacityMah();
            case SPECIFIC_CHARGE_CAPACITY -> getSpecificChargeCapacity();
            case SPECIFIC_DISCHARGE_CAPACITY -> getSpecificDischargeCapacity();
            case COULOMBIC_EFFICIENCY -> getCoulombicEfficiency();
        };
    }

    public int getCycleNumber() {
        return cycleNumber;
    }

    public Optional<Double> getChargeCapacityMah() {
        return Optional.ofNullable(chargeCapacityMah);
    }

    public Optional<Double> getDischargeCapacityMah() {
        return Optional.ofNullable(dischargeCapacityMah);
    }

    public Optional<Double> getSpecificChargeCapacity() {
        return Optional.ofNullable(specificChargeCapacity);
    }

    public Optional<Double> getSpecificDischargeCapacity() {
        return Optional.ofNullable(specificDischargeCapacity);
    }

    public Optional<Double> getCoulombicEfficiency() {
        return Optional.ofNullable(coulombicEfficiency);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link CycleRecord}. Non-finite values ({@code NaN} and infinities) are
     * stored as absent.
     */
    public static class Builder {
        private final int cycleNumber;
        private Double chargeCapacityMah;
        private Double dischargeCapacityMah;
        private Double specificChargeCapacity;
        private Double specificDischargeCapacity;
        private Double coulombicEfficiency;

        private Builder(int cycleNumber) {
            this.cycleNumber = cycleNumber;
        }

        public Builder chargeCapacityMah(Double v) {
            this.chargeCapacityMah = present(v);
            return this;
        }

        public Builder dischargeCapacityMah(Double v) {
            this.dischargeCapacityMah = present(v);
            return this;
        }

        public Builder specificChargeCapacity(Double v) {
            this.specificChargeCapacity = present(v);
            return this;
        }

        public Builder specificDischargeCapacity(Double v) {
            this.specificDischargeCapacity = present(v);
            return this;
        }

        public Builder coulombicEfficiency(Double v) {
            this.coulombicEfficiency = present(v);
            return this;
        }

        public CycleRecord build() {
            return new CycleRecord(this);
        }

        private static Double present(Double v) {
            return v == null || !Double.isFinite(v) ? null : v;
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CycleRecord that))
            return false;
        return cycleNumber == that.cycleNumber
                && Objects.equals(chargeCapacityMah, that.chargeCapacityMah)
                && Objects.equals(dischargeCapacityMah, that.dischargeCapacityMah)
                && Objects.equals(specificChargeCapacity, that.specificChargeCapacity)
                && Objects.equals(specificDischargeCapacity, that.specificDischargeCapacity)
                && Objects.equals(coulombicEfficiency, that.coulombicEfficiency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cycleNumber, chargeCapacityMah, dischargeCapacityMah,
                specificChargeCapacity, specificDischargeCapacity, coulombicEfficiency);
    }

    @Override
    public String toString() {
        return "CycleRecord{" +
                "cycle=" + cycleNumber +
                ", qChg=" + chargeCapacityMah +
                ", qDis=" + dischargeCapacityMah +
                ", qChgSpecific=" + specificChargeCapacity +
                ", qDisSpecific=" + specificDischargeCapacity +
                ", ce=" + coulombicEfficiency +
                '}';
    }
}
