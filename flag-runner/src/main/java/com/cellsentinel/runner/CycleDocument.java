package com.cellsentinel.runner;

import com.cellsentinel.core.model.CycleRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON shape of one cycle row in an experiment input document. Absent
 * numbers stay {@code null}.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CycleDocument {

    private int cycle;
    private Double chargeCapacityMah;
    private Double dischargeCapacityMah;
    private Double specificChargeCapacity;
    private Double specificDischargeCapacity;
    private Double coulombicEfficiency;

    public CycleDocument() {
    }

    /**
     * @return the domain record of this row
     */
    public CycleRecord toRecord() {
        return CycleRecord.builder(cycle)
                .chargeCapacityMah(chargeCapacityMah)
                .dischargeCapacityMah(dischargeCapacityMah)
                .specificChargeCapacity(specificChargeCapacity)
                .specificDischargeCapacity(specificDischargeCapacity)
                .coulombicEfficiency(coulombicEfficiency)
                .build();
    }

    public int getCycle() {
        return cycle;
    }

    public void setCycle(int cycle) {
        this.cycle = cycle;
    }

    public Double getChargeCapacityMah() {
        return chargeCapacityMah;
    }

    public void setChargeCapacityMah(Double chargeCapacityMah) {
        this.chargeCapacityMah = chargeCapacityMah;
    }

    public Double getDischargeCapacityMah() {
        return dischargeCapacityMah;
    }

    public void setDischargeCapacityMah(Double dischargeCapacityMah) {
        this.dischargeCapacityMah = dischargeCapacityMah;
    }

    public Double getSpecificChargeCapacity() {
        return specificChargeCapacity;
    }

    public void setSpecificChargeCapacity(Double specificChargeCapacity) {
        this.specificChargeCapacity = specificChargeCapacity;
    }

    public Double getSpecificDischargeCapacity() {
        return specificDischargeCapacity;
    }

    public void setSpecificDischargeCapacity(Double specificDischargeCapacity) {
        this.specificDischargeCapacity = specificDischargeCapacity;
    }

    public Double getCoulombicEfficiency() {
        return coulombicEfficiency;
    }

    public void setCoulombicEfficiency(Double coulombicEfficiency) {
        this.coulombicEfficiency = coulombicEfficiency;
    }
}
