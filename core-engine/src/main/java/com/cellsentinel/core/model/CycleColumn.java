package com.cellsentinel.core.model;

/**
 * Named measurement columns of a {@link CycleRecord}.
 *
 * @since 1.0.0
 */
public enum CycleColumn {

    CHARGE_CAPACITY("Q Chg (mAh)", true),
    DISCHARGE_CAPACITY("Q Dis (mAh)", true),
    SPECIFIC_CHARGE_CAPACITY("Q Chg (mAh/g)", true),
    SPECIFIC_DISCHARGE_CAPACITY("Q Dis (mAh/g)", true),
    COULOMBIC_EFFICIENCY("Efficiency (-)", false);

    private final String label;
    private final boolean capacity;

    CycleColumn(String label, boolean capacity) {
        this.label = label;
        this.capacity = capacity;
    }

    /**
     * @return label used in flag messages
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return {@code true} for the four capacity columns
     */
    public boolean isCapacity() {
        return capacity;
    }
}
