package com.cellsentinel.core.model;

/**
 * Grouping of flag types for display and roll-up statistics.
 *
 * @since 1.0.0
 */
public enum FlagCategory {

    PERFORMANCE("Performance"),
    QUALITY_ASSURANCE("Quality Assurance"),
    DATA_INTEGRITY("Data Integrity"),
    ELECTROCHEMISTRY("Electrochemistry");

    private final String displayName;

    FlagCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
