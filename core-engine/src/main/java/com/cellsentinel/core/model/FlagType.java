package com.cellsentinel.core.model;

/**
 * Fixed taxonomy of findings the detection engine can emit.
 *
 * <p>
 * Every type carries a stable identifier, a display name, its
 * {@link FlagCategory} and the identifier of the algorithm that produces it.
 * There is exactly one detector per type.
 * </p>
 *
 * @since 1.0.0
 */
public enum FlagType {

    RAPID_CAPACITY_FADE("rapid_capacity_fade", "Rapid Capacity Fade",
            FlagCategory.PERFORMANCE, "pattern_rapid_fade"),
    CELL_FAILURE("cell_failure", "Cell Failure",
            FlagCategory.PERFORMANCE, "pattern_cell_failure"),
    LOW_COULOMBIC_EFFICIENCY("low_coulombic_efficiency", "Low Coulombic Efficiency",
            FlagCategory.PERFORMANCE, "statistical_low_ce"),
    HIGH_CE_VARIATION("high_ce_variation", "High CE Variation",
            FlagCategory.PERFORMANCE, "statistical_ce_variation"),
    ACCELERATING_DEGRADATION("accelerating_degradation", "Accelerating Degradation",
            FlagCategory.PERFORMANCE, "pattern_accelerating_fade"),
    POOR_FIRST_CYCLE_EFFICIENCY("poor_first_cycle_efficiency", "Poor First-Cycle Efficiency",
            FlagCategory.PERFORMANCE, "threshold_first_efficiency"),
    INCOMPLETE_DATASET("incomplete_dataset", "Incomplete Dataset",
            FlagCategory.DATA_INTEGRITY, "heuristic_incomplete_data"),
    PREMATURE_TERMINATION("premature_termination", "Premature Termination",
            FlagCategory.DATA_INTEGRITY, "pattern_premature_stop"),
    MISSING_DATA("missing_data", "Missing Data",
            FlagCategory.DATA_INTEGRITY, "data_completeness_check"),
    DATA_INCONSISTENCY("data_inconsistency", "Data Inconsistency",
            FlagCategory.DATA_INTEGRITY, "data_validation"),
    IMPOSSIBLE_EFFICIENCY("impossible_efficiency", "Impossible Efficiency",
            FlagCategory.ELECTROCHEMISTRY, "physics_conservation_laws"),
    EXCEEDS_THEORETICAL_CAPACITY("theoretical_capacity_violation", "Exceeds Theoretical Capacity",
            FlagCategory.ELECTROCHEMISTRY, "physics_theoretical_limit"),
    ANOMALOUS_FIRST_DISCHARGE("anomalous_first_discharge", "Anomalous First Discharge",
            FlagCategory.QUALITY_ASSURANCE, "statistical_z_score");

    private final String id;
    private final String displayName;
    private final FlagCategory category;
    private final String algorithm;

    FlagType(String id, String displayName, FlagCategory category, String algorithm) {
        this.id = id;
        this.displayName = displayName;
        this.category = category;
        this.algorithm = algorithm;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public FlagCategory getCategory() {
        return category;
    }

    public String getAlgorithm() {
        return algorithm;
    }
}
