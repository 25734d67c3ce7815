package com.cellsentinel.core.summary;

import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagCategory;
import com.cellsentinel.core.model.FlagSet;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-cell roll-up of the flags raised for one experiment.
 *
 * <p>
 * Severity and category counts always carry every constant (zero when
 * nothing was raised); type counts only carry the types that occurred. All
 * maps iterate in enum declaration order.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExperimentFlagReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int totalFlags;
    private final int cellsEvaluated;
    private final int cellsWithFlags;
    private final Map<Severity, Integer> bySeverity;
    private final Map<FlagType, Integer> byType;
    private final Map<FlagCategory, Integer> byCategory;

    private ExperimentFlagReport(int totalFlags, int cellsEvaluated, int cellsWithFlags,
            EnumMap<Severity, Integer> bySeverity,
            EnumMap<FlagType, Integer> byType,
            EnumMap<FlagCategory, Integer> byCategory) {
        this.totalFlags = totalFlags;
        this.cellsEvaluated = cellsEvaluated;
        this.cellsWithFlags = cellsWithFlags;
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.byType = Collections.unmodifiableMap(byType);
        this.byCategory = Collections.unmodifiableMap(byCategory);
    }

    /**
     * Roll up the flag sets of an experiment.
     *
     * @param flagsByCell flag sets keyed by cell identifier; must not be
     *                    {@code null}
     * @return the report
     */
    public static ExperimentFlagReport of(Map<String, FlagSet> flagsByCell) {
        Objects.requireNonNull(flagsByCell, "Flag sets must not be null");

        EnumMap<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            bySeverity.put(s, 0);
        }
        EnumMap<FlagCategory, Integer> byCategory = new EnumMap<>(FlagCategory.class);
        for (FlagCategory c : FlagCategory.values()) {
            byCategory.put(c, 0);
        }
        EnumMap<FlagType, Integer> byType = new EnumMap<>(FlagType.class);

        int total = 0;
        int withFlags = 0;
        for (FlagSet set : flagsByCell.values()) {
            if (!set.isEmpty()) {
                withFlags++;
            }
            for (Flag f : set.getFlags()) {
                total++;
                bySeverity.merge(f.getSeverity(), 1, Integer::sum);
                byCategory.merge(f.getCategory(), 1, Integer::sum);
                byType.merge(f.getType(), 1, Integer::sum);
            }
        }
        return new ExperimentFlagReport(total, flagsByCell.size(), withFlags, bySeverity, byType, byCategory);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getTotalFlags() {
        return totalFlags;
    }

    public int getCellsEvaluated() {
        return cellsEvaluated;
    }

    public int getCellsWithFlags() {
        return cellsWithFlags;
    }

    public Map<Severity, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<FlagType, Integer> getByType() {
        return byType;
    }

    public Map<FlagCategory, Integer> getByCategory() {
        return byCategory;
    }

    public int count(Severity severity) {
        return bySeverity.get(severity);
    }

    public int count(FlagType type) {
        return byType.getOrDefault(type, 0);
    }

    public int count(FlagCategory category) {
        return byCategory.get(category);
    }

    @Override
    public String toString() {
        return "ExperimentFlagReport{"
                + "totalFlags=" + totalFlags
                + ", cellsEvaluated=" + cellsEvaluated
                + ", cellsWithFlags=" + cellsWithFlags
                + ", bySeverity=" + bySeverity
                + '}';
    }
}
