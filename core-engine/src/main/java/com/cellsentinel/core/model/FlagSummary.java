package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-severity tally of a cell's flags.
 *
 * @since 1.0.0
 */
public final class FlagSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final FlagSummary EMPTY = new FlagSummary(new EnumMap<>(Severity.class));

    private final Map<Severity, Integer> counts;

    private FlagSummary(EnumMap<Severity, Integer> counts) {
        for (Severity s : Severity.values()) {
            counts.putIfAbsent(s, 0);
        }
        this.counts = Collections.unmodifiableMap(counts);
    }

    /**
     * Tally the given flags.
     *
     * @param flags flags to count; must not be {@code null}
     * @return summary of the flags
     */
    public static FlagSummary of(Collection<Flag> flags) {
        Objects.requireNonNull(flags, "Flags must not be null");
        EnumMap<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Flag f : flags) {
            counts.merge(f.getSeverity(), 1, Integer::sum);
        }
        return new FlagSummary(counts);
    }

    public static FlagSummary empty() {
        return EMPTY;
    }

    public int count(Severity severity) {
        return counts.get(severity);
    }

    public int getCriticalCount() {
        return count(Severity.CRITICAL);
    }

    public int getWarningCount() {
        return count(Severity.WARNING);
    }

    public int getInfoCount() {
        return count(Severity.INFO);
    }

    public int getTotal() {
        return getCriticalCount() + getWarningCount() + getInfoCount();
    }

    /**
     * @return unmodifiable counts keyed by severity, in severity order
     */
    public Map<Severity, Integer> getCounts() {
        return counts;
    }

    public Optional<Severity> highestSeverity() {
        for (Severity s : Severity.values()) {
            if (counts.get(s) > 0) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Compact per-row label such as {@code "2 Critical, 3 Warning"}.
     * Severities with no flags are omitted.
     *
     * @return the label, or an empty string when there are no flags
     */
    public String compactLabel() {
        List<String> parts = new ArrayList<>();
        for (Severity s : Severity.values()) {
            int n = counts.get(s);
            if (n > 0) {
                parts.add(n + " " + s.getLabel());
            }
        }
        return String.join(", ", parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlagSummary that))
            return false;
        return counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "FlagSummary" + counts;
    }
}
