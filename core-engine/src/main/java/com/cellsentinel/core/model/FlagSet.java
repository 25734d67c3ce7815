package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered result of one detection pass over one cell.
 *
 * <p>
 * Flags are sorted by severity (Critical first) and then by descending
 * confidence. The sort is stable, so flags that tie keep the order in which
 * they were supplied.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlagSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String cellIdentifier;
    private final List<Flag> flags;
    private final FlagSummary summary;

    private FlagSet(String cellIdentifier, List<Flag> sorted) {
        this.cellIdentifier = cellIdentifier;
        this.flags = Collections.unmodifiableList(sorted);
        this.summary = FlagSummary.of(sorted);
    }

    /**
     * Sort the given flags and wrap them in a set.
     *
     * @param cellIdentifier owning cell; must not be {@code null}
     * @param flags          flags in any order; must not be {@code null}
     * @return the ordered set
     */
    public static FlagSet of(String cellIdentifier, Collection<Flag> flags) {
        Objects.requireNonNull(cellIdentifier, "cellIdentifier must not be null");
        Objects.requireNonNull(flags, "Flags must not be null");
        List<Flag> sorted = new ArrayList<>(flags);
        sorted.sort(Flag.BY_SEVERITY_THEN_CONFIDENCE);
        return new FlagSet(cellIdentifier, sorted);
    }

    public static FlagSet empty(String cellIdentifier) {
        return of(cellIdentifier, List.of());
    }

    public String getCellIdentifier() {
        return cellIdentifier;
    }

    /**
     * @return unmodifiable, sorted list of flags
     */
    public List<Flag> getFlags() {
        return flags;
    }

    public FlagSummary getSummary() {
        return summary;
    }

    public boolean isEmpty() {
        return flags.isEmpty();
    }

    public int size() {
        return flags.size();
    }

    /**
     * @param type flag type to look for
     * @return {@code true} if at least one flag of the type is present
     */
    public boolean contains(FlagType type) {
        return flags.stream().anyMatch(f -> f.getType() == type);
    }

    /**
     * @param type flag type to filter by
     * @return flags of the given type, in set order
     */
    public List<Flag> ofType(FlagType type) {
        return flags.stream().filter(f -> f.getType() == type).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlagSet that))
            return false;
        return cellIdentifier.equals(that.cellIdentifier) && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellIdentifier, flags);
    }

    @Override
    public String toString() {
        return "FlagSet{cell='" + cellIdentifier + "', " + summary.compactLabel() + ", flags=" + flags + '}';
    }
}
