package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Inclusive range of cycle numbers implicated by a {@link Flag}.
 *
 * @since 1.0.0
 */
public final class CycleRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int first;
    private final int last;

    private CycleRange(int first, int last) {
        if (first > last) {
            throw new IllegalArgumentException("first must be <= last, got: " + first + ".." + last);
        }
        this.first = first;
        this.last = last;
    }

    public static CycleRange of(int first, int last) {
        return new CycleRange(first, last);
    }

    public static CycleRange single(int cycle) {
        return new CycleRange(cycle, cycle);
    }

    public int getFirst() {
        return first;
    }

    public int getLast() {
        return last;
    }

    public boolean isSingleCycle() {
        return first == last;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CycleRange that))
            return false;
        return first == that.first && last == that.last;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, last);
    }

    @Override
    public String toString() {
        return isSingleCycle() ? "cycle " + first : "cycles " + first + "-" + last;
    }
}
