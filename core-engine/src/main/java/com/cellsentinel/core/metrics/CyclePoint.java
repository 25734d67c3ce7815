package com.cellsentinel.core.metrics;

import java.io.Serializable;
import java.util.Objects;

/**
 * A present value of some per-cycle quantity, tagged with its cycle number.
 *
 * @since 1.0.0
 */
public final class CyclePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int cycle;
    private final double value;

    public CyclePoint(int cycle, double value) {
        this.cycle = cycle;
        this.value = value;
    }

    public int getCycle() {
        return cycle;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CyclePoint that))
            return false;
        return cycle == that.cycle && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cycle, value);
    }

    @Override
    public String toString() {
        return cycle + ":" + value;
    }
}
