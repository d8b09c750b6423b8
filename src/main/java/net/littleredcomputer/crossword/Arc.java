package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * An ordered pair of neighboring variables awaiting revision: x is to be made consistent with y.
 */
public final class Arc {
    final Variable x;
    final Variable y;

    public Arc(Variable x, Variable y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arc arc = (Arc) o;
        return x.equals(arc.x) && y.equals(arc.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return x + " -> " + y;
    }
}
