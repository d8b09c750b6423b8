package net.littleredcomputer.crossword;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import java.util.Locale;
import java.util.Objects;

/**
 * A slot of the crossword: a run of open cells read across or down, starting at (row, column).
 */
public final class Variable implements Comparable<Variable> {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private final int row;
    private final int column;
    private final Direction direction;
    private final int length;

    public Variable(int row, int column, Direction direction, int length) {
        Preconditions.checkArgument(row >= 0 && column >= 0, "negative origin %s,%s", row, column);
        Preconditions.checkArgument(length >= 2, "slot length must be at least 2: %s", length);
        this.row = row;
        this.column = column;
        this.direction = Preconditions.checkNotNull(direction);
        this.length = length;
    }

    public int row() { return row; }
    public int column() { return column; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    int rowOf(int k) { return row + (direction == Direction.DOWN ? k : 0); }
    int columnOf(int k) { return column + (direction == Direction.ACROSS ? k : 0); }

    /**
     * @return the cells covered by this slot, as {row, column} pairs, in letter order
     */
    public ImmutableList<int[]> cells() {
        ImmutableList.Builder<int[]> b = ImmutableList.builder();
        for (int k = 0; k < length; ++k) b.add(new int[]{rowOf(k), columnOf(k)});
        return b.build();
    }

    @Override
    public int compareTo(Variable o) {
        return ComparisonChain.start()
                .compare(row, o.row)
                .compare(column, o.column)
                .compare(direction, o.direction)
                .compare(length, o.length)
                .result();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variable v = (Variable) o;
        return row == v.row && column == v.column && direction == v.direction && length == v.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, direction, length);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ") " + direction.name().toLowerCase(Locale.ROOT) + " : " + length;
    }
}
