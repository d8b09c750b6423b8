package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * The shared cell of two crossing slots: letter {@code first} of one word must equal
 * letter {@code second} of the other.
 */
public final class Overlap {
    private final int first;
    private final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public int first() { return first; }
    public int second() { return second; }

    Overlap reversed() { return new Overlap(second, first); }

    /**
     * @return true if word {@code x} and word {@code y} agree at this overlap
     */
    boolean agrees(String x, String y) {
        return x.charAt(first) == y.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Overlap overlap = (Overlap) o;
        return first == overlap.first && second == overlap.second;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
