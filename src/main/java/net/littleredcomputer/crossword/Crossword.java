package net.littleredcomputer.crossword;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Ordering;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The fixed puzzle: which cells of the grid are open, the slots (variables) they form, the
 * vocabulary, and the overlap of every crossing pair of slots. Immutable once built.
 */
public class Crossword {
    private static final char OPEN = '_';

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final ImmutableSet<String> words;
    private final ImmutableList<Variable> variables;
    private final ImmutableTable<Variable, Variable, Overlap> overlaps;

    private Crossword(boolean[][] structure, Iterable<String> words) {
        Preconditions.checkArgument(structure.length > 0, "structure has no rows");
        this.height = structure.length;
        this.width = structure[0].length;
        Preconditions.checkArgument(width > 0, "structure has no columns");
        for (boolean[] row : structure) {
            Preconditions.checkArgument(row.length == width, "ragged structure");
        }
        this.structure = structure;
        this.words = ImmutableSet.copyOf(words);

        List<Variable> vs = new ArrayList<>();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                // A slot starts at an open cell whose predecessor in the slot's direction is closed.
                if (i == 0 || !structure[i - 1][j]) {
                    int length = 0;
                    while (i + length < height && structure[i + length][j]) ++length;
                    if (length > 1) vs.add(new Variable(i, j, Variable.Direction.DOWN, length));
                }
                if (j == 0 || !structure[i][j - 1]) {
                    int length = 0;
                    while (j + length < width && structure[i][j + length]) ++length;
                    if (length > 1) vs.add(new Variable(i, j, Variable.Direction.ACROSS, length));
                }
            }
        }
        this.variables = ImmutableList.sortedCopyOf(vs);

        ImmutableTable.Builder<Variable, Variable, Overlap> ob = ImmutableTable.<Variable, Variable, Overlap>builder()
                .orderRowsBy(Ordering.natural())
                .orderColumnsBy(Ordering.natural());
        for (int a = 0; a < variables.size(); ++a) {
            Variable v1 = variables.get(a);
            for (Variable v2 : variables.subList(a + 1, variables.size())) {
                crossing(v1, v2).ifPresent(o -> {
                    ob.put(v1, v2, o);
                    ob.put(v2, v1, o.reversed());
                });
            }
        }
        this.overlaps = ob.build();
    }

    private static Optional<Overlap> crossing(Variable v1, Variable v2) {
        if (v1.direction() == v2.direction()) return Optional.empty();
        ImmutableList<int[]> c1 = v1.cells();
        ImmutableList<int[]> c2 = v2.cells();
        for (int k = 0; k < c1.size(); ++k) {
            for (int l = 0; l < c2.size(); ++l) {
                if (Arrays.equals(c1.get(k), c2.get(l))) return Optional.of(new Overlap(k, l));
            }
        }
        return Optional.empty();
    }

    public int height() { return height; }
    public int width() { return width; }

    public boolean isOpen(int row, int column) {
        return structure[row][column];
    }

    public ImmutableSet<String> words() { return words; }

    /**
     * @return the slots of the puzzle in their natural order
     */
    public ImmutableList<Variable> variables() { return variables; }

    /**
     * @return the overlap of x with y, if they cross. The overlap of y with x is the reverse.
     */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        return Optional.ofNullable(overlaps.get(x, y));
    }

    /**
     * @return the variables crossing v, with the overlap of v with each of them
     */
    public ImmutableMap<Variable, Overlap> neighbors(Variable v) {
        return overlaps.row(v);
    }

    public int degree(Variable v) {
        return overlaps.row(v).size();
    }

    /**
     * @return every ordered pair of neighboring variables
     */
    public ImmutableList<Arc> arcs() {
        return overlaps.cellSet().stream()
                .map(c -> new Arc(c.getRowKey(), c.getColumnKey()))
                .collect(ImmutableList.toImmutableList());
    }

    public static Crossword parseFrom(String structure, String words) {
        return parseFrom(new StringReader(structure), new StringReader(words));
    }

    /**
     * Builds a puzzle from its two text descriptions.
     * @param structure one line per grid row; '_' marks an open cell, any other character a
     *                  block. Short lines are padded with blocks to the width of the longest.
     * @param words one word per line; words are trimmed and upper-cased, and blank lines skipped
     * @return the puzzle
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        List<String> rows = new BufferedReader(structure).lines().collect(Collectors.toList());
        if (rows.isEmpty()) throw new IllegalArgumentException("empty structure");
        int width = rows.stream().mapToInt(String::length).max().orElse(0);
        boolean[][] s = new boolean[rows.size()][width];
        for (int i = 0; i < rows.size(); ++i) {
            String row = rows.get(i);
            for (int j = 0; j < row.length(); ++j) s[i][j] = row.charAt(j) == OPEN;
        }
        List<String> vocabulary = new BufferedReader(words).lines()
                .map(String::trim)
                .filter(w -> !w.isEmpty())
                .map(w -> w.toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
        return new Crossword(s, vocabulary);
    }
}
