package net.littleredcomputer.crossword;

import java.util.Map;

/**
 * Renders an assignment (complete or partial) on the grid of its puzzle.
 */
public class CrosswordFormatter {
    private static final char BLOCK = '█';

    private CrosswordFormatter() {}

    /**
     * @return the letter in each cell of the grid, or null where no assigned word passes
     */
    public static Character[][] letterGrid(Crossword crossword, Map<Variable, String> assignment) {
        Character[][] letters = new Character[crossword.height()][crossword.width()];
        assignment.forEach((v, w) -> {
            for (int k = 0; k < w.length(); ++k) letters[v.rowOf(k)][v.columnOf(k)] = w.charAt(k);
        });
        return letters;
    }

    public static String format(Crossword crossword, Map<Variable, String> assignment) {
        Character[][] letters = letterGrid(crossword, assignment);
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < crossword.height(); ++i) {
            for (int j = 0; j < crossword.width(); ++j) {
                if (!crossword.isOpen(i, j)) s.append(BLOCK);
                else s.append(letters[i][j] == null ? ' ' : letters[i][j]);
            }
            s.append('\n');
        }
        return s.toString();
    }
}
