package net.littleredcomputer.crossword;

import java.util.Map;

/**
 * Draws a (possibly partial) assignment as text, one line per row of the grid.
 */
public class TextRenderer {
    static final char BLOCKED = '█';

    private TextRenderer() {}

    public static String render(Crossword crossword, Map<Variable, String> assignment) {
        char[][] letters = crossword.letterGrid(assignment);
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < crossword.height(); ++i) {
            for (int j = 0; j < crossword.width(); ++j) {
                if (!crossword.fillable(i, j)) s.append(BLOCKED);
                else s.append(letters[i][j] == 0 ? ' ' : letters[i][j]);
            }
            s.append('\n');
        }
        return s.toString();
    }
}
