package net.littleredcomputer.crossword;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Draws an assignment as an image: white squares for fillable cells on a black ground.
 */
public class ImageRenderer {
    static final int cellSize = 100;
    static final int cellBorder = 2;
    private static final int interiorSize = cellSize - 2 * cellBorder;
    private static final Font font = new Font(Font.SANS_SERIF, Font.PLAIN, 80);

    private ImageRenderer() {}

    public static BufferedImage render(Crossword crossword, Map<Variable, String> assignment) {
        char[][] letters = crossword.letterGrid(assignment);
        BufferedImage img = new BufferedImage(
                crossword.width() * cellSize, crossword.height() * cellSize, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            for (int i = 0; i < crossword.height(); ++i) {
                for (int j = 0; j < crossword.width(); ++j) {
                    if (!crossword.fillable(i, j)) continue;
                    int x = j * cellSize + cellBorder;
                    int y = i * cellSize + cellBorder;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interiorSize, interiorSize);
                    if (letters[i][j] == 0) continue;
                    g.setColor(Color.BLACK);
                    g.setFont(font);
                    FontMetrics fm = g.getFontMetrics();
                    String letter = String.valueOf(letters[i][j]);
                    int w = fm.stringWidth(letter);
                    g.drawString(letter,
                            x + (interiorSize - w) / 2,
                            y + (interiorSize - fm.getHeight()) / 2 + fm.getAscent());
                }
            }
        } finally {
            g.dispose();
        }
        return img;
    }

    /**
     * Write the rendering of the assignment to a PNG file.
     */
    public static void save(Crossword crossword, Map<Variable, String> assignment, Path file) throws IOException {
        if (!ImageIO.write(render(crossword, assignment), "png", file.toFile())) {
            throw new IOException("no PNG writer available");
        }
    }
}
