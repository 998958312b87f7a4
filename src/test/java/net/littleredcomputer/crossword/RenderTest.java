// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.awt.image.BufferedImage;
import java.util.Collections;

import static net.littleredcomputer.crossword.Fixtures.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class RenderTest {
    @Test
    public void text() {
        ImmutableMap<Variable, String> a = ImmutableMap.of(
                down5, "SEVEN", across3, "SIX", down4, "FIVE", across4, "NINE");
        assertThat(TextRenderer.render(crossword0, a),
                is("█SIX█\n" +
                   "█E██F\n" +
                   "█V██I\n" +
                   "█E██V\n" +
                   "█NINE\n"));
    }

    @Test
    public void partialText() {
        assertThat(TextRenderer.render(crossword0, ImmutableMap.of(across3, "SIX")),
                is("█SIX█\n" +
                   "█ ██ \n" +
                   "█ ██ \n" +
                   "█ ██ \n" +
                   "█    \n"));
    }

    @Test
    public void image() {
        BufferedImage img = ImageRenderer.render(crossword0, Collections.emptyMap());
        assertThat(img.getWidth(), is(5 * ImageRenderer.cellSize));
        assertThat(img.getHeight(), is(5 * ImageRenderer.cellSize));
        int half = ImageRenderer.cellSize / 2;
        // Center of a blocked cell, of a fillable cell, and the border between two fillable cells.
        assertThat(img.getRGB(half, half), is(0xff000000));
        assertThat(img.getRGB(ImageRenderer.cellSize + half, half), is(0xffffffff));
        assertThat(img.getRGB(2 * ImageRenderer.cellSize, half), is(0xff000000));
    }
}
