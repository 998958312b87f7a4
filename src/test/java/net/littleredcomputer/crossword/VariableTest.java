package net.littleredcomputer.crossword;

import org.junit.Test;

import static net.littleredcomputer.crossword.Variable.Direction.ACROSS;
import static net.littleredcomputer.crossword.Variable.Direction.DOWN;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class VariableTest {
    @Test
    public void equalityCoversAllAttributes() {
        Variable v = new Variable(1, 2, ACROSS, 3);
        assertThat(v, is(new Variable(1, 2, ACROSS, 3)));
        assertThat(v.hashCode(), is(new Variable(1, 2, ACROSS, 3).hashCode()));
        assertThat(v, is(not(new Variable(1, 2, DOWN, 3))));
        assertThat(v, is(not(new Variable(1, 2, ACROSS, 4))));
        assertThat(v, is(not(new Variable(2, 1, ACROSS, 3))));
    }

    @Test
    public void cells() {
        Variable a = new Variable(1, 2, ACROSS, 3);
        assertThat(a.rowAt(2), is(1));
        assertThat(a.columnAt(2), is(4));
        Variable d = new Variable(1, 2, DOWN, 3);
        assertThat(d.rowAt(2), is(3));
        assertThat(d.columnAt(2), is(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void lengthMustBePositive() {
        new Variable(0, 0, ACROSS, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void originMustBeInGrid() {
        new Variable(-1, 0, DOWN, 2);
    }

    @Test
    public void overlapReversal() {
        Overlap o = new Overlap(1, 3);
        assertThat(o.reversed(), is(new Overlap(3, 1)));
        assertThat(o.agrees("CAT", "ZZZA"), is(true));
        assertThat(o.agrees("CAT", "ZZZB"), is(false));
        // Too short to reach the crossing.
        assertThat(o.agrees("CAT", "ZZA"), is(false));
        assertThat(o.agrees("C", "ZZZA"), is(false));
    }
}
