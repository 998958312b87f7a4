package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static net.littleredcomputer.crossword.Fixtures.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class ArcConsistencyTest {

    @Test
    public void nodeConsistencyKeepsWordsOfSlotLength() {
        Domains d = nodeConsistent(crossword0);
        assertThat(d.get(across3), contains("ONE", "TWO", "SIX", "TEN"));
        assertThat(d.get(down5), contains("THREE", "SEVEN", "EIGHT"));
        assertThat(d.get(down4), contains("FOUR", "FIVE", "NINE"));
        for (Crossword c : Arrays.asList(crossword0, crossword1)) {
            Domains dc = nodeConsistent(c);
            for (Variable v : c.variables()) {
                assertThat(dc.get(v).stream().allMatch(w -> w.length() == v.length()), is(true));
            }
        }
    }

    @Test
    public void nodeConsistencyIsIdempotent() {
        Domains d = nodeConsistent(crossword0);
        String once = d.toString();
        new ArcConsistency(crossword0, d).enforceNodeConsistency();
        assertThat(d.toString(), is(once));
    }

    @Test
    public void ac3Structure0() {
        Domains d = nodeConsistent(crossword0);
        assertThat(new ArcConsistency(crossword0, d).ac3(), is(true));
        assertThat(d.get(across3), contains("SIX"));
        assertThat(d.get(down5), contains("SEVEN"));
        assertThat(d.get(down4), contains("FIVE"));
        assertThat(d.get(across4), contains("NINE"));
    }

    @Test
    public void reviseWithoutOverlapChangesNothing() {
        Domains d = nodeConsistent(crossword0);
        ArcConsistency ac = new ArcConsistency(crossword0, d);
        assertThat(ac.revise(across3, down4), is(false));
        assertThat(d.get(across3), contains("ONE", "TWO", "SIX", "TEN"));
    }

    @Test
    public void revise() {
        Domains d = nodeConsistent(crossword0);
        ArcConsistency ac = new ArcConsistency(crossword0, d);
        assertThat(ac.revise(down5, across3), is(true));
        assertThat(d.get(down5), contains("THREE", "SEVEN"));
        assertThat(ac.revise(down5, across3), is(false));
    }

    // Two slots which cross at their first letters.
    private static final String corner = "__\n_#";

    @Test
    public void wordCannotSupportItself() {
        Crossword c = Crossword.fromStructure(corner, Collections.singletonList("AB"));
        Variable down = c.variables().get(0);
        Variable across = c.variables().get(1);
        Domains d = nodeConsistent(c);
        ArcConsistency ac = new ArcConsistency(c, d);
        // AB agrees with itself at the crossing, but only one slot could hold it.
        assertThat(ac.revise(across, down), is(true));
        assertThat(d.get(across), is(empty()));
        assertThat(new ArcConsistency(c, nodeConsistent(c)).ac3(), is(false));
    }

    @Test
    public void distinctWordsSupportEachOther() {
        Crossword c = Crossword.fromStructure(corner, Arrays.asList("AB", "AC"));
        Domains d = nodeConsistent(c);
        assertThat(new ArcConsistency(c, d).ac3(), is(true));
        for (Variable v : c.variables()) assertThat(d.get(v), contains("AB", "AC"));
    }

    @Test
    public void disjointSlotsArePrunedByLengthOnly() {
        Crossword c = Crossword.fromStructure("___#\n####\n##__", Arrays.asList("CAT", "DOG", "AT", "TO"));
        assertThat(c.arcs().isEmpty(), is(true));
        Domains d = nodeConsistent(c);
        String before = d.toString();
        ArcConsistency ac = new ArcConsistency(c, d);
        assertThat(ac.ac3(), is(true));
        assertThat(ac.revisions(), is(0L));
        assertThat(d.toString(), is(before));
    }

    @Test
    public void failsOnEmptyDomain() {
        // No five letter words, so node consistency empties the long slot.
        Crossword c = Crossword.fromStructure("#___#\n#_##_\n#_##_\n#_##_\n#____",
                Arrays.asList("ONE", "TWO", "SIX", "FOUR", "FIVE", "NINE"));
        Domains d = nodeConsistent(c);
        assertThat(d.anyEmpty(), is(true));
        assertThat(new ArcConsistency(c, d).ac3(), is(false));
    }

    @Test
    public void emptyArcListMeansEveryArc() {
        Domains d = nodeConsistent(crossword0);
        assertThat(new ArcConsistency(crossword0, d).ac3(Collections.emptyList()), is(true));
        assertThat(d.get(across3), contains("SIX"));
        assertThat(d.get(down5), contains("SEVEN"));
        assertThat(d.get(down4), contains("FIVE"));
        assertThat(d.get(across4), contains("NINE"));
    }

    @Test
    public void explicitArcs() {
        Domains d = nodeConsistent(crossword0);
        ArcConsistency ac = new ArcConsistency(crossword0, d);
        // The arc between slots which do not cross is ignored.
        assertThat(ac.ac3(ImmutableList.of(new Arc(across3, down4))), is(true));
        assertThat(ac.revisions(), is(0L));
        assertThat(d.get(across3).size(), is(4));
        // Shrinking the long slot forces a look at the arcs into it, and so on down the chain;
        // arcs not reached that way are left alone.
        assertThat(ac.ac3(ImmutableList.of(new Arc(down5, across3))), is(true));
        assertThat(d.get(down5), contains("THREE", "SEVEN"));
        assertThat(d.get(across4), contains("NINE"));
        assertThat(d.get(down4), contains("FIVE"));
        assertThat(d.get(across3).size(), is(4));
    }

    @Test
    public void everyRemainingWordIsSupported() {
        Domains d = nodeConsistent(crossword1);
        assertThat(new ArcConsistency(crossword1, d).ac3(), is(true));
        for (Arc arc : crossword1.arcs()) {
            Overlap o = crossword1.overlap(arc.x(), arc.y()).get();
            for (String w : d.get(arc.x())) {
                assertThat(arc + " " + w,
                        d.get(arc.y()).stream().anyMatch(v -> !v.equals(w) && o.agrees(w, v)), is(true));
            }
        }
    }
}
