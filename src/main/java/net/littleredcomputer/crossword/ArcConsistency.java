package net.littleredcomputer.crossword;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.Collection;
import java.util.Set;

/**
 * Prunes the domains of a crossword: node consistency removes words of the wrong length,
 * and AC-3 removes words that no word of a crossing slot can accompany.
 */
public class ArcConsistency {
    private static final Logger log = LogManager.getFormatterLogger();
    private final Crossword crossword;
    private final Domains domains;
    private long revisions = 0;

    public ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /** @return number of revisions which removed at least one word */
    public long revisions() { return revisions; }

    /**
     * Remove from each domain every word whose length differs from that of its slot.
     */
    public void enforceNodeConsistency() {
        for (Variable v : crossword.variables()) {
            final int before = domains.size(v);
            domains.removeIf(v, w -> w.length() != v.length());
            log.debug("%s: %d of %d words have the right length", v, domains.size(v), before);
        }
    }

    /**
     * Make x arc consistent with y: drop each word of x's domain that no other word of y's
     * domain matches at the crossing. A word cannot support itself, since no word may be
     * used twice.
     * @return true if the domain of x was changed
     */
    @CheckReturnValue
    public boolean revise(Variable x, Variable y) {
        Overlap o = crossword.overlap(x, y).orElse(null);
        if (o == null) return false;  // no constraint between x and y
        Set<String> ys = domains.get(y);
        return domains.removeIf(x, w -> !supported(w, o, ys));
    }

    private static boolean supported(String w, Overlap o, Set<String> candidates) {
        for (String v : candidates) {
            if (!v.equals(w) && o.agrees(w, v)) return true;
        }
        return false;
    }

    /**
     * Run AC-3 over every arc of the puzzle.
     * @return false if some domain is empty (the puzzle has no solution), else true
     */
    @CheckReturnValue
    public boolean ac3() {
        return ac3(crossword.arcs());
    }

    /**
     * Run AC-3, starting with the given arcs, or with every arc of the puzzle if none are given.
     * Arcs between slots that do not cross are ignored.
     * @return false if some domain is empty (the puzzle has no solution), else true
     */
    @CheckReturnValue
    public boolean ac3(Collection<Arc> initial) {
        if (domains.anyEmpty()) {
            log.debug("a domain is empty before propagation");
            return false;
        }
        final int nArcs = crossword.arcs().size();
        boolean[] queued = new boolean[nArcs];
        TIntStack queue = new TIntArrayStack(Math.max(nArcs, 1));
        for (Arc a : initial.isEmpty() ? crossword.arcs() : initial) {
            int ix = crossword.arcIndex(a);
            if (ix < 0) {
                log.trace("ignoring %s: no crossing", a);
                continue;
            }
            if (!queued[ix]) {
                queued[ix] = true;
                queue.push(ix);
            }
        }
        long examined = 0;
        while (queue.size() > 0) {
            int ix = queue.pop();
            queued[ix] = false;
            ++examined;
            Arc arc = crossword.arcs().get(ix);
            if (!revise(arc.x, arc.y)) continue;
            ++revisions;
            if (domains.size(arc.x) == 0) {
                log.debug("domain of %s emptied by %s", arc.x, arc.y);
                return false;
            }
            // Words of x may have been the only support of some word of a neighbor z.
            for (Variable z : crossword.neighbors(arc.x)) {
                if (z.equals(arc.y)) continue;
                int zx = crossword.arcIndex(new Arc(z, arc.x));
                if (!queued[zx]) {
                    queued[zx] = true;
                    queue.push(zx);
                }
            }
        }
        log.debug("arc consistency reached after examining %d arcs (%d revisions)", examined, revisions);
        return true;
    }
}
