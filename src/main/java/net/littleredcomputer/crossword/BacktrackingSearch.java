package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Depth-first search for a complete assignment of words to slots, choosing the next slot by
 * minimum remaining values (then degree) and trying its words least constraining first.
 * The domains are read but never modified; only the assignment grows and shrinks.
 */
public class BacktrackingSearch {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final int logCheckSteps = 1000;

    public enum VariableOrder {
        FIRST,
        MRV,
    }

    public enum ValueOrder {
        DOMAIN,
        LEAST_CONSTRAINING,
    }

    enum Trace {STEP, SEARCH}
    EnumSet<Trace> tracing = EnumSet.noneOf(Trace.class);

    private final Crossword crossword;
    private final Domains domains;
    private VariableOrder variableOrder = VariableOrder.MRV;
    private ValueOrder valueOrder = ValueOrder.LEAST_CONSTRAINING;
    private final ProgressLog progress = new ProgressLog("backtrack");
    private long stepCount = 0;
    private long nodeCount = 0;

    public BacktrackingSearch(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    public BacktrackingSearch setVariableOrder(VariableOrder order) {
        variableOrder = order;
        return this;
    }

    public BacktrackingSearch setValueOrder(ValueOrder order) {
        valueOrder = order;
        return this;
    }

    public BacktrackingSearch setLogInterval(Duration interval) {
        progress.setLogInterval(interval);
        return this;
    }

    /** @return number of search levels entered so far */
    public long nodeCount() { return nodeCount; }

    /** @return number of tentative bindings made so far */
    public long stepCount() { return stepCount; }

    public boolean complete(Map<Variable, String> assignment) {
        return assignment.keySet().containsAll(crossword.variables());
    }

    /**
     * @return true if no word is used twice, every word fits its slot, and every pair of
     * crossing slots in the assignment agree on their shared letter
     */
    public boolean consistent(Map<Variable, String> assignment) {
        Set<String> used = new HashSet<>();
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            if (!used.add(e.getValue())) return false;
            if (e.getValue().length() != e.getKey().length()) return false;
        }
        List<Map.Entry<Variable, String>> es = new ArrayList<>(assignment.entrySet());
        for (int a = 0; a < es.size(); ++a) {
            for (int b = a + 1; b < es.size(); ++b) {
                Overlap o = crossword.overlapOrNull(es.get(a).getKey(), es.get(b).getKey());
                if (o != null && !o.agrees(es.get(a).getValue(), es.get(b).getValue())) return false;
            }
        }
        return true;
    }

    /**
     * Choose the slot to fill next. Under MRV this is the unassigned slot with the fewest
     * candidates; ties go to the slot with the most neighbors, then to the earliest slot
     * of the puzzle.
     */
    public Variable selectUnassignedVariable(Map<Variable, String> assignment) {
        Comparator<Variable> mrv = Comparator.<Variable>comparingInt(domains::size)
                .thenComparing(Comparator.<Variable>comparingInt(crossword::degree).reversed());
        Comparator<Variable> order = variableOrder == VariableOrder.MRV ? mrv : (v, w) -> 0;
        // Stream.min keeps the first of equal elements.
        return crossword.variables().stream()
                .filter(v -> !assignment.containsKey(v))
                .min(order)
                .orElseThrow(() -> new IllegalStateException("all variables are assigned"));
    }

    /**
     * @return the candidates of var, ordered so that the word ruling out the fewest candidates
     * of unassigned neighbors comes first. Equally constraining words keep domain order.
     */
    public List<String> orderDomainValues(Variable var, Map<Variable, String> assignment) {
        List<String> values = new ArrayList<>(domains.get(var));
        if (valueOrder == ValueOrder.DOMAIN) return values;
        List<Variable> open = crossword.neighbors(var).stream()
                .filter(n -> !assignment.containsKey(n))
                .collect(Collectors.toList());
        Map<String, Integer> ruledOut = new HashMap<>();
        for (String w : values) {
            int count = 0;
            for (Variable n : open) {
                Overlap o = crossword.overlapOrNull(var, n);
                for (String u : domains.get(n)) {
                    if (!o.agrees(w, u)) ++count;
                }
            }
            ruledOut.put(w, count);
        }
        values.sort(Comparator.comparingInt(ruledOut::get));
        return values;
    }

    /**
     * @return a complete, consistent assignment, if one exists
     */
    public Optional<ImmutableMap<Variable, String>> solve() {
        return backtrack(Collections.emptyMap());
    }

    /**
     * Extend the given partial assignment to a complete one. The search keeps its own stack
     * of levels rather than recursing, one level per slot to fill.
     * @param initial bindings to start from; not modified
     * @return the first complete consistent extension found, or empty if there is none
     */
    public Optional<ImmutableMap<Variable, String>> backtrack(Map<Variable, String> initial) {
        for (Variable v : initial.keySet()) {
            if (!crossword.contains(v)) throw new IllegalArgumentException("unknown variable: " + v);
        }
        Map<Variable, String> assignment = new LinkedHashMap<>(initial);
        if (!consistent(assignment)) {
            log.debug("initial assignment is inconsistent");
            return Optional.empty();
        }
        final int n = crossword.variables().size() - assignment.size();
        Variable[] var = new Variable[n];
        List<List<String>> choices = new ArrayList<>(Collections.nCopies(n, Collections.<String>emptyList()));
        int[] x = new int[n];
        int l = 0;
        int state = 2;
        progress.start(stepCount);

        STEP: while (true) {
            switch (state) {
                case 2:  // Enter level l.
                    if (l == n) {
                        progress.stop();
                        log.debug("solution found after %d nodes, %d steps, %s", nodeCount, stepCount, progress.elapsed());
                        return Optional.of(ImmutableMap.copyOf(assignment));
                    }
                    ++nodeCount;
                    var[l] = selectUnassignedVariable(assignment);
                    choices.set(l, orderDomainValues(var[l], assignment));
                    x[l] = 0;
                    if (tracing.contains(Trace.SEARCH)) {
                        log.trace("level %d: %s with %d candidates", l, var[l], choices.get(l).size());
                    }
                case 3:  // Try x[l].
                    if (x[l] == choices.get(l).size()) {
                        state = 5;
                        continue STEP;
                    }
                    ++stepCount;
                    if (stepCount % logCheckSteps == 0) {
                        final int depth = l;
                        progress.maybeReport(stepCount, () -> String.format("depth %d/%d", depth, n));
                    }
                    String w = choices.get(l).get(x[l]);
                    assignment.put(var[l], w);
                    if (tracing.contains(Trace.STEP)) log.trace("level %d: %s = %s", l, var[l], w);
                    if (consistent(assignment)) {
                        ++l;
                        state = 2;
                        continue STEP;
                    }
                case 4:  // Try again.
                    assignment.remove(var[l]);
                    ++x[l];
                    state = 3;
                    continue STEP;
                case 5:  // Backtrack.
                    if (l == 0) {
                        progress.stop();
                        log.debug("search exhausted after %d nodes, %d steps, %s", nodeCount, stepCount, progress.elapsed());
                        return Optional.empty();
                    }
                    if (tracing.contains(Trace.SEARCH)) log.trace("backtracking from level %d", l);
                    --l;
                    state = 4;
            }
        }
    }
}
