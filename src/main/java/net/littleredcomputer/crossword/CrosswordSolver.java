package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Fills a crossword: prunes fresh domains with node and arc consistency, then searches.
 * A puzzle refuted by arc consistency is reported unsolvable without searching.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger();
    private final Crossword crossword;
    private BacktrackingSearch.VariableOrder variableOrder = BacktrackingSearch.VariableOrder.MRV;
    private BacktrackingSearch.ValueOrder valueOrder = BacktrackingSearch.ValueOrder.LEAST_CONSTRAINING;
    private Duration logInterval = Duration.ofMillis(1000);
    private long nodeCount = 0;

    public CrosswordSolver(Crossword crossword) {
        this.crossword = crossword;
    }

    public CrosswordSolver setVariableOrder(BacktrackingSearch.VariableOrder order) {
        variableOrder = order;
        return this;
    }

    public CrosswordSolver setValueOrder(BacktrackingSearch.ValueOrder order) {
        valueOrder = order;
        return this;
    }

    public CrosswordSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /** @return search nodes visited by the most recent solve; 0 if the search never ran */
    public long nodeCount() { return nodeCount; }

    public static Optional<ImmutableMap<Variable, String>> solve(Crossword crossword) {
        return new CrosswordSolver(crossword).solve();
    }

    /**
     * @return a complete assignment of distinct words to slots in which crossing slots agree,
     * or empty if the puzzle has no solution
     */
    public Optional<ImmutableMap<Variable, String>> solve() {
        Stopwatch sw = Stopwatch.createStarted();
        nodeCount = 0;
        Domains domains = Domains.of(crossword);
        ArcConsistency ac = new ArcConsistency(crossword, domains);
        ac.enforceNodeConsistency();
        if (!ac.ac3()) {
            log.info("%s: refuted by arc consistency in %s", crossword, sw);
            return Optional.empty();
        }
        BacktrackingSearch search = new BacktrackingSearch(crossword, domains)
                .setVariableOrder(variableOrder)
                .setValueOrder(valueOrder)
                .setLogInterval(logInterval);
        Optional<ImmutableMap<Variable, String>> result = search.solve();
        nodeCount = search.nodeCount();
        log.info("%s: %s after %d nodes in %s", crossword, result.isPresent() ? "solved" : "no solution", nodeCount, sw);
        return result;
    }
}
