package net.littleredcomputer.crossword;

import java.util.*;
import java.util.function.Predicate;

/**
 * The candidate words of each slot for a single solve. Domains only ever shrink.
 */
public final class Domains {
    private final Map<Variable, Set<String>> domains = new LinkedHashMap<>();

    private Domains() {}

    /**
     * @return domains in which every variable of the crossword may take every word of its
     * word list, in word list order
     */
    public static Domains of(Crossword crossword) {
        Domains d = new Domains();
        for (Variable v : crossword.variables()) d.domains.put(v, new LinkedHashSet<>(crossword.words()));
        return d;
    }

    private Set<String> words(Variable v) {
        Set<String> ws = domains.get(v);
        if (ws == null) throw new IllegalArgumentException("unknown variable: " + v);
        return ws;
    }

    /** @return a read-only view of the candidates of v */
    public Set<String> get(Variable v) {
        return Collections.unmodifiableSet(words(v));
    }

    public int size(Variable v) {
        return words(v).size();
    }

    /** @return true if some variable has no candidates left */
    public boolean anyEmpty() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    /** @return true if any word was removed */
    boolean removeIf(Variable v, Predicate<String> p) {
        return words(v).removeIf(p);
    }

    /**
     * Narrow the candidates of v to those also found in the given words.
     * @return true if any word was removed
     */
    public boolean retain(Variable v, Collection<String> ws) {
        return words(v).retainAll(ws);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        domains.forEach((v, ws) -> sb.append(v).append(": ").append(ws).append('\n'));
        return sb.toString();
    }
}
