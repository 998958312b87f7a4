// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The static part of a crossword puzzle: which cells may hold letters, the slots (variables)
 * those cells form, where slots cross, and the word list from which slots are filled.
 * Instances are immutable; the mutable state of a solve lives in {@link Domains}.
 */
public class Crossword {
    private static final char FILLABLE = '_';

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final ImmutableSet<String> words;
    private final ImmutableList<Variable> variables;
    private final ImmutableTable<Variable, Variable, Overlap> overlaps;
    private final ImmutableMap<Variable, ImmutableSet<Variable>> neighbors;
    private final ImmutableList<Arc> arcs;
    private final ImmutableMap<Arc, Integer> arcIndex;  // inverse of above mapping

    private Crossword(boolean[][] structure, Iterable<Variable> variables, Iterable<String> words) {
        if (structure.length == 0) throw new IllegalArgumentException("empty structure");
        height = structure.length;
        width = Arrays.stream(structure).mapToInt(r -> r.length).max().orElse(0);
        this.structure = new boolean[height][width];
        for (int i = 0; i < height; ++i) {
            System.arraycopy(structure[i], 0, this.structure[i], 0, structure[i].length);
        }

        Set<Variable> seen = new HashSet<>();
        for (Variable v : variables) {
            if (!seen.add(v)) throw new IllegalArgumentException("duplicate variable: " + v);
            for (int k = 0; k < v.length(); ++k) {
                if (!fillable(v.rowAt(k), v.columnAt(k))) {
                    throw new IllegalArgumentException(String.format(
                            "variable %s covers cell %d,%d, which is not fillable", v, v.rowAt(k), v.columnAt(k)));
                }
            }
        }
        this.variables = ImmutableList.copyOf(variables);
        this.words = ImmutableSet.copyOf(words);

        ImmutableTable.Builder<Variable, Variable, Overlap> tb = ImmutableTable.builder();
        for (int a = 0; a < this.variables.size(); ++a) {
            for (int b = a + 1; b < this.variables.size(); ++b) {
                Variable v1 = this.variables.get(a);
                Variable v2 = this.variables.get(b);
                Overlap o = crossing(v1, v2);
                if (o != null) {
                    tb.put(v1, v2, o);
                    tb.put(v2, v1, o.reversed());
                }
            }
        }
        overlaps = tb.build();

        ImmutableMap.Builder<Variable, ImmutableSet<Variable>> nb = ImmutableMap.builder();
        ImmutableList.Builder<Arc> ab = ImmutableList.builder();
        ImmutableMap.Builder<Arc, Integer> ib = ImmutableMap.builder();
        int ix = 0;
        for (Variable v : this.variables) {
            // Keep neighbors in variable order so that iteration is reproducible.
            ImmutableSet<Variable> ns = this.variables.stream()
                    .filter(n -> overlaps.contains(v, n))
                    .collect(ImmutableSet.toImmutableSet());
            nb.put(v, ns);
            for (Variable n : ns) {
                Arc arc = new Arc(v, n);
                ab.add(arc);
                ib.put(arc, ix++);
            }
        }
        neighbors = nb.build();
        arcs = ab.build();
        arcIndex = ib.build();
    }

    /**
     * Find the cell shared by two slots, if any.
     * @return offsets of the shared cell within v1 and v2, or null if they do not meet
     */
    private static Overlap crossing(Variable v1, Variable v2) {
        Map<List<Integer>, Integer> cells = new HashMap<>();
        for (int k = 0; k < v1.length(); ++k) cells.put(Arrays.asList(v1.rowAt(k), v1.columnAt(k)), k);
        Overlap found = null;
        for (int k = 0; k < v2.length(); ++k) {
            Integer k1 = cells.get(Arrays.asList(v2.rowAt(k), v2.columnAt(k)));
            if (k1 == null) continue;
            if (found != null) {
                throw new IllegalArgumentException(String.format("variables %s and %s share more than one cell", v1, v2));
            }
            found = new Overlap(k1, k);
        }
        return found;
    }

    /**
     * Create a puzzle from an explicit list of slots.
     * @param structure structure[i][j] is true if cell i,j can hold a letter. Short rows are
     *                  padded with blocked cells.
     * @param variables the slots, in the order the solver should prefer among equals
     * @param words the word list (upper-cased; duplicates are dropped)
     */
    public static Crossword of(boolean[][] structure, Iterable<Variable> variables, Iterable<String> words) {
        return new Crossword(structure, variables, normalize(words));
    }

    /**
     * Create a puzzle from a structure description, in which '_' marks a cell that can hold a
     * letter and any other character marks a blocked cell. Every maximal horizontal or vertical
     * run of at least two fillable cells becomes a slot.
     */
    public static Crossword fromStructure(String structure, Iterable<String> words) {
        boolean[][] s = parseStructure(new StringReader(structure));
        return new Crossword(s, findVariables(s), normalize(words));
    }

    public static Crossword parseFrom(String structure, String words) {
        return parseFrom(new StringReader(structure), new StringReader(words));
    }

    /**
     * Parse a structure file and a word file (one word per line) into a puzzle.
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        boolean[][] s = parseStructure(structure);
        List<String> ws = new BufferedReader(words).lines().collect(Collectors.toList());
        return new Crossword(s, findVariables(s), normalize(ws));
    }

    private static List<String> normalize(Iterable<String> words) {
        List<String> ws = new ArrayList<>();
        for (String w : words) {
            String t = w.trim();
            if (!t.isEmpty()) ws.add(t.toUpperCase(Locale.ROOT));
        }
        return ws;
    }

    static boolean[][] parseStructure(Reader r) {
        List<String> lines = new BufferedReader(r).lines().collect(Collectors.toCollection(ArrayList::new));
        while (!lines.isEmpty() && lines.get(lines.size() - 1).trim().isEmpty()) lines.remove(lines.size() - 1);
        if (lines.isEmpty()) throw new IllegalArgumentException("empty structure");
        int w = lines.stream().mapToInt(String::length).max().orElse(0);
        boolean[][] s = new boolean[lines.size()][w];
        for (int i = 0; i < lines.size(); ++i) {
            String line = lines.get(i);
            for (int j = 0; j < line.length(); ++j) s[i][j] = line.charAt(j) == FILLABLE;
        }
        return s;
    }

    /**
     * Scan the grid in row-major order. At each cell a DOWN slot starting there is listed
     * before an ACROSS slot starting there.
     */
    static List<Variable> findVariables(boolean[][] s) {
        List<Variable> vs = new ArrayList<>();
        for (int i = 0; i < s.length; ++i) {
            for (int j = 0; j < s[i].length; ++j) {
                if (!s[i][j]) continue;
                if (i == 0 || !s[i - 1][j]) {
                    int n = 1;
                    while (i + n < s.length && j < s[i + n].length && s[i + n][j]) ++n;
                    if (n > 1) vs.add(new Variable(i, j, Variable.Direction.DOWN, n));
                }
                if (j == 0 || !s[i][j - 1]) {
                    int n = 1;
                    while (j + n < s[i].length && s[i][j + n]) ++n;
                    if (n > 1) vs.add(new Variable(i, j, Variable.Direction.ACROSS, n));
                }
            }
        }
        return vs;
    }

    public int height() { return height; }
    public int width() { return width; }

    public boolean fillable(int i, int j) {
        return i >= 0 && i < height && j >= 0 && j < width && structure[i][j];
    }

    public ImmutableSet<String> words() { return words; }
    public ImmutableList<Variable> variables() { return variables; }

    /**
     * @return the constraint between x and y, if they cross. overlap(y, x) is the reverse
     * of overlap(x, y).
     */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        return Optional.ofNullable(overlaps.get(check(x), check(y)));
    }

    Overlap overlapOrNull(Variable x, Variable y) {
        return overlaps.get(x, y);
    }

    public ImmutableSet<Variable> neighbors(Variable v) {
        return neighbors.get(check(v));
    }

    public int degree(Variable v) {
        return neighbors(v).size();
    }

    /** @return every ordered pair of crossing slots */
    public ImmutableList<Arc> arcs() { return arcs; }

    /** @return the position of the arc in {@link #arcs()}, or -1 if its slots do not cross */
    int arcIndex(Arc a) {
        Integer ix = arcIndex.get(a);
        return ix == null ? -1 : ix;
    }

    boolean contains(Variable v) {
        return neighbors.containsKey(v);
    }

    private Variable check(Variable v) {
        if (!neighbors.containsKey(v)) throw new IllegalArgumentException("unknown variable: " + v);
        return v;
    }

    /**
     * @return the letters placed by the assignment; '\0' marks a cell without a letter
     */
    public char[][] letterGrid(Map<Variable, String> assignment) {
        char[][] letters = new char[height][width];
        assignment.forEach((v, w) -> {
            for (int k = 0; k < w.length() && k < v.length(); ++k) letters[v.rowAt(k)][v.columnAt(k)] = w.charAt(k);
        });
        return letters;
    }

    @Override
    public String toString() {
        return String.format("%dx%d crossword, %d variables, %d words", height, width, variables.size(), words.size());
    }
}
