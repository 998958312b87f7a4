package net.littleredcomputer.crossword;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static net.littleredcomputer.crossword.Variable.Direction.ACROSS;
import static net.littleredcomputer.crossword.Variable.Direction.DOWN;

/**
 * Puzzles shared among the tests.
 */
class Fixtures {
    // The slots of structure0.txt, in the order in which they are found.
    static final Variable down5 = new Variable(0, 1, DOWN, 5);
    static final Variable across3 = new Variable(0, 1, ACROSS, 3);
    static final Variable down4 = new Variable(1, 4, DOWN, 4);
    static final Variable across4 = new Variable(4, 1, ACROSS, 4);

    static final Crossword crossword0 = fromResources("structure0.txt", "words0.txt");
    static final Crossword crossword1 = fromResources("structure1.txt", "words1.txt");

    private static Reader resource(String name) {
        return new InputStreamReader(Fixtures.class.getClassLoader().getResourceAsStream(name), StandardCharsets.UTF_8);
    }

    static Crossword fromResources(String structure, String words) {
        return Crossword.parseFrom(resource(structure), resource(words));
    }

    /** @return fresh domains for c, already made node consistent */
    static Domains nodeConsistent(Crossword c) {
        Domains d = Domains.of(c);
        new ArcConsistency(c, d).enforceNodeConsistency();
        return d;
    }
}
