package net.littleredcomputer.crossword;

import java.util.Objects;

/** An ordered pair of slots: the domain of x is to be made consistent with that of y. */
public final class Arc {
    final Variable x;
    final Variable y;

    public Arc(Variable x, Variable y) {
        this.x = Objects.requireNonNull(x);
        this.y = Objects.requireNonNull(y);
    }

    public Variable x() { return x; }
    public Variable y() { return y; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arc)) return false;
        Arc a = (Arc) o;
        return x.equals(a.x) && y.equals(a.y);
    }

    @Override
    public int hashCode() {
        return 31 * x.hashCode() + y.hashCode();
    }

    @Override
    public String toString() {
        return x + " -> " + y;
    }
}
