package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * A slot of the crossword: a run of cells starting at (row, column) and extending
 * either rightward (ACROSS) or downward (DOWN).
 */
public final class Variable {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private final int i;
    private final int j;
    private final Direction direction;
    private final int length;

    public Variable(int i, int j, Direction direction, int length) {
        if (i < 0 || j < 0) throw new IllegalArgumentException(String.format("negative origin %d,%d", i, j));
        if (length < 1) throw new IllegalArgumentException("length must be positive: " + length);
        this.i = i;
        this.j = j;
        this.direction = Objects.requireNonNull(direction, "direction");
        this.length = length;
    }

    public int row() { return i; }
    public int column() { return j; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** @return row of the k-th letter of this slot */
    int rowAt(int k) { return direction == Direction.DOWN ? i + k : i; }

    /** @return column of the k-th letter of this slot */
    int columnAt(int k) { return direction == Direction.ACROSS ? j + k : j; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return i == v.i && j == v.j && direction == v.direction && length == v.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(i, j, direction, length);
    }

    @Override
    public String toString() {
        return String.format("%d,%d %s %d", i, j, direction.name().toLowerCase(), length);
    }
}
