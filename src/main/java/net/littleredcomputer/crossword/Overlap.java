package net.littleredcomputer.crossword;

/**
 * The constraint between two crossing slots: letter {@code first} of the first slot's
 * word must equal letter {@code second} of the second slot's word.
 */
public final class Overlap {
    private final int first;
    private final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public int first() { return first; }
    public int second() { return second; }

    /** @return the same constraint seen from the other slot */
    public Overlap reversed() { return new Overlap(second, first); }

    /**
     * @return true if x and y carry the same letter at the crossing. A word too short
     * to reach the crossing never agrees.
     */
    public boolean agrees(String x, String y) {
        return first < x.length() && second < y.length() && x.charAt(first) == y.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap ov = (Overlap) o;
        return first == ov.first && second == ov.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
