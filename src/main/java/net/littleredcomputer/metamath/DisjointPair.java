package net.littleredcomputer.metamath;

import java.util.Objects;

/** An unordered pair of distinct variables that may not share a variable under substitution. */
public final class DisjointPair {
    private final Symbol first;
    private final Symbol second;

    private DisjointPair(Symbol first, Symbol second) {
        this.first = first;
        this.second = second;
    }

    public static DisjointPair of(Symbol x, Symbol y) {
        if (!x.isVariable() || !y.isVariable()) throw new IllegalArgumentException("$d of non-variable: " + x + " " + y);
        if (x.equals(y)) throw new IllegalArgumentException("$d of a variable with itself: " + x);
        return x.name().compareTo(y.name()) < 0 ? new DisjointPair(x, y) : new DisjointPair(y, x);
    }

    public Symbol first() {
        return first;
    }

    public Symbol second() {
        return second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DisjointPair)) return false;
        DisjointPair p = (DisjointPair) o;
        return first.equals(p.first) && second.equals(p.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first + " " + second;
    }
}
