package net.littleredcomputer.refactor;

import net.littleredcomputer.metamath.Proof;

/** The outcome of refactoring one theorem with one new theorem. */
public final class Rewrite {
    private final String theorem;
    private final String lemma;
    private final Proof proof;
    private final int applied;
    private final int discarded;

    Rewrite(String theorem, String lemma, Proof proof, int applied, int discarded) {
        this.theorem = theorem;
        this.lemma = lemma;
        this.proof = proof;
        this.applied = applied;
        this.discarded = discarded;
    }

    public String theorem() {
        return theorem;
    }

    public String lemma() {
        return lemma;
    }

    /** The verified proof after every applied replacement. */
    public Proof proof() {
        return proof;
    }

    /** Number of occurrences replaced. */
    public int applied() {
        return applied;
    }

    /** Number of occurrences whose replacement failed verification. */
    public int discarded() {
        return discarded;
    }

    public boolean changed() {
        return applied > 0;
    }

    @Override
    public String toString() {
        return String.format("%s with %s: %d applied, %d discarded", theorem, lemma, applied, discarded);
    }
}
