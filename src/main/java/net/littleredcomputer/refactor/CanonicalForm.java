package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.metamath.Formula;

import java.util.Objects;

/** A statement and its hypotheses with variables renamed in order of appearance; a key, nothing more. */
public final class CanonicalForm {
    private final Formula conclusion;
    private final ImmutableList<Formula> hypotheses;

    CanonicalForm(Formula conclusion, ImmutableList<Formula> hypotheses) {
        this.conclusion = conclusion;
        this.hypotheses = hypotheses;
    }

    public Formula conclusion() {
        return conclusion;
    }

    public ImmutableList<Formula> hypotheses() {
        return hypotheses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalForm)) return false;
        CanonicalForm f = (CanonicalForm) o;
        return conclusion.equals(f.conclusion) && hypotheses.equals(f.hypotheses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conclusion, hypotheses);
    }

    @Override
    public String toString() {
        return hypotheses + " => " + conclusion;
    }
}
