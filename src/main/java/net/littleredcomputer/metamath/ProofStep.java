package net.littleredcomputer.metamath;

import java.util.Objects;

/**
 * One step of a proof: either a citation of an assertion (or of one of the
 * owning theorem's essential hypotheses) together with the substitution for the
 * cited assertion's variables, or a reuse of the result of an earlier step.
 */
public final class ProofStep {
    private final String label;
    private final Substitution substitution;
    private final int reuse;

    private ProofStep(String label, Substitution substitution, int reuse) {
        this.label = label;
        this.substitution = substitution;
        this.reuse = reuse;
    }

    public static ProofStep cite(String label, Substitution substitution) {
        return new ProofStep(Objects.requireNonNull(label), substitution, -1);
    }

    public static ProofStep hypothesis(String label) {
        return cite(label, Substitution.EMPTY);
    }

    public static ProofStep reuse(int index) {
        if (index < 0) throw new IllegalArgumentException("negative reuse index " + index);
        return new ProofStep(null, Substitution.EMPTY, index);
    }

    public boolean isReuse() {
        return reuse >= 0;
    }

    public String label() {
        if (isReuse()) throw new IllegalStateException("reuse step has no label");
        return label;
    }

    public Substitution substitution() {
        return substitution;
    }

    /** Index of the step whose result this step pushes again. */
    public int reuseIndex() {
        if (!isReuse()) throw new IllegalStateException("not a reuse step: " + label);
        return reuse;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProofStep)) return false;
        ProofStep s = (ProofStep) o;
        return reuse == s.reuse && Objects.equals(label, s.label) && substitution.equals(s.substitution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, substitution, reuse);
    }

    @Override
    public String toString() {
        if (isReuse()) return "@" + reuse;
        return substitution.isEmpty() ? label : label + substitution;
    }
}
