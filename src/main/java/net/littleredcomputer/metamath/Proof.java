package net.littleredcomputer.metamath;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;

/** An immutable sequence of proof steps, read as a stack program. */
public final class Proof {
    private final ImmutableList<ProofStep> steps;

    private Proof(ImmutableList<ProofStep> steps) {
        this.steps = steps;
    }

    public static Proof of(List<ProofStep> steps) {
        return new Proof(ImmutableList.copyOf(steps));
    }

    public static Proof of(ProofStep... steps) {
        return new Proof(ImmutableList.copyOf(steps));
    }

    public ImmutableList<ProofStep> steps() {
        return steps;
    }

    public ProofStep get(int i) {
        return steps.get(i);
    }

    public int size() {
        return steps.size();
    }

    /** Labels cited by the non-reuse steps, in order of first citation. */
    public ImmutableSet<String> citedLabels() {
        ImmutableSet.Builder<String> b = ImmutableSet.builder();
        for (ProofStep s : steps) if (!s.isReuse()) b.add(s.label());
        return b.build();
    }

    public boolean cites(String label) {
        for (ProofStep s : steps) if (!s.isReuse() && s.label().equals(label)) return true;
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proof)) return false;
        return steps.equals(((Proof) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return Joiner.on(' ').join(steps);
    }
}
