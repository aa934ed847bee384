package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Formula;

/**
 * A connected part of a proof with a single exit. Its hypotheses are the
 * distinct formulas flowing into it from outside, in order of first reference;
 * {@link #producers} holds, for each hypothesis, the outside node that first
 * supplies it.
 */
public final class CandidateSubproof {
    private final ProofGraph graph;
    private final int rank;
    private final ImmutableSortedSet<Integer> steps;
    private final int exit;
    private final ImmutableList<Formula> hypotheses;
    private final ImmutableList<Integer> producers;

    CandidateSubproof(ProofGraph graph, int rank, ImmutableSortedSet<Integer> steps, int exit,
                      ImmutableList<Formula> hypotheses, ImmutableList<Integer> producers) {
        this.graph = graph;
        this.rank = rank;
        this.steps = steps;
        this.exit = exit;
        this.hypotheses = hypotheses;
        this.producers = producers;
    }

    public ProofGraph graph() {
        return graph;
    }

    public Assertion owner() {
        return graph.owner();
    }

    public int rank() {
        return rank;
    }

    public ImmutableSortedSet<Integer> steps() {
        return steps;
    }

    public int exit() {
        return exit;
    }

    public ImmutableList<Formula> hypotheses() {
        return hypotheses;
    }

    public ImmutableList<Integer> producers() {
        return producers;
    }

    public Formula conclusion() {
        return graph.result(exit);
    }

    @Override
    public String toString() {
        return String.format("%s#%d %s: %s => %s", owner().label(), rank, steps, hypotheses, conclusion());
    }
}
