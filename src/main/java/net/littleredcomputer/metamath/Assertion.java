package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An axiom or theorem together with its frame: the floating hypotheses of its
 * mandatory variables (in declaration order), its essential hypotheses and its
 * disjoint variable restrictions. Theorems carry a proof.
 */
public final class Assertion {
    public enum Kind {
        AXIOM,
        THEOREM,
    }

    private final String label;
    private final Kind kind;
    private final Formula statement;
    private final ImmutableList<Hypothesis> floating;
    private final ImmutableList<Hypothesis> essential;
    private final ImmutableSet<DisjointPair> disjoint;
    private final Proof proof;

    private Assertion(String label, Kind kind, Formula statement, List<Hypothesis> floating,
                      List<Hypothesis> essential, Set<DisjointPair> disjoint, Proof proof) {
        statement.typecode();
        for (Hypothesis h : floating) {
            if (!h.isFloating()) throw new IllegalArgumentException(label + ": " + h.label() + " is not floating");
        }
        for (Hypothesis h : essential) {
            if (h.isFloating()) throw new IllegalArgumentException(label + ": " + h.label() + " is not essential");
        }
        this.label = label;
        this.kind = kind;
        this.statement = statement;
        this.floating = ImmutableList.copyOf(floating);
        this.essential = ImmutableList.copyOf(essential);
        this.disjoint = ImmutableSet.copyOf(disjoint);
        this.proof = proof;
    }

    public static Assertion axiom(String label, Formula statement, List<Hypothesis> floating,
                                  List<Hypothesis> essential, Set<DisjointPair> disjoint) {
        return new Assertion(label, Kind.AXIOM, statement, floating, essential, disjoint, null);
    }

    public static Assertion theorem(String label, Formula statement, List<Hypothesis> floating,
                                    List<Hypothesis> essential, Set<DisjointPair> disjoint, Proof proof) {
        if (proof == null) throw new IllegalArgumentException(label + ": theorem without proof");
        return new Assertion(label, Kind.THEOREM, statement, floating, essential, disjoint, proof);
    }

    public Assertion withProof(Proof proof) {
        if (kind != Kind.THEOREM) throw new IllegalStateException(label + " is not a theorem");
        return new Assertion(label, kind, statement, floating, essential, disjoint, proof);
    }

    /** The same assertion with further disjoint variable restrictions. */
    public Assertion withDisjoint(Set<DisjointPair> more) {
        return new Assertion(label, kind, statement, floating, essential,
                ImmutableSet.<DisjointPair>builder().addAll(disjoint).addAll(more).build(), proof);
    }

    public String label() {
        return label;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTheorem() {
        return kind == Kind.THEOREM;
    }

    public Formula statement() {
        return statement;
    }

    public Symbol typecode() {
        return statement.typecode();
    }

    public ImmutableList<Hypothesis> floating() {
        return floating;
    }

    public ImmutableList<Hypothesis> essential() {
        return essential;
    }

    public ImmutableSet<DisjointPair> disjoint() {
        return disjoint;
    }

    public Optional<Proof> proof() {
        return Optional.ofNullable(proof);
    }

    /** The variables typed by the floating hypotheses, in their order. */
    public ImmutableList<Symbol> mandatoryVariables() {
        ImmutableList.Builder<Symbol> b = ImmutableList.builder();
        for (Hypothesis h : floating) b.add(h.variable());
        return b.build();
    }

    public Optional<Hypothesis> essentialHypothesis(String label) {
        for (Hypothesis h : essential) if (h.label().equals(label)) return Optional.of(h);
        return Optional.empty();
    }

    public boolean isDisjoint(Symbol x, Symbol y) {
        return !x.equals(y) && disjoint.contains(DisjointPair.of(x, y));
    }

    /** The labels of other assertions cited by the proof. */
    public ImmutableSet<String> citedAssertions() {
        if (proof == null) return ImmutableSet.of();
        ImmutableSet.Builder<String> b = ImmutableSet.builder();
        for (String l : proof.citedLabels()) if (!essentialHypothesis(l).isPresent()) b.add(l);
        return b.build();
    }

    @Override
    public String toString() {
        return label + " " + statement;
    }
}
