package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.Formula;
import net.littleredcomputer.metamath.Proof;
import net.littleredcomputer.metamath.ProofStep;
import net.littleredcomputer.metamath.VerificationException;
import net.littleredcomputer.metamath.Verifier;

/**
 * The dependency structure of a proof. Nodes are the indices of the
 * non-reuse steps; a reuse step stands for the step it refers to. For every
 * node we keep the nodes whose results it pops (in pop order), the nodes that
 * pop its result, and the formula it proves.
 */
public final class ProofGraph {
    private final Assertion owner;
    private final Proof proof;
    private final ImmutableList<Formula> results;
    private final int[] target;
    private final TIntArrayList[] inputs;
    private final TIntArrayList[] consumers;
    private final boolean[] hypothesis;
    private final int root;

    private ProofGraph(Assertion owner, Proof proof, ImmutableList<Formula> results, Database database) {
        this.owner = owner;
        this.proof = proof;
        this.results = results;
        int n = proof.size();
        target = new int[n];
        inputs = new TIntArrayList[n];
        consumers = new TIntArrayList[n];
        hypothesis = new boolean[n];
        TIntArrayStack stack = new TIntArrayStack();
        for (int i = 0; i < n; ++i) {
            ProofStep s = proof.get(i);
            inputs[i] = new TIntArrayList();
            consumers[i] = new TIntArrayList();
            if (s.isReuse()) {
                target[i] = target[s.reuseIndex()];
                stack.push(target[i]);
                continue;
            }
            target[i] = i;
            if (owner.essentialHypothesis(s.label()).isPresent()) {
                hypothesis[i] = true;
            } else {
                int arity = database.get(s.label()).essential().size();
                int[] popped = new int[arity];
                for (int k = arity - 1; k >= 0; --k) popped[k] = stack.pop();
                inputs[i].add(popped);
                for (int p : popped) if (!consumers[p].contains(i)) consumers[p].add(i);
            }
            stack.push(i);
        }
        root = stack.size() > 0 ? stack.peek() : -1;
    }

    /**
     * Builds the graph of a theorem's current proof.
     * @throws VerificationException if the proof cannot be run
     */
    public static ProofGraph of(Database database, Assertion theorem) throws VerificationException {
        Proof proof = theorem.proof().orElseThrow(() -> new IllegalArgumentException(theorem.label() + " has no proof"));
        ImmutableList<Formula> results = new Verifier(database, false).evaluate(theorem, proof);
        return new ProofGraph(theorem, proof, results, database);
    }

    public Assertion owner() {
        return owner;
    }

    public Proof proof() {
        return proof;
    }

    public int size() {
        return proof.size();
    }

    public ProofStep step(int i) {
        return proof.get(i);
    }

    public Formula result(int i) {
        return results.get(i);
    }

    /** The node a step stands for: itself, or the target of a reuse step. */
    public int resolve(int i) {
        return target[i];
    }

    public boolean isNode(int i) {
        return target[i] == i;
    }

    /** True for nodes citing one of the owner's essential hypotheses. */
    public boolean isHypothesis(int i) {
        return hypothesis[i];
    }

    /** True for nodes citing an assertion. */
    public boolean isCitation(int i) {
        return target[i] == i && !hypothesis[i];
    }

    public int[] inputs(int i) {
        return inputs[i].toArray();
    }

    public int[] consumers(int i) {
        return consumers[i].toArray();
    }

    /** The node whose result is the conclusion of the proof. */
    public int root() {
        return root;
    }
}
