package net.littleredcomputer.refactor;

import net.littleredcomputer.metamath.Proof;
import net.littleredcomputer.metamath.ProofStep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A proof under construction as a graph of citations. Linearizing it emits
 * each node after its inputs; a node with inputs that is needed again is
 * referred to by a reuse step instead of being proved twice.
 */
final class ProofDag {
    private final List<ProofStep> steps = new ArrayList<>();
    private final List<int[]> inputs = new ArrayList<>();

    /** Adds a citation whose essential hypotheses are discharged by the given nodes, in order. */
    int add(ProofStep citation, int... inputNodes) {
        for (int n : inputNodes) {
            if (n < 0 || n >= steps.size()) throw new IllegalArgumentException("no node " + n);
        }
        steps.add(citation);
        inputs.add(inputNodes.clone());
        return steps.size() - 1;
    }

    int size() {
        return steps.size();
    }

    Proof linearize(int root) {
        int[] position = new int[steps.size()];
        Arrays.fill(position, -1);
        List<ProofStep> out = new ArrayList<>();
        emit(root, out, position);
        return Proof.of(out);
    }

    private void emit(int node, List<ProofStep> out, int[] position) {
        int[] in = inputs.get(node);
        if (position[node] >= 0 && in.length > 0) {
            out.add(ProofStep.reuse(position[node]));
            return;
        }
        for (int n : in) emit(n, out, position);
        if (position[node] < 0) position[node] = out.size();
        out.add(steps.get(node));
    }
}
