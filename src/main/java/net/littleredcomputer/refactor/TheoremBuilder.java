package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.DisjointPair;
import net.littleredcomputer.metamath.Formula;
import net.littleredcomputer.metamath.Hypothesis;
import net.littleredcomputer.metamath.ProofStep;
import net.littleredcomputer.metamath.Substitution;
import net.littleredcomputer.metamath.Symbol;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes a theorem of a candidate subproof. The hypotheses of the candidate
 * become essential hypotheses labelled {@code label.1}, {@code label.2}, ...;
 * every variable gets the floating hypothesis that declares it in the
 * database; the disjoint variable restrictions are those the cited steps
 * impose; and the proof is the candidate's steps with each input from outside
 * replaced by a citation of the matching hypothesis.
 */
public class TheoremBuilder {
    private final Database database;

    public TheoremBuilder(Database database) {
        this.database = database;
    }

    public Assertion build(CandidateSubproof c, String label) {
        ProofGraph g = c.graph();
        ImmutableList.Builder<Hypothesis> essential = ImmutableList.builder();
        Map<Formula, Integer> hypothesisNode = new HashMap<>();
        ProofDag dag = new ProofDag();
        for (int i = 0; i < c.hypotheses().size(); ++i) {
            String hl = label + "." + (i + 1);
            essential.add(Hypothesis.essential(hl, c.hypotheses().get(i)));
            hypothesisNode.put(c.hypotheses().get(i), dag.add(ProofStep.hypothesis(hl)));
        }

        Set<Symbol> variables = new LinkedHashSet<>();
        for (Formula h : c.hypotheses()) variables.addAll(h.variables());
        variables.addAll(c.conclusion().variables());
        ImmutableList.Builder<Hypothesis> floating = ImmutableList.builder();
        for (Symbol v : variables) {
            floating.add(database.floatingFor(v)
                    .orElseThrow(() -> new IllegalArgumentException(label + ": no type for variable " + v)));
        }

        Set<DisjointPair> disjoint = new LinkedHashSet<>();
        Map<Integer, Integer> node = new HashMap<>();
        for (int n : c.steps()) {
            ProofStep step = g.step(n);
            disjoint.addAll(restrictions(database.get(step.label()), step.substitution()));
            int[] in = g.inputs(n);
            int[] mapped = new int[in.length];
            for (int k = 0; k < in.length; ++k) {
                Integer inside = node.get(in[k]);
                mapped[k] = inside != null ? inside : hypothesisNode.get(g.result(in[k]));
            }
            node.put(n, dag.add(step, mapped));
        }
        return Assertion.theorem(label, c.conclusion(), floating.build(), essential.build(), disjoint,
                dag.linearize(node.get(c.exit())));
    }

    /** The pairs of variables a citation requires to be disjoint. */
    static Set<DisjointPair> restrictions(Assertion cited, Substitution sigma) {
        Set<DisjointPair> out = new LinkedHashSet<>();
        List<Symbol> mandatory = cited.mandatoryVariables();
        for (DisjointPair p : cited.disjoint()) {
            if (!mandatory.contains(p.first()) || !mandatory.contains(p.second())) continue;
            for (Symbol x : sigma.variablesOf(p.first())) {
                for (Symbol y : sigma.variablesOf(p.second())) {
                    if (!x.equals(y)) out.add(DisjointPair.of(x, y));
                }
            }
        }
        return out;
    }
}
