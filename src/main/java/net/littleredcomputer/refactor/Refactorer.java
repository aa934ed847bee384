package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.Formula;
import net.littleredcomputer.metamath.Hypothesis;
import net.littleredcomputer.metamath.Proof;
import net.littleredcomputer.metamath.ProofStep;
import net.littleredcomputer.metamath.Substitution;
import net.littleredcomputer.metamath.Unifier;
import net.littleredcomputer.metamath.VerificationException;
import net.littleredcomputer.metamath.Verifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites a proof to cite a new theorem. An occurrence of the theorem is a
 * connected single-exit fragment of citation steps, at least two unless the
 * theorem's own proof has a single citation, whose exit
 * result and inputs unify with the theorem's statement and hypotheses, and
 * whose other results are used only inside the fragment. It is replaced by a
 * single citation of the theorem. Occurrences are taken earliest exit first;
 * after each replacement the search starts over on the new proof. A
 * replacement that fails verification is discarded.
 */
public class Refactorer {
    private static final Logger log = LogManager.getFormatterLogger(Refactorer.class);

    private final Database database;
    private final Verifier verifier;
    private final int maxFragmentSize;

    public Refactorer(Database database, int maxFragmentSize) {
        this.database = database;
        this.verifier = new Verifier(database);
        this.maxFragmentSize = maxFragmentSize;
    }

    private static final class Occurrence {
        final ImmutableSortedSet<Integer> steps;
        final int exit;
        final ImmutableList<Integer> producers;
        final Substitution substitution;

        Occurrence(ImmutableSortedSet<Integer> steps, int exit, ImmutableList<Integer> producers, Substitution substitution) {
            this.steps = steps;
            this.exit = exit;
            this.producers = producers;
            this.substitution = substitution;
        }
    }

    /** Replaces every occurrence of {@code lemma} in the proof of {@code theorem}, which must come later. */
    public Rewrite refactor(Assertion theorem, Assertion lemma) {
        Proof original = theorem.proof().orElseThrow(() -> new IllegalArgumentException(theorem.label() + " is not a theorem"));
        if (!database.precedes(lemma.label(), theorem.label())) {
            return new Rewrite(theorem.label(), lemma.label(), original, 0, 0);
        }
        Unifier unifier = database.unifier();
        Assertion current = theorem;
        int applied = 0;
        int discarded = 0;
        Set<Set<Integer>> failed = new HashSet<>();
        while (true) {
            ProofGraph g;
            try {
                g = ProofGraph.of(database, current);
            } catch (VerificationException e) {
                log.warn("cannot refactor %s: %s", theorem.label(), e.getMessage());
                break;
            }
            Optional<Occurrence> o = find(g, lemma, minFragmentSize(lemma), unifier, failed);
            if (!o.isPresent()) break;
            Assertion rewritten = current.withProof(replace(g, lemma, o.get()));
            try {
                verifier.verify(rewritten);
                current = rewritten;
                ++applied;
                failed.clear();
            } catch (VerificationException e) {
                ++discarded;
                failed.add(o.get().steps);
                log.debug("%s: replacing steps %s by %s does not verify: %s", theorem.label(), o.get().steps,
                        lemma.label(), e.getMessage());
            }
        }
        return new Rewrite(theorem.label(), lemma.label(), current.proof().get(), applied, discarded);
    }

    /** One for a theorem proved by a single citation, so that its one-step instances are found. */
    static int minFragmentSize(Assertion lemma) {
        if (!lemma.proof().isPresent()) return 2;
        int citations = 0;
        for (ProofStep s : lemma.proof().get().steps()) {
            if (!s.isReuse() && !lemma.essentialHypothesis(s.label()).isPresent()) ++citations;
        }
        return Math.min(2, Math.max(1, citations));
    }

    private Optional<Occurrence> find(ProofGraph g, Assertion lemma, int minSize, Unifier unifier,
                                      Set<Set<Integer>> failed) {
        List<Formula> patterns = new ArrayList<>();
        patterns.add(lemma.statement());
        for (Hypothesis h : lemma.essential()) patterns.add(h.formula());
        for (int exit = 0; exit < g.size(); ++exit) {
            if (!g.isCitation(exit)) continue;
            if (!Unifier.unify(lemma.statement(), g.result(exit)).isPresent()) continue;
            Iterator<Set<Integer>> fragments = StructuralSearch.rootedAt(g, exit, minSize, maxFragmentSize).iterator();
            while (fragments.hasNext()) {
                ImmutableSortedSet<Integer> steps = ImmutableSortedSet.copyOf(fragments.next());
                if (failed.contains(steps) || !usedOnlyInside(g, steps, exit)) continue;
                // Already a citation of the theorem.
                if (steps.size() == 1 && g.step(exit).label().equals(lemma.label())) continue;
                CandidateSubproof f = CandidateExtractor.fragment(g, steps, 0);
                if (f.hypotheses().size() != lemma.essential().size()) continue;
                List<Formula> concretes = new ArrayList<>();
                concretes.add(f.conclusion());
                concretes.addAll(f.hypotheses());
                Optional<Substitution> sigma = unifier.unify(patterns, concretes);
                if (sigma.isPresent()) {
                    return Optional.of(new Occurrence(steps, exit, f.producers(),
                            sigma.get().restrictTo(lemma.mandatoryVariables())));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean usedOnlyInside(ProofGraph g, Set<Integer> steps, int exit) {
        for (int n : steps) {
            if (n == exit) continue;
            for (int c : g.consumers(n)) if (!steps.contains(c)) return false;
        }
        return true;
    }

    private static Proof replace(ProofGraph g, Assertion lemma, Occurrence o) {
        ProofDag dag = new ProofDag();
        int[] node = new int[g.size()];
        Arrays.fill(node, -1);
        for (int i = 0; i < g.size(); ++i) {
            if (!g.isNode(i) || o.steps.contains(i) && i != o.exit) continue;
            int[] in = i == o.exit ? o.producers.stream().mapToInt(Integer::intValue).toArray() : g.inputs(i);
            int[] mapped = new int[in.length];
            for (int k = 0; k < in.length; ++k) {
                mapped[k] = node[in[k]];
                if (mapped[k] < 0) throw new IllegalStateException("step " + i + " uses a removed step");
            }
            ProofStep step = i == o.exit ? ProofStep.cite(lemma.label(), o.substitution) : g.step(i);
            node[i] = dag.add(step, mapped);
        }
        return dag.linearize(node[g.root()]);
    }
}
