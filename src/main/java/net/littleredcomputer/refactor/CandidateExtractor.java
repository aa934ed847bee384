package net.littleredcomputer.refactor;

import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Multiset;
import com.google.common.collect.Streams;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;
import net.littleredcomputer.metamath.Formula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Turns sets of step indices into candidate subproofs. Reuse steps are
 * replaced by the steps they refer to. Steps citing the owner's hypotheses
 * count toward the size of a proposal and must feed one of its citations, but
 * they are always inputs of the candidate, never part of it. The citations
 * must form a connected set with a single exit that needs at least one
 * hypothesis and does not just prove the owner again.
 */
public class CandidateExtractor {
    private static final Logger log = LogManager.getFormatterLogger(CandidateExtractor.class);

    private final int minSize;
    private final Multiset<Rejection> rejections = ConcurrentHashMultiset.create();

    public CandidateExtractor(int minSize) {
        this.minSize = minSize;
    }

    /** The candidates proposed by {@code oracle} for the proof, in rank order. Invalid proposals are skipped. */
    public Stream<CandidateSubproof> candidates(ProofGraph graph, CandidateOracle oracle) {
        return Streams.mapWithIndex(oracle.rankCandidates(graph), (steps, rank) -> extract(graph, steps, (int) rank))
                .filter(Optional::isPresent)
                .map(Optional::get);
    }

    public Optional<CandidateSubproof> extract(ProofGraph graph, Set<Integer> requested, int rank) {
        TreeSet<Integer> steps = new TreeSet<>();
        TreeSet<Integer> inputs = new TreeSet<>();
        for (int i : requested) {
            if (i < 0 || i >= graph.size()) return reject(graph, rank, Rejection.OUT_OF_RANGE);
            int n = graph.resolve(i);
            if (graph.isCitation(n)) {
                steps.add(n);
            } else {
                inputs.add(n);
            }
        }
        if (steps.isEmpty() || steps.size() + inputs.size() < minSize) return reject(graph, rank, Rejection.TOO_SMALL);
        Optional<Rejection> shape = shape(graph, steps);
        if (shape.isPresent()) return reject(graph, rank, shape.get());
        for (int h : inputs) {
            if (!feeds(graph, h, steps)) return reject(graph, rank, Rejection.DISCONNECTED);
        }
        CandidateSubproof c = fragment(graph, ImmutableSortedSet.copyOf(steps), rank);
        if (c.hypotheses().isEmpty()) return reject(graph, rank, Rejection.NO_HYPOTHESES);
        if (c.conclusion().equals(graph.owner().statement())) return reject(graph, rank, Rejection.SELF_EXTRACTION);
        if (c.hypotheses().contains(c.conclusion())) return reject(graph, rank, Rejection.TRIVIAL);
        return Optional.of(c);
    }

    /** Counts of the proposals rejected so far, by reason. */
    public ImmutableMultiset<Rejection> rejections() {
        return ImmutableMultiset.copyOf(rejections);
    }

    private Optional<CandidateSubproof> reject(ProofGraph graph, int rank, Rejection why) {
        rejections.add(why);
        log.debug("%s candidate %d rejected: %s", graph.owner().label(), rank, why);
        return Optional.empty();
    }

    private static boolean feeds(ProofGraph graph, int hypothesis, Set<Integer> steps) {
        for (int m : graph.consumers(hypothesis)) if (steps.contains(m)) return true;
        return false;
    }

    /** Checks that the nodes are connected and have exactly one exit. */
    static Optional<Rejection> shape(ProofGraph graph, SortedSet<Integer> steps) {
        TIntHashSet seen = new TIntHashSet();
        TIntArrayList queue = new TIntArrayList();
        queue.add(steps.first());
        seen.add(steps.first());
        for (int q = 0; q < queue.size(); ++q) {
            int n = queue.get(q);
            for (int m : graph.inputs(n)) if (steps.contains(m) && seen.add(m)) queue.add(m);
            for (int m : graph.consumers(n)) if (steps.contains(m) && seen.add(m)) queue.add(m);
        }
        if (seen.size() != steps.size()) return Optional.of(Rejection.DISCONNECTED);
        int exits = 0;
        for (int n : steps) {
            boolean consumedInside = false;
            for (int m : graph.consumers(n)) consumedInside |= steps.contains(m);
            if (!consumedInside) ++exits;
        }
        return exits == 1 ? Optional.empty() : Optional.of(Rejection.MULTIPLE_EXITS);
    }

    /** The candidate of a connected single-exit node set: the exit is its latest node. */
    static CandidateSubproof fragment(ProofGraph graph, ImmutableSortedSet<Integer> steps, int rank) {
        ImmutableList.Builder<Formula> hypotheses = ImmutableList.builder();
        ImmutableList.Builder<Integer> producers = ImmutableList.builder();
        Set<Formula> seen = new HashSet<>();
        for (int n : steps) {
            for (int m : graph.inputs(n)) {
                if (steps.contains(m)) continue;
                if (seen.add(graph.result(m))) {
                    hypotheses.add(graph.result(m));
                    producers.add(m);
                }
            }
        }
        return new CandidateSubproof(graph, rank, steps, steps.last(), hypotheses.build(), producers.build());
    }
}
