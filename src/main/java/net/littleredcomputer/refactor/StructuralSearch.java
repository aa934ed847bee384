package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableSortedSet;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Proposes every connected set of citation steps that has a single exit and a
 * size between the bounds. Sets are grown downward from their exit through the
 * inputs of their members, so each set is connected and has the exit as its
 * only member not consumed inside it. Exits are visited in step order.
 */
public class StructuralSearch implements CandidateOracle {
    private final int minSize;
    private final int maxSize;

    public StructuralSearch(int minSize, int maxSize) {
        if (minSize < 2) throw new IllegalArgumentException("minimum size must be at least 2");
        if (maxSize < minSize) throw new IllegalArgumentException("maximum size is less than minimum");
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    @Override
    public Stream<Set<Integer>> rankCandidates(ProofGraph proof) {
        return StreamSupport.stream(new Subsets(proof, 0, proof.size(), minSize, maxSize), false);
    }

    /** The sets with the given exit only. */
    static Stream<Set<Integer>> rootedAt(ProofGraph proof, int exit, int minSize, int maxSize) {
        return StreamSupport.stream(new Subsets(proof, exit, exit + 1, minSize, maxSize), false);
    }

    /**
     * One level of the enumeration: the members chosen so far, the frontier of
     * inputs that may still be added, and the frontier nodes passed over at
     * earlier levels, which may not be added below this level.
     */
    private static final class Frame {
        final TIntArrayList members;
        final int[] frontier;
        final TIntHashSet excluded;
        int next = 0;

        Frame(TIntArrayList members, int[] frontier, TIntHashSet excluded) {
            this.members = members;
            this.frontier = frontier;
            this.excluded = excluded;
        }
    }

    private static final class Subsets implements Spliterator<Set<Integer>> {
        private final ProofGraph graph;
        private final int end;
        private final int minSize;
        private final int maxSize;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private int exit;

        Subsets(ProofGraph graph, int start, int end, int minSize, int maxSize) {
            this.graph = graph;
            this.exit = start;
            this.end = end;
            this.minSize = minSize;
            this.maxSize = maxSize;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Set<Integer>> action) {
            while (true) {
                if (stack.isEmpty()) {
                    while (exit < end && !graph.isCitation(exit)) ++exit;
                    if (exit >= end) return false;
                    TIntArrayList members = new TIntArrayList();
                    members.add(exit);
                    stack.push(new Frame(members, extend(new int[0], exit, members, new TIntHashSet()), new TIntHashSet()));
                    ++exit;
                    if (minSize <= 1) {
                        action.accept(ImmutableSortedSet.of(members.get(0)));
                        return true;
                    }
                    continue;
                }
                Frame top = stack.peek();
                if (top.next >= top.frontier.length || top.members.size() >= maxSize) {
                    stack.pop();
                    continue;
                }
                int k = top.next++;
                int v = top.frontier[k];
                TIntHashSet excluded = new TIntHashSet(top.excluded);
                for (int j = 0; j < k; ++j) excluded.add(top.frontier[j]);
                TIntArrayList members = new TIntArrayList(top.members);
                members.add(v);
                int[] rest = new int[top.frontier.length - k - 1];
                System.arraycopy(top.frontier, k + 1, rest, 0, rest.length);
                stack.push(new Frame(members, extend(rest, v, members, excluded), excluded));
                if (members.size() >= minSize) {
                    ImmutableSortedSet.Builder<Integer> b = ImmutableSortedSet.naturalOrder();
                    for (int i = 0; i < members.size(); ++i) b.add(members.get(i));
                    action.accept(b.build());
                    return true;
                }
            }
        }

        /** The frontier after adding {@code v}: the old one followed by v's new citation inputs. */
        private int[] extend(int[] frontier, int v, TIntArrayList members, TIntHashSet excluded) {
            TIntArrayList out = new TIntArrayList(frontier);
            for (int m : graph.inputs(v)) {
                if (graph.isCitation(m) && !members.contains(m) && !excluded.contains(m) && !out.contains(m)) out.add(m);
            }
            return out.toArray();
        }

        @Override
        public Spliterator<Set<Integer>> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return ORDERED | NONNULL | DISTINCT;
        }
    }
}
