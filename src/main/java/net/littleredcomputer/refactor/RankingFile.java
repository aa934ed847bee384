package net.littleredcomputer.refactor;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedSet;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Candidate rankings computed ahead of time, such as by a trained model. Each
 * non-blank line not starting with {@code #} names a theorem and a set of
 * zero-based step indices of its proof:
 * <pre>
 *   syl: 2 3
 * </pre>
 * Lines for the same theorem are ranked in file order.
 */
public class RankingFile implements CandidateOracle {
    private static final Splitter INDICES = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final ImmutableListMultimap<String, Set<Integer>> rankings;

    private RankingFile(ImmutableListMultimap<String, Set<Integer>> rankings) {
        this.rankings = rankings;
    }

    @Override
    public Stream<Set<Integer>> rankCandidates(ProofGraph proof) {
        return rankings.get(proof.owner().label()).stream();
    }

    public Set<String> theorems() {
        return rankings.keySet();
    }

    public static RankingFile parseFrom(Reader r) {
        ImmutableListMultimap.Builder<String, Set<Integer>> b = ImmutableListMultimap.builder();
        BufferedReader br = new BufferedReader(r);
        try {
            String line;
            int lineNumber = 0;
            while ((line = br.readLine()) != null) {
                ++lineNumber;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                int colon = line.indexOf(':');
                if (colon <= 0) throw new IllegalArgumentException("line " + lineNumber + ": expected 'label: indices'");
                String label = line.substring(0, colon).trim();
                ImmutableSortedSet.Builder<Integer> steps = ImmutableSortedSet.naturalOrder();
                for (String index : INDICES.split(line.substring(colon + 1))) {
                    try {
                        steps.add(Integer.parseInt(index));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("line " + lineNumber + ": bad step index " + index, e);
                    }
                }
                b.put(label, steps.build());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new RankingFile(b.build());
    }

    public static RankingFile parseFrom(String text) {
        return parseFrom(new StringReader(text));
    }
}
