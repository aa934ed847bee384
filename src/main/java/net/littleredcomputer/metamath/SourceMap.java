package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Where things are in the source text a database was read from: the span of
 * each proof, the floating hypotheses active in each proof, and the points
 * after top-level blocks where new assertions can be inserted.
 */
public final class SourceMap {
    private final String text;
    private final ImmutableMap<String, Span> proofs;
    private final ImmutableMap<String, Map<Symbol, String>> proofFloats;
    private final ImmutableMap<String, Insertion> insertions;
    private final ImmutableList<Symbol> topLevelVariables;
    private final ImmutableList<Hypothesis> topLevelFloats;

    private SourceMap(Builder b) {
        this.text = b.text;
        this.proofs = ImmutableMap.copyOf(b.proofs);
        this.proofFloats = ImmutableMap.copyOf(b.proofFloats);
        this.insertions = ImmutableMap.copyOf(b.insertions);
        this.topLevelVariables = ImmutableList.copyOf(b.topLevelVariables);
        this.topLevelFloats = ImmutableList.copyOf(b.topLevelFloats);
    }

    /** A half-open range of character offsets. */
    public static final class Span {
        private final int start;
        private final int end;

        Span(int start, int end) {
            this.start = start;
            this.end = end;
        }

        public int start() {
            return start;
        }

        public int end() {
            return end;
        }

        @Override
        public String toString() {
            return "[" + start + ", " + end + ")";
        }
    }

    /** The end of a top-level block and the top-level declarations in effect there. */
    static final class Insertion {
        final int offset;
        final int variables;
        final int floats;

        Insertion(int offset, int variables, int floats) {
            this.offset = offset;
            this.variables = variables;
            this.floats = floats;
        }
    }

    public String text() {
        return text;
    }

    /** The span of the proof of {@code theorem}, from its first token to the end of its last. */
    public Optional<Span> proofSpan(String theorem) {
        return Optional.ofNullable(proofs.get(theorem));
    }

    /** Variable to floating hypothesis label for every $f active in the proof of {@code theorem}. */
    public Map<Symbol, String> activeFloats(String theorem) {
        Map<Symbol, String> m = proofFloats.get(theorem);
        if (m == null) throw new IllegalArgumentException("no proof of " + theorem + " in source");
        return m;
    }

    /** The insertion point after the top-level block that ends with {@code label}. */
    Optional<Insertion> insertionAfter(String label) {
        return Optional.ofNullable(insertions.get(label));
    }

    List<Symbol> topLevelVariables(Insertion at) {
        return topLevelVariables.subList(0, at.variables);
    }

    List<Hypothesis> topLevelFloats(Insertion at) {
        return topLevelFloats.subList(0, at.floats);
    }

    static final class Builder {
        private final String text;
        private final Map<String, Span> proofs = new HashMap<>();
        private final Map<String, Map<Symbol, String>> proofFloats = new HashMap<>();
        private final Map<String, Insertion> insertions = new HashMap<>();
        private final List<Symbol> topLevelVariables = new ArrayList<>();
        private final List<Hypothesis> topLevelFloats = new ArrayList<>();

        Builder(String text) {
            this.text = text;
        }

        void proof(String label, int start, int end, Map<Symbol, String> floats) {
            proofs.put(label, new Span(start, end));
            proofFloats.put(label, floats);
        }

        void topLevelVariable(Symbol v) {
            topLevelVariables.add(v);
        }

        void topLevelFloat(Hypothesis f) {
            topLevelFloats.add(f);
        }

        void blockEnd(String label, int offset) {
            insertions.put(label, new Insertion(offset, topLevelVariables.size(), topLevelFloats.size()));
        }

        SourceMap build() {
            return new SourceMap(this);
        }
    }
}
