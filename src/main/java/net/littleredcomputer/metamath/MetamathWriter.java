package net.littleredcomputer.metamath;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Writes a database back in the source format it was read from. The source
 * text is kept; rewritten proofs replace the original proof text in place, in
 * normal (uncompressed) form, and each placed assertion is inserted as a block
 * of its own after the top-level block it was placed after.
 */
public class MetamathWriter {
    private static final Logger log = LogManager.getFormatterLogger(MetamathWriter.class);
    private static final int WIDTH = 79;
    private static final String INDENT = "      ";

    private final Database database;
    private final SourceMap sourceMap;
    private final Grammar grammar;
    // Argument order of placed assertions; the syntax arguments of a citation follow it.
    private final Map<String, List<Symbol>> argumentOrder = new HashMap<>();
    private final Set<String> usedLabels = new HashSet<>();

    public MetamathWriter(Database database, SourceMap sourceMap) {
        this.database = database;
        this.sourceMap = sourceMap;
        this.grammar = database.grammar();
    }

    private static final class Edit {
        final int start;
        final int end;
        final String text;

        Edit(int start, int end, String text) {
            this.start = start;
            this.end = end;
            this.text = text;
        }
    }

    /**
     * The source text with {@code placed} assertions inserted and the proofs of
     * {@code rewritten} theorems replaced.
     */
    public String write(Collection<String> placed, Collection<String> rewritten) {
        List<Edit> edits = new ArrayList<>();
        Set<String> toPlace = new HashSet<>(placed);
        // Definition order, so that an assertion is written before its argument order is needed.
        for (Assertion a : database.assertions()) {
            if (!toPlace.contains(a.label())) continue;
            String after = database.placedAfter(a.label())
                    .orElseThrow(() -> new IllegalArgumentException(a.label() + " was not placed"));
            SourceMap.Insertion at = sourceMap.insertionAfter(after)
                    .orElseThrow(() -> new IllegalStateException("no insertion point after " + after));
            edits.add(new Edit(at.offset, at.offset, block(a, at)));
        }
        for (String label : rewritten) {
            // A placed assertion is written with its current proof already.
            if (toPlace.contains(label)) continue;
            SourceMap.Span span = sourceMap.proofSpan(label)
                    .orElseThrow(() -> new IllegalArgumentException("no proof of " + label + " in source"));
            Map<Symbol, String> floats = sourceMap.activeFloats(label);
            List<String> proof = proof(database.get(label), floats::get);
            edits.add(new Edit(span.start(), span.end(), wrap(proof, column(span.start()), indentOf(span.start()))));
        }
        edits.sort(Comparator.comparingInt(e -> e.start));
        String text = sourceMap.text();
        StringBuilder out = new StringBuilder(text.length() + 256 * edits.size());
        int done = 0;
        for (Edit e : edits) {
            out.append(text, done, e.start).append(e.text);
            done = e.end;
        }
        out.append(text, done, text.length());
        log.info("wrote %d new assertions and %d rewritten proofs", placed.size(), rewritten.size());
        return out.toString();
    }

    private String block(Assertion a, SourceMap.Insertion at) {
        Set<Symbol> active = new HashSet<>(sourceMap.topLevelVariables(at));
        Map<Symbol, Hypothesis> topFloats = new LinkedHashMap<>();
        for (Hypothesis f : sourceMap.topLevelFloats(at)) topFloats.putIfAbsent(f.variable(), f);

        Set<Symbol> variables = new LinkedHashSet<>(a.mandatoryVariables());
        for (ProofStep s : a.proof().get().steps()) {
            for (Formula value : s.substitution().bindings().values()) variables.addAll(value.variables());
        }
        List<String> newVariables = new ArrayList<>();
        Map<Symbol, String> floatLabels = new HashMap<>();
        List<String> lines = new ArrayList<>();
        List<Symbol> localOrder = new ArrayList<>();
        int k = 0;
        for (Symbol v : variables) {
            if (!active.contains(v)) newVariables.add(v.name());
            Hypothesis top = topFloats.get(v);
            if (top != null) {
                floatLabels.put(v, top.label());
                continue;
            }
            Symbol type = database.typeOf(v).orElseThrow(() -> new IllegalStateException("no type for " + v));
            String label;
            do {
                label = a.label() + ".f" + (++k);
            } while (database.isLabelTaken(label) || !usedLabels.add(label));
            floatLabels.put(v, label);
            localOrder.add(v);
            lines.add("    " + label + " $f " + type + " " + v + " $.");
        }
        // The argument order a verifier derives: top-level $f in declaration order, then the local ones.
        Set<Symbol> mandatory = new HashSet<>(a.mandatoryVariables());
        List<Symbol> order = new ArrayList<>();
        for (Symbol v : topFloats.keySet()) if (mandatory.contains(v)) order.add(v);
        for (Symbol v : localOrder) if (mandatory.contains(v)) order.add(v);
        argumentOrder.put(a.label(), ImmutableList.copyOf(order));

        StringBuilder b = new StringBuilder();
        b.append("\n\n  ${\n");
        if (!newVariables.isEmpty()) b.append("    $v ").append(Joiner.on(' ').join(newVariables)).append(" $.\n");
        for (String line : lines) b.append(line).append('\n');
        List<String> pairs = new ArrayList<>();
        for (DisjointPair p : a.disjoint()) pairs.add(p.toString());
        Collections.sort(pairs);
        for (String p : pairs) b.append("    $d ").append(p).append(" $.\n");
        for (Hypothesis h : a.essential()) {
            b.append("    ").append(h.label()).append(" $e ").append(h.formula()).append(" $.\n");
        }
        b.append("    ").append(a.label()).append(" $p ").append(a.statement()).append(" $=\n");
        b.append(INDENT).append(wrap(proof(a, floatLabels::get), INDENT.length(), INDENT)).append(" $.\n");
        b.append("  $}");
        return b.toString();
    }

    /** The proof of {@code theorem} as labels in normal form, with syntax proofs regenerated. */
    List<String> proof(Assertion theorem, Function<Symbol, String> floatLabel) {
        Proof proof = theorem.proof().orElseThrow(() -> new IllegalArgumentException(theorem.label() + " has no proof"));
        List<List<String>> byStep = new ArrayList<>();
        List<List<String>> stack = new ArrayList<>();
        for (ProofStep s : proof.steps()) {
            List<String> tokens;
            if (s.isReuse()) {
                tokens = byStep.get(s.reuseIndex());
            } else if (theorem.essentialHypothesis(s.label()).isPresent()) {
                tokens = ImmutableList.of(s.label());
            } else {
                Assertion cited = database.get(s.label());
                tokens = new ArrayList<>();
                for (Symbol v : argumentOrder.getOrDefault(cited.label(), cited.mandatoryVariables())) {
                    Symbol type = typeIn(cited, v);
                    Formula value = s.substitution().get(v)
                            .orElseThrow(() -> new IllegalStateException(theorem.label() + ": no value for " + v));
                    tokens.addAll(grammar.syntaxProof(type, value, floatLabel)
                            .orElseThrow(() -> new IllegalStateException("cannot parse " + type + " " + value)));
                }
                int n = cited.essential().size();
                List<List<String>> args = stack.subList(stack.size() - n, stack.size());
                for (List<String> arg : args) tokens.addAll(arg);
                args.clear();
                tokens.add(cited.label());
            }
            stack.add(tokens);
            byStep.add(tokens);
        }
        return stack.get(stack.size() - 1);
    }

    private static Symbol typeIn(Assertion a, Symbol v) {
        for (Hypothesis h : a.floating()) if (h.variable().equals(v)) return h.typecode();
        throw new IllegalStateException(v + " is not a variable of " + a.label());
    }

    private int column(int offset) {
        int nl = sourceMap.text().lastIndexOf('\n', offset - 1);
        return offset - nl - 1;
    }

    private String indentOf(int offset) {
        return Strings.repeat(" ", column(offset));
    }

    /** Joins tokens into lines no wider than {@link #WIDTH}, continuation lines indented. */
    static String wrap(List<String> tokens, int firstColumn, String indent) {
        StringBuilder b = new StringBuilder();
        int col = firstColumn;
        for (String t : tokens) {
            if (b.length() > 0) {
                if (col + 1 + t.length() > WIDTH) {
                    b.append('\n').append(indent);
                    col = indent.length();
                } else {
                    b.append(' ');
                    ++col;
                }
            }
            b.append(t);
            col += t.length();
        }
        return b.toString();
    }
}
