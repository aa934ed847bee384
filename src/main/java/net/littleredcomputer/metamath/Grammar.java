package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Recognizes the expressions of each syntactic typecode. The rules are the
 * syntax axioms of a database (axioms such as {@code wi $a wff ( ph -> ps ) $.}
 * whose typecode is not the provable one) and the leaves are variables typed by
 * floating hypotheses. Parsing is recursive descent over symbol ranges,
 * memoized per range; the first parse found wins.
 */
public class Grammar {
    private final ImmutableListMultimap<Symbol, Assertion> rules;
    private final ImmutableMap<Symbol, Hypothesis> floats;
    private final Map<Key, Boolean> recognized = new ConcurrentHashMap<>();

    Grammar(Iterable<Assertion> syntaxAxioms, Map<Symbol, Hypothesis> floats) {
        ImmutableListMultimap.Builder<Symbol, Assertion> b = ImmutableListMultimap.builder();
        for (Assertion a : syntaxAxioms) b.put(a.typecode(), a);
        this.rules = b.build();
        this.floats = ImmutableMap.copyOf(floats);
    }

    /** True if there are no syntax axioms, in which case nothing can be checked. */
    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public boolean isExpression(Symbol typecode, Formula expression) {
        return recognized.computeIfAbsent(new Key(typecode, expression),
                k -> new Parse(expression).parse(typecode, 0, expression.size()).isPresent());
    }

    /**
     * The syntax proof of {@code expression} as a list of labels in reverse
     * Polish order. Variables are proved by the floating hypothesis labels
     * {@code floatLabel} gives for them.
     */
    public Optional<ImmutableList<String>> syntaxProof(Symbol typecode, Formula expression,
                                                      Function<Symbol, String> floatLabel) {
        return new Parse(expression).parse(typecode, 0, expression.size()).map(n -> {
            ImmutableList.Builder<String> b = ImmutableList.builder();
            n.emit(b, floatLabel);
            return b.build();
        });
    }

    private static final class Key {
        final Symbol typecode;
        final Formula expression;

        Key(Symbol typecode, Formula expression) {
            this.typecode = typecode;
            this.expression = expression;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Key)) return false;
            Key k = (Key) o;
            return typecode.equals(k.typecode) && expression.equals(k.expression);
        }

        @Override
        public int hashCode() {
            return Objects.hash(typecode, expression);
        }
    }

    /** A parse tree node: either a variable leaf or a rule applied to one subtree per rule variable. */
    private static final class Node {
        final Symbol variable;
        final Assertion rule;
        final ImmutableList<Node> args;

        Node(Symbol variable) {
            this.variable = variable;
            this.rule = null;
            this.args = ImmutableList.of();
        }

        Node(Assertion rule, List<Node> args) {
            this.variable = null;
            this.rule = rule;
            this.args = ImmutableList.copyOf(args);
        }

        void emit(ImmutableList.Builder<String> out, Function<Symbol, String> floatLabel) {
            if (rule == null) {
                String label = floatLabel.apply(variable);
                if (label == null) throw new IllegalStateException("no floating hypothesis for " + variable);
                out.add(label);
                return;
            }
            for (Node n : args) n.emit(out, floatLabel);
            out.add(rule.label());
        }
    }

    private final class Parse {
        final Formula e;
        final Map<Long, Optional<Node>> memo = new HashMap<>();
        final Set<Long> active = new HashSet<>();
        final Map<Symbol, Integer> typecodes = new HashMap<>();

        Parse(Formula e) {
            this.e = e;
        }

        private long key(Symbol typecode, int from, int to) {
            int t = typecodes.computeIfAbsent(typecode, k -> typecodes.size());
            return ((long) t << 40) | ((long) from << 20) | to;
        }

        Optional<Node> parse(Symbol typecode, int from, int to) {
            if (from >= to) return Optional.empty();
            long k = key(typecode, from, to);
            Optional<Node> memoized = memo.get(k);
            if (memoized != null) return memoized;
            // A rule cycle over the same range (a -> b -> a) cannot produce a parse.
            if (!active.add(k)) return Optional.empty();
            Optional<Node> result = Optional.empty();
            if (to - from == 1 && e.get(from).isVariable()) {
                Hypothesis f = floats.get(e.get(from));
                if (f != null && f.typecode().equals(typecode)) result = Optional.of(new Node(e.get(from)));
            }
            if (!result.isPresent()) {
                for (Assertion rule : rules.get(typecode)) {
                    Map<Symbol, Node> bound = new HashMap<>();
                    Map<Symbol, Formula> spans = new HashMap<>();
                    if (matchRule(rule, rule.statement(), 1, from, to, bound, spans)) {
                        ImmutableList.Builder<Node> args = ImmutableList.builder();
                        for (Symbol v : rule.mandatoryVariables()) args.add(bound.get(v));
                        result = Optional.of(new Node(rule, args.build()));
                        break;
                    }
                }
            }
            active.remove(k);
            memo.put(k, result);
            return result;
        }

        private boolean matchRule(Assertion rule, Formula pattern, int pi, int pos, int to,
                                  Map<Symbol, Node> bound, Map<Symbol, Formula> spans) {
            if (pi == pattern.size()) return pos == to;
            if (to - pos < pattern.size() - pi) return false;
            Symbol s = pattern.get(pi);
            if (!s.isVariable()) {
                return e.get(pos).equals(s) && matchRule(rule, pattern, pi + 1, pos + 1, to, bound, spans);
            }
            Formula previous = spans.get(s);
            if (previous != null) {
                return e.regionMatches(pos, previous)
                        && matchRule(rule, pattern, pi + 1, pos + previous.size(), to, bound, spans);
            }
            Symbol type = typeInRule(rule, s);
            if (type == null) return false;
            int last = to - (pattern.size() - pi - 1);
            for (int end = pos + 1; end <= last; ++end) {
                Optional<Node> n = parse(type, pos, end);
                if (!n.isPresent()) continue;
                bound.put(s, n.get());
                spans.put(s, e.subFormula(pos, end));
                if (matchRule(rule, pattern, pi + 1, end, to, bound, spans)) return true;
                bound.remove(s);
                spans.remove(s);
            }
            return false;
        }

        private Symbol typeInRule(Assertion rule, Symbol variable) {
            for (Hypothesis h : rule.floating()) if (h.variable().equals(variable)) return h.typecode();
            return null;
        }
    }
}
