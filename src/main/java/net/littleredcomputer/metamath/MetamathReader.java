package net.littleredcomputer.metamath;

import com.google.common.base.CharMatcher;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.CharStreams;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a database in Metamath source format: {@code $c $v $f $e $d $a $p},
 * scoping with <code>${ $}</code>, comments, and proofs in normal or compressed
 * form. Syntax steps of proofs (floating hypotheses and syntax axioms) are
 * folded into the substitutions of the provable steps. File inclusion,
 * essential hypotheses outside any block and theorems of a syntactic typecode
 * are not accepted.
 */
public class MetamathReader {
    private static final Logger log = LogManager.getFormatterLogger(MetamathReader.class);
    private static final CharMatcher LABEL_CHARS =
            CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.inRange('0', '9')).or(CharMatcher.anyOf("-_."));

    private final boolean verifying;

    MetamathReader(boolean verifying) {
        this.verifying = verifying;
    }

    /** Reads and verifies a database. */
    public static Result parseFrom(String text) {
        return new MetamathReader(true).read(text);
    }

    public static Result parseFrom(Reader r) throws IOException {
        return parseFrom(CharStreams.toString(r));
    }

    /** Reads a database without verifying its proofs. */
    public static Result parseUnverified(String text) {
        return new MetamathReader(false).read(text);
    }

    public Result read(String text) {
        Stopwatch sw = Stopwatch.createStarted();
        Parser p = new Parser(text);
        p.parse();
        log.info("read %d assertions in %s", p.db.size(), sw);
        return new Result(p.db, p.map.build());
    }

    public static final class Result {
        private final Database database;
        private final SourceMap sourceMap;

        Result(Database database, SourceMap sourceMap) {
            this.database = database;
            this.sourceMap = sourceMap;
        }

        public Database database() {
            return database;
        }

        public SourceMap sourceMap() {
            return sourceMap;
        }
    }

    private static final class Frame {
        final Set<Symbol> variables = new HashSet<>();
        final List<Hypothesis> hypotheses = new ArrayList<>();
        final Map<Symbol, Hypothesis> floats = new HashMap<>();
        final Set<DisjointPair> disjoint = new LinkedHashSet<>();
    }

    /** A stack entry of proof decoding: a formula, and the proof step that produced it (-1 for syntax). */
    private static final class Entry {
        final Formula formula;
        final int step;

        Entry(Formula formula, int step) {
            this.formula = formula;
            this.step = step;
        }
    }

    private final class Parser {
        final String text;
        final Database db = new Database();
        final SourceMap.Builder map;
        final Verifier verifier;
        final Deque<Frame> frames = new ArrayDeque<>();
        final Set<String> labels = new HashSet<>();
        final Set<String> constants = new HashSet<>();
        int pos = 0;
        int tokenStart;
        String lastInBlock;
        Map<Symbol, String> floatSnapshot;

        Parser(String text) {
            this.text = text;
            this.map = new SourceMap.Builder(text);
            this.verifier = new Verifier(db, false);
            frames.push(new Frame());
        }

        private MalformedDatabaseException error(String message) {
            return new MalformedDatabaseException(tokenStart, message);
        }

        /** The next token outside comments, or null at the end of the text. */
        private String next() {
            while (true) {
                String t = rawToken();
                if (t == null) return null;
                if (t.equals("$(")) {
                    int start = tokenStart;
                    String c;
                    do {
                        c = rawToken();
                        if (c == null) {
                            tokenStart = start;
                            throw error("unterminated comment");
                        }
                    } while (!c.equals("$)"));
                    continue;
                }
                if (t.equals("$[")) throw error("file inclusion is not supported");
                return t;
            }
        }

        private String rawToken() {
            int n = text.length();
            while (pos < n && Character.isWhitespace(text.charAt(pos))) ++pos;
            if (pos >= n) return null;
            tokenStart = pos;
            while (pos < n && !Character.isWhitespace(text.charAt(pos))) ++pos;
            return text.substring(tokenStart, pos);
        }

        private String expect() {
            String t = next();
            if (t == null) throw error("unexpected end of database");
            return t;
        }

        void parse() {
            String t;
            while ((t = next()) != null) {
                switch (t) {
                    case "$c":
                        if (frames.size() != 1) throw error("$c inside a block");
                        for (String s : symbolsUntil("$.")) {
                            // The provable typecode is known to the database before it is declared.
                            if (!constants.add(s) || db.symbol(s).filter(Symbol::isVariable).isPresent()) {
                                throw error("symbol " + s + " declared twice");
                            }
                            db.declareConstant(s);
                        }
                        break;
                    case "$v":
                        for (String s : symbolsUntil("$.")) {
                            Optional<Symbol> existing = db.symbol(s);
                            if (existing.isPresent() && (!existing.get().isVariable() || isActive(existing.get()))) {
                                throw error("symbol " + s + " declared twice");
                            }
                            Symbol v;
                            try {
                                v = db.declareVariable(s);
                            } catch (IllegalArgumentException e) {
                                throw error(e.getMessage());
                            }
                            frames.peek().variables.add(v);
                            if (frames.size() == 1) map.topLevelVariable(v);
                        }
                        break;
                    case "$d":
                        disjoint();
                        break;
                    case "${":
                        frames.push(new Frame());
                        break;
                    case "$}":
                        closeBlock();
                        break;
                    default:
                        if (t.startsWith("$")) throw error("unexpected " + t);
                        labelled(t);
                }
            }
            if (frames.size() != 1) throw error("unclosed block");
        }

        private void closeBlock() {
            if (frames.size() == 1) throw error("$} without ${");
            Frame f = frames.pop();
            if (!f.floats.isEmpty()) floatSnapshot = null;
            if (frames.size() == 1 && lastInBlock != null) {
                map.blockEnd(lastInBlock, pos);
                db.markBlockEnd(lastInBlock);
                lastInBlock = null;
            }
        }

        private void labelled(String label) {
            if (!LABEL_CHARS.matchesAllOf(label)) throw error("bad label " + label);
            if (!labels.add(label)) throw error("label " + label + " used twice");
            String keyword = expect();
            switch (keyword) {
                case "$f":
                    floating(label);
                    break;
                case "$e": {
                    if (frames.size() == 1) throw error("essential hypothesis " + label + " outside a block");
                    Formula f = statement("$.");
                    Hypothesis h = Hypothesis.essential(label, f);
                    frames.peek().hypotheses.add(h);
                    db.reserveLabel(label);
                    break;
                }
                case "$a": {
                    Formula f = statement("$.");
                    Assertion a = assertion(label, f, null);
                    db.append(a);
                    ended(label);
                    break;
                }
                case "$p":
                    provable(label);
                    break;
                default:
                    throw error("unexpected " + keyword + " after label " + label);
            }
        }

        private void floating(String label) {
            List<String> parts = symbolsUntil("$.");
            if (parts.size() != 2) throw error("$f needs a typecode and a variable");
            Symbol type = db.symbol(parts.get(0)).orElseThrow(() -> error("undeclared " + parts.get(0)));
            Symbol v = db.symbol(parts.get(1)).orElseThrow(() -> error("undeclared " + parts.get(1)));
            if (type.isVariable()) throw error("typecode " + type + " is a variable");
            if (!v.isVariable() || !isActive(v)) throw error(v + " is not an active variable");
            if (activeFloat(v) != null) throw error(v + " already has an active $f");
            Hypothesis h = Hypothesis.floating(label, type, v);
            Frame f = frames.peek();
            f.hypotheses.add(h);
            f.floats.put(v, h);
            db.declareType(h);
            if (frames.size() == 1) map.topLevelFloat(h);
            floatSnapshot = null;
        }

        private void disjoint() {
            List<Symbol> vs = new ArrayList<>();
            for (String s : symbolsUntil("$.")) {
                Symbol v = db.symbol(s).orElseThrow(() -> error("undeclared " + s));
                if (!v.isVariable() || !isActive(v)) throw error(s + " is not an active variable");
                if (vs.contains(v)) throw error("$d repeats " + s);
                vs.add(v);
            }
            for (int i = 0; i < vs.size(); ++i) {
                for (int j = i + 1; j < vs.size(); ++j) {
                    DisjointPair p = DisjointPair.of(vs.get(i), vs.get(j));
                    frames.peek().disjoint.add(p);
                    if (frames.size() == 1) db.declareTopLevelDisjoint(p);
                }
            }
        }

        private void provable(String label) {
            Formula f = statement("$=");
            if (!f.typecode().equals(db.provableTypecode())) {
                throw error("theorem " + label + " has typecode " + f.typecode());
            }
            List<Hypothesis> mandatory = mandatoryHypotheses(f);
            ProofDecoder decoder = new ProofDecoder(mandatory);
            String t = expect();
            int start = tokenStart;
            int end;
            if (t.equals("(")) {
                List<String> refs = new ArrayList<>();
                while (!(t = expect()).equals(")")) refs.add(t);
                StringBuilder letters = new StringBuilder();
                end = pos;
                while (!(t = expect()).equals("$.")) {
                    letters.append(t);
                    end = pos;
                }
                decoder.compressed(refs, letters);
            } else {
                end = start;
                while (!t.equals("$.")) {
                    decoder.apply(t);
                    end = pos;
                    t = expect();
                }
            }
            if (end == start) throw error("empty proof of " + label);
            Proof proof = decoder.finish();
            Assertion a = assertion(label, f, proof);
            if (verifying) {
                try {
                    verifier.verify(a);
                } catch (VerificationException e) {
                    throw new MalformedDatabaseException(start, e.getMessage(), e);
                }
            }
            db.append(a);
            map.proof(label, start, end, floatSnapshot());
            ended(label);
        }

        private void ended(String label) {
            if (frames.size() == 1) {
                map.blockEnd(label, pos);
                db.markBlockEnd(label);
            } else {
                lastInBlock = label;
            }
        }

        private List<String> symbolsUntil(String terminator) {
            List<String> out = new ArrayList<>();
            String t;
            while (!(t = expect()).equals(terminator)) {
                if (t.startsWith("$")) throw error("unexpected " + t + " before " + terminator);
                out.add(t);
            }
            return out;
        }

        private Formula statement(String terminator) {
            List<Symbol> out = new ArrayList<>();
            for (String s : symbolsUntil(terminator)) {
                Symbol sym = db.symbol(s).orElseThrow(() -> error("undeclared symbol " + s));
                if (sym.isVariable() && !isActive(sym)) throw error("inactive variable " + s);
                out.add(sym);
            }
            if (out.isEmpty() || out.get(0).isVariable()) throw error("statement must begin with a constant");
            return Formula.of(out);
        }

        private boolean isActive(Symbol v) {
            for (Frame f : frames) if (f.variables.contains(v)) return true;
            return false;
        }

        private Hypothesis activeFloat(Symbol v) {
            for (Frame f : frames) {
                Hypothesis h = f.floats.get(v);
                if (h != null) return h;
            }
            return null;
        }

        private Hypothesis activeHypothesis(String label) {
            for (Frame f : frames) {
                for (Hypothesis h : f.hypotheses) if (h.label().equals(label)) return h;
            }
            return null;
        }

        private Map<Symbol, String> floatSnapshot() {
            if (floatSnapshot == null) {
                ImmutableMap.Builder<Symbol, String> b = ImmutableMap.builder();
                for (Frame f : frames) f.floats.forEach((v, h) -> b.put(v, h.label()));
                floatSnapshot = b.build();
            }
            return floatSnapshot;
        }

        /** The hypotheses of the frame that a statement needs, floating ones first. */
        private List<Hypothesis> mandatoryHypotheses(Formula statement) {
            List<Hypothesis> all = new ArrayList<>();
            Iterator<Frame> outward = frames.descendingIterator();
            while (outward.hasNext()) all.addAll(outward.next().hypotheses);
            Set<Symbol> vars = new HashSet<>(statement.variables());
            for (Hypothesis h : all) if (!h.isFloating()) vars.addAll(h.formula().variables());
            List<Hypothesis> mandatory = new ArrayList<>();
            boolean seenEssential = false;
            for (Hypothesis h : all) {
                if (h.isFloating()) {
                    if (!vars.contains(h.variable())) continue;
                    if (seenEssential) throw error("$f " + h.label() + " follows an essential hypothesis");
                } else {
                    seenEssential = true;
                }
                mandatory.add(h);
            }
            for (Symbol v : vars) {
                if (activeFloat(v) == null) throw error("variable " + v + " has no active $f");
            }
            return mandatory;
        }

        private Assertion assertion(String label, Formula statement, Proof proof) {
            List<Hypothesis> floating = new ArrayList<>();
            List<Hypothesis> essential = new ArrayList<>();
            for (Hypothesis h : mandatoryHypotheses(statement)) (h.isFloating() ? floating : essential).add(h);
            Set<Symbol> relevant = new HashSet<>();
            for (Hypothesis h : floating) relevant.add(h.variable());
            if (proof != null) {
                for (ProofStep s : proof.steps()) {
                    for (Formula value : s.substitution().bindings().values()) relevant.addAll(value.variables());
                }
            }
            Set<DisjointPair> disjoint = new LinkedHashSet<>();
            for (Frame f : frames) {
                for (DisjointPair p : f.disjoint) {
                    if (relevant.contains(p.first()) && relevant.contains(p.second())) disjoint.add(p);
                }
            }
            return proof == null
                    ? Assertion.axiom(label, statement, floating, essential, disjoint)
                    : Assertion.theorem(label, statement, floating, essential, disjoint, proof);
        }

        /** Turns the labels of a proof into provable steps, folding the syntax steps into substitutions. */
        private final class ProofDecoder {
            final List<Hypothesis> mandatory;
            final List<ProofStep> steps = new ArrayList<>();
            final List<Entry> stack = new ArrayList<>();
            final List<Entry> saved = new ArrayList<>();

            ProofDecoder(List<Hypothesis> mandatory) {
                this.mandatory = mandatory;
            }

            void apply(String label) {
                if (label.equals("?")) throw error("incomplete proof");
                Hypothesis h = activeHypothesis(label);
                if (h != null) {
                    if (h.isFloating()) {
                        stack.add(new Entry(h.formula(), -1));
                    } else {
                        steps.add(ProofStep.hypothesis(label));
                        stack.add(new Entry(h.formula(), steps.size() - 1));
                    }
                    return;
                }
                Assertion a = db.find(label).orElseThrow(() -> error("proof cites unknown label " + label));
                int nf = a.floating().size();
                int n = nf + a.essential().size();
                if (stack.size() < n) throw error("proof stack underflow at " + label);
                List<Entry> args = stack.subList(stack.size() - n, stack.size());
                Substitution.Builder sb = Substitution.builder();
                for (int k = 0; k < nf; ++k) {
                    Entry e = args.get(k);
                    Hypothesis f = a.floating().get(k);
                    if (e.step >= 0 || !e.formula.typecode().equals(f.typecode())) {
                        throw error(label + ": argument " + e.formula + " does not match " + f);
                    }
                    sb.put(f.variable(), e.formula.expression());
                }
                for (int k = nf; k < n; ++k) {
                    if (args.get(k).step < 0) throw error(label + ": syntax result " + args.get(k).formula + " used as a premise");
                }
                Substitution sigma = sb.build();
                Formula result;
                try {
                    result = sigma.apply(a.statement());
                } catch (UnboundMetavariableException e) {
                    throw error(label + ": " + e.getMessage());
                }
                args.clear();
                if (db.isSyntax(a)) {
                    stack.add(new Entry(result, -1));
                } else {
                    steps.add(ProofStep.cite(label, sigma));
                    stack.add(new Entry(result, steps.size() - 1));
                }
            }

            void compressed(List<String> refs, CharSequence letters) {
                int m = mandatory.size();
                int number = 0;
                for (int i = 0; i < letters.length(); ++i) {
                    char c = letters.charAt(i);
                    if (c == 'Z') {
                        if (stack.isEmpty()) throw error("Z with an empty stack");
                        saved.add(stack.get(stack.size() - 1));
                    } else if (c >= 'A' && c <= 'T') {
                        number = 20 * number + (c - 'A' + 1);
                        reference(number, m, refs);
                        number = 0;
                    } else if (c >= 'U' && c <= 'Y') {
                        number = 5 * number + (c - 'U' + 1);
                    } else if (c == '?') {
                        throw error("incomplete proof");
                    } else {
                        throw error("bad character '" + c + "' in compressed proof");
                    }
                }
                if (number != 0) throw error("compressed proof ends inside a number");
            }

            private void reference(int number, int m, List<String> refs) {
                if (number <= m) {
                    apply(mandatory.get(number - 1).label());
                } else if (number <= m + refs.size()) {
                    String label = refs.get(number - m - 1);
                    Hypothesis h = activeHypothesis(label);
                    if (h != null && mandatory.contains(h)) {
                        throw error("mandatory hypothesis " + label + " in compressed label list");
                    }
                    apply(label);
                } else {
                    int k = number - m - refs.size() - 1;
                    if (k >= saved.size()) throw error("reference to unsaved subproof " + number);
                    Entry e = saved.get(k);
                    if (e.step >= 0) {
                        steps.add(ProofStep.reuse(e.step));
                    }
                    stack.add(e);
                }
            }

            Proof finish() {
                if (stack.size() != 1 || stack.get(0).step < 0) {
                    throw error("proof leaves " + stack.size() + " results");
                }
                return Proof.of(steps);
            }
        }
    }
}
