package net.littleredcomputer.metamath;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * The label to assertion store. Storage is append-only, but definition order is
 * an explicit position: assertions read from a source take consecutive major
 * positions, and an assertion {@link #place placed} after an anchor takes the
 * next minor position at the end of the anchor's top-level block, so that it
 * precedes every later assertion of the source and can be cited by them.
 *
 * <p>Reads may run concurrently with each other; {@link #append},
 * {@link #place} and {@link #replaceProof} are serialized.
 */
public class Database {
    private static final Logger log = LogManager.getFormatterLogger(Database.class);
    public static final String PROVABLE = "|-";

    private final Symbol provable;
    private final Map<String, Symbol> symbols = new ConcurrentHashMap<>();
    private final Map<Symbol, Hypothesis> floats = new ConcurrentHashMap<>();
    private final Set<String> hypothesisLabels = ConcurrentHashMap.newKeySet();
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    // Guarded by this.
    private final List<String> majorLabels = new ArrayList<>();
    private final TreeSet<Integer> blockEnds = new TreeSet<>();
    private final Map<Integer, Integer> lastMinor = new HashMap<>();
    private final List<ScopedPair> topLevelDisjoint = new ArrayList<>();
    private volatile Grammar grammar;

    public Database() {
        this(PROVABLE);
    }

    public Database(String provableTypecode) {
        this.provable = declareConstant(provableTypecode);
    }

    /** Definition order position. */
    static final class Position implements Comparable<Position> {
        final int major;
        final int minor;

        Position(int major, int minor) {
            this.major = major;
            this.minor = minor;
        }

        @Override
        public int compareTo(Position o) {
            return major != o.major ? Integer.compare(major, o.major) : Integer.compare(minor, o.minor);
        }

        @Override
        public String toString() {
            return major + "." + minor;
        }
    }

    private static final class Entry {
        final Assertion assertion;
        final Position position;

        Entry(Assertion assertion, Position position) {
            this.assertion = assertion;
            this.position = position;
        }
    }

    /** A top-level disjoint variable restriction and the number of assertions read before it. */
    private static final class ScopedPair {
        final DisjointPair pair;
        final int from;

        ScopedPair(DisjointPair pair, int from) {
            this.pair = pair;
            this.from = from;
        }
    }

    public Symbol provableTypecode() {
        return provable;
    }

    public synchronized Symbol declareConstant(String name) {
        Symbol s = symbols.get(name);
        if (s != null) {
            if (s.isVariable()) throw new IllegalArgumentException(name + " is already a variable");
            return s;
        }
        s = Symbol.constant(name);
        symbols.put(name, s);
        return s;
    }

    public synchronized Symbol declareVariable(String name) {
        Symbol s = symbols.get(name);
        if (s != null) {
            if (!s.isVariable()) throw new IllegalArgumentException(name + " is already a constant");
            return s;
        }
        s = Symbol.variable(name);
        symbols.put(name, s);
        return s;
    }

    public Optional<Symbol> symbol(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /** Parses space separated symbol names, all of which must be declared. */
    public Formula formula(String text) {
        List<Symbol> out = new ArrayList<>();
        for (String name : Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().split(text)) {
            Symbol s = symbols.get(name);
            if (s == null) throw new IllegalArgumentException("undeclared symbol " + name + " in " + text);
            out.add(s);
        }
        return Formula.of(out);
    }

    /**
     * Records a floating hypothesis as the type declaration of its variable.
     * The first declaration of a variable wins.
     */
    public void declareType(Hypothesis floating) {
        reserveLabel(floating.label());
        Hypothesis previous = floats.putIfAbsent(floating.variable(), floating);
        if (previous == null) {
            grammar = null;
        } else if (!previous.typecode().equals(floating.typecode())) {
            log.warn("%s gives %s type %s; keeping %s from %s", floating.label(), floating.variable(),
                    floating.typecode(), previous.typecode(), previous.label());
        }
    }

    public Optional<Symbol> typeOf(Symbol variable) {
        Hypothesis h = floats.get(variable);
        return h == null ? Optional.empty() : Optional.of(h.typecode());
    }

    /** The first floating hypothesis declared for the variable. */
    public Optional<Hypothesis> floatingFor(Symbol variable) {
        return Optional.ofNullable(floats.get(variable));
    }

    /** Reserves a hypothesis label so that no assertion can take it. */
    public void reserveLabel(String label) {
        if (entries.containsKey(label)) throw new DatabaseException.DuplicateLabel(label);
        hypothesisLabels.add(label);
    }

    public boolean isLabelTaken(String label) {
        return entries.containsKey(label) || hypothesisLabels.contains(label);
    }

    public Assertion get(String label) {
        Entry e = entries.get(label);
        if (e == null) throw new DatabaseException.UnknownLabel(label);
        return e.assertion;
    }

    public Optional<Assertion> find(String label) {
        Entry e = entries.get(label);
        return e == null ? Optional.empty() : Optional.of(e.assertion);
    }

    public boolean contains(String label) {
        return entries.containsKey(label);
    }

    public int size() {
        return entries.size();
    }

    /** True if {@code a} is strictly earlier than {@code b} in definition order. */
    public boolean precedes(String a, String b) {
        return position(a).compareTo(position(b)) < 0;
    }

    Position position(String label) {
        Entry e = entries.get(label);
        if (e == null) throw new DatabaseException.UnknownLabel(label);
        return e.position;
    }

    /** Of the given labels, the one latest in definition order. */
    public Optional<String> latest(Iterable<String> labels) {
        String best = null;
        for (String l : labels) {
            if (best == null || precedes(best, l)) best = l;
        }
        return Optional.ofNullable(best);
    }

    /** True if the assertion is a syntax axiom, i.e. its typecode is not the provable one. */
    public boolean isSyntax(Assertion a) {
        return !a.typecode().equals(provable);
    }

    /**
     * Appends an assertion at the end of definition order.
     * @throws DatabaseException.DuplicateLabel if the label is in use
     * @throws DatabaseException.ForwardReference if the proof cites an assertion not already present
     */
    public synchronized void append(Assertion assertion) {
        checkLabel(assertion);
        for (String cited : assertion.citedAssertions()) {
            if (!entries.containsKey(cited)) throw new DatabaseException.ForwardReference(assertion.label(), cited);
        }
        Position p = new Position(majorLabels.size(), 0);
        majorLabels.add(assertion.label());
        add(assertion, p);
    }

    /**
     * Marks the end of a top-level block of the source. Placed assertions are
     * positioned at block ends.
     */
    public synchronized void markBlockEnd(String label) {
        Position p = position(label);
        if (p.minor != 0) throw new IllegalArgumentException(label + " was placed, not read");
        blockEnds.add(p.major);
    }

    /**
     * Appends an assertion positioned immediately after the top-level block
     * containing {@code anchor} (after any assertions already placed there).
     * @throws DatabaseException.ForwardReference if the proof cites an assertion
     *     that does not precede the new position
     */
    public synchronized void place(Assertion assertion, String anchor) {
        checkLabel(assertion);
        int major = placementMajor(anchor);
        Position p = new Position(major, lastMinor.merge(major, 1, Integer::sum));
        for (String cited : assertion.citedAssertions()) {
            Entry c = entries.get(cited);
            if (c == null || c.position.compareTo(p) >= 0) {
                throw new DatabaseException.ForwardReference(assertion.label(), cited);
            }
        }
        add(assertion, p);
        log.debug("placed %s at %s after %s", assertion.label(), p, majorLabels.get(major));
    }

    private int placementMajor(String anchor) {
        Integer end = blockEnds.ceiling(position(anchor).major);
        return end != null ? end : position(anchor).major;
    }

    /** Records a top-level restriction, in force for every assertion appended after it. */
    public synchronized void declareTopLevelDisjoint(DisjointPair pair) {
        topLevelDisjoint.add(new ScopedPair(pair, majorLabels.size()));
    }

    /**
     * The top-level restrictions on pairs of {@code variables} in force where an
     * assertion {@link #place placed} after {@code anchor} goes.
     */
    public synchronized ImmutableSet<DisjointPair> disjointInForceAfter(String anchor, Collection<Symbol> variables) {
        int major = placementMajor(anchor);
        ImmutableSet.Builder<DisjointPair> b = ImmutableSet.builder();
        for (ScopedPair s : topLevelDisjoint) {
            if (s.from <= major && variables.contains(s.pair.first()) && variables.contains(s.pair.second())) {
                b.add(s.pair);
            }
        }
        return b.build();
    }

    /** For a placed assertion, the label of the source assertion it was placed after. */
    public synchronized Optional<String> placedAfter(String label) {
        Position p = position(label);
        return p.minor == 0 ? Optional.empty() : Optional.of(majorLabels.get(p.major));
    }

    /**
     * Replaces the proof of a theorem.
     * @throws DatabaseException.ForwardReference if the proof cites an assertion that does not precede it
     */
    public synchronized void replaceProof(String label, Proof proof) {
        Entry e = entries.get(label);
        if (e == null) throw new DatabaseException.UnknownLabel(label);
        Assertion replaced = e.assertion.withProof(proof);
        for (String cited : replaced.citedAssertions()) {
            Entry c = entries.get(cited);
            if (c == null || c.position.compareTo(e.position) >= 0) {
                throw new DatabaseException.ForwardReference(label, cited);
            }
        }
        entries.put(label, new Entry(replaced, e.position));
    }

    /** All assertions in definition order. */
    public ImmutableList<Assertion> assertions() {
        List<Entry> snapshot = new ArrayList<>(entries.values());
        snapshot.sort(Comparator.comparing(e -> e.position));
        ImmutableList.Builder<Assertion> b = ImmutableList.builder();
        for (Entry e : snapshot) b.add(e.assertion);
        return b.build();
    }

    /** The theorems in definition order. */
    public Stream<Assertion> theorems() {
        return assertions().stream().filter(Assertion::isTheorem);
    }

    /** The theorems whose proofs cite {@code label}; each iteration rescans the database. */
    public Iterable<Assertion> iterProofsCiting(String label) {
        Iterable<Assertion> scan = () -> theorems().iterator();
        return FluentIterable.from(scan).filter(t -> t.citedAssertions().contains(label));
    }

    /** The grammar of the syntax axioms present now. */
    public Grammar grammar() {
        Grammar g = grammar;
        if (g == null) {
            synchronized (this) {
                g = grammar;
                if (g == null) {
                    g = new Grammar(FluentIterable.from(assertions()).filter(a -> !a.isTheorem() && isSyntax(a)), floats);
                    grammar = g;
                }
            }
        }
        return g;
    }

    /** A unifier that only binds variables to well-formed expressions of their type. */
    public Unifier unifier() {
        Grammar g = grammar();
        if (g.isEmpty()) return new Unifier((v, e) -> true);
        return new Unifier((v, e) -> {
            Optional<Symbol> t = typeOf(v);
            return !t.isPresent() || g.isExpression(t.get(), e);
        });
    }

    private void checkLabel(Assertion assertion) {
        if (isLabelTaken(assertion.label())) throw new DatabaseException.DuplicateLabel(assertion.label());
        for (Hypothesis h : assertion.essential()) {
            if (entries.containsKey(h.label())) throw new DatabaseException.DuplicateLabel(h.label());
        }
    }

    private void add(Assertion assertion, Position p) {
        entries.put(assertion.label(), new Entry(assertion, p));
        for (Hypothesis h : assertion.essential()) hypothesisLabels.add(h.label());
        if (!assertion.isTheorem() && isSyntax(assertion)) grammar = null;
    }
}
