package net.littleredcomputer.metamath;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Iterator;
import java.util.List;

/**
 * An immutable sequence of symbols. A statement formula carries its typecode as
 * the first symbol; the values of a {@link Substitution} are bare expressions
 * without one.
 */
public final class Formula implements Iterable<Symbol> {
    public static final Formula EMPTY = new Formula(ImmutableList.of());

    private final ImmutableList<Symbol> symbols;
    private int hash;

    private Formula(ImmutableList<Symbol> symbols) {
        this.symbols = symbols;
    }

    public static Formula of(Iterable<Symbol> symbols) {
        return new Formula(ImmutableList.copyOf(symbols));
    }

    public static Formula of(Symbol... symbols) {
        return new Formula(ImmutableList.copyOf(symbols));
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int i) {
        return symbols.get(i);
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    /** The leading constant of a statement. */
    public Symbol typecode() {
        if (symbols.isEmpty() || symbols.get(0).isVariable()) {
            throw new IllegalStateException("formula has no typecode: " + this);
        }
        return symbols.get(0);
    }

    /** The statement with its typecode removed. */
    public Formula expression() {
        typecode();
        return new Formula(symbols.subList(1, symbols.size()));
    }

    public Formula withTypecode(Symbol typecode) {
        return new Formula(ImmutableList.<Symbol>builder().add(typecode).addAll(symbols).build());
    }

    public Formula subFormula(int from, int to) {
        return new Formula(symbols.subList(from, to));
    }

    /** True if the symbols at {@code offset} onwards begin with {@code other}. */
    public boolean regionMatches(int offset, Formula other) {
        if (offset + other.size() > size()) return false;
        for (int i = 0; i < other.size(); ++i) {
            if (!symbols.get(offset + i).equals(other.symbols.get(i))) return false;
        }
        return true;
    }

    /** Variables in order of first occurrence. */
    public ImmutableSet<Symbol> variables() {
        ImmutableSet.Builder<Symbol> b = ImmutableSet.builder();
        for (Symbol s : symbols) if (s.isVariable()) b.add(s);
        return b.build();
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        return symbols.equals(((Formula) o).symbols);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = symbols.hashCode();
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return Joiner.on(' ').join(symbols);
    }
}
