package net.littleredcomputer.metamath;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable assignment of expressions to variables.
 */
public final class Substitution {
    public static final Substitution EMPTY = new Substitution(ImmutableMap.of());

    private final ImmutableMap<Symbol, Formula> bindings;

    private Substitution(ImmutableMap<Symbol, Formula> bindings) {
        this.bindings = bindings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Formula> get(Symbol variable) {
        return Optional.ofNullable(bindings.get(variable));
    }

    public boolean binds(Symbol variable) {
        return bindings.containsKey(variable);
    }

    public ImmutableSet<Symbol> variables() {
        return bindings.keySet();
    }

    public Map<Symbol, Formula> bindings() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /**
     * Replaces every variable of {@code formula} by its value. Every variable
     * must be bound.
     * @throws UnboundMetavariableException if a variable has no binding
     */
    public Formula apply(Formula formula) {
        ImmutableList.Builder<Symbol> b = ImmutableList.builder();
        for (Symbol s : formula) {
            if (s.isVariable()) {
                Formula value = bindings.get(s);
                if (value == null) throw new UnboundMetavariableException(s);
                b.addAll(value);
            } else {
                b.add(s);
            }
        }
        return Formula.of(b.build());
    }

    /**
     * Replaces the bound variables of {@code formula}. Variables in
     * {@code required} must be bound; others without a binding are copied.
     */
    public Formula apply(Formula formula, Set<Symbol> required) {
        ImmutableList.Builder<Symbol> b = ImmutableList.builder();
        for (Symbol s : formula) {
            Formula value = s.isVariable() ? bindings.get(s) : null;
            if (value != null) {
                b.addAll(value);
            } else if (s.isVariable() && required.contains(s)) {
                throw new UnboundMetavariableException(s);
            } else {
                b.add(s);
            }
        }
        return Formula.of(b.build());
    }

    /** This substitution restricted to the given variables. */
    public Substitution restrictTo(Collection<Symbol> variables) {
        Builder b = builder();
        for (Symbol v : variables) {
            Formula value = bindings.get(v);
            if (value != null) b.put(v, value);
        }
        return b.build();
    }

    /** The variables occurring in the value bound to {@code variable}. */
    public ImmutableSet<Symbol> variablesOf(Symbol variable) {
        Formula value = bindings.get(variable);
        return value == null ? ImmutableSet.of() : value.variables();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Substitution)) return false;
        return bindings.equals(((Substitution) o).bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "{" + Joiner.on(", ").withKeyValueSeparator(" := ").join(bindings) + "}";
    }

    public static final class Builder {
        private final Map<Symbol, Formula> bindings = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(Symbol variable, Formula value) {
            if (!variable.isVariable()) throw new IllegalArgumentException("not a variable: " + variable);
            if (value.isEmpty()) throw new IllegalArgumentException("empty value for " + variable);
            Formula previous = bindings.putIfAbsent(variable, value);
            if (previous != null && !previous.equals(value)) {
                throw new IllegalArgumentException("conflicting values for " + variable + ": " + previous + ", " + value);
            }
            return this;
        }

        public Builder putAll(Substitution s) {
            s.bindings.forEach(this::put);
            return this;
        }

        public Substitution build() {
            return bindings.isEmpty() ? EMPTY : new Substitution(ImmutableMap.copyOf(bindings));
        }
    }
}
