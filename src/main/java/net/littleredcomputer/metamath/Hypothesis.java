package net.littleredcomputer.metamath;

import java.util.Objects;

/**
 * A labelled hypothesis. A floating hypothesis {@code wff ph} gives a variable
 * its type; an essential hypothesis is a premise of its assertion.
 */
public final class Hypothesis {
    public enum Kind {
        FLOATING,
        ESSENTIAL,
    }

    private final String label;
    private final Formula formula;
    private final Kind kind;

    private Hypothesis(String label, Formula formula, Kind kind) {
        this.label = label;
        this.formula = formula;
        this.kind = kind;
    }

    public static Hypothesis floating(String label, Symbol typecode, Symbol variable) {
        if (!variable.isVariable()) throw new IllegalArgumentException(label + ": not a variable: " + variable);
        return new Hypothesis(label, Formula.of(typecode, variable), Kind.FLOATING);
    }

    public static Hypothesis essential(String label, Formula formula) {
        formula.typecode();
        return new Hypothesis(label, formula, Kind.ESSENTIAL);
    }

    public String label() {
        return label;
    }

    public Formula formula() {
        return formula;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFloating() {
        return kind == Kind.FLOATING;
    }

    public Symbol typecode() {
        return formula.typecode();
    }

    /** The variable typed by a floating hypothesis. */
    public Symbol variable() {
        if (kind != Kind.FLOATING) throw new IllegalStateException(label + " is not a floating hypothesis");
        return formula.get(1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hypothesis)) return false;
        Hypothesis h = (Hypothesis) o;
        return label.equals(h.label) && formula.equals(h.formula) && kind == h.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, formula, kind);
    }

    @Override
    public String toString() {
        return label + " " + formula;
    }
}
