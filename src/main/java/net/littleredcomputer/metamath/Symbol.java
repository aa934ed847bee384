package net.littleredcomputer.metamath;

import java.util.Objects;

/**
 * A math symbol of a database's alphabet: either a constant or a variable. The
 * type of a variable is not part of the symbol; it is given by the floating
 * hypothesis that declares it (see {@link Database#typeOf(Symbol)}).
 */
public final class Symbol {
    public enum Kind {
        CONSTANT,
        VARIABLE,
    }

    private final String name;
    private final Kind kind;

    private Symbol(String name, Kind kind) {
        if (name.isEmpty()) throw new IllegalArgumentException("empty symbol");
        if (name.indexOf('$') >= 0 && kind == Kind.CONSTANT) {
            throw new IllegalArgumentException("constant may not contain '$': " + name);
        }
        this.name = name;
        this.kind = kind;
    }

    public static Symbol constant(String name) {
        return new Symbol(name, Kind.CONSTANT);
    }

    public static Symbol variable(String name) {
        return new Symbol(name, Kind.VARIABLE);
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isVariable() {
        return kind == Kind.VARIABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Symbol)) return false;
        Symbol s = (Symbol) o;
        return kind == s.kind && name.equals(s.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind.ordinal());
    }

    @Override
    public String toString() {
        return name;
    }
}
