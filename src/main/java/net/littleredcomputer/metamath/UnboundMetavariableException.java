package net.littleredcomputer.metamath;

/** Thrown when a substitution is applied to a formula containing a variable it does not bind. */
public class UnboundMetavariableException extends IllegalArgumentException {
    private final Symbol variable;

    public UnboundMetavariableException(Symbol variable) {
        super("unbound variable " + variable);
        this.variable = variable;
    }

    public Symbol variable() {
        return variable;
    }
}
