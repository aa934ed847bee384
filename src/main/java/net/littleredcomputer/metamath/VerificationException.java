package net.littleredcomputer.metamath;

/**
 * Signals that a proof does not establish its theorem. Carries the kind of
 * failure together with the offending step (-1 for a failure at the end of the
 * proof) and the label cited there.
 */
public class VerificationException extends Exception {
    public enum Failure {
        UNKNOWN_LABEL,
        FORWARD_REFERENCE,
        BAD_REUSE,
        UNBOUND_METAVARIABLE,
        TYPE_MISMATCH,
        STACK_UNDERFLOW,
        STEP_HYPOTHESIS_MISMATCH,
        DISJOINTNESS_VIOLATION,
        INCOMPLETE_OR_MISMATCHED_PROOF,
    }

    private final Failure failure;
    private final String theorem;
    private final int step;
    private final String cited;

    VerificationException(Failure failure, String theorem, int step, String cited, String detail) {
        super(String.format("%s: %s at step %d%s: %s", theorem, failure, step,
                cited == null ? "" : " (" + cited + ")", detail));
        this.failure = failure;
        this.theorem = theorem;
        this.step = step;
        this.cited = cited;
    }

    public Failure failure() {
        return failure;
    }

    public String theorem() {
        return theorem;
    }

    public int step() {
        return step;
    }

    /** The label cited at the failing step, or null. */
    public String cited() {
        return cited;
    }
}
