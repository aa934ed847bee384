package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import net.littleredcomputer.metamath.VerificationException.Failure;

/**
 * The proof checking kernel. A proof is run as a stack program: a citation pops
 * the results matching the cited assertion's essential hypotheses under the
 * step's substitution and pushes the substituted statement; a reuse step pushes
 * an earlier result again.
 */
public class Verifier {
    private final Database database;
    private final boolean checkTypes;

    public Verifier(Database database) {
        this(database, true);
    }

    /**
     * @param checkTypes whether substitution values are checked against the
     *     grammar; proofs read from source have values built from syntax proofs
     *     and need no check
     */
    public Verifier(Database database, boolean checkTypes) {
        this.database = database;
        this.checkTypes = checkTypes;
    }

    /**
     * Checks that the theorem's proof proves its statement.
     * @throws VerificationException describing the first failure
     */
    public void verify(Assertion theorem) throws VerificationException {
        Proof proof = theorem.proof().orElseThrow(() -> new IllegalArgumentException(theorem.label() + " has no proof"));
        run(theorem, proof, true);
    }

    /**
     * Runs the proof without checking disjoint variable restrictions or the
     * final result, returning the formula each step pushes.
     */
    public ImmutableList<Formula> evaluate(Assertion theorem, Proof proof) throws VerificationException {
        return run(theorem, proof, false);
    }

    public boolean accepts(Assertion theorem) {
        try {
            verify(theorem);
            return true;
        } catch (VerificationException e) {
            return false;
        }
    }

    private ImmutableList<Formula> run(Assertion owner, Proof proof, boolean strict) throws VerificationException {
        Grammar grammar = checkTypes ? database.grammar() : null;
        if (grammar != null && grammar.isEmpty()) grammar = null;
        boolean ownerStored = database.contains(owner.label());
        List<Formula> stack = new ArrayList<>();
        List<Formula> byStep = new ArrayList<>();
        for (int i = 0; i < proof.size(); ++i) {
            ProofStep step = proof.get(i);
            Formula result;
            if (step.isReuse()) {
                int j = step.reuseIndex();
                if (j >= i) throw new VerificationException(Failure.BAD_REUSE, owner.label(), i, null, "reuse of step " + j);
                result = byStep.get(j);
            } else {
                result = cite(owner, ownerStored, grammar, stack, i, step, strict);
            }
            stack.add(result);
            byStep.add(result);
        }
        if (strict) {
            if (stack.size() != 1) {
                throw new VerificationException(Failure.INCOMPLETE_OR_MISMATCHED_PROOF, owner.label(), -1, null,
                        stack.size() + " results on the stack");
            }
            if (!stack.get(0).equals(owner.statement())) {
                throw new VerificationException(Failure.INCOMPLETE_OR_MISMATCHED_PROOF, owner.label(), -1, null,
                        "proved " + stack.get(0));
            }
        }
        return ImmutableList.copyOf(byStep);
    }

    private Formula cite(Assertion owner, boolean ownerStored, Grammar grammar, List<Formula> stack, int i,
                         ProofStep step, boolean strict) throws VerificationException {
        String label = step.label();
        Optional<Hypothesis> h = owner.essentialHypothesis(label);
        if (h.isPresent()) {
            if (!step.substitution().isEmpty()) {
                throw new VerificationException(Failure.STEP_HYPOTHESIS_MISMATCH, owner.label(), i, label,
                        "hypothesis cited with a substitution");
            }
            return h.get().formula();
        }
        Optional<Assertion> found = database.find(label);
        if (!found.isPresent()) {
            throw new VerificationException(Failure.UNKNOWN_LABEL, owner.label(), i, label, "no such assertion");
        }
        Assertion cited = found.get();
        if (label.equals(owner.label()) || ownerStored && !database.precedes(label, owner.label())) {
            throw new VerificationException(Failure.FORWARD_REFERENCE, owner.label(), i, label, "cited assertion is not earlier");
        }
        Substitution sigma = step.substitution();
        for (Hypothesis f : cited.floating()) {
            Optional<Formula> value = sigma.get(f.variable());
            if (!value.isPresent()) {
                throw new VerificationException(Failure.UNBOUND_METAVARIABLE, owner.label(), i, label,
                        "no value for " + f.variable());
            }
            if (grammar != null && !grammar.isExpression(f.typecode(), value.get())) {
                throw new VerificationException(Failure.TYPE_MISMATCH, owner.label(), i, label,
                        value.get() + " is not a " + f.typecode());
            }
        }
        int n = cited.essential().size();
        if (stack.size() < n) {
            throw new VerificationException(Failure.STACK_UNDERFLOW, owner.label(), i, label,
                    "needs " + n + ", stack has " + stack.size());
        }
        List<Formula> popped = stack.subList(stack.size() - n, stack.size());
        Formula result;
        try {
            for (int j = 0; j < n; ++j) {
                Formula expected = sigma.apply(cited.essential().get(j).formula());
                if (!expected.equals(popped.get(j))) {
                    throw new VerificationException(Failure.STEP_HYPOTHESIS_MISMATCH, owner.label(), i, label,
                            "expected " + expected + " for " + cited.essential().get(j).label() + ", have " + popped.get(j));
                }
            }
            result = sigma.apply(cited.statement());
        } catch (UnboundMetavariableException e) {
            throw new VerificationException(Failure.UNBOUND_METAVARIABLE, owner.label(), i, label, e.getMessage());
        }
        if (strict) checkDisjoint(owner, cited, sigma, i);
        popped.clear();
        return result;
    }

    private void checkDisjoint(Assertion owner, Assertion cited, Substitution sigma, int i) throws VerificationException {
        ImmutableSet<Symbol> mandatory = ImmutableSet.copyOf(cited.mandatoryVariables());
        for (DisjointPair p : cited.disjoint()) {
            // Restrictions on variables the cited assertion doesn't take as arguments only concern its own proof.
            if (!mandatory.contains(p.first()) || !mandatory.contains(p.second())) continue;
            for (Symbol x : sigma.variablesOf(p.first())) {
                for (Symbol y : sigma.variablesOf(p.second())) {
                    if (x.equals(y)) {
                        throw new VerificationException(Failure.DISJOINTNESS_VIOLATION, owner.label(), i, cited.label(),
                                "$d " + p + " but both substitutions contain " + x);
                    }
                    if (!owner.isDisjoint(x, y)) {
                        throw new VerificationException(Failure.DISJOINTNESS_VIOLATION, owner.label(), i, cited.label(),
                                "$d " + x + " " + y + " is not declared");
                    }
                }
            }
        }
    }
}
