package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * One-way matching of pattern formulas against concrete formulas. Pattern
 * variables bind to non-empty runs of concrete symbols; a variable occurring
 * more than once must bind to the same run each time. Variables of the concrete
 * side are opaque symbols. Since the formulas are flat, a pattern can match in
 * more than one way; bindings are backtracked, and an admissibility test (such
 * as a type check by a {@link Grammar}) can prune runs that are not
 * well-formed expressions for the variable.
 */
public class Unifier {
    private static final Unifier UNCONSTRAINED = new Unifier((v, e) -> true);

    private final BiPredicate<Symbol, Formula> admissible;

    public Unifier(BiPredicate<Symbol, Formula> admissible) {
        this.admissible = admissible;
    }

    public static Optional<Substitution> unify(Formula pattern, Formula concrete) {
        return UNCONSTRAINED.unify(ImmutableList.of(pattern), ImmutableList.of(concrete));
    }

    /** Finds one substitution that maps each pattern onto the concrete formula at the same index. */
    public Optional<Substitution> unify(List<Formula> patterns, List<Formula> concretes) {
        if (patterns.size() != concretes.size()) return Optional.empty();
        Match m = new Match(patterns, concretes);
        if (!m.match(0, 0, 0)) return Optional.empty();
        Substitution.Builder b = Substitution.builder();
        m.bindings.forEach(b::put);
        return Optional.of(b.build());
    }

    private class Match {
        final List<Formula> patterns;
        final List<Formula> concretes;
        final Map<Symbol, Formula> bindings = new HashMap<>();

        Match(List<Formula> patterns, List<Formula> concretes) {
            this.patterns = patterns;
            this.concretes = concretes;
        }

        boolean match(int k, int pi, int ci) {
            if (k == patterns.size()) return true;
            Formula p = patterns.get(k);
            Formula c = concretes.get(k);
            if (pi == p.size()) return ci == c.size() && match(k + 1, 0, 0);
            // Every remaining pattern symbol consumes at least one concrete symbol.
            if (c.size() - ci < p.size() - pi) return false;
            Symbol s = p.get(pi);
            if (!s.isVariable()) {
                return c.get(ci).equals(s) && match(k, pi + 1, ci + 1);
            }
            Formula bound = bindings.get(s);
            if (bound != null) {
                return c.regionMatches(ci, bound) && match(k, pi + 1, ci + bound.size());
            }
            int last = c.size() - (p.size() - pi - 1);
            for (int end = ci + 1; end <= last; ++end) {
                Formula value = c.subFormula(ci, end);
                if (!admissible.test(s, value)) continue;
                bindings.put(s, value);
                if (match(k, pi + 1, end)) return true;
                bindings.remove(s);
            }
            return false;
        }
    }
}
