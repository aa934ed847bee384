package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.Formula;
import net.littleredcomputer.metamath.Hypothesis;
import net.littleredcomputer.metamath.Symbol;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renames variables by first appearance, over the conclusion and then the
 * hypotheses in order, to {@code type$1}, {@code type$2}, ... so that
 * statements that differ only in the names of their variables get the same
 * form.
 */
public class Canonicalizer {
    private final Database database;

    public Canonicalizer(Database database) {
        this.database = database;
    }

    public CanonicalForm canonicalize(CandidateSubproof c) {
        return canonicalize(c.conclusion(), c.hypotheses());
    }

    public CanonicalForm canonicalize(Assertion a) {
        List<Formula> hypotheses = new ArrayList<>();
        for (Hypothesis h : a.essential()) hypotheses.add(h.formula());
        return canonicalize(a.statement(), hypotheses);
    }

    CanonicalForm canonicalize(Formula conclusion, List<Formula> hypotheses) {
        Map<Symbol, Symbol> renaming = new HashMap<>();
        Formula c = rename(conclusion, renaming);
        ImmutableList.Builder<Formula> hs = ImmutableList.builder();
        for (Formula h : hypotheses) hs.add(rename(h, renaming));
        return new CanonicalForm(c, hs.build());
    }

    private Formula rename(Formula f, Map<Symbol, Symbol> renaming) {
        List<Symbol> out = new ArrayList<>(f.size());
        for (Symbol s : f) {
            out.add(s.isVariable() ? renaming.computeIfAbsent(s, v -> fresh(v, renaming.size() + 1)) : s);
        }
        return Formula.of(out);
    }

    private Symbol fresh(Symbol v, int n) {
        String type = database.typeOf(v).map(Symbol::name).orElse("");
        return Symbol.variable(type + "$" + n);
    }
}
