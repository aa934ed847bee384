package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.Objects;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class FormulaTest {
    private static final Symbol TURNSTILE = Symbol.constant("|-");
    private static final Symbol LP = Symbol.constant("(");
    private static final Symbol RP = Symbol.constant(")");
    private static final Symbol IMP = Symbol.constant("->");
    private static final Symbol PH = Symbol.variable("ph");
    private static final Symbol PS = Symbol.variable("ps");

    // |- ( ps -> ( ph -> ps ) )
    private static final Formula F = Formula.of(TURNSTILE, LP, PS, IMP, LP, PH, IMP, PS, RP, RP);

    @Test
    public void typecodeAndExpression() {
        assertThat(F.typecode(), is(TURNSTILE));
        assertThat(F.expression().size(), is(F.size() - 1));
        assertThat(F.expression().withTypecode(TURNSTILE), is(F));
    }

    @Test(expected = IllegalStateException.class)
    public void variableFirstHasNoTypecode() {
        Formula.of(PH, IMP, PS).typecode();
    }

    @Test
    public void variablesInOrderOfFirstOccurrence() {
        assertThat(F.variables(), contains(PS, PH));
    }

    @Test
    public void regionMatches() {
        Formula inner = Formula.of(LP, PH, IMP, PS, RP);
        assertThat(F.regionMatches(4, inner), is(true));
        assertThat(F.regionMatches(1, inner), is(false));
        assertThat(F.regionMatches(7, inner), is(false));
        assertThat(F.subFormula(4, 9), is(inner));
    }

    @Test
    public void equalityIsBySymbols() {
        assertThat(Formula.of(ImmutableList.of(TURNSTILE, PH)), is(Formula.of(TURNSTILE, PH)));
        assertThat(Formula.of(TURNSTILE, PH).equals(Formula.of(TURNSTILE, PS)), is(false));
        assertThat(Symbol.constant("ph").equals(PH), is(false));
        assertThat(F.toString(), is("|- ( ps -> ( ph -> ps ) )"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void constantsMayNotContainDollar() {
        Symbol.constant("$x");
    }

    @Test
    public void symbolHashDoesNotDependOnTheRun() {
        // Hash sets of symbols iterate in the same order on every run.
        assertThat(PH.hashCode(), is(Objects.hash("ph", Symbol.Kind.VARIABLE.ordinal())));
        assertThat(IMP.hashCode(), is(Objects.hash("->", Symbol.Kind.CONSTANT.ordinal())));
    }
}
