package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.function.Function;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class GrammarTest {
    private final Database db = TestDatabases.demo().database();
    private final Grammar grammar = db.grammar();
    private final Symbol wff = db.symbol("wff").get();
    private final Function<Symbol, String> floats = v -> "w" + v.name();

    @Test
    public void recognizesExpressions() {
        assertThat(grammar.isEmpty(), is(false));
        assertThat(grammar.isExpression(wff, db.formula("ph")), is(true));
        assertThat(grammar.isExpression(wff, db.formula("( ph -> -. ( ps -> ph ) )")), is(true));
        assertThat(grammar.isExpression(wff, db.formula("( ph -> )")), is(false));
        assertThat(grammar.isExpression(wff, db.formula("ph -> ps")), is(false));
        assertThat(grammar.isExpression(db.provableTypecode(), db.formula("ph")), is(false));
    }

    @Test
    public void syntaxProofInReversePolishOrder() {
        assertThat(grammar.syntaxProof(wff, db.formula("( ph -> -. ps )"), floats),
                isPresentAndIs(ImmutableList.of("wph", "wps", "wn", "wi")));
        assertThat(grammar.syntaxProof(wff, db.formula("( ( ph -> ps ) -> ph )"), floats),
                isPresentAndIs(ImmutableList.of("wph", "wps", "wi", "wph", "wi")));
        assertThat(grammar.syntaxProof(wff, db.formula("( ph"), floats), isEmpty());
    }

    @Test
    public void emptyWithoutSyntaxAxioms() {
        assertThat(new Database().grammar().isEmpty(), is(true));
    }
}
