package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.Hypothesis;
import net.littleredcomputer.metamath.TestDatabases;
import net.littleredcomputer.metamath.VerificationException;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class CanonicalizerTest {
    private final Database db = TestDatabases.demo().database();
    private final Canonicalizer canonicalizer = new Canonicalizer(db);

    private CandidateSubproof candidate(String theorem, Integer... steps) throws VerificationException {
        return new CandidateExtractor(2).extract(ProofGraph.of(db, db.get(theorem)), ImmutableSet.copyOf(steps), 0).get();
    }

    private Assertion axiom(String statement, String... hypotheses) {
        ImmutableList.Builder<Hypothesis> hs = ImmutableList.builder();
        for (int i = 0; i < hypotheses.length; ++i) hs.add(Hypothesis.essential("h" + i, db.formula(hypotheses[i])));
        return Assertion.axiom("ax", db.formula(statement), ImmutableList.of(), hs.build(), ImmutableSet.of());
    }

    @Test
    public void variablesAreNumberedByFirstAppearance() {
        CanonicalForm f = canonicalizer.canonicalize(db.get("a1i"));
        assertThat(f.conclusion().toString(), is("|- ( wff$1 -> wff$2 )"));
        assertThat(f.hypotheses().get(0).toString(), is("|- wff$2"));
    }

    @Test
    public void renamingVariablesKeepsTheForm() {
        assertThat(canonicalizer.canonicalize(axiom("|- ( th -> ch )", "|- ch")),
                is(canonicalizer.canonicalize(db.get("a1i"))));
        assertThat(canonicalizer.canonicalize(axiom("|- ( ps -> ph )", "|- ( ps -> ch )", "|- ( ch -> ph )")),
                is(canonicalizer.canonicalize(db.get("syl"))));
    }

    @Test
    public void hypothesisOrderMatters() {
        assertThat(canonicalizer.canonicalize(axiom("|- ( ph -> ch )", "|- ( ps -> ch )", "|- ( ph -> ps )")),
                is(not(canonicalizer.canonicalize(db.get("syl")))));
    }

    @Test
    public void sameFragmentInDifferentProofs() throws VerificationException {
        CandidateSubproof fromSyl = candidate("syl", 2, 3);
        CandidateSubproof from3syl = candidate("3syl", 6, 7);
        assertThat(from3syl.conclusion(), is(not(fromSyl.conclusion())));
        assertThat(canonicalizer.canonicalize(from3syl), is(canonicalizer.canonicalize(fromSyl)));
        assertThat(canonicalizer.canonicalize(fromSyl),
                is(canonicalizer.canonicalize(new TheoremBuilder(db).build(fromSyl, "lem"))));
    }
}
