package net.littleredcomputer.metamath;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertThat;

public class MetamathWriterTest {
    private final MetamathReader.Result demo = TestDatabases.demo();
    private final Database db = demo.database();

    private Hypothesis floating(String variable) {
        return db.floatingFor(db.symbol(variable).get()).get();
    }

    /** Places the first two steps of syl as a theorem of their own and has syl cite it. */
    private void extractFromSyl() {
        Assertion xt1 = Assertion.theorem("xt1", db.formula("|- ( ( ph -> ps ) -> ( ph -> ch ) )"),
                ImmutableList.of(floating("ps"), floating("ch"), floating("ph")),
                ImmutableList.of(Hypothesis.essential("xt1.1", db.formula("|- ( ps -> ch )"))),
                ImmutableSet.of(),
                Proof.of(ProofStep.hypothesis("xt1.1"),
                        TestDatabases.cite(db, "a1i", "ph", "( ps -> ch )", "ps", "ph"),
                        TestDatabases.cite(db, "a2i", "ph", "ph", "ps", "ps", "ch", "ch")));
        db.place(xt1, db.latest(xt1.citedAssertions()).get());
        db.replaceProof("syl", Proof.of(ProofStep.hypothesis("syl.1"), ProofStep.hypothesis("syl.2"),
                TestDatabases.cite(db, "xt1", "ph", "ph", "ps", "ps", "ch", "ch"),
                TestDatabases.cite(db, "ax-mp", "ph", "( ph -> ps )", "ps", "( ph -> ch )")));
    }

    @Test
    public void disjointLinesAreSorted() {
        Symbol ph = db.symbol("ph").get();
        Symbol ps = db.symbol("ps").get();
        Symbol ch = db.symbol("ch").get();
        Assertion lem = Assertion.theorem("lem", db.formula("|- ( ps -> ph )"),
                ImmutableList.of(floating("ph"), floating("ps"), floating("ch")),
                ImmutableList.of(Hypothesis.essential("lem.1", db.formula("|- ph"))),
                ImmutableSet.of(DisjointPair.of(ph, ps), DisjointPair.of(ps, ch), DisjointPair.of(ch, ph)),
                Proof.of(ProofStep.hypothesis("lem.1"),
                        TestDatabases.cite(db, "ax-1", "ph", "ph", "ps", "ps"),
                        TestDatabases.cite(db, "ax-mp", "ph", "ph", "ps", "( ps -> ph )")));
        db.place(lem, "ax-mp");
        String out = new MetamathWriter(db, demo.sourceMap()).write(ImmutableList.of("lem"), ImmutableList.of());
        assertThat(out, containsString("    $d ch ph $.\n    $d ch ps $.\n    $d ph ps $.\n"));
    }

    @Test
    public void unchangedDatabaseIsWrittenVerbatim() {
        String out = new MetamathWriter(db, demo.sourceMap()).write(ImmutableList.of(), ImmutableList.of());
        assertThat(out, is(demo.sourceMap().text()));
    }

    @Test
    public void insertsPlacedTheoremAndRewritesProof() {
        extractFromSyl();
        String out = new MetamathWriter(db, demo.sourceMap()).write(ImmutableList.of("xt1"), ImmutableList.of("syl"));
        assertThat(out, containsString("  ${\n"
                + "    xt1.1 $e |- ( ps -> ch ) $.\n"
                + "    xt1 $p |- ( ( ph -> ps ) -> ( ph -> ch ) ) $=\n"
                + "      wph wps wch wps wch wi wph xt1.1 a1i a2i $.\n"
                + "  $}"));
        assertThat(out, containsString("    syl $p |- ( ph -> ch ) $=\n"
                + "      wph wps wi wph wch wi syl.1 wph wps wch syl.2 xt1 ax-mp $.\n"));
        assertThat(out.indexOf("xt1 $p"), greaterThan(out.indexOf("a2i $p")));
        assertThat(out.indexOf("xt1 $p"), lessThan(out.indexOf("syl $p")));
        // Other proofs are untouched.
        assertThat(out, containsString("( wi a1i ax-mp ) BAFZCABDGZIICFJEHH $."));
    }

    @Test
    public void writtenDatabaseReadsBackAndVerifies() throws VerificationException {
        extractFromSyl();
        String out = new MetamathWriter(db, demo.sourceMap()).write(ImmutableList.of("xt1"), ImmutableList.of("syl"));
        Database reread = MetamathReader.parseFrom(out).database();
        assertThat(reread.size(), is(db.size()));
        assertThat(reread.get("syl").proof().get(), is(db.get("syl").proof().get()));
        assertThat(reread.get("xt1").statement(), is(db.get("xt1").statement()));
        assertThat(reread.precedes("xt1", "syl"), is(true));
        new Verifier(reread).verify(reread.get("xt1"));
    }

    @Test
    public void wrapsLongProofs() {
        ImmutableList.Builder<String> tokens = ImmutableList.builder();
        for (int i = 0; i < 40; ++i) tokens.add("wph");
        String wrapped = MetamathWriter.wrap(tokens.build(), 6, "      ");
        String[] lines = wrapped.split("\n");
        assertThat(lines.length, is(3));
        assertThat(6 + lines[0].length(), lessThanOrEqualTo(79));
        for (int i = 1; i < lines.length; ++i) {
            assertThat(lines[i].startsWith("      wph"), is(true));
            assertThat(lines[i].length(), lessThanOrEqualTo(79));
        }
    }
}
