package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.MetamathReader;
import net.littleredcomputer.metamath.MetamathWriter;
import net.littleredcomputer.metamath.Proof;
import net.littleredcomputer.metamath.ProofStep;
import net.littleredcomputer.metamath.TestDatabases;
import net.littleredcomputer.metamath.VerificationException;
import net.littleredcomputer.metamath.Verifier;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class PipelineTest {
    private static RefactorSettings settings(int threads) {
        return new RefactorSettings().setThreads(threads);
    }

    private static ImmutableMap<String, Proof> proofs(Database db) {
        ImmutableMap.Builder<String, Proof> b = ImmutableMap.builder();
        db.theorems().forEachOrdered(t -> b.put(t.label(), t.proof().get()));
        return b.build();
    }

    @Test
    public void rankedCandidateIsExtractedAndReused() {
        MetamathReader.Result demo = TestDatabases.demo();
        Database db = demo.database();
        ImmutableMap<String, Proof> before = proofs(db);
        RunReport r = new Pipeline(settings(2)).run(db, RankingFile.parseFrom("syl: 2 3\n"));
        assertThat(r.theorems(), is(7));
        assertThat(r.skippedTheorems(), is(0));
        assertThat(r.verified(), is(1));
        assertThat(r.verificationFailures().isEmpty(), is(true));
        assertThat(r.duplicates(), is(0));
        assertThat(r.accepted(), contains("xt1"));
        assertThat(db.placedAfter("xt1").get(), is("a2i"));
        assertThat(r.rewritten(), contains("syl", "3syl"));
        assertThat(r.rewritesApplied(), is(3));
        assertThat(r.rewritesDiscarded(), is(0));
        assertThat(db.get("syl").proof().get().size(), is(4));
        assertThat(db.get("3syl").proof().get().size(), is(7));
        for (String unchanged : ImmutableList.of("a1i", "a2i", "dup", "round", "id")) {
            assertThat(db.get(unchanged).proof().get(), is(before.get(unchanged)));
        }
    }

    @Test
    public void sameOutcomeOnAnyNumberOfThreads() {
        Database one = TestDatabases.demo().database();
        Database four = TestDatabases.demo().database();
        RunReport r1 = new Pipeline(settings(1)).run(one, new StructuralSearch(2, 4));
        RunReport r4 = new Pipeline(settings(4)).run(four, new StructuralSearch(2, 4));
        assertThat(r1.accepted().isEmpty(), is(false));
        assertThat(r4.accepted(), is(r1.accepted()));
        assertThat(r4.rewritten(), is(r1.rewritten()));
        assertThat(r4.rewritesApplied(), is(r1.rewritesApplied()));
        assertThat(proofs(four), is(proofs(one)));
        for (String label : r1.accepted()) {
            assertThat(four.get(label).statement(), is(one.get(label).statement()));
            assertThat(four.placedAfter(label), is(one.placedAfter(label)));
        }
    }

    @Test
    public void everyTheoremStillVerifies() throws VerificationException {
        Database db = TestDatabases.demo().database();
        RunReport r = new Pipeline(settings(3)).run(db, new StructuralSearch(2, 6));
        assertThat(r.rewritesApplied(), greaterThan(0));
        Verifier verifier = new Verifier(db);
        for (Assertion t : db.theorems().collect(ImmutableList.toImmutableList())) {
            verifier.verify(t);
            for (String cited : t.citedAssertions()) {
                assertTrue(cited + " precedes " + t.label(), db.precedes(cited, t.label()));
            }
        }
    }

    @Test
    public void candidatesThatFailVerificationAreCounted() {
        Database db = TestDatabases.disjoint().database();
        RunReport r = new Pipeline(settings(2)).run(db, RankingFile.parseFrom("bad: 1 2\n"));
        assertThat(r.accepted(), is(empty()));
        assertThat(r.verificationFailures().count(VerificationException.Failure.DISJOINTNESS_VIOLATION), is(1));
        assertThat(r.rewritten(), is(empty()));
    }

    @Test
    public void refactoredDatabaseWritesOutAndReadsBack() {
        MetamathReader.Result demo = TestDatabases.demo();
        Database db = demo.database();
        RunReport r = new Pipeline(settings(2)).run(db, new StructuralSearch(2, 4));
        String out = new MetamathWriter(db, demo.sourceMap()).write(r.accepted(), r.rewritten());
        Database back = MetamathReader.parseFrom(out).database();
        assertThat(back.size(), is(db.size()));
        for (String label : r.accepted()) {
            assertThat(back.get(label).statement().toString(), is(db.get(label).statement().toString()));
        }
    }

    @Test
    public void inferenceFromTwoHypothesesIsExtracted() throws VerificationException {
        MetamathReader.Result both = TestDatabases.both();
        Database db = both.database();
        RunReport r = new Pipeline(settings(2)).run(db, RankingFile.parseFrom("both: 0 1 2\n"));
        assertThat(r.verified(), is(1));
        assertThat(r.accepted(), contains("xt1"));
        assertThat(db.placedAfter("xt1").get(), is("imp"));
        Assertion xt1 = db.get("xt1");
        assertThat(xt1.statement(), is(db.formula("|- ( ( ph -> ps ) -> ch )")));
        assertThat(xt1.isDisjoint(db.symbol("ph").get(), db.symbol("ch").get()), is(true));
        assertThat(r.rewritten(), contains("both"));
        assertThat(r.rewritesApplied(), is(1));
        assertThat(r.rewritesDiscarded(), is(0));
        Assertion t = db.get("both");
        assertThat(t.proof().get().steps(), contains(
                ProofStep.hypothesis("both.1"),
                ProofStep.hypothesis("both.2"),
                TestDatabases.cite(db, "xt1", "ph", "ph", "ps", "ps", "ch", "ch"),
                ProofStep.hypothesis("both.1"),
                TestDatabases.cite(db, "conj", "ph", "( ( ph -> ps ) -> ch )", "ps", "( ph -> ps )")));
        new Verifier(db).verify(t);

        String out = new MetamathWriter(db, both.sourceMap()).write(r.accepted(), r.rewritten());
        Database back = MetamathReader.parseFrom(out).database();
        assertThat(back.get("xt1").statement().toString(), is(xt1.statement().toString()));
        assertThat(back.get("both").citedAssertions(), contains("xt1", "conj"));
    }

    @Test
    public void provisionalLabelsCannotCollideWithSourceLabels() {
        String text = TestDatabases.text("demo.mm").replace("  ax-1 $a", "  syl-x0 $a |- ( ph -> ph ) $.\n  ax-1 $a");
        Database db = MetamathReader.parseFrom(text).database();
        RunReport r = new Pipeline(settings(2)).run(db, RankingFile.parseFrom("syl: 2 3\n"));
        assertThat(r.verificationFailures().isEmpty(), is(true));
        assertThat(r.accepted(), contains("xt1"));
        assertThat(r.rewritten(), contains("syl", "3syl"));
    }
}
