package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.TestDatabases;
import net.littleredcomputer.metamath.VerificationException;
import org.junit.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class CandidateExtractorTest {
    private final Database db = TestDatabases.demo().database();
    private final CandidateExtractor extractor = new CandidateExtractor(2);

    private ProofGraph graph(String theorem) throws VerificationException {
        return ProofGraph.of(db, db.get(theorem));
    }

    private void assertRejected(String theorem, Rejection why, Integer... steps) throws VerificationException {
        CandidateExtractor e = new CandidateExtractor(2);
        assertThat(e.extract(graph(theorem), ImmutableSet.copyOf(steps), 0), isEmpty());
        assertThat(e.rejections().count(why), is(1));
        assertThat(e.rejections().size(), is(1));
    }

    @Test
    public void sylPrefix() throws VerificationException {
        CandidateSubproof c = extractor.extract(graph("syl"), ImmutableSet.of(2, 3), 7).get();
        assertThat(c.steps(), contains(2, 3));
        assertThat(c.exit(), is(3));
        assertThat(c.rank(), is(7));
        assertThat(c.owner().label(), is("syl"));
        assertThat(c.hypotheses(), contains(db.formula("|- ( ps -> ch )")));
        assertThat(c.producers(), contains(1));
        assertThat(c.conclusion(), is(db.formula("|- ( ( ph -> ps ) -> ( ph -> ch ) )")));
    }

    @Test
    public void hypothesisStepsStayOnTheBoundary() throws VerificationException {
        CandidateSubproof c = extractor.extract(graph("syl"), ImmutableSet.of(1, 2, 3), 0).get();
        assertThat(c.steps(), contains(2, 3));
    }

    @Test
    public void reuseStepsResolveToTheirTargets() throws VerificationException {
        CandidateSubproof c = extractor.extract(graph("dup"), ImmutableSet.of(2, 4), 0).get();
        assertThat(c.steps(), contains(1, 4));
        assertThat(c.hypotheses(), contains(db.formula("|- ph"),
                db.formula("|- ( ( ps -> ph ) -> ( ( ps -> ph ) -> ch ) )")));
        assertThat(c.producers(), contains(0, 3));
    }

    @Test
    public void outOfRange() throws VerificationException {
        assertRejected("syl", Rejection.OUT_OF_RANGE, 2, 3, 5);
    }

    @Test
    public void tooSmall() throws VerificationException {
        assertRejected("syl", Rejection.TOO_SMALL, 2);
        assertRejected("syl", Rejection.TOO_SMALL, 0, 1);
    }

    @Test
    public void hypothesisStepsCountTowardSize() throws VerificationException {
        CandidateSubproof c = extractor.extract(graph("syl"), ImmutableSet.of(1, 2), 0).get();
        assertThat(c.steps(), contains(2));
        assertThat(c.hypotheses(), contains(db.formula("|- ( ps -> ch )")));
        assertThat(c.conclusion(), is(db.formula("|- ( ph -> ( ps -> ch ) )")));
    }

    @Test
    public void hypothesisStepOutsideTheCandidateIsDisconnected() throws VerificationException {
        // syl.1 is only used by the last step.
        assertRejected("syl", Rejection.DISCONNECTED, 0, 1, 2);
    }

    @Test
    public void twoHypothesesAndOneCitation() throws VerificationException {
        Database both = TestDatabases.both().database();
        CandidateSubproof c = new CandidateExtractor(2).extract(ProofGraph.of(both, both.get("both")),
                ImmutableSet.of(0, 1, 2), 0).get();
        assertThat(c.steps(), contains(2));
        assertThat(c.hypotheses(), contains(both.formula("|- ( ph -> ps )"), both.formula("|- ch")));
        assertThat(c.producers(), contains(0, 1));
        assertThat(c.conclusion(), is(both.formula("|- ( ( ph -> ps ) -> ch )")));
    }

    @Test
    public void disconnected() throws VerificationException {
        assertRejected("3syl", Rejection.DISCONNECTED, 2, 6);
    }

    @Test
    public void noHypotheses() throws VerificationException {
        assertRejected("id", Rejection.NO_HYPOTHESES, 1, 2, 3);
    }

    @Test
    public void selfExtraction() throws VerificationException {
        assertRejected("syl", Rejection.SELF_EXTRACTION, 2, 3, 4);
    }

    @Test
    public void trivial() throws VerificationException {
        assertRejected("round", Rejection.TRIVIAL, 2, 3);
    }

    @Test
    public void candidatesInRankOrder() throws VerificationException {
        // {3, 4} and {2, 3, 4} both end in the root, which proves syl itself.
        List<CandidateSubproof> cs = extractor.candidates(graph("syl"), new StructuralSearch(2, 6)).collect(Collectors.toList());
        assertThat(cs.stream().map(CandidateSubproof::rank).collect(Collectors.toList()), contains(0));
        assertThat(extractor.rejections().count(Rejection.SELF_EXTRACTION), is(2));
        List<CandidateSubproof> from3syl = extractor.candidates(graph("3syl"), new StructuralSearch(2, 2))
                .collect(Collectors.toList());
        assertThat(from3syl.stream().map(CandidateSubproof::rank).collect(Collectors.toList()), contains(0, 1, 2));
    }

    @Test
    public void rankingFileProposals() throws VerificationException {
        RankingFile ranking = RankingFile.parseFrom("syl: 4 3\nsyl: 2\nsyl: 3 2\n");
        Optional<CandidateSubproof> first = extractor.candidates(graph("syl"), ranking).findFirst();
        assertThat(first.get().rank(), is(2));
        assertThat(first.get().steps(), contains(2, 3));
        assertThat(extractor.rejections().count(Rejection.SELF_EXTRACTION), is(1));
        assertThat(extractor.rejections().count(Rejection.TOO_SMALL), is(1));
    }
}
