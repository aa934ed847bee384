package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.TestDatabases;
import net.littleredcomputer.metamath.VerificationException;
import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class DeduplicatorTest {
    private final Database db = TestDatabases.demo().database();

    private CanonicalForm form(Deduplicator d, String theorem, Integer... steps) throws VerificationException {
        CandidateSubproof c = new CandidateExtractor(2).extract(ProofGraph.of(db, db.get(theorem)),
                ImmutableSet.copyOf(steps), 0).get();
        return d.canonicalizer().canonicalize(c);
    }

    @Test
    public void seededWithProvableAssertions() {
        Deduplicator d = Deduplicator.seededFrom(db);
        // Everything but the two syntax axioms.
        assertThat(d.size(), is(10));
        assertThat(d.existing(d.canonicalizer().canonicalize(db.get("syl"))), isPresentAndIs("syl"));
        assertThat(d.existing(d.canonicalizer().canonicalize(db.get("wi"))), isEmpty());
    }

    @Test
    public void firstClaimWins() throws VerificationException {
        Deduplicator d = Deduplicator.seededFrom(db);
        CanonicalForm fromSyl = form(d, "syl", 2, 3);
        assertThat(d.isDuplicate(fromSyl), is(false));
        assertThat(d.claim(fromSyl, "xt1"), is(true));
        CanonicalForm from3syl = form(d, "3syl", 2, 3);
        assertThat(d.isDuplicate(from3syl), is(true));
        assertThat(d.claim(from3syl, "xt2"), is(false));
        assertThat(d.existing(form(d, "3syl", 6, 7)), isPresentAndIs("xt1"));
    }
}
