package net.littleredcomputer.refactor;

import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.TestDatabases;
import net.littleredcomputer.metamath.VerificationException;
import org.junit.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertThat;

public class RankingFileTest {
    private final Database db = TestDatabases.demo().database();

    @Test
    public void linesInRankOrder() throws VerificationException {
        RankingFile r = RankingFile.parseFrom("# model output\n\nsyl: 2 3\n  3syl:6 7  \nsyl: 3  4\n");
        assertThat(r.theorems(), containsInAnyOrder("syl", "3syl"));
        assertThat(r.rankCandidates(ProofGraph.of(db, db.get("syl"))).collect(Collectors.toList()),
                contains((Set<Integer>) ImmutableSet.of(2, 3), ImmutableSet.of(3, 4)));
        assertThat(r.rankCandidates(ProofGraph.of(db, db.get("3syl"))).count(), is(1L));
        assertThat(r.rankCandidates(ProofGraph.of(db, db.get("dup"))).count(), is(0L));
    }

    @Test
    public void emptySetIsAllowed() {
        assertThat(RankingFile.parseFrom("syl:\n").theorems(), contains("syl"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingLabel() {
        RankingFile.parseFrom("2 3\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void badIndex() {
        RankingFile.parseFrom("syl: 2 three\n");
    }
}
