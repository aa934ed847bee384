package net.littleredcomputer.refactor;

import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.TestDatabases;
import net.littleredcomputer.metamath.VerificationException;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class ProofGraphTest {
    private final Database db = TestDatabases.demo().database();

    @Test
    public void syl() throws VerificationException {
        ProofGraph g = ProofGraph.of(db, db.get("syl"));
        assertThat(g.size(), is(5));
        assertThat(g.isHypothesis(0), is(true));
        assertThat(g.isCitation(0), is(false));
        assertThat(g.isCitation(2), is(true));
        assertArrayEquals(new int[]{1}, g.inputs(2));
        assertArrayEquals(new int[]{2}, g.inputs(3));
        assertArrayEquals(new int[]{0, 3}, g.inputs(4));
        assertArrayEquals(new int[]{4}, g.consumers(3));
        assertArrayEquals(new int[0], g.consumers(4));
        assertThat(g.root(), is(4));
        assertThat(g.result(3), is(db.formula("|- ( ( ph -> ps ) -> ( ph -> ch ) )")));
    }

    @Test
    public void reuseStandsForItsTarget() throws VerificationException {
        ProofGraph g = ProofGraph.of(db, db.get("dup"));
        assertThat(g.resolve(2), is(1));
        assertThat(g.isNode(2), is(false));
        assertThat(g.isCitation(2), is(false));
        assertThat(g.result(2), is(db.formula("|- ( ps -> ph )")));
        assertArrayEquals(new int[]{1, 3}, g.inputs(4));
        assertArrayEquals(new int[]{1, 4}, g.inputs(5));
        assertArrayEquals(new int[]{4, 5}, g.consumers(1));
        assertThat(g.root(), is(5));
    }

    @Test
    public void theoremsWithoutHypotheses() throws VerificationException {
        ProofGraph g = ProofGraph.of(db, db.get("id"));
        assertArrayEquals(new int[]{1, 2}, g.inputs(3));
        assertArrayEquals(new int[]{0, 3}, g.inputs(4));
        assertArrayEquals(new int[0], g.inputs(0));
    }
}
