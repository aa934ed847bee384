package net.littleredcomputer.metamath;

import com.google.common.io.CharStreams;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Databases the tests read, and shorthand for building proof steps against them. */
public final class TestDatabases {
    private TestDatabases() {}

    public static String text(String resource) {
        try (InputStream in = TestDatabases.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalArgumentException("no resource " + resource);
            return CharStreams.toString(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** The implicational calculus with a1i, a2i, syl, 3syl, dup, round and id. */
    public static MetamathReader.Result demo() {
        return MetamathReader.parseFrom(text("demo.mm"));
    }

    /** An axiom with a $d restriction, and theorems citing it; "nodv" and "bad" do not verify. */
    public static MetamathReader.Result disjoint() {
        return MetamathReader.parseUnverified(text("disjoint.mm"));
    }

    /** One theorem whose proof cites "imp" on both its hypotheses and then reuses the first; a top-level $d ph ch. */
    public static MetamathReader.Result both() {
        return MetamathReader.parseFrom(text("both.mm"));
    }

    /** A substitution from alternating variable names and expressions. */
    public static Substitution substitution(Database db, String... bindings) {
        if (bindings.length % 2 != 0) throw new IllegalArgumentException("odd number of arguments");
        Substitution.Builder b = Substitution.builder();
        for (int i = 0; i < bindings.length; i += 2) {
            b.put(db.symbol(bindings[i]).get(), db.formula(bindings[i + 1]));
        }
        return b.build();
    }

    public static ProofStep cite(Database db, String label, String... bindings) {
        return ProofStep.cite(label, substitution(db, bindings));
    }
}
