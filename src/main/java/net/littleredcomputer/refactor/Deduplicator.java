package net.littleredcomputer.refactor;

import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the canonical form of every provable assertion, so that a
 * candidate that restates one (up to the names of its variables) is known.
 * The first label to claim a form keeps it. Not thread safe; used by the single
 * merging thread.
 */
public class Deduplicator {
    private final Canonicalizer canonicalizer;
    private final Map<CanonicalForm, String> claimed = new HashMap<>();

    public Deduplicator(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /** A deduplicator that knows every provable assertion of the database, in definition order. */
    public static Deduplicator seededFrom(Database database) {
        Deduplicator d = new Deduplicator(new Canonicalizer(database));
        for (Assertion a : database.assertions()) {
            if (database.isSyntax(a)) continue;
            d.claim(d.canonicalizer.canonicalize(a), a.label());
        }
        return d;
    }

    public Canonicalizer canonicalizer() {
        return canonicalizer;
    }

    /** The label that claimed the form, if any. */
    public Optional<String> existing(CanonicalForm form) {
        return Optional.ofNullable(claimed.get(form));
    }

    public boolean isDuplicate(CanonicalForm form) {
        return claimed.containsKey(form);
    }

    /** Claims the form for {@code label}; false if it was already claimed. */
    public boolean claim(CanonicalForm form, String label) {
        return claimed.putIfAbsent(form, label) == null;
    }

    public int size() {
        return claimed.size();
    }
}
