package net.littleredcomputer.refactor;

import com.google.common.base.Joiner;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import net.littleredcomputer.metamath.VerificationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** What a refactoring run did. */
public final class RunReport {
    private final int theorems;
    private final int skippedTheorems;
    private final int proposed;
    private final ImmutableMultiset<Rejection> rejected;
    private final int verified;
    private final ImmutableMultiset<VerificationException.Failure> verificationFailures;
    private final int duplicates;
    private final ImmutableList<String> accepted;
    private final int rewritesApplied;
    private final int rewritesDiscarded;
    private final ImmutableList<String> rewritten;

    private RunReport(Builder b) {
        this.theorems = b.theorems;
        this.skippedTheorems = b.skippedTheorems;
        this.proposed = b.proposed;
        this.rejected = ImmutableMultiset.copyOf(b.rejected);
        this.verified = b.verified;
        this.verificationFailures = ImmutableMultiset.copyOf(b.verificationFailures);
        this.duplicates = b.duplicates;
        this.accepted = ImmutableList.copyOf(b.accepted);
        this.rewritesApplied = b.rewritesApplied;
        this.rewritesDiscarded = b.rewritesDiscarded;
        this.rewritten = ImmutableList.copyOf(b.rewritten);
    }

    /** Theorems whose proofs were searched. */
    public int theorems() { return theorems; }
    /** Theorems whose proofs could not be run and were left alone. */
    public int skippedTheorems() { return skippedTheorems; }
    /** Candidate step sets proposed by the oracle. */
    public int proposed() { return proposed; }
    public ImmutableMultiset<Rejection> rejected() { return rejected; }
    public int verified() { return verified; }
    public ImmutableMultiset<VerificationException.Failure> verificationFailures() { return verificationFailures; }
    public int duplicates() { return duplicates; }
    /** Labels of the new theorems, in acceptance order. */
    public ImmutableList<String> accepted() { return accepted; }
    public int rewritesApplied() { return rewritesApplied; }
    public int rewritesDiscarded() { return rewritesDiscarded; }
    /** Labels of the theorems whose proofs changed, in definition order of first change. */
    public ImmutableList<String> rewritten() { return rewritten; }

    @Override
    public String toString() {
        return String.format("theorems %d (skipped %d), candidates proposed %d, rejected %d %s, verified %d, "
                        + "failed verification %d %s, duplicates %d, accepted %d, rewrites applied %d, discarded %d, "
                        + "proofs rewritten %d",
                theorems, skippedTheorems, proposed, rejected.size(), rejected, verified,
                verificationFailures.size(), verificationFailures, duplicates, accepted.size(), rewritesApplied,
                rewritesDiscarded, rewritten.size());
    }

    /** The accepted labels, one per line. */
    public String acceptedList() {
        return Joiner.on('\n').join(accepted);
    }

    static final class Builder {
        int theorems;
        int skippedTheorems;
        int proposed;
        final Multiset<Rejection> rejected = HashMultiset.create();
        int verified;
        final Multiset<VerificationException.Failure> verificationFailures = HashMultiset.create();
        int duplicates;
        final List<String> accepted = new ArrayList<>();
        int rewritesApplied;
        int rewritesDiscarded;
        final Set<String> rewritten = new LinkedHashSet<>();

        RunReport build() {
            return new RunReport(this);
        }
    }
}
