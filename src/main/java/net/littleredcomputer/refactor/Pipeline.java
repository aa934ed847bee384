package net.littleredcomputer.refactor;

import com.google.common.base.Throwables;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import net.littleredcomputer.metamath.Assertion;
import net.littleredcomputer.metamath.Database;
import net.littleredcomputer.metamath.VerificationException;
import net.littleredcomputer.metamath.Verifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * A refactoring run over a database. Candidates are extracted, built and
 * verified for every theorem in parallel; a single thread then deduplicates
 * them and adds the survivors to the database in theorem order and rank order.
 * Every theorem is then refactored with each new theorem in turn, again in
 * parallel, with the verified rewrites stored in definition order. The outcome
 * does not depend on the number of threads.
 */
public class Pipeline {
    private static final Logger log = LogManager.getFormatterLogger(Pipeline.class);

    private final RefactorSettings settings;
    private int nextLabel = 1;

    public Pipeline(RefactorSettings settings) {
        this.settings = settings;
    }

    private static final class Proposal {
        final CandidateSubproof candidate;
        final CanonicalForm form;

        Proposal(CandidateSubproof candidate, CanonicalForm form) {
            this.candidate = candidate;
            this.form = form;
        }
    }

    private static final class Extraction {
        final List<Proposal> proposals = new ArrayList<>();
        final Multiset<VerificationException.Failure> failures = HashMultiset.create();
        boolean skipped;
        int candidates;
        int verified;
    }

    public RunReport run(Database database, CandidateOracle oracle) {
        RunReport.Builder report = new RunReport.Builder();
        ExecutorService pool = Executors.newFixedThreadPool(settings.threads(),
                new ThreadFactoryBuilder().setNameFormat("refactor-%d").setDaemon(true).build());
        try {
            List<Assertion> accepted = extractAndMerge(database, oracle, pool, report);
            refactor(database, accepted, pool, report);
        } finally {
            pool.shutdownNow();
        }
        RunReport r = report.build();
        log.info("%s", r);
        return r;
    }

    private List<Assertion> extractAndMerge(Database database, CandidateOracle oracle, ExecutorService pool,
                                            RunReport.Builder report) {
        List<Assertion> theorems = database.theorems().collect(Collectors.toList());
        report.theorems = theorems.size();
        CandidateExtractor extractor = new CandidateExtractor(settings.minSize());
        CandidateOracle limited = p -> oracle.rankCandidates(p).limit(settings.maxCandidatesPerProof());
        TheoremBuilder builder = new TheoremBuilder(database);
        Verifier verifier = new Verifier(database);
        Canonicalizer canonicalizer = new Canonicalizer(database);

        List<Future<Extraction>> futures = new ArrayList<>();
        for (Assertion t : theorems) {
            futures.add(pool.submit(() -> extract(database, t, extractor, limited, builder, verifier, canonicalizer)));
        }

        Deduplicator dedup = Deduplicator.seededFrom(database);
        List<Assertion> accepted = new ArrayList<>();
        Progress progress = new Progress("extraction", theorems.size(), settings.logInterval());
        for (Future<Extraction> f : futures) {
            Extraction x = get(f);
            if (x.skipped) ++report.skippedTheorems;
            report.proposed += x.candidates;
            report.verified += x.verified;
            report.verificationFailures.addAll(x.failures);
            for (Proposal p : x.proposals) {
                if (dedup.isDuplicate(p.form)) {
                    ++report.duplicates;
                    log.debug("%s restates %s", p.candidate, dedup.existing(p.form).get());
                    continue;
                }
                Assertion built = builder.build(p.candidate, freshLabel(database, p.candidate.hypotheses().size()));
                String anchor = database.latest(built.citedAssertions())
                        .orElseThrow(() -> new IllegalStateException(built.label() + " cites nothing"));
                // Written after the anchor, the theorem is also bound by the top-level $d in force there.
                Assertion t = built.withDisjoint(database.disjointInForceAfter(anchor, built.mandatoryVariables()));
                try {
                    verifier.verify(t);
                } catch (VerificationException e) {
                    report.verificationFailures.add(e.failure());
                    log.warn("%s no longer verifies: %s", p.candidate, e.getMessage());
                    continue;
                }
                database.place(t, anchor);
                dedup.claim(p.form, t.label());
                accepted.add(t);
                report.accepted.add(t.label());
                log.info("accepted %s from %s#%d: %s", t.label(), p.candidate.owner().label(), p.candidate.rank(), t.statement());
            }
            progress.step(() -> "accepted " + accepted.size());
        }
        progress.done();
        report.rejected.addAll(extractor.rejections());
        report.proposed += report.rejected.size();
        return accepted;
    }

    private Extraction extract(Database database, Assertion theorem, CandidateExtractor extractor, CandidateOracle oracle,
                               TheoremBuilder builder, Verifier verifier, Canonicalizer canonicalizer) {
        Extraction x = new Extraction();
        ProofGraph g;
        try {
            g = ProofGraph.of(database, theorem);
        } catch (VerificationException e) {
            log.warn("skipping %s: %s", theorem.label(), e.getMessage());
            x.skipped = true;
            return x;
        }
        extractor.candidates(g, oracle).forEachOrdered(c -> {
            ++x.candidates;
            Assertion t;
            try {
                t = builder.build(c, provisionalLabel(theorem, c));
            } catch (IllegalArgumentException e) {
                log.warn("cannot build %s: %s", c, e.getMessage());
                return;
            }
            try {
                verifier.verify(t);
            } catch (VerificationException e) {
                x.failures.add(e.failure());
                log.info("dropped %s: %s", c, e.getMessage());
                return;
            }
            ++x.verified;
            x.proposals.add(new Proposal(c, canonicalizer.canonicalize(c)));
        });
        return x;
    }

    /** A label for checking a candidate before it is merged; '#' cannot occur in a label read from source. */
    static String provisionalLabel(Assertion theorem, CandidateSubproof c) {
        return theorem.label() + "#" + c.rank();
    }

    private String freshLabel(Database database, int hypotheses) {
        while (true) {
            String label = settings.labelPrefix() + nextLabel++;
            boolean free = !database.isLabelTaken(label);
            for (int i = 1; free && i <= hypotheses; ++i) free = !database.isLabelTaken(label + "." + i);
            if (free) return label;
        }
    }

    private void refactor(Database database, List<Assertion> accepted, ExecutorService pool, RunReport.Builder report) {
        Refactorer refactorer = new Refactorer(database, settings.maxFragmentSize());
        Progress progress = new Progress("refactoring", accepted.size(), settings.logInterval());
        for (Assertion lemma : accepted) {
            List<Future<Rewrite>> futures = new ArrayList<>();
            database.theorems()
                    .filter(t -> database.precedes(lemma.label(), t.label()))
                    .forEachOrdered(t -> futures.add(pool.submit(() -> refactorer.refactor(t, lemma))));
            for (Future<Rewrite> f : futures) {
                Rewrite r = get(f);
                report.rewritesApplied += r.applied();
                report.rewritesDiscarded += r.discarded();
                if (!r.changed()) continue;
                database.replaceProof(r.theorem(), r.proof());
                report.rewritten.add(r.theorem());
                log.info("%s", r);
            }
            progress.step(lemma::label);
        }
        progress.done();
    }

    private static <T> T get(Future<T> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        } catch (ExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException(e.getCause());
        }
    }
}
