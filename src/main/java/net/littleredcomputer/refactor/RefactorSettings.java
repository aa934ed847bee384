package net.littleredcomputer.refactor;

import java.time.Duration;

/** Tunable parameters of a refactoring run. */
public class RefactorSettings {
    private int minSize = 2;
    private int maxSize = 6;
    private int maxCandidatesPerProof = 256;
    private int maxFragmentSize = 8;
    private String labelPrefix = "xt";
    private int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
    private Duration logInterval = Duration.ofMillis(1000);

    public int minSize() { return minSize; }
    public int maxSize() { return maxSize; }
    public int maxCandidatesPerProof() { return maxCandidatesPerProof; }
    public int maxFragmentSize() { return maxFragmentSize; }
    public String labelPrefix() { return labelPrefix; }
    public int threads() { return threads; }
    public Duration logInterval() { return logInterval; }

    /** Fewest steps in a candidate, counting the hypothesis steps a ranking names; at least 2. */
    public RefactorSettings setMinSize(int minSize) {
        if (minSize < 2) throw new IllegalArgumentException("minimum candidate size must be at least 2");
        this.minSize = minSize;
        return this;
    }

    /** Most citation steps in a candidate proposed by structural search. */
    public RefactorSettings setMaxSize(int maxSize) {
        if (maxSize < 2) throw new IllegalArgumentException("maximum candidate size must be at least 2");
        this.maxSize = maxSize;
        return this;
    }

    public RefactorSettings setMaxCandidatesPerProof(int n) {
        if (n < 1) throw new IllegalArgumentException("candidate limit must be positive");
        this.maxCandidatesPerProof = n;
        return this;
    }

    /** Most citation steps in a fragment replaced by one citation of a new theorem. */
    public RefactorSettings setMaxFragmentSize(int maxFragmentSize) {
        if (maxFragmentSize < 2) throw new IllegalArgumentException("maximum fragment size must be at least 2");
        this.maxFragmentSize = maxFragmentSize;
        return this;
    }

    public RefactorSettings setLabelPrefix(String labelPrefix) {
        if (labelPrefix.isEmpty() || !labelPrefix.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("bad label prefix '" + labelPrefix + "'");
        }
        this.labelPrefix = labelPrefix;
        return this;
    }

    public RefactorSettings setThreads(int threads) {
        if (threads < 1) throw new IllegalArgumentException("need at least one thread");
        this.threads = threads;
        return this;
    }

    public RefactorSettings setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }
}
