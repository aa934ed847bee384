package net.littleredcomputer.refactor;

import java.util.Set;
import java.util.stream.Stream;

/**
 * Proposes sets of proof step indices of a theorem that may be worth
 * extracting as theorems of their own, best first.
 */
public interface CandidateOracle {
    Stream<Set<Integer>> rankCandidates(ProofGraph proof);
}
