package io.hearthwarrio.selectorium.core;

import java.util.List;

/**
 * Produces scored selector candidates for a fingerprint.
 * Implementations must be deterministic and free of hidden state.
 */
@FunctionalInterface
public interface CandidateGenerator {
    /**
     * Generate every applicable candidate for the given fingerprint, unsorted and unprobed.
     *
     * @param fingerprint captured element (must not be null)
     * @return candidates in generation order; empty when no attribute is usable
     */
    List<SelectorCandidate> generate(ElementFingerprint fingerprint);
}
