package io.hearthwarrio.selectorium.core.composite;

import io.hearthwarrio.selectorium.core.CandidateType;
import io.hearthwarrio.selectorium.core.CompositeStrategy;
import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.ResolveOptions;
import io.hearthwarrio.selectorium.core.SelectorCandidate;

import java.util.Objects;

/**
 * Last resort: picks the element by its position among same-tag siblings, {@code best.nth(2)}.
 * Skipped when the position was not captured.
 */
public final class IndexDisambiguationStrategy implements CompositeStrategy {

    private static final int PENALTY = 3;

    @Override
    public int order() {
        return 300;
    }

    @Override
    public SelectorCandidate attempt(ElementFingerprint fingerprint, SelectorCandidate best, ResolveOptions options) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(best, "best must not be null");

        if (!fingerprint.hasNthIndex()) {
            return null;
        }
        int index = fingerprint.getNthIndex();

        return new SelectorCandidate(
                CandidateType.NTH,
                null,
                best.getLocator() + ".nth(" + index + ")",
                null,
                Math.max(1, best.getScore() - PENALTY),
                "nth:" + best.getStrategy() + "[" + index + "]"
        );
    }
}
