package io.hearthwarrio.selectorium.core.composite;

import io.hearthwarrio.selectorium.core.CandidateType;
import io.hearthwarrio.selectorium.core.CompositeStrategy;
import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.ResolveOptions;
import io.hearthwarrio.selectorium.core.SelectorCandidate;
import io.hearthwarrio.selectorium.core.StabilityHeuristics;

import java.util.Objects;

import static io.hearthwarrio.selectorium.core.SelectorLiterals.quoted;

/**
 * Narrows the best candidate by the element's visible text: {@code best.filter({ hasText: 'Save' })}.
 */
public final class TextFilterStrategy implements CompositeStrategy {

    public static final int MAX_FILTER_TEXT_LENGTH = 60;

    @Override
    public int order() {
        return 200;
    }

    @Override
    public SelectorCandidate attempt(ElementFingerprint fingerprint, SelectorCandidate best, ResolveOptions options) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(best, "best must not be null");

        String text = fingerprint.getText();
        if (text.isEmpty() || text.length() > MAX_FILTER_TEXT_LENGTH || StabilityHeuristics.isDynamicText(text)) {
            return null;
        }

        return new SelectorCandidate(
                CandidateType.FILTERED,
                null,
                best.getLocator() + ".filter({ hasText: '" + quoted(text) + "' })",
                null,
                best.getScore() - 1,
                "filtered:" + best.getStrategy() + "+text"
        );
    }
}
