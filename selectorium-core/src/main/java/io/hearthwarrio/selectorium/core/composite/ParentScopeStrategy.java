package io.hearthwarrio.selectorium.core.composite;

import io.hearthwarrio.selectorium.core.CandidateGenerator;
import io.hearthwarrio.selectorium.core.CandidateType;
import io.hearthwarrio.selectorium.core.CompositeStrategy;
import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.ResolveOptions;
import io.hearthwarrio.selectorium.core.SelectorCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.hearthwarrio.selectorium.core.SelectorLiterals.quoted;

/**
 * Scopes the best child candidate under the parent's best candidate:
 * {@code page.getByTestId('card').locator('[aria-label="Edit"]')}.
 * <p>
 * The parent must be known to the ancestor lookup and its best candidate must score at least
 * {@value #MIN_PARENT_SCORE}; the match count of the scoped locator is not known.
 */
public final class ParentScopeStrategy implements CompositeStrategy {

    public static final int MIN_PARENT_SCORE = 5;

    private static final String PAGE_PREFIX = "page.";

    private final CandidateGenerator generator;

    public ParentScopeStrategy(CandidateGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    @Override
    public int order() {
        return 100;
    }

    @Override
    public SelectorCandidate attempt(ElementFingerprint fingerprint, SelectorCandidate best, ResolveOptions options) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(best, "best must not be null");
        Objects.requireNonNull(options, "options must not be null");

        ElementFingerprint parent = options.findParent(fingerprint);
        if (parent == null) {
            return null;
        }

        List<SelectorCandidate> parentCandidates = new ArrayList<>(generator.generate(parent));
        if (parentCandidates.isEmpty()) {
            return null;
        }
        parentCandidates.sort(SelectorCandidate.BY_STABILITY);
        SelectorCandidate parentBest = parentCandidates.get(0);
        if (parentBest.getScore() < MIN_PARENT_SCORE) {
            return null;
        }

        String childSelector = best.hasCssSelector() ? best.getCssSelector() : best.getSelector();
        if (childSelector == null) {
            return null;
        }

        String childLocator = best.getLocator();
        if (childLocator.startsWith(PAGE_PREFIX)) {
            childLocator = childLocator.substring(PAGE_PREFIX.length());
        }

        return new SelectorCandidate(
                CandidateType.PARENT_SCOPED,
                null,
                parentBest.getLocator() + ".locator('" + quoted(childSelector) + "')",
                parentBest.getLocator() + "." + childLocator,
                null,
                Math.min(parentBest.getScore(), best.getScore()) - 1,
                "composite:" + parentBest.getStrategy() + ">" + best.getStrategy(),
                SelectorCandidate.NOT_PROBED
        );
    }
}
