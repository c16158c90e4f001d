package io.hearthwarrio.selectorium.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.hearthwarrio.selectorium.core.SelectorLiterals.quoted;

/**
 * Default resolver.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>generate candidates; none at all gives a degraded {@code tag.nth(i)} descriptor</li>
 *   <li>rank by {@link SelectorCandidate#BY_STABILITY}</li>
 *   <li>scan: the first candidate with exactly one live match is primary, the first other one is fallback</li>
 *   <li>nothing unique: try composite strategies, first success wins; otherwise keep the best non-unique</li>
 * </ol>
 */
public class DefaultUniquenessResolver implements UniquenessResolver {

    private static final String DEFAULT_TAG = "div";

    private final CandidateGenerator generator;
    private final List<CompositeStrategy> strategies;

    public DefaultUniquenessResolver() {
        this(new DefaultCandidateGenerator());
    }

    public DefaultUniquenessResolver(CandidateGenerator generator) {
        this(generator, CompositeStrategies.defaults(generator));
    }

    public DefaultUniquenessResolver(CandidateGenerator generator, List<? extends CompositeStrategy> strategies) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.strategies = CompositeStrategies.normalize(strategies);
    }

    public CandidateGenerator getGenerator() {
        return generator;
    }

    /**
     * Composite strategies in application order.
     */
    public List<CompositeStrategy> getStrategies() {
        return strategies;
    }

    /**
     * Copy of this resolver with a different composite chain.
     */
    public DefaultUniquenessResolver withStrategies(List<? extends CompositeStrategy> strategies) {
        return new DefaultUniquenessResolver(generator, strategies);
    }

    @Override
    public SelectorDescriptor resolve(
            ElementFingerprint fingerprint,
            Map<String, Integer> matchCounts,
            ResolveOptions options
    ) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(matchCounts, "matchCounts must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<SelectorCandidate> candidates = new ArrayList<>(generator.generate(fingerprint));
        if (candidates.isEmpty()) {
            return degraded(fingerprint);
        }

        candidates.sort(SelectorCandidate.BY_STABILITY);

        List<SelectorCandidate> probed = new ArrayList<>(candidates.size());
        for (SelectorCandidate c : candidates) {
            probed.add(c.withMatchCount(countOf(c, matchCounts)));
        }

        SelectorCandidate primary = null;
        SelectorCandidate fallback = null;
        for (SelectorCandidate c : probed) {
            if (primary == null && c.isUnique()) {
                primary = c;
            } else if (fallback == null) {
                fallback = c;
            }
            if (primary != null && fallback != null) {
                break;
            }
        }

        SelectorCandidate best = probed.get(0);

        if (primary != null) {
            return describe(primary, fallback, null, best);
        }

        for (CompositeStrategy strategy : strategies) {
            SelectorCandidate composed = strategy.attempt(fingerprint, best, options);
            if (composed != null) {
                return describe(composed, best, composed, best);
            }
        }

        SelectorCandidate next = probed.size() > 1 ? probed.get(1) : null;
        return describe(best, next, null, best);
    }

    private SelectorDescriptor describe(
            SelectorCandidate primary,
            SelectorCandidate fallback,
            SelectorCandidate composite,
            SelectorCandidate best
    ) {
        String compositeLocator = null;
        if (composite != null) {
            compositeLocator = composite.getChainedLocator() != null
                    ? composite.getChainedLocator()
                    : composite.getLocator();
        }
        String css = primary.hasCssSelector() ? primary.getCssSelector() : best.getCssSelector();

        return new SelectorDescriptor(
                primary.getLocator(),
                fallback == null ? null : fallback.getLocator(),
                compositeLocator,
                primary.getStrategy(),
                primary.getType(),
                primary.getScore(),
                primary.isUnique(),
                primary.getMatchCount(),
                css
        );
    }

    private SelectorDescriptor degraded(ElementFingerprint fingerprint) {
        String tag = fingerprint.getTagName().isEmpty() ? DEFAULT_TAG : fingerprint.getTagName();
        int index = fingerprint.hasNthIndex() ? fingerprint.getNthIndex() : 0;
        return new SelectorDescriptor(
                "page.locator('" + quoted(tag) + "').nth(" + index + ")",
                null,
                null,
                CandidateType.TAG_NTH_FALLBACK.strategyName(),
                CandidateType.TAG_NTH_FALLBACK,
                1,
                false,
                SelectorCandidate.NOT_PROBED,
                tag
        );
    }

    private static int countOf(SelectorCandidate candidate, Map<String, Integer> matchCounts) {
        Integer count = null;
        if (candidate.getSelector() != null) {
            count = matchCounts.get(candidate.getSelector());
        }
        if (count == null && candidate.getCssSelector() != null) {
            count = matchCounts.get(candidate.getCssSelector());
        }
        return count == null ? SelectorCandidate.NOT_PROBED : count;
    }
}
