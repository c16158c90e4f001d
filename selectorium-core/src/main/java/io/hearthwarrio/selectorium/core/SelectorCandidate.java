package io.hearthwarrio.selectorium.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * A generated, scored, not-yet-validated selector guess for one fingerprint.
 * <p>
 * Instances are immutable. Attaching a probe result creates a copy via {@link #withMatchCount(int)}.
 */
public final class SelectorCandidate {

    /**
     * Match count of a candidate that was never probed, or whose selector failed to parse.
     */
    public static final int NOT_PROBED = -1;

    /**
     * Ranking order: higher score first, ties broken by {@link CandidateType} declaration order.
     * Used with a stable sort, equal candidates keep their generation order.
     */
    public static final Comparator<SelectorCandidate> BY_STABILITY =
            Comparator.comparingInt(SelectorCandidate::getScore).reversed()
                    .thenComparing(SelectorCandidate::getType);

    private final CandidateType type;
    private final String selector;
    private final String locator;
    private final String chainedLocator;
    private final String cssSelector;
    private final int score;
    private final String strategy;
    private final int matchCount;

    public SelectorCandidate(
            CandidateType type,
            String selector,
            String locator,
            String cssSelector,
            int score,
            String strategy
    ) {
        this(type, selector, locator, null, cssSelector, score, strategy, NOT_PROBED);
    }

    public SelectorCandidate(
            CandidateType type,
            String selector,
            String locator,
            String chainedLocator,
            String cssSelector,
            int score,
            String strategy,
            int matchCount
    ) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.selector = selector;
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.chainedLocator = chainedLocator;
        this.cssSelector = cssSelector;
        this.score = score;
        this.strategy = strategy == null ? type.strategyName() : strategy;
        this.matchCount = matchCount;
    }

    public CandidateType getType() {
        return type;
    }

    /**
     * Key used to look up live match counts; {@code null} for composed candidates.
     */
    public String getSelector() {
        return selector;
    }

    /**
     * Playwright-style locator expression, e.g. {@code page.getByTestId('login')}.
     */
    public String getLocator() {
        return locator;
    }

    /**
     * Chained locator form of a parent-scoped candidate, {@code null} otherwise.
     */
    public String getChainedLocator() {
        return chainedLocator;
    }

    /**
     * Plain CSS equivalent, or {@code null} when the candidate cannot be expressed in CSS.
     */
    public String getCssSelector() {
        return cssSelector;
    }

    public boolean hasCssSelector() {
        return cssSelector != null && !cssSelector.isEmpty();
    }

    /**
     * Stability score in range 1..10.
     */
    public int getScore() {
        return score;
    }

    public String getStrategy() {
        return strategy;
    }

    public int getMatchCount() {
        return matchCount;
    }

    public boolean isUnique() {
        return matchCount == 1;
    }

    /**
     * Returns a copy carrying the given live match count.
     *
     * @param count observed match count, {@link #NOT_PROBED} for unknown or invalid
     * @return probed copy
     */
    public SelectorCandidate withMatchCount(int count) {
        return new SelectorCandidate(type, selector, locator, chainedLocator, cssSelector, score, strategy, count);
    }

    @Override
    public String toString() {
        return "SelectorCandidate{" +
                "type=" + type +
                ", strategy='" + strategy + '\'' +
                ", score=" + score +
                ", selector='" + selector + '\'' +
                ", locator='" + locator + '\'' +
                ", cssSelector='" + cssSelector + '\'' +
                ", matchCount=" + matchCount +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorCandidate)) return false;
        SelectorCandidate that = (SelectorCandidate) o;
        return score == that.score &&
                matchCount == that.matchCount &&
                type == that.type &&
                Objects.equals(selector, that.selector) &&
                Objects.equals(locator, that.locator) &&
                Objects.equals(chainedLocator, that.chainedLocator) &&
                Objects.equals(cssSelector, that.cssSelector) &&
                Objects.equals(strategy, that.strategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, selector, locator, chainedLocator, cssSelector, score, strategy, matchCount);
    }
}
