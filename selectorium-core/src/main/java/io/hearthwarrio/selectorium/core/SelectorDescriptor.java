package io.hearthwarrio.selectorium.core;

import java.util.Objects;

/**
 * Result of resolving a stable selector for one fingerprint.
 * <p>
 * A descriptor is always produced, even when uniqueness could not be established: check {@link #isUnique()}
 * before treating {@link #getPrimary()} as an exact address.
 */
public final class SelectorDescriptor {

    private final String primary;
    private final String fallback;
    private final String composite;
    private final String strategy;
    private final CandidateType candidateType;
    private final int stabilityScore;
    private final boolean unique;
    private final int matchCount;
    private final String cssSelector;

    public SelectorDescriptor(
            String primary,
            String fallback,
            String composite,
            String strategy,
            CandidateType candidateType,
            int stabilityScore,
            boolean unique,
            int matchCount,
            String cssSelector
    ) {
        this.primary = Objects.requireNonNull(primary, "primary must not be null");
        this.fallback = fallback;
        this.composite = composite;
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.candidateType = Objects.requireNonNull(candidateType, "candidateType must not be null");
        this.stabilityScore = stabilityScore;
        this.unique = unique;
        this.matchCount = matchCount;
        this.cssSelector = cssSelector;
    }

    /**
     * Best locator expression.
     */
    public String getPrimary() {
        return primary;
    }

    /**
     * Second-best locator (diagnostic), or {@code null}.
     */
    public String getFallback() {
        return fallback;
    }

    /**
     * Composite locator when a composite strategy produced the primary, otherwise {@code null}.
     */
    public String getComposite() {
        return composite;
    }

    public String getStrategy() {
        return strategy;
    }

    public CandidateType getCandidateType() {
        return candidateType;
    }

    public int getStabilityScore() {
        return stabilityScore;
    }

    public boolean isUnique() {
        return unique;
    }

    public int getMatchCount() {
        return matchCount;
    }

    /**
     * Plain CSS selector for direct interaction, or {@code null} if none is derivable.
     */
    public String getCssSelector() {
        return cssSelector;
    }

    @Override
    public String toString() {
        return "SelectorDescriptor{" +
                "primary='" + primary + '\'' +
                ", fallback='" + fallback + '\'' +
                ", composite='" + composite + '\'' +
                ", strategy='" + strategy + '\'' +
                ", stabilityScore=" + stabilityScore +
                ", unique=" + unique +
                ", matchCount=" + matchCount +
                ", cssSelector='" + cssSelector + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorDescriptor)) return false;
        SelectorDescriptor that = (SelectorDescriptor) o;
        return stabilityScore == that.stabilityScore &&
                unique == that.unique &&
                matchCount == that.matchCount &&
                candidateType == that.candidateType &&
                Objects.equals(primary, that.primary) &&
                Objects.equals(fallback, that.fallback) &&
                Objects.equals(composite, that.composite) &&
                Objects.equals(strategy, that.strategy) &&
                Objects.equals(cssSelector, that.cssSelector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primary, fallback, composite, strategy, candidateType,
                stabilityScore, unique, matchCount, cssSelector);
    }
}
