package io.hearthwarrio.selectorium.core;

/**
 * Kinds of selector candidates.
 * <p>
 * Generated kinds carry a fixed base stability score. Declaration order is the tie-break between candidates
 * of equal score: an earlier constant wins.
 * Composed kinds ({@link #PARENT_SCOPED}, {@link #FILTERED}, {@link #NTH}, {@link #TAG_NTH_FALLBACK})
 * derive their score from the candidates they wrap and report {@code 0} as base score.
 */
public enum CandidateType {
    TEST_ID(10, "data-testid"),
    TEST_ID_ALT(10, "data-test-id"),
    QA_ID(10, "data-qa"),
    ROLE_NAME(9, "role+name"),
    ID(8, "id"),
    ROLE_NAME_PATTERN(7, "role+name-regex"),
    ARIA_LABEL(7, "aria-label"),
    LABEL(6, "label"),
    PLACEHOLDER(6, "placeholder"),
    ALT_TEXT(6, "alt-text"),
    TITLE(5, "title"),
    NAME(5, "name-attr"),
    TEXT(4, "text-content"),
    HREF(3, "href"),

    PARENT_SCOPED(0, "composite"),
    FILTERED(0, "filtered"),
    NTH(0, "nth"),
    TAG_NTH_FALLBACK(0, "tag-nth-fallback");

    private final int baseScore;
    private final String strategyName;

    CandidateType(int baseScore, String strategyName) {
        this.baseScore = baseScore;
        this.strategyName = strategyName;
    }

    public int baseScore() {
        return baseScore;
    }

    /**
     * Default strategy name reported in {@link SelectorDescriptor#getStrategy()}.
     */
    public String strategyName() {
        return strategyName;
    }

    public boolean isComposed() {
        return baseScore == 0;
    }
}
