package io.hearthwarrio.selectorium.webdriver;

/**
 * Controls which selector data should be logged for a resolved element.
 */
public enum SelectorLogDetail {

    /**
     * Log only ref, strategy and score.
     */
    NONE,

    /**
     * Log the primary locator expression.
     */
    LOCATOR_ONLY,

    /**
     * Log only the plain CSS selector.
     */
    CSS_ONLY,

    /**
     * Log both the locator expression and the CSS selector.
     */
    BOTH
}
