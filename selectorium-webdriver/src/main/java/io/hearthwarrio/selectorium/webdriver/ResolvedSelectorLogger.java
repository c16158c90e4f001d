package io.hearthwarrio.selectorium.webdriver;

import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;

/**
 * Receives information about selectors resolved for a page snapshot.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface ResolvedSelectorLogger {

    /**
     * Called once per captured element after resolution.
     *
     * @param ref         element ref assigned by the walker
     * @param fingerprint captured element
     * @param descriptor  resolved selector
     */
    void logResolvedSelector(String ref, ElementFingerprint fingerprint, SelectorDescriptor descriptor);

    /**
     * Declares how much selector info this logger wants.
     */
    default SelectorLogDetail detail() {
        return SelectorLogDetail.BOTH;
    }

    /**
     * Called when live match counting failed and the snapshot was resolved without counts.
     * Ignored by default.
     *
     * @param message failure description
     */
    default void probeFailed(String message) {
    }
}
