package io.hearthwarrio.selectorium.core;

/**
 * Builds a compound locator when no single-attribute candidate is unique.
 * <p>
 * Strategies are tried in {@link #order()} sequence (ascending); the first one that returns a candidate wins.
 * A strategy must not throw for a well-formed fingerprint: return {@code null} when not applicable.
 */
public interface CompositeStrategy {

    /**
     * Stable identifier used in diagnostics and for deduplication.
     *
     * @return strategy identifier
     */
    default String id() {
        return getClass().getSimpleName();
    }

    /**
     * Lower values run earlier.
     *
     * @return order value
     */
    default int order() {
        return 0;
    }

    /**
     * @param fingerprint element being resolved
     * @param best        highest-ranked raw candidate (not unique)
     * @param options     resolution options
     * @return composed candidate or {@code null}
     */
    SelectorCandidate attempt(ElementFingerprint fingerprint, SelectorCandidate best, ResolveOptions options);
}
