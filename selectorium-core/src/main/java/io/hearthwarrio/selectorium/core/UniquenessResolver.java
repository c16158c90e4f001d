package io.hearthwarrio.selectorium.core;

import java.util.Map;

/**
 * Chooses the best selector for a fingerprint given live match counts.
 */
public interface UniquenessResolver {

    /**
     * Resolve a selector descriptor. Never fails for a well-formed fingerprint: when nothing is unique the
     * descriptor says so through {@link SelectorDescriptor#isUnique()}.
     *
     * @param fingerprint element to resolve (must not be null)
     * @param matchCounts selector to live match count; {@code -1} marks a selector the page rejected (must not be null)
     * @param options     resolution options (must not be null)
     * @return descriptor
     */
    SelectorDescriptor resolve(ElementFingerprint fingerprint, Map<String, Integer> matchCounts, ResolveOptions options);
}
