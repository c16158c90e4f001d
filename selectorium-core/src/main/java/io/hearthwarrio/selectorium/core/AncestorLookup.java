package io.hearthwarrio.selectorium.core;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a ref (usually {@link ElementFingerprint#getParentRef()}) to a fingerprint of the same snapshot.
 */
@FunctionalInterface
public interface AncestorLookup {

    /**
     * @param ref element ref (never null)
     * @return fingerprint or {@code null} if the ref is not known
     */
    ElementFingerprint find(String ref);

    /**
     * Lookup that knows no element.
     */
    static AncestorLookup none() {
        return ref -> null;
    }

    /**
     * Lookup over a snapshot. Fingerprints without a ref are ignored; for duplicate refs the first one wins.
     *
     * @param fingerprints snapshot elements (must not be null)
     * @return immutable lookup
     */
    static AncestorLookup of(Collection<ElementFingerprint> fingerprints) {
        Objects.requireNonNull(fingerprints, "fingerprints must not be null");
        Map<String, ElementFingerprint> byRef = new LinkedHashMap<>();
        for (ElementFingerprint f : fingerprints) {
            if (f != null && !f.getRef().isEmpty()) {
                byRef.putIfAbsent(f.getRef(), f);
            }
        }
        Map<String, ElementFingerprint> copy = Map.copyOf(byRef);
        return copy::get;
    }
}
