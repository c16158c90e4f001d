package io.hearthwarrio.selectorium.core;

import java.util.Objects;

/**
 * Optional inputs of a single resolution.
 */
public final class ResolveOptions {

    private static final ResolveOptions NONE = new ResolveOptions(AncestorLookup.none());

    private final AncestorLookup ancestors;

    private ResolveOptions(AncestorLookup ancestors) {
        this.ancestors = ancestors;
    }

    /**
     * Options without an ancestor lookup: parent scoping is skipped.
     */
    public static ResolveOptions none() {
        return NONE;
    }

    public static ResolveOptions withAncestors(AncestorLookup ancestors) {
        return new ResolveOptions(Objects.requireNonNull(ancestors, "ancestors must not be null"));
    }

    public AncestorLookup getAncestors() {
        return ancestors;
    }

    /**
     * Finds the parent of a fingerprint.
     *
     * @return parent fingerprint or {@code null} if it has no parent ref or the ref is unknown
     */
    public ElementFingerprint findParent(ElementFingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        String parentRef = fingerprint.getParentRef();
        if (parentRef.isEmpty()) {
            return null;
        }
        return ancestors.find(parentRef);
    }

    @Override
    public String toString() {
        return "ResolveOptions{" + (this == NONE ? "none" : "ancestors") + '}';
    }
}
