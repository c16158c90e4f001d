package io.hearthwarrio.selectorium.webdriver;

import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One captured page: fingerprints, live match counts and the resolved selector of every ref.
 * Immutable.
 */
public final class PageSnapshot {

    private final String url;
    private final List<ElementFingerprint> fingerprints;
    private final Map<String, ElementFingerprint> byRef;
    private final Map<String, Integer> matchCounts;
    private final Map<String, SelectorDescriptor> descriptors;
    private final boolean probed;

    public PageSnapshot(
            String url,
            List<ElementFingerprint> fingerprints,
            Map<String, Integer> matchCounts,
            Map<String, SelectorDescriptor> descriptors,
            boolean probed
    ) {
        this.url = url == null ? "" : url;
        this.fingerprints = List.copyOf(Objects.requireNonNull(fingerprints, "fingerprints must not be null"));
        this.matchCounts = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(matchCounts, "matchCounts must not be null")));
        this.descriptors = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(descriptors, "descriptors must not be null")));
        this.probed = probed;

        Map<String, ElementFingerprint> refs = new LinkedHashMap<>();
        for (ElementFingerprint f : this.fingerprints) {
            refs.putIfAbsent(f.getRef(), f);
        }
        this.byRef = Collections.unmodifiableMap(refs);
    }

    public String getUrl() {
        return url;
    }

    public List<ElementFingerprint> getFingerprints() {
        return fingerprints;
    }

    /**
     * @return fingerprint for the ref, or {@code null}
     */
    public ElementFingerprint getFingerprint(String ref) {
        return byRef.get(ref);
    }

    /**
     * @return descriptor for the ref, or {@code null}
     */
    public SelectorDescriptor getDescriptor(String ref) {
        return descriptors.get(ref);
    }

    public Map<String, SelectorDescriptor> getDescriptors() {
        return descriptors;
    }

    public Map<String, Integer> getMatchCounts() {
        return matchCounts;
    }

    /**
     * Refs in document order.
     */
    public Set<String> refs() {
        return descriptors.keySet();
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * {@code false} when match counting failed: no descriptor of this snapshot is unique.
     */
    public boolean isProbed() {
        return probed;
    }

    @Override
    public String toString() {
        return "PageSnapshot{" +
                "url='" + url + '\'' +
                ", elements=" + descriptors.size() +
                ", selectors=" + matchCounts.size() +
                ", probed=" + probed +
                '}';
    }
}
