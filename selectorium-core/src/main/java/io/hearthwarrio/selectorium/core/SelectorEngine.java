package io.hearthwarrio.selectorium.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the selector engine.
 * <p>
 * Typical flow against a live page:
 * <ol>
 *   <li>run {@link #getWalkerSource()} in the page and map the result to fingerprints</li>
 *   <li>run {@link #buildProbeScript(List)} in the page to obtain match counts</li>
 *   <li>call {@link #resolveAll(List, Map)} (or {@link #resolveSelector} per element)</li>
 * </ol>
 * Instances are immutable and thread-safe as long as the injected generator and resolver are.
 */
public final class SelectorEngine {

    private final CandidateGenerator generator;
    private final UniquenessResolver resolver;
    private final ProbeScriptBuilder probeScriptBuilder;
    private final FastCssResolver fastCssResolver = new FastCssResolver();

    public SelectorEngine() {
        this(new DefaultCandidateGenerator());
    }

    public SelectorEngine(CandidateGenerator generator) {
        this(generator, new DefaultUniquenessResolver(generator));
    }

    public SelectorEngine(CandidateGenerator generator, UniquenessResolver resolver) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.probeScriptBuilder = new ProbeScriptBuilder(generator);
    }

    public CandidateGenerator getGenerator() {
        return generator;
    }

    public UniquenessResolver getResolver() {
        return resolver;
    }

    public SelectorDescriptor resolveSelector(ElementFingerprint fingerprint, Map<String, Integer> matchCounts) {
        return resolveSelector(fingerprint, matchCounts, ResolveOptions.none());
    }

    public SelectorDescriptor resolveSelector(
            ElementFingerprint fingerprint,
            Map<String, Integer> matchCounts,
            ResolveOptions options
    ) {
        return resolver.resolve(fingerprint, matchCounts, options);
    }

    /**
     * Resolves every fingerprint of a snapshot, using the snapshot itself for parent scoping.
     *
     * @param fingerprints snapshot elements (must not be null)
     * @param matchCounts  probe result (must not be null)
     * @return ref to descriptor, in input order; fingerprints without a ref or with a duplicate ref are skipped
     */
    public Map<String, SelectorDescriptor> resolveAll(
            List<ElementFingerprint> fingerprints,
            Map<String, Integer> matchCounts
    ) {
        Objects.requireNonNull(fingerprints, "fingerprints must not be null");
        Objects.requireNonNull(matchCounts, "matchCounts must not be null");

        ResolveOptions options = ResolveOptions.withAncestors(AncestorLookup.of(fingerprints));
        Map<String, SelectorDescriptor> out = new LinkedHashMap<>();
        for (ElementFingerprint f : fingerprints) {
            Objects.requireNonNull(f, "fingerprint must not be null");
            if (f.getRef().isEmpty() || out.containsKey(f.getRef())) {
                continue;
            }
            out.put(f.getRef(), resolver.resolve(f, matchCounts, options));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * @param fingerprint element (may be null)
     * @return CSS selector or {@code null}
     */
    public String resolveFastCssSelector(ElementFingerprint fingerprint) {
        return fastCssResolver.resolve(fingerprint);
    }

    public String buildProbeScript(List<ElementFingerprint> fingerprints) {
        return probeScriptBuilder.build(fingerprints);
    }

    public String getWalkerSource() {
        return FingerprintWalker.source();
    }

    /**
     * Unranked, unprobed candidates, for inspection.
     */
    public List<SelectorCandidate> generateCandidates(ElementFingerprint fingerprint) {
        return generator.generate(fingerprint);
    }
}
