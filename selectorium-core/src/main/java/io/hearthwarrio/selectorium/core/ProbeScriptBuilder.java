package io.hearthwarrio.selectorium.core;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the in-page script that counts live matches of every candidate CSS selector.
 * <p>
 * The script evaluates to an object {@code {selector: count}}; selectors that {@code querySelectorAll}
 * rejects are reported as {@code -1}.
 */
public final class ProbeScriptBuilder {

    private final CandidateGenerator generator;

    public ProbeScriptBuilder(CandidateGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Distinct CSS selectors of all candidates of all fingerprints, in first-seen order.
     */
    public Set<String> collectSelectors(List<ElementFingerprint> fingerprints) {
        Objects.requireNonNull(fingerprints, "fingerprints must not be null");
        Set<String> selectors = new LinkedHashSet<>();
        for (ElementFingerprint f : fingerprints) {
            Objects.requireNonNull(f, "fingerprint must not be null");
            for (SelectorCandidate c : generator.generate(f)) {
                if (c.hasCssSelector()) {
                    selectors.add(c.getCssSelector());
                }
            }
        }
        return selectors;
    }

    public String build(List<ElementFingerprint> fingerprints) {
        Set<String> selectors = collectSelectors(fingerprints);

        StringBuilder array = new StringBuilder("[");
        boolean first = true;
        for (String s : selectors) {
            if (!first) {
                array.append(", ");
            }
            array.append(SelectorLiterals.jsString(s));
            first = false;
        }
        array.append(']');

        return "(function () {\n"
                + "    var selectors = " + array + ";\n"
                + "    var counts = {};\n"
                + "    for (var i = 0; i < selectors.length; i++) {\n"
                + "        var sel = selectors[i];\n"
                + "        try {\n"
                + "            counts[sel] = document.querySelectorAll(sel).length;\n"
                + "        } catch (e) {\n"
                + "            counts[sel] = -1;\n"
                + "        }\n"
                + "    }\n"
                + "    return counts;\n"
                + "})()";
    }
}
