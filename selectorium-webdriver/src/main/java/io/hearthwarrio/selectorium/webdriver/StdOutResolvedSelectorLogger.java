package io.hearthwarrio.selectorium.webdriver;

import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Default stdout logger for resolved selectors.
 */
public final class StdOutResolvedSelectorLogger implements ResolvedSelectorLogger {

    static final String PREFIX = "[Selectorium]";

    private final SelectorLogDetail detail;
    private final PrintStream out;

    public StdOutResolvedSelectorLogger(SelectorLogDetail detail) {
        this(detail, System.out);
    }

    StdOutResolvedSelectorLogger(SelectorLogDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public SelectorLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedSelector(String ref, ElementFingerprint fingerprint, SelectorDescriptor descriptor) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(PREFIX).append(" ref='").append(safe(ref)).append('\'')
                .append(", strategy=").append(descriptor.getStrategy())
                .append(", score=").append(descriptor.getStabilityScore())
                .append(", unique=").append(descriptor.isUnique());

        if (detail == SelectorLogDetail.LOCATOR_ONLY || detail == SelectorLogDetail.BOTH) {
            sb.append(", locator=").append(descriptor.getPrimary());
        }
        if (detail == SelectorLogDetail.CSS_ONLY || detail == SelectorLogDetail.BOTH) {
            sb.append(", css=").append(nullSafe(descriptor.getCssSelector()));
        }

        if (fingerprint != null) {
            sb.append(", tag=").append(fingerprint.getTagName());
        }

        out.println(sb);
    }

    @Override
    public void probeFailed(String message) {
        out.println(PREFIX + " match counting failed, selectors are unverified: " + safe(message));
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private static String nullSafe(String s) {
        return s == null ? "null" : s;
    }
}
