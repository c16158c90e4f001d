package io.hearthwarrio.selectorium.core;

import static io.hearthwarrio.selectorium.core.SelectorLiterals.cssAttr;
import static io.hearthwarrio.selectorium.core.SelectorLiterals.cssIdentifier;

/**
 * Single-pass CSS selector for an already captured element, without probing.
 * <p>
 * Priority: test id, stable id, aria-label, name, placeholder, title, short stable text,
 * {@code tag[role="r"]}, bare tag.
 */
public final class FastCssResolver {

    private static final int MAX_TEXT_LENGTH = 80;

    /**
     * @param f fingerprint (may be null)
     * @return CSS selector, or {@code null} when the fingerprint is null or has no tag
     */
    public String resolve(ElementFingerprint f) {
        if (f == null) {
            return null;
        }
        if (!f.getDataTestId().isEmpty()) {
            return "[data-testid=\"" + cssAttr(f.getDataTestId()) + "\"]";
        }
        if (!StabilityHeuristics.isDynamicId(f.getId())) {
            return "#" + cssIdentifier(f.getId());
        }
        if (!f.getAriaLabel().isEmpty()) {
            return "[aria-label=\"" + cssAttr(f.getAriaLabel()) + "\"]";
        }
        if (!f.getName().isEmpty()) {
            return "[name=\"" + cssAttr(f.getName()) + "\"]";
        }
        if (!f.getPlaceholder().isEmpty()) {
            return "[placeholder=\"" + cssAttr(f.getPlaceholder()) + "\"]";
        }
        if (!f.getTitle().isEmpty()) {
            return "[title=\"" + cssAttr(f.getTitle()) + "\"]";
        }
        String text = f.getText();
        if (!text.isEmpty() && text.length() <= MAX_TEXT_LENGTH && !StabilityHeuristics.isDynamicText(text)) {
            return "text=\"" + cssAttr(text) + "\"";
        }
        String tag = f.getTagName();
        if (!f.getRole().isEmpty() && !tag.isEmpty()) {
            return tag + "[role=\"" + cssAttr(f.getRole()) + "\"]";
        }
        return tag.isEmpty() ? null : tag;
    }
}
