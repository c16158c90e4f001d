package io.hearthwarrio.selectorium.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.hearthwarrio.selectorium.core.SelectorLiterals.cssAttr;
import static io.hearthwarrio.selectorium.core.SelectorLiterals.cssIdentifier;
import static io.hearthwarrio.selectorium.core.SelectorLiterals.quoted;
import static io.hearthwarrio.selectorium.core.SelectorLiterals.regex;

/**
 * Default candidate generator.
 * <p>
 * Candidates are emitted from the most to the least durable source attribute:
 * <ol>
 *   <li>test/qa hooks ({@code data-testid}, {@code data-test-id}, {@code data-qa}) - 10</li>
 *   <li>explicit role + stable accessible name - 9</li>
 *   <li>non-dynamic HTML id - 8</li>
 *   <li>explicit role + partially dynamic name (substring match) - 7</li>
 *   <li>aria-label - 7</li>
 *   <li>associated label, placeholder, alt - 6</li>
 *   <li>title, name - 5</li>
 *   <li>short exact visible text - 4</li>
 *   <li>link path - 3</li>
 * </ol>
 * Text-bearing attributes are skipped when {@link StabilityHeuristics#isDynamicText(String)} rejects them.
 */
public class DefaultCandidateGenerator implements CandidateGenerator {

    private static final int MAX_TEXT_LENGTH = 80;
    private static final int MAX_HREF_LENGTH = 100;

    /**
     * Scheme and authority of an absolute URL; group 1 is the raw path, up to the query or fragment.
     */
    private static final Pattern ABSOLUTE_URL = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://[^/?#]*([^?#]*)");

    @Override
    public List<SelectorCandidate> generate(ElementFingerprint e) {
        Objects.requireNonNull(e, "fingerprint must not be null");

        List<SelectorCandidate> out = new ArrayList<>();

        addTestIds(e, out);
        addRoleName(e, out);
        addId(e, out);
        addRoleNamePattern(e, out);

        String aria = e.getAriaLabel();
        if (!StabilityHeuristics.isDynamicText(aria)) {
            String css = "[aria-label=\"" + cssAttr(aria) + "\"]";
            out.add(candidate(CandidateType.ARIA_LABEL, css, "page.locator('" + quoted(css) + "')", css));
        }

        String label = e.getAssociatedLabel();
        if (!StabilityHeuristics.isDynamicText(label)) {
            out.add(candidate(
                    CandidateType.LABEL,
                    "label:has-text(\"" + cssAttr(label) + "\") + " + tagOrAny(e),
                    "page.getByLabel('" + quoted(label) + "')",
                    null
            ));
        }

        addAttribute(e.getPlaceholder(), CandidateType.PLACEHOLDER, "placeholder", "getByPlaceholder", out);
        addAttribute(e.getAlt(), CandidateType.ALT_TEXT, "alt", "getByAltText", out);
        addAttribute(e.getTitle(), CandidateType.TITLE, "title", "getByTitle", out);

        String name = e.getName();
        if (!name.isEmpty()) {
            String css = "[name=\"" + cssAttr(name) + "\"]";
            out.add(candidate(CandidateType.NAME, css, "page.locator('" + quoted(css) + "')", css));
        }

        String text = e.getText();
        if (!text.isEmpty() && text.length() <= MAX_TEXT_LENGTH && !StabilityHeuristics.isDynamicText(text)) {
            out.add(candidate(
                    CandidateType.TEXT,
                    "text=\"" + cssAttr(text) + "\"",
                    "page.getByText('" + quoted(text) + "', { exact: true })",
                    null
            ));
        }

        addHref(e, out);

        return Collections.unmodifiableList(out);
    }

    private void addTestIds(ElementFingerprint e, List<SelectorCandidate> out) {
        String testId = e.getDataTestId();
        if (!testId.isEmpty()) {
            String css = "[data-testid=\"" + cssAttr(testId) + "\"]";
            out.add(candidate(CandidateType.TEST_ID, css, "page.getByTestId('" + quoted(testId) + "')", css));
        }

        String testIdAlt = e.getDataTestIdAlt();
        if (!testIdAlt.isEmpty()) {
            String css = "[data-test-id=\"" + cssAttr(testIdAlt) + "\"]";
            out.add(candidate(CandidateType.TEST_ID_ALT, css, "page.locator('" + quoted(css) + "')", css));
        }

        String qa = e.getDataQa();
        if (!qa.isEmpty()) {
            String css = "[data-qa=\"" + cssAttr(qa) + "\"]";
            out.add(candidate(CandidateType.QA_ID, css, "page.locator('" + quoted(css) + "')", css));
        }
    }

    private void addRoleName(ElementFingerprint e, List<SelectorCandidate> out) {
        String label = e.getComputedLabel();
        if (e.getRole().isEmpty() || label.isEmpty() || StabilityHeuristics.isDynamicText(label)) {
            return;
        }
        String role = roleOf(e);
        if (role == null) {
            return;
        }
        out.add(candidate(
                CandidateType.ROLE_NAME,
                "role=" + role + "[name=\"" + cssAttr(label) + "\"]",
                "page.getByRole('" + quoted(role) + "', { name: '" + quoted(label) + "' })",
                "[role=\"" + cssAttr(role) + "\"][aria-label=\"" + cssAttr(label) + "\"]"
        ));
    }

    private void addId(ElementFingerprint e, List<SelectorCandidate> out) {
        String id = e.getId();
        if (StabilityHeuristics.isDynamicId(id)) {
            return;
        }
        String css = "#" + cssIdentifier(id);
        out.add(candidate(CandidateType.ID, css, "page.locator('" + quoted(css) + "')", css));
    }

    private void addRoleNamePattern(ElementFingerprint e, List<SelectorCandidate> out) {
        String label = e.getComputedLabel();
        if (e.getRole().isEmpty() || label.isEmpty() || !StabilityHeuristics.isDynamicText(label)) {
            return;
        }
        String stablePart = StabilityHeuristics.extractStableTextPortion(label);
        String role = roleOf(e);
        if (stablePart == null || role == null) {
            return;
        }
        // no CSS equivalent for a substring name match
        out.add(candidate(
                CandidateType.ROLE_NAME_PATTERN,
                "role=" + role + "[name*=\"" + cssAttr(stablePart) + "\"]",
                "page.getByRole('" + quoted(role) + "', { name: /" + regex(stablePart) + "/i })",
                null
        ));
    }

    private void addAttribute(
            String value,
            CandidateType type,
            String attribute,
            String locatorMethod,
            List<SelectorCandidate> out
    ) {
        if (StabilityHeuristics.isDynamicText(value)) {
            return;
        }
        String css = "[" + attribute + "=\"" + cssAttr(value) + "\"]";
        out.add(candidate(type, css, "page." + locatorMethod + "('" + quoted(value) + "')", css));
    }

    private void addHref(ElementFingerprint e, List<SelectorCandidate> out) {
        String href = e.getHref();
        if (href.isEmpty() || !"a".equalsIgnoreCase(e.getTagName())) {
            return;
        }
        if (href.trim().toLowerCase(Locale.ROOT).startsWith("javascript:")) {
            return;
        }

        String path = absolutePath(href);
        if (path != null) {
            // path only: the same link must match across environments with different hosts
            if (path.isEmpty() || "/".equals(path) || path.length() >= MAX_HREF_LENGTH) {
                return;
            }
            String css = "a[href*=\"" + cssAttr(path) + "\"]";
            out.add(new SelectorCandidate(CandidateType.HREF, css, "page.locator('" + quoted(css) + "')",
                    css, CandidateType.HREF.baseScore(), "href-path"));
            return;
        }

        if (href.length() < MAX_HREF_LENGTH) {
            String css = "a[href=\"" + cssAttr(href) + "\"]";
            out.add(candidate(CandidateType.HREF, css, "page.locator('" + quoted(css) + "')", css));
        }
    }

    /**
     * @return raw path of an absolute URL, {@code null} for a relative href
     */
    private static String absolutePath(String href) {
        Matcher m = ABSOLUTE_URL.matcher(href.trim());
        return m.find() ? m.group(1) : null;
    }

    private String roleOf(ElementFingerprint e) {
        String role = StabilityHeuristics.mapAriaRole(e.getRole(), e.getTagName());
        if (role == null || "generic".equals(role)) {
            return null;
        }
        return role;
    }

    private String tagOrAny(ElementFingerprint e) {
        return e.getTagName().isEmpty() ? "*" : e.getTagName();
    }

    private SelectorCandidate candidate(CandidateType type, String selector, String locator, String css) {
        return new SelectorCandidate(type, selector, locator, css, type.baseScore(), type.strategyName());
    }
}
