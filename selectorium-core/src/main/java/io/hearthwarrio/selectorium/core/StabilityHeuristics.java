package io.hearthwarrio.selectorium.core;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Heuristics that decide whether an attribute value is likely to survive the next page load.
 * <p>
 * Ids produced by UI frameworks (React {@code :r0:}, MUI {@code mui-1234}, CSS-in-JS hashes, UUIDs) and texts that
 * embed dates, prices, counters or relative time are treated as dynamic and never used as exact selector anchors.
 */
public final class StabilityHeuristics {

    private static final int MAX_STABLE_TEXT_LENGTH = 200;
    private static final int MIN_STABLE_PORTION_LENGTH = 3;

    private static final List<Pattern> DYNAMIC_ID_PATTERNS = List.of(
            // UUID: 550e8400-e29b-...
            Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}"),
            // React / Next.js: ":r0:", "__next-route-announcer"
            Pattern.compile("^:r[0-9a-z]+:"),
            Pattern.compile("^__next"),
            // MUI, emotion, JSS, styled-components
            Pattern.compile("^(mui|css|jss|sc)-[a-z0-9]{4,}", Pattern.CASE_INSENSITIVE),
            // Radix UI
            Pattern.compile("^radix-")
    );

    private static final Pattern HEX_SUFFIX = Pattern.compile("[a-f0-9]{6,}$", Pattern.CASE_INSENSITIVE);
    private static final int HEX_SUFFIX_MIN_ID_LENGTH = 11;

    private static final Pattern DATE = Pattern.compile("\\d{1,2}[/\\-.]\\d{1,2}[/\\-.]\\d{2,4}");
    private static final Pattern TIME = Pattern.compile("\\d{1,2}:\\d{2}(:\\d{2})?");
    private static final Pattern RELATIVE_TIME = Pattern.compile(
            "\\d+\\s+(second|minute|hour|day|week|month|year)s?\\s+ago", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIVE_NOW = Pattern.compile("just now|a moment ago", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRICE = Pattern.compile("\\$[\\d,]+(\\.\\d{2})?");

    private static final List<Pattern> DYNAMIC_TEXT_PATTERNS = List.of(
            DATE,
            TIME,
            RELATIVE_TIME,
            RELATIVE_NOW,
            PRICE,
            Pattern.compile("\\d+\\s+(results?|items?|listings?|properties|matches|records)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("showing\\s+\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("page\\s+\\d+\\s+of\\s+\\d+", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d[\\d,]*\\s*");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("\\s*\\d[\\d,]*$");

    private static final Map<String, String> IMPLICIT_ROLES = Map.ofEntries(
            Map.entry("a", "link"),
            Map.entry("button", "button"),
            // refined by input type only in the page, not here
            Map.entry("input", "textbox"),
            Map.entry("select", "combobox"),
            Map.entry("textarea", "textbox"),
            Map.entry("img", "img"),
            Map.entry("nav", "navigation"),
            Map.entry("main", "main"),
            Map.entry("header", "banner"),
            Map.entry("footer", "contentinfo"),
            Map.entry("aside", "complementary"),
            Map.entry("form", "form"),
            Map.entry("table", "table"),
            Map.entry("tr", "row"),
            Map.entry("th", "columnheader"),
            Map.entry("td", "cell"),
            Map.entry("ul", "list"),
            Map.entry("ol", "list"),
            Map.entry("li", "listitem"),
            Map.entry("h1", "heading"),
            Map.entry("h2", "heading"),
            Map.entry("h3", "heading"),
            Map.entry("h4", "heading"),
            Map.entry("h5", "heading"),
            Map.entry("h6", "heading"),
            Map.entry("dialog", "dialog"),
            Map.entry("details", "group"),
            Map.entry("summary", "button"),
            Map.entry("progress", "progressbar"),
            Map.entry("meter", "meter"),
            Map.entry("output", "status")
    );

    private StabilityHeuristics() {
    }

    /**
     * Detects auto-generated ids that will change across page loads.
     *
     * @param id id attribute value (may be null)
     * @return {@code true} if the id is unusable as a stable anchor (null and empty included)
     */
    public static boolean isDynamicId(String id) {
        if (id == null || id.isEmpty()) {
            return true;
        }

        for (Pattern p : DYNAMIC_ID_PATTERNS) {
            if (p.matcher(id).find()) {
                return true;
            }
        }

        int digits = 0;
        int letters = 0;
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c >= '0' && c <= '9') {
                digits++;
            } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                letters++;
            }
        }
        if (digits > 4 && digits > letters) {
            return true;
        }

        return id.length() >= HEX_SUFFIX_MIN_ID_LENGTH && HEX_SUFFIX.matcher(id).find();
    }

    /**
     * Detects text that changes between runs: dates, times, relative time, prices, counters and pagination.
     *
     * @param text visible text or label (may be null)
     * @return {@code true} if the text is unusable as an exact anchor (null and empty included)
     */
    public static boolean isDynamicText(String text) {
        if (text == null || text.isEmpty()) {
            return true;
        }
        if (text.length() > MAX_STABLE_TEXT_LENGTH) {
            return true;
        }
        for (Pattern p : DYNAMIC_TEXT_PATTERNS) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strips leading/trailing numbers, prices, dates and relative-time phrases from a dynamic text.
     * <p>
     * Example: {@code "42 results"} gives {@code "results"}.
     *
     * @param text dynamic text (may be null)
     * @return trimmed residual of at least 3 characters, or {@code null}
     */
    public static String extractStableTextPortion(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }

        String stable = LEADING_NUMBER.matcher(text).replaceFirst("");
        stable = TRAILING_NUMBER.matcher(stable).replaceFirst("");
        stable = PRICE.matcher(stable).replaceAll("");
        stable = DATE.matcher(stable).replaceAll("");
        stable = RELATIVE_TIME.matcher(stable).replaceAll("");
        stable = stable.trim();

        return stable.length() >= MIN_STABLE_PORTION_LENGTH ? stable : null;
    }

    /**
     * Maps an explicit role and tag to the ARIA role a role-based locator expects.
     *
     * @param explicitRole value of the {@code role} attribute (may be null)
     * @param tag          tag name (may be null)
     * @return explicit role, implicit role of the tag, or {@code null} if there is none
     */
    public static String mapAriaRole(String explicitRole, String tag) {
        if (explicitRole != null && !explicitRole.isBlank()
                && !"presentation".equals(explicitRole) && !"none".equals(explicitRole)) {
            return explicitRole;
        }
        if (tag == null) {
            return null;
        }
        return IMPLICIT_ROLES.get(tag.trim().toLowerCase(Locale.ROOT));
    }
}
