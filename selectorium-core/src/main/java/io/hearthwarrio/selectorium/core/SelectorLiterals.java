package io.hearthwarrio.selectorium.core;

/**
 * Escaping helpers for the selector and locator strings built by the engine.
 */
public final class SelectorLiterals {

    private static final String REGEX_SPECIALS = ".*+?^${}()|[]\\";

    private SelectorLiterals() {
    }

    /**
     * Escapes a value for a single-quoted locator argument, e.g. {@code page.getByText('...')}.
     */
    public static String quoted(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case (char) 0x2028 -> sb.append("\\u2028");
                case (char) 0x2029 -> sb.append("\\u2029");
                default -> sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes a value for a double-quoted CSS attribute selector, e.g. {@code [title="..."]}.
     */
    public static String cssAttr(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Escapes a CSS identifier (used for {@code #id}).
     */
    public static String cssIdentifier(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (i == 0 && Character.isDigit(ch)) {
                // identifiers cannot start with a digit: use the hex escape form
                sb.append('\\').append(Integer.toHexString(ch)).append(' ');
                continue;
            }
            boolean ok = Character.isLetterOrDigit(ch) || ch == '-' || ch == '_';
            if (ok) {
                sb.append(ch);
            } else {
                sb.append('\\').append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes regular expression metacharacters for a {@code /.../i} locator literal.
     */
    public static String regex(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (REGEX_SPECIALS.indexOf(ch) >= 0) {
                sb.append('\\');
            }
            sb.append(ch);
        }
        return sb.toString();
    }

    /**
     * Renders a double-quoted JavaScript string literal.
     */
    public static String jsString(String value) {
        String v = value == null ? "" : value;
        StringBuilder sb = new StringBuilder(v.length() + 2);
        sb.append('"');
        for (int i = 0; i < v.length(); i++) {
            char ch = v.charAt(i);
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case (char) 0x2028 -> sb.append("\\u2028");
                case (char) 0x2029 -> sb.append("\\u2029");
                default -> {
                    if (ch < 0x20) {
                        sb.append(String.format("\\u%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
