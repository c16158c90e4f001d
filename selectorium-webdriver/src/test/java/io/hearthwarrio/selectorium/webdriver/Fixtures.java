package io.hearthwarrio.selectorium.webdriver;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walker and probe results shaped the way Selenium returns them (numbers as {@code Long}).
 */
final class Fixtures {

    static final String PROFILE_CSS = "[data-testid=\"profile\"]";
    static final String SAVE_CSS = "[role=\"button\"][aria-label=\"Save\"]";

    private Fixtures() {
    }

    static Map<String, Object> form() {
        Map<String, Object> m = new HashMap<>();
        m.put("ref", "s1e1");
        m.put("tagName", "form");
        m.put("dataTestId", "profile");
        m.put("visible", true);
        m.put("bounds", Map.of("x", 0L, "y", 0L, "width", 400L, "height", 300L));
        m.put("nthIndex", 0L);
        m.put("parentRef", "");
        m.put("interactive", false);
        return m;
    }

    static Map<String, Object> saveButton() {
        Map<String, Object> m = new HashMap<>();
        m.put("ref", "s1e2");
        m.put("tagName", "button");
        m.put("role", "button");
        m.put("text", "Save");
        m.put("textFull", "Save");
        m.put("computedLabel", "Save");
        m.put("visible", true);
        m.put("bounds", Map.of("x", 10L, "y", 250L, "width", 80L, "height", 24L));
        m.put("nthIndex", 0L);
        m.put("parentRef", "s1e1");
        m.put("interactive", true);
        return m;
    }

    /**
     * Save button that also carries a title; only its exact text was unique when probed.
     */
    static Map<String, Object> titledSaveButton() {
        Map<String, Object> m = saveButton();
        m.put("title", "Save changes");
        return m;
    }

    static List<Object> page() {
        return List.of(form(), saveButton());
    }

    static Map<String, Object> counts() {
        return Map.of(PROFILE_CSS, 1L, SAVE_CSS, 2L);
    }
}
