package io.hearthwarrio.selectorium.webdriver;

import io.hearthwarrio.selectorium.core.BoundingBox;
import io.hearthwarrio.selectorium.core.ElementFingerprint;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the fingerprint walker through {@link JavascriptExecutor} and maps its result to {@link ElementFingerprint}s.
 * <p>
 * Selenium returns script objects as {@code Map}, integral numbers as {@code Long} and booleans as {@code Boolean};
 * missing or mistyped fields fall back to the fingerprint defaults.
 */
public class WebDriverFingerprintMapper {

    private final JavascriptExecutor js;

    public WebDriverFingerprintMapper(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor: " + driver.getClass().getName());
        }
        this.js = (JavascriptExecutor) driver;
    }

    /**
     * Executes the walker in the current page.
     *
     * @param walkerSource self-invoking walker expression
     * @return fingerprints in document order
     * @throws SnapshotCaptureException if the script fails or does not return an array
     */
    public List<ElementFingerprint> capture(String walkerSource) {
        Objects.requireNonNull(walkerSource, "walkerSource must not be null");

        Object result;
        try {
            result = js.executeScript("return " + walkerSource);
        } catch (WebDriverException e) {
            throw new SnapshotCaptureException("Fingerprint walker failed: " + e.getMessage(), e);
        }

        if (!(result instanceof List<?> items)) {
            throw new SnapshotCaptureException(
                    "Fingerprint walker returned " + (result == null ? "null" : result.getClass().getSimpleName())
                            + " instead of an array");
        }

        List<ElementFingerprint> out = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof Map<?, ?> map) {
                out.add(toFingerprint(map));
            }
        }
        return Collections.unmodifiableList(out);
    }

    static ElementFingerprint toFingerprint(Map<?, ?> m) {
        return ElementFingerprint.builder()
                .ref(str(m, "ref"))
                .tagName(str(m, "tagName"))
                .role(str(m, "role"))
                .text(str(m, "text"))
                .textFull(str(m, "textFull"))
                .id(str(m, "id"))
                .name(str(m, "name"))
                .cssClasses(str(m, "cssClasses"))
                .type(str(m, "type"))
                .href(str(m, "href"))
                .placeholder(str(m, "placeholder"))
                .ariaLabel(str(m, "ariaLabel"))
                .title(str(m, "title"))
                .alt(str(m, "alt"))
                .computedLabel(str(m, "computedLabel"))
                .associatedLabel(str(m, "associatedLabel"))
                .dataTestId(str(m, "dataTestId"))
                .dataTestIdAlt(str(m, "dataTestIdAlt"))
                .dataQa(str(m, "dataQa"))
                .visible(bool(m, "visible", true))
                .bounds(bounds(m.get("bounds")))
                .nthIndex(integer(m, "nthIndex", ElementFingerprint.UNKNOWN_INDEX))
                .parentRef(str(m, "parentRef"))
                .interactive(bool(m, "interactive", false))
                .build();
    }

    private static BoundingBox bounds(Object value) {
        if (!(value instanceof Map<?, ?> b)) {
            return BoundingBox.EMPTY;
        }
        return new BoundingBox(integer(b, "x", 0), integer(b, "y", 0), integer(b, "width", 0), integer(b, "height", 0));
    }

    private static String str(Map<?, ?> m, String key) {
        Object v = m.get(key);
        return v == null ? "" : String.valueOf(v);
    }

    private static int integer(Map<?, ?> m, String key, int defaultValue) {
        Object v = m.get(key);
        return v instanceof Number n ? n.intValue() : defaultValue;
    }

    private static boolean bool(Map<?, ?> m, String key, boolean defaultValue) {
        Object v = m.get(key);
        return v instanceof Boolean b ? b : defaultValue;
    }
}
