package io.hearthwarrio.selectorium.webdriver;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Executes a probe script and converts its {@code {selector: count}} result.
 */
public class WebDriverMatchCounter {

    private final JavascriptExecutor js;

    public WebDriverMatchCounter(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor: " + driver.getClass().getName());
        }
        this.js = (JavascriptExecutor) driver;
    }

    /**
     * @param probeScript self-invoking probe expression
     * @return selector to match count ({@code -1} for selectors the page rejected)
     * @throws SnapshotCaptureException if the script fails or does not return an object
     */
    public Map<String, Integer> count(String probeScript) {
        Objects.requireNonNull(probeScript, "probeScript must not be null");

        Object result;
        try {
            result = js.executeScript("return " + probeScript);
        } catch (WebDriverException e) {
            throw new SnapshotCaptureException("Probe script failed: " + e.getMessage(), e);
        }

        if (!(result instanceof Map<?, ?> raw)) {
            throw new SnapshotCaptureException(
                    "Probe script returned " + (result == null ? "null" : result.getClass().getSimpleName())
                            + " instead of an object");
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            if (e.getKey() != null && e.getValue() instanceof Number n) {
                counts.put(String.valueOf(e.getKey()), n.intValue());
            }
        }
        return Collections.unmodifiableMap(counts);
    }
}
