package io.hearthwarrio.selectorium.testkit;

import io.hearthwarrio.selectorium.webdriver.SelectorLogDetail;
import io.hearthwarrio.selectorium.webdriver.SelectoriumWebDriver;
import org.openqa.selenium.WebDriver;

import java.util.Objects;

/**
 * Convenience factory methods for creating Selectorium instances in tests.
 * <p>
 * Does not depend on Allure.
 */
public final class TestSelectorium {

    private TestSelectorium() {
        // utility class
    }

    /**
     * Creates a plain SelectoriumWebDriver without logging and without checks.
     */
    public static SelectoriumWebDriver plain(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new SelectoriumWebDriver(driver);
    }

    /**
     * Creates a SelectoriumWebDriver with stdout selector logging enabled.
     */
    public static SelectoriumWebDriver stdout(WebDriver driver, SelectorLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new SelectoriumWebDriver(driver)
                .withLoggingToStdOut(detail);
    }

    /**
     * Creates a SelectoriumWebDriver with stdout selector logging and consistency checks enabled.
     */
    public static SelectoriumWebDriver stdoutWithChecks(WebDriver driver, SelectorLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new SelectoriumWebDriver(driver)
                .withLoggingToStdOut(detail)
                .checkSelectors();
    }
}
