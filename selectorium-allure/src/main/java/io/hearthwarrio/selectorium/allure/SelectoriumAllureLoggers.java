package io.hearthwarrio.selectorium.allure;

import io.hearthwarrio.selectorium.webdriver.ResolvedSelectorLogger;
import io.hearthwarrio.selectorium.webdriver.SelectorLogDetail;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Selectorium loggers.
 */
public final class SelectoriumAllureLoggers {

    private SelectoriumAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that logs both the locator and the CSS selector, without screenshots.
     */
    public static ResolvedSelectorLogger resolvedSelectors(WebDriver driver) {
        return new AllureResolvedSelectorLogger(driver, SelectorLogDetail.BOTH, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static ResolvedSelectorLogger resolvedSelectors(
            WebDriver driver,
            SelectorLogDetail detail,
            boolean screenshots
    ) {
        return new AllureResolvedSelectorLogger(driver, detail, screenshots);
    }
}
