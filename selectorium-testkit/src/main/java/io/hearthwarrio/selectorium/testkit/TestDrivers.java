package io.hearthwarrio.selectorium.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.time.Duration;
import java.util.Objects;

/**
 * Drivers for snapshot tests.
 * <p>
 * Every driver gets a script timeout long enough for the fingerprint walker and the match-count script
 * on large pages, plus a short implicit wait for {@code SelectoriumWebDriver.findElement(ref)}.
 */
public final class TestDrivers {
    /**
     * Implicit wait applied to ref lookups.
     */
    public static final Duration DEFAULT_IMPLICIT_WAIT = Duration.ofSeconds(5);

    /**
     * Script timeout for the walker and probe scripts.
     */
    public static final Duration DEFAULT_SCRIPT_TIMEOUT = Duration.ofSeconds(30);

    private TestDrivers() {
    }

    /**
     * Visible local Chrome, handy when debugging a page whose selectors look wrong.
     */
    public static WebDriver chrome() {
        return chrome(new ChromeOptions());
    }

    /**
     * Headless Chrome for CI. The window size is fixed so that captured bounds and visibility do not
     * depend on the machine.
     */
    public static WebDriver headlessChrome() {
        ChromeOptions options = new ChromeOptions();
        options.addArguments("--headless=new", "--window-size=1280,1024", "--no-sandbox", "--disable-dev-shm-usage");
        return chrome(options);
    }

    /**
     * Local Chrome with caller options; the snapshot timeouts are applied on top.
     */
    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        WebDriver driver = new ChromeDriver(options);
        applyDefaults(driver);
        return driver;
    }

    /**
     * Browser on a Selenium Grid node. Snapshots run through {@code executeScript}, so any grid browser
     * with JavaScript enabled works.
     */
    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        WebDriver driver = new RemoteWebDriver(remoteUrl, capabilities);
        applyDefaults(driver);
        return driver;
    }

    private static void applyDefaults(WebDriver driver) {
        driver.manage().timeouts().implicitlyWait(DEFAULT_IMPLICIT_WAIT);
        driver.manage().timeouts().scriptTimeout(DEFAULT_SCRIPT_TIMEOUT);
    }
}
