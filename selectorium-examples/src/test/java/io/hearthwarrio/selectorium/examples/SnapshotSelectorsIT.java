package io.hearthwarrio.selectorium.examples;

import io.hearthwarrio.selectorium.allure.SelectoriumAllureLoggers;
import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;
import io.hearthwarrio.selectorium.testkit.TestDrivers;
import io.hearthwarrio.selectorium.testkit.TestSelectorium;
import io.hearthwarrio.selectorium.webdriver.PageSnapshot;
import io.hearthwarrio.selectorium.webdriver.SelectorLogDetail;
import io.hearthwarrio.selectorium.webdriver.SelectoriumWebDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotSelectorsIT {

    private WebDriver driver;

    @BeforeEach
    void openPage() {
        driver = TestDrivers.headlessChrome();
        Path page = Paths.get("src", "test", "resources", "pages", "selectorium-snapshot.html");
        driver.get(page.toUri().toString());
    }

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    private static String refOf(PageSnapshot snapshot, String tag, String text) {
        for (ElementFingerprint f : snapshot.getFingerprints()) {
            if (f.getTagName().equals(tag) && f.getText().equals(text)) {
                return f.getRef();
            }
        }
        return fail("No captured " + tag + " with text '" + text + "'");
    }

    @Test
    void resolvesStableSelectorsForFormFields() {
        PageSnapshot snapshot = TestSelectorium.stdoutWithChecks(driver, SelectorLogDetail.BOTH).snapshot();

        assertTrue(snapshot.isProbed());
        ElementFingerprint email = snapshot.getFingerprints().stream()
                .filter(f -> "email".equals(f.getId()))
                .findFirst()
                .orElseThrow();
        assertEquals("Email", email.getAssociatedLabel());

        SelectorDescriptor d = snapshot.getDescriptor(email.getRef());
        assertEquals("page.locator('#email')", d.getPrimary());
        assertTrue(d.isUnique());
    }

    @Test
    void ignoresGeneratedIds() {
        PageSnapshot snapshot = TestSelectorium.plain(driver).snapshot();

        ElementFingerprint close = snapshot.getFingerprints().stream()
                .filter(f -> "Close".equals(f.getAriaLabel()))
                .findFirst()
                .orElseThrow();

        SelectorDescriptor d = snapshot.getDescriptor(close.getRef());
        assertEquals("aria-label", d.getStrategy());
        assertFalse(d.getPrimary().contains("mui-48213"));
    }

    @Test
    void disambiguatesRepeatedButtons() {
        PageSnapshot snapshot = TestSelectorium.plain(driver).snapshot();

        List<SelectorDescriptor> saves = snapshot.getFingerprints().stream()
                .filter(f -> f.getTagName().equals("button") && f.getText().equals("Save"))
                .map(f -> snapshot.getDescriptor(f.getRef()))
                .collect(Collectors.toList());

        assertEquals(3, saves.size());
        for (SelectorDescriptor d : saves) {
            assertNotEquals("page.getByText('Save', { exact: true })", d.getPrimary());
            assertTrue(d.getStabilityScore() < 4 || d.getComposite() != null, d.toString());
        }
    }

    @Test
    void findsElementsByRef() {
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(driver)
                .withLogger(SelectoriumAllureLoggers.resolvedSelectors(driver));
        PageSnapshot snapshot = selectorium.snapshot();

        String shoes = refOf(snapshot, "a", "Shoes");
        WebElement link = selectorium.findElement(shoes);

        assertEquals("Shoes", link.getText());
        assertEquals("a[href*=\"/catalog/shoes\"]", snapshot.getDescriptor(shoes).getCssSelector());
    }
}
