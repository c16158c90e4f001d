package io.hearthwarrio.selectorium.webdriver;

import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;
import io.hearthwarrio.selectorium.core.composite.IndexDisambiguationStrategy;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.ScriptTimeoutException;
import org.openqa.selenium.WebDriverException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SelectoriumWebDriverTest {

    private static FakeScriptDriver page() {
        return new FakeScriptDriver().walkerReturns(Fixtures.page()).probeReturns(Fixtures.counts());
    }

    @Test
    void snapshotRunsWalkerProbeAndResolution() {
        FakeScriptDriver driver = page();

        PageSnapshot snapshot = new SelectoriumWebDriver(driver).snapshot();

        assertEquals(2, driver.scripts.size());
        assertTrue(driver.scripts.get(0).startsWith("return (function"));
        assertTrue(driver.scripts.get(1).contains("querySelectorAll(sel)"));

        assertTrue(snapshot.isProbed());
        assertEquals("http://localhost/form.html", snapshot.getUrl());
        assertEquals(List.of("s1e1", "s1e2"), List.copyOf(snapshot.refs()));

        SelectorDescriptor form = snapshot.getDescriptor("s1e1");
        assertEquals("page.getByTestId('profile')", form.getPrimary());
        assertTrue(form.isUnique());

        SelectorDescriptor save = snapshot.getDescriptor("s1e2");
        assertEquals("composite:data-testid>role+name", save.getStrategy());
        assertEquals("page.getByTestId('profile').getByRole('button', { name: 'Save' })", save.getComposite());
    }

    @Test
    void logsEveryResolvedSelector() {
        List<String> logged = new ArrayList<>();
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(page())
                .withLogger((ref, fingerprint, descriptor) -> logged.add(ref + "=" + descriptor.getStrategy()));

        selectorium.snapshot();

        assertEquals(List.of("s1e1=data-testid", "s1e2=composite:data-testid>role+name"), logged);
    }

    @Test
    void probeFailureIsNotFatal() {
        List<String> failures = new ArrayList<>();
        FakeScriptDriver driver = new FakeScriptDriver()
                .walkerReturns(Fixtures.page())
                .probeFails(new ScriptTimeoutException("script timeout"));
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(driver).withLogger(new ResolvedSelectorLogger() {
            @Override
            public void logResolvedSelector(String ref, ElementFingerprint fingerprint, SelectorDescriptor descriptor) {
            }

            @Override
            public void probeFailed(String message) {
                failures.add(message);
            }
        });

        PageSnapshot snapshot = selectorium.snapshot();

        assertFalse(snapshot.isProbed());
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).contains("Probe script failed"));
        assertEquals(2, snapshot.size());
        assertFalse(snapshot.getDescriptor("s1e1").isUnique());
    }

    @Test
    void walkerFailureIsFatal() {
        FakeScriptDriver driver = new FakeScriptDriver().walkerFails(new WebDriverException("no page"));

        assertThrows(SnapshotCaptureException.class, () -> new SelectoriumWebDriver(driver).snapshot());
    }

    @Test
    void consistencyCheckPassesWhenUniqueSelectorStillMatchesOnce() {
        FakeScriptDriver driver = page().live(Fixtures.PROFILE_CSS, 1);

        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(driver).checkSelectors();

        assertTrue(selectorium.isConsistencyCheckEnabled());
        assertDoesNotThrow(selectorium::snapshot);
    }

    @Test
    void consistencyCheckFailsWhenPageChanged() {
        FakeScriptDriver driver = page().live(Fixtures.PROFILE_CSS, 2);

        SelectorConsistencyException ex = assertThrows(
                SelectorConsistencyException.class,
                () -> new SelectoriumWebDriver(driver).withConsistencyCheck(true).snapshot()
        );
        assertTrue(ex.getMessage().contains("s1e1"));
        assertTrue(ex.getMessage().contains("matches 2 now"));
    }

    @Test
    void consistencyCheckIsOffByDefault() {
        FakeScriptDriver driver = page().live(Fixtures.PROFILE_CSS, 2);

        assertDoesNotThrow(() -> new SelectoriumWebDriver(driver).snapshot());
    }

    @Test
    void findsElementByRef() {
        FakeScriptDriver driver = page().live(Fixtures.PROFILE_CSS, 1);
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(driver);
        selectorium.snapshot();

        assertSame(driver.element, selectorium.findElement("s1e1"));
    }

    @Test
    void ambiguousRefIsReported() {
        FakeScriptDriver driver = page().live(Fixtures.SAVE_CSS, 2);
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(driver);
        selectorium.snapshot();

        assertThrows(SelectorConsistencyException.class, () -> selectorium.findElement("s1e2"));
    }

    @Test
    void uniqueTextPrimaryIsFoundThroughFastCss() {
        FakeScriptDriver driver = new FakeScriptDriver()
                .walkerReturns(List.of(Fixtures.form(), Fixtures.titledSaveButton()))
                .probeReturns(Map.of(Fixtures.PROFILE_CSS, 1L, Fixtures.SAVE_CSS, 2L, "text=\"Save\"", 1L))
                .live(Fixtures.SAVE_CSS, 2)
                .live("[title=\"Save changes\"]", 1);
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(driver);
        selectorium.snapshot();

        SelectorDescriptor d = selectorium.getLastSnapshot().getDescriptor("s1e2");
        assertTrue(d.isUnique());
        assertEquals("text-content", d.getStrategy());
        assertEquals(Fixtures.SAVE_CSS, d.getCssSelector());

        assertSame(driver.element, selectorium.findElement("s1e2"));
    }

    @Test
    void unknownRefIsNotFound() {
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(page());
        selectorium.snapshot();

        assertThrows(NoSuchElementException.class, () -> selectorium.findElement("s1e99"));
        assertNull(selectorium.resolveFastCssSelector("s1e99"));
    }

    @Test
    void refsNeedSnapshot() {
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(page());

        assertNull(selectorium.getLastSnapshot());
        assertThrows(IllegalStateException.class, () -> selectorium.resolveFastCssSelector("s1e1"));
        assertThrows(IllegalStateException.class, () -> selectorium.findElement("s1e1"));
    }

    @Test
    void resolvesFastCssSelectorForRef() {
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(page());
        selectorium.snapshot();

        assertEquals("[data-testid=\"profile\"]", selectorium.resolveFastCssSelector("s1e1"));
        assertEquals("text=\"Save\"", selectorium.resolveFastCssSelector("s1e2"));
    }

    @Test
    void compositeChainCanBeReplaced() {
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(page())
                .withCompositeStrategies(new IndexDisambiguationStrategy());

        PageSnapshot snapshot = selectorium.snapshot();

        assertEquals("nth:role+name[0]", snapshot.getDescriptor("s1e2").getStrategy());
    }

    @Test
    void loggingSugar() {
        SelectoriumWebDriver selectorium = new SelectoriumWebDriver(page()).logSelectors();
        assertTrue(selectorium.getResolvedSelectorLogger() instanceof StdOutResolvedSelectorLogger);
        assertEquals(SelectorLogDetail.BOTH, selectorium.getResolvedSelectorLogger().detail());

        selectorium.disableSelectorLogging();
        assertNull(selectorium.getResolvedSelectorLogger());
    }

    @Test
    void rejectsNullDriver() {
        assertThrows(NullPointerException.class, () -> new SelectoriumWebDriver(null));
    }
}
