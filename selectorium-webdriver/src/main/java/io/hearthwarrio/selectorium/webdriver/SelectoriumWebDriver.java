package io.hearthwarrio.selectorium.webdriver;

import io.hearthwarrio.selectorium.core.CandidateGenerator;
import io.hearthwarrio.selectorium.core.CompositeStrategy;
import io.hearthwarrio.selectorium.core.DefaultUniquenessResolver;
import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;
import io.hearthwarrio.selectorium.core.SelectorEngine;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * High-level Selectorium entry point for Selenium WebDriver.
 * <p>
 * {@link #snapshot()} captures the current page in three phases:
 * <ol>
 *   <li>the fingerprint walker runs in the page</li>
 *   <li>the probe script counts live matches of every candidate CSS selector; a failure here is not fatal and
 *       yields a snapshot without unique selectors</li>
 *   <li>every fingerprint is resolved, with the snapshot itself used for parent scoping</li>
 * </ol>
 * The last snapshot is kept so that refs can be turned into CSS selectors or elements later.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class SelectoriumWebDriver {

    private final WebDriver driver;
    private final WebDriverFingerprintMapper fingerprintMapper;
    private final WebDriverMatchCounter matchCounter;

    /**
     * Mutable to support runtime overrides.
     */
    private SelectorEngine engine;
    private ResolvedSelectorLogger resolvedSelectorLogger;
    private boolean consistencyCheckEnabled = false;

    private PageSnapshot lastSnapshot;

    public SelectoriumWebDriver(WebDriver driver) {
        this(driver, new SelectorEngine(), null);
    }

    public SelectoriumWebDriver(WebDriver driver, ResolvedSelectorLogger logger) {
        this(driver, new SelectorEngine(), logger);
    }

    public SelectoriumWebDriver(WebDriver driver, SelectorEngine engine, ResolvedSelectorLogger logger) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.fingerprintMapper = new WebDriverFingerprintMapper(driver);
        this.matchCounter = new WebDriverMatchCounter(driver);
        this.resolvedSelectorLogger = logger;
    }

    // ----------- configuration (low-level) -----------

    public SelectoriumWebDriver withLogger(ResolvedSelectorLogger logger) {
        this.resolvedSelectorLogger = logger;
        return this;
    }

    public SelectoriumWebDriver withLoggingToStdOut(SelectorLogDetail detail) {
        this.resolvedSelectorLogger = new StdOutResolvedSelectorLogger(detail);
        return this;
    }

    public SelectoriumWebDriver withConsistencyCheck(boolean enabled) {
        this.consistencyCheckEnabled = enabled;
        return this;
    }

    /**
     * Replaces the composite chain tried when no single-attribute selector is unique.
     * The candidate generator of the current engine is kept.
     *
     * @param strategies strategies in any order; normalized by order and id
     * @return this driver instance for fluent chaining
     */
    public SelectoriumWebDriver withCompositeStrategies(CompositeStrategy... strategies) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        return withCompositeStrategies(Arrays.asList(strategies));
    }

    public SelectoriumWebDriver withCompositeStrategies(List<? extends CompositeStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        CandidateGenerator generator = engine.getGenerator();
        this.engine = new SelectorEngine(generator, new DefaultUniquenessResolver(generator, strategies));
        return this;
    }

    // ----------- configuration (sugar, minimal set) -----------

    public SelectoriumWebDriver logSelectors() {
        return withLoggingToStdOut(SelectorLogDetail.BOTH);
    }

    public SelectoriumWebDriver disableSelectorLogging() {
        this.resolvedSelectorLogger = null;
        return this;
    }

    public SelectoriumWebDriver checkSelectors() {
        this.consistencyCheckEnabled = true;
        return this;
    }

    public SelectoriumWebDriver disableSelectorChecks() {
        this.consistencyCheckEnabled = false;
        return this;
    }

    public boolean isConsistencyCheckEnabled() {
        return consistencyCheckEnabled;
    }

    public SelectorEngine getEngine() {
        return engine;
    }

    public WebDriver getDriver() {
        return driver;
    }

    ResolvedSelectorLogger getResolvedSelectorLogger() {
        return resolvedSelectorLogger;
    }

    // ----------- snapshot -----------

    /**
     * Captures the current page and resolves a selector for every captured element.
     *
     * @return snapshot, also kept as {@link #getLastSnapshot()}
     * @throws SnapshotCaptureException      if the walker cannot run
     * @throws SelectorConsistencyException if consistency checks are enabled and a unique selector no longer
     *                                       matches exactly one element
     */
    public PageSnapshot snapshot() {
        List<ElementFingerprint> fingerprints = fingerprintMapper.capture(engine.getWalkerSource());

        Map<String, Integer> counts;
        boolean probed = true;
        try {
            counts = matchCounter.count(engine.buildProbeScript(fingerprints));
        } catch (SnapshotCaptureException e) {
            counts = Map.of();
            probed = false;
            if (resolvedSelectorLogger != null) {
                resolvedSelectorLogger.probeFailed(e.getMessage());
            }
        }

        Map<String, SelectorDescriptor> descriptors = engine.resolveAll(fingerprints, counts);
        PageSnapshot snapshot = new PageSnapshot(driver.getCurrentUrl(), fingerprints, counts, descriptors, probed);

        if (resolvedSelectorLogger != null) {
            for (Map.Entry<String, SelectorDescriptor> e : descriptors.entrySet()) {
                resolvedSelectorLogger.logResolvedSelector(e.getKey(), snapshot.getFingerprint(e.getKey()), e.getValue());
            }
        }

        if (consistencyCheckEnabled) {
            runConsistencyCheck(snapshot);
        }

        this.lastSnapshot = snapshot;
        return snapshot;
    }

    /**
     * @return last snapshot or {@code null} if {@link #snapshot()} was never called
     */
    public PageSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    /**
     * Fast CSS selector for a ref of the last snapshot, computed without probing.
     *
     * @param ref element ref
     * @return CSS selector, or {@code null} if the ref is unknown
     * @throws IllegalStateException if no snapshot was captured yet
     */
    public String resolveFastCssSelector(String ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        return engine.resolveFastCssSelector(requireSnapshot().getFingerprint(ref));
    }

    /**
     * Finds the live element for a ref of the last snapshot through its CSS selector.
     *
     * @param ref element ref
     * @return element
     * @throws NoSuchElementException        if the ref is unknown, has no usable CSS selector or matches nothing
     * @throws SelectorConsistencyException if the CSS selector matches more than one element
     */
    public WebElement findElement(String ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        PageSnapshot snapshot = requireSnapshot();

        String css = cssFor(snapshot, ref);
        List<WebElement> found = driver.findElements(By.cssSelector(css));
        if (found.isEmpty()) {
            throw new NoSuchElementException("No element for ref '" + ref + "' by css '" + css + "'");
        }
        if (found.size() > 1) {
            throw new SelectorConsistencyException(
                    "Ref '" + ref + "' is ambiguous: css '" + css + "' matches " + found.size() + " elements");
        }
        return found.get(0);
    }

    private String cssFor(PageSnapshot snapshot, String ref) {
        SelectorDescriptor descriptor = snapshot.getDescriptor(ref);
        if (descriptor == null) {
            throw new NoSuchElementException("Unknown ref '" + ref + "' in the last snapshot");
        }
        if (descriptor.isUnique() && probedUnique(snapshot, descriptor.getCssSelector())) {
            return descriptor.getCssSelector();
        }
        String fast = engine.resolveFastCssSelector(snapshot.getFingerprint(ref));
        // text="..." is a locator engine selector, not CSS
        if (fast == null || fast.startsWith("text=")) {
            if (descriptor.getCssSelector() != null) {
                return descriptor.getCssSelector();
            }
            throw new NoSuchElementException("No CSS selector can be derived for ref '" + ref + "'");
        }
        return fast;
    }

    /**
     * A unique primary without a CSS form carries the best raw candidate's CSS, which may match several elements.
     */
    private static boolean probedUnique(PageSnapshot snapshot, String css) {
        return css != null && Integer.valueOf(1).equals(snapshot.getMatchCounts().get(css));
    }

    private PageSnapshot requireSnapshot() {
        if (lastSnapshot == null) {
            throw new IllegalStateException("No snapshot captured yet, call snapshot() first");
        }
        return lastSnapshot;
    }

    // ----------- consistency check -----------

    private void runConsistencyCheck(PageSnapshot snapshot) {
        for (Map.Entry<String, SelectorDescriptor> e : snapshot.getDescriptors().entrySet()) {
            SelectorDescriptor d = e.getValue();
            String css = d.getCssSelector();
            if (!d.isUnique() || !probedUnique(snapshot, css)) {
                continue;
            }
            int live = driver.findElements(By.cssSelector(css)).size();
            if (live != 1) {
                throw new SelectorConsistencyException(
                        "Selector consistency check failed for ref '" + e.getKey() + "': css '" + css +
                                "' matched 1 element when probed but matches " + live + " now" +
                                ", strategy=" + d.getStrategy()
                );
            }
        }
    }
}
