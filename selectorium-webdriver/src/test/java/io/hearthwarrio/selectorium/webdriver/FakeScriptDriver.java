package io.hearthwarrio.selectorium.webdriver;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Minimal driver double: answers the walker and the probe script with canned results and
 * {@code findElements(By.cssSelector)} with a configured number of elements.
 */
final class FakeScriptDriver implements WebDriver, JavascriptExecutor {

    private static final String CSS_PREFIX = "By.cssSelector: ";

    final List<String> scripts = new ArrayList<>();
    final WebElement element = fakeElement();

    private Object walkerResult = List.of();
    private Object probeResult = Map.of();
    private RuntimeException walkerFailure;
    private RuntimeException probeFailure;
    private final Map<String, Integer> liveCounts = new HashMap<>();

    FakeScriptDriver walkerReturns(Object result) {
        this.walkerResult = result;
        return this;
    }

    FakeScriptDriver walkerFails(RuntimeException failure) {
        this.walkerFailure = failure;
        return this;
    }

    FakeScriptDriver probeReturns(Object result) {
        this.probeResult = result;
        return this;
    }

    FakeScriptDriver probeFails(RuntimeException failure) {
        this.probeFailure = failure;
        return this;
    }

    FakeScriptDriver live(String css, int count) {
        liveCounts.put(css, count);
        return this;
    }

    @Override
    public Object executeScript(String script, Object... args) {
        scripts.add(script);
        if (script.contains("querySelectorAll(sel)")) {
            if (probeFailure != null) {
                throw probeFailure;
            }
            return probeResult;
        }
        if (walkerFailure != null) {
            throw walkerFailure;
        }
        return walkerResult;
    }

    @Override
    public Object executeAsyncScript(String script, Object... args) {
        throw new UnsupportedOperationException("executeAsyncScript");
    }

    @Override
    public List<WebElement> findElements(By by) {
        String s = by.toString();
        if (!s.startsWith(CSS_PREFIX)) {
            throw new UnsupportedOperationException("Only css lookups are supported: " + s);
        }
        int count = liveCounts.getOrDefault(s.substring(CSS_PREFIX.length()), 0);
        return Collections.nCopies(count, element);
    }

    @Override
    public WebElement findElement(By by) {
        List<WebElement> found = findElements(by);
        if (found.isEmpty()) {
            throw new org.openqa.selenium.NoSuchElementException(by.toString());
        }
        return found.get(0);
    }

    @Override
    public String getCurrentUrl() {
        return "http://localhost/form.html";
    }

    @Override
    public void get(String url) {
    }

    @Override
    public String getTitle() {
        return "fake";
    }

    @Override
    public String getPageSource() {
        return "";
    }

    @Override
    public void close() {
    }

    @Override
    public void quit() {
    }

    @Override
    public Set<String> getWindowHandles() {
        return Set.of("main");
    }

    @Override
    public String getWindowHandle() {
        return "main";
    }

    @Override
    public TargetLocator switchTo() {
        throw new UnsupportedOperationException("switchTo");
    }

    @Override
    public Navigation navigate() {
        throw new UnsupportedOperationException("navigate");
    }

    @Override
    public Options manage() {
        throw new UnsupportedOperationException("manage");
    }

    private static WebElement fakeElement() {
        return (WebElement) Proxy.newProxyInstance(
                FakeScriptDriver.class.getClassLoader(),
                new Class<?>[]{WebElement.class},
                (proxy, method, args) -> switch (method.getName()) {
                    case "toString" -> "FakeElement";
                    case "hashCode" -> System.identityHashCode(proxy);
                    case "equals" -> proxy == args[0];
                    case "getTagName" -> "button";
                    default -> throw new UnsupportedOperationException(method.getName());
                }
        );
    }
}
