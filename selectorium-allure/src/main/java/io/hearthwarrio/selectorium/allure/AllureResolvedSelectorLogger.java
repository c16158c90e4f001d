package io.hearthwarrio.selectorium.allure;

import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;
import io.hearthwarrio.selectorium.webdriver.ResolvedSelectorLogger;
import io.hearthwarrio.selectorium.webdriver.SelectorLogDetail;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for resolved selectors: one step per element with a text attachment.
 * <p>
 * Lives in selectorium-allure to avoid leaking Allure dependency into core/webdriver.
 * Screenshots, when enabled, are attached to the step reporting a failed match count.
 */
public final class AllureResolvedSelectorLogger implements ResolvedSelectorLogger {

    private final WebDriver driver;
    private final SelectorLogDetail detail;
    private final boolean attachScreenshot;

    public AllureResolvedSelectorLogger(WebDriver driver, SelectorLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? SelectorLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public SelectorLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedSelector(String ref, ElementFingerprint fingerprint, SelectorDescriptor descriptor) {
        String title = "Selectorium: " + safe(ref) + " - " + descriptor.getStrategy()
                + (descriptor.isUnique() ? "" : " (not unique)");

        Allure.step(title, () -> {
            StringBuilder sb = new StringBuilder(512);

            sb.append("ref: ").append(safe(ref)).append('\n')
                    .append("strategy: ").append(descriptor.getStrategy()).append('\n')
                    .append("score: ").append(descriptor.getStabilityScore()).append('\n')
                    .append("unique: ").append(descriptor.isUnique())
                    .append(" (matches: ").append(descriptor.getMatchCount()).append(")\n");

            if (detail == SelectorLogDetail.LOCATOR_ONLY || detail == SelectorLogDetail.BOTH) {
                sb.append("locator: ").append(descriptor.getPrimary()).append('\n')
                        .append("fallback: ").append(nullSafe(descriptor.getFallback())).append('\n');
                if (descriptor.getComposite() != null) {
                    sb.append("composite: ").append(descriptor.getComposite()).append('\n');
                }
            }
            if (detail == SelectorLogDetail.CSS_ONLY || detail == SelectorLogDetail.BOTH) {
                sb.append("css: ").append(nullSafe(descriptor.getCssSelector())).append('\n');
            }

            if (fingerprint != null) {
                sb.append("dom.tag: ").append(fingerprint.getTagName()).append('\n')
                        .append("dom.role: ").append(fingerprint.getRole()).append('\n')
                        .append("dom.label: ").append(fingerprint.getComputedLabel()).append('\n');
            }

            byte[] txt = sb.toString().getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(
                    "Resolved selector",
                    "text/plain",
                    new ByteArrayInputStream(txt),
                    ".txt"
            );
        });
    }

    @Override
    public void probeFailed(String message) {
        Allure.step("Selectorium: match counting failed", () -> {
            Allure.addAttachment(
                    "Probe failure",
                    "text/plain",
                    new ByteArrayInputStream(safe(message).getBytes(StandardCharsets.UTF_8)),
                    ".txt"
            );

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private static String nullSafe(String s) {
        return s == null ? "null" : s;
    }
}
