package io.hearthwarrio.selectorium.webdriver;

import io.hearthwarrio.selectorium.core.CandidateType;
import io.hearthwarrio.selectorium.core.ElementFingerprint;
import io.hearthwarrio.selectorium.core.SelectorDescriptor;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class StdOutResolvedSelectorLoggerTest {

    private final ElementFingerprint fingerprint = ElementFingerprint.builder().ref("s1e1").tagName("input").build();
    private final SelectorDescriptor descriptor = new SelectorDescriptor(
            "page.locator('#email')", null, null, "id", CandidateType.ID, 8, true, 1, "#email");

    private static String log(SelectorLogDetail detail, ElementFingerprint f, SelectorDescriptor d) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new StdOutResolvedSelectorLogger(detail, new PrintStream(buffer, true, StandardCharsets.UTF_8))
                .logResolvedSelector("s1e1", f, d);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void logsLocatorAndCss() {
        String line = log(SelectorLogDetail.BOTH, fingerprint, descriptor);

        assertTrue(line.startsWith("[Selectorium] ref='s1e1', strategy=id, score=8, unique=true"));
        assertTrue(line.contains("locator=page.locator('#email')"));
        assertTrue(line.contains("css=#email"));
        assertTrue(line.contains("tag=input"));
    }

    @Test
    void respectsDetail() {
        String cssOnly = log(SelectorLogDetail.CSS_ONLY, fingerprint, descriptor);
        String none = log(SelectorLogDetail.NONE, null, descriptor);

        assertFalse(cssOnly.contains("locator="));
        assertTrue(cssOnly.contains("css=#email"));
        assertFalse(none.contains("locator="));
        assertFalse(none.contains("css="));
        assertFalse(none.contains("tag="));
    }

    @Test
    void reportsProbeFailure() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new StdOutResolvedSelectorLogger(SelectorLogDetail.BOTH, new PrintStream(buffer, true, StandardCharsets.UTF_8))
                .probeFailed("script timeout");

        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("[Selectorium] match counting failed"));
    }

    @Test
    void rejectsNullDetail() {
        assertThrows(NullPointerException.class, () -> new StdOutResolvedSelectorLogger(null));
    }
}
