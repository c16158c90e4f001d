package io.hearthwarrio.selectorium.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ProbeScriptBuilderTest {

    private final ProbeScriptBuilder builder = new ProbeScriptBuilder(new DefaultCandidateGenerator());

    @Test
    void collectsDistinctCssSelectorsInFirstSeenOrder() {
        List<ElementFingerprint> fingerprints = List.of(
                ElementFingerprint.builder().tagName("input").id("email").name("email").build(),
                ElementFingerprint.builder().tagName("input").name("email").text("ignored text").build()
        );

        Set<String> selectors = builder.collectSelectors(fingerprints);

        assertEquals(List.of("#email", "[name=\"email\"]"), List.copyOf(selectors));
    }

    @Test
    void skipsCandidatesWithoutCss() {
        List<ElementFingerprint> fingerprints = List.of(
                ElementFingerprint.builder().tagName("button").text("Sign in").build()
        );

        assertTrue(builder.collectSelectors(fingerprints).isEmpty());
    }

    @Test
    void scriptIsSelfInvokingAndEmbedsEscapedSelectors() {
        String script = builder.build(List.of(
                ElementFingerprint.builder().tagName("button").dataTestId("submit").build()
        ));

        assertTrue(script.startsWith("(function"));
        assertTrue(script.endsWith("})()"));
        assertTrue(script.contains("\"[data-testid=\\\"submit\\\"]\""));
        assertTrue(script.contains("document.querySelectorAll(sel).length"));
        assertTrue(script.contains("counts[sel] = -1"));
    }

    @Test
    void emptySnapshotGivesEmptySelectorArray() {
        assertTrue(builder.build(List.of()).contains("var selectors = [];"));
    }
}
