package io.hearthwarrio.selectorium.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorEngineTest {

    private final SelectorEngine engine = new SelectorEngine();

    private final ElementFingerprint form = ElementFingerprint.builder()
            .ref("s1e1").tagName("form").dataTestId("profile").build();
    private final ElementFingerprint save = ElementFingerprint.builder()
            .ref("s1e2").parentRef("s1e1").tagName("button").role("button")
            .computedLabel("Save").text("Save").nthIndex(0).build();

    @Test
    void resolvesSnapshotInInputOrder() {
        Map<String, SelectorDescriptor> resolved = engine.resolveAll(
                List.of(form, save),
                Map.of("[data-testid=\"profile\"]", 1, "[role=\"button\"][aria-label=\"Save\"]", 2)
        );

        assertEquals(List.of("s1e1", "s1e2"), List.copyOf(resolved.keySet()));
        assertEquals("page.getByTestId('profile')", resolved.get("s1e1").getPrimary());
        assertTrue(resolved.get("s1e1").isUnique());
    }

    @Test
    void usesSnapshotForParentScoping() {
        Map<String, SelectorDescriptor> resolved = engine.resolveAll(
                List.of(form, save),
                Map.of("[role=\"button\"][aria-label=\"Save\"]", 2)
        );

        SelectorDescriptor d = resolved.get("s1e2");
        assertEquals("page.getByTestId('profile').locator('[role=\"button\"][aria-label=\"Save\"]')", d.getPrimary());
        assertEquals("page.getByTestId('profile').getByRole('button', { name: 'Save' })", d.getComposite());
        assertEquals("composite:data-testid>role+name", d.getStrategy());
        assertEquals(8, d.getStabilityScore());
        assertEquals("page.getByRole('button', { name: 'Save' })", d.getFallback());
    }

    @Test
    void singleResolutionWithoutOptionsSkipsParentScoping() {
        SelectorDescriptor d = engine.resolveSelector(save, Map.of("[role=\"button\"][aria-label=\"Save\"]", 2));

        assertEquals("filtered:role+name+text", d.getStrategy());
    }

    @Test
    void skipsFingerprintsWithoutRefOrDuplicated() {
        ElementFingerprint noRef = ElementFingerprint.builder().tagName("div").build();
        ElementFingerprint duplicate = ElementFingerprint.builder().ref("s1e1").tagName("span").build();

        Map<String, SelectorDescriptor> resolved = engine.resolveAll(List.of(form, noRef, duplicate), Map.of());

        assertEquals(1, resolved.size());
        assertEquals("data-testid", resolved.get("s1e1").getStrategy());
    }

    @Test
    void exposesScriptsAndCandidates() {
        assertSame(FingerprintWalker.source(), engine.getWalkerSource());
        assertTrue(engine.buildProbeScript(List.of(form)).contains("profile"));
        assertEquals(CandidateType.TEST_ID, engine.generateCandidates(form).get(0).getType());
        assertEquals("[data-testid=\"profile\"]", engine.resolveFastCssSelector(form));
    }
}
