package io.hearthwarrio.selectorium.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * In-page DOM walker that captures one {@link ElementFingerprint}-shaped object per interesting element.
 * <p>
 * The script is a self-invoking expression that evaluates to an array. Captured elements get refs
 * {@code s1e1, s1e2, ...} in document order; elements that are neither interactive nor identifiable are not
 * captured, and their children report the nearest captured ancestor as {@code parentRef}.
 */
public final class FingerprintWalker {

    /**
     * Classpath resource, relative to this class.
     */
    public static final String RESOURCE = "fingerprint-walker.js";

    /**
     * Prefix of every ref the walker assigns.
     */
    public static final String REF_PREFIX = "s1e";

    private static final String SOURCE = load();

    private FingerprintWalker() {
    }

    /**
     * @return walker script, trimmed, ready to be prefixed with {@code return }
     */
    public static String source() {
        return SOURCE;
    }

    private static String load() {
        try (InputStream in = FingerprintWalker.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Walker script not found on classpath: " + RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read walker script: " + RESOURCE, e);
        }
    }
}
