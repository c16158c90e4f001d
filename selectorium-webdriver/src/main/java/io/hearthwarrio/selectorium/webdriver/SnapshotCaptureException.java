package io.hearthwarrio.selectorium.webdriver;

/**
 * Thrown when the in-page walker or probe script cannot be executed or returns an unexpected shape.
 */
public class SnapshotCaptureException extends RuntimeException {
    public SnapshotCaptureException(String message) {
        super(message);
    }

    public SnapshotCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
