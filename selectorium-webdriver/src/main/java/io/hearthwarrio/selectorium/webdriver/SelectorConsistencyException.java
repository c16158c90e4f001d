package io.hearthwarrio.selectorium.webdriver;

/**
 * Thrown when a selector reported as unique no longer resolves to exactly one element,
 * or when a ref cannot be mapped to a single element.
 */
public class SelectorConsistencyException extends RuntimeException {
    public SelectorConsistencyException(String message) {
        super(message);
    }
}
