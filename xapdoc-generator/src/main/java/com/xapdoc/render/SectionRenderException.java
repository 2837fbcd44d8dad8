package com.xapdoc.render;

/**
 * Thrown when a section cannot be rendered because its source definitions are malformed.
 */
public class SectionRenderException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public SectionRenderException(String message) {
        super(message);
    }
}
