package com.xapdoc.source;

/**
 * Thrown when definition sources cannot be located or read.
 */
public class DefinitionSourceException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DefinitionSourceException(String message) {
        super(message);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public DefinitionSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
