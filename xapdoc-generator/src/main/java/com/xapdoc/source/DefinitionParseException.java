package com.xapdoc.source;

/**
 * Thrown when a definition source is not a valid structured document.
 */
public class DefinitionParseException extends DefinitionSourceException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DefinitionParseException(String message) {
        super(message);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause parser failure
     */
    public DefinitionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
