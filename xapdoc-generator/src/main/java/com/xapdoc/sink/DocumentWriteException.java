package com.xapdoc.sink;

/**
 * Thrown when a generated document cannot be written.
 */
public class DocumentWriteException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying I/O failure
     */
    public DocumentWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
