package com.xapdoc.service;

/**
 * Thrown when the documentation subtree cannot be assembled into a document.
 */
public class DocumentAssemblyException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DocumentAssemblyException(String message) {
        super(message);
    }
}
