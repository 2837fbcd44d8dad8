package com.xapdoc.sink;

/**
 * Receives finished documents.
 */
public interface DocumentSink {

    /**
     * Stores a document, replacing any previous content under the same name.
     *
     * @param fileName document name, e.g. {@code xap_0.1.0.md}
     * @param content full document text
     * @throws DocumentWriteException if the document cannot be stored
     */
    void write(String fileName, String content);
}
