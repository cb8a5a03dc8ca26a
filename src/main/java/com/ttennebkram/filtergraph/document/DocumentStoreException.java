package com.ttennebkram.filtergraph.document;

/**
 * Thrown when the document store refuses a mutation.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
