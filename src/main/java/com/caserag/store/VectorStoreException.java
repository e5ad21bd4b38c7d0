package com.caserag.store;

/**
 * Raised when the store cannot be opened or a read or write against it fails. Never replaced by an
 * empty result.
 */
public class VectorStoreException extends RuntimeException {
    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
