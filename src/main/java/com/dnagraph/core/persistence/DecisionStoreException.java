package com.dnagraph.core.persistence;

/**
 * Thrown when decision files, the scratchpad or the lint config cannot be read or written.
 */
public class DecisionStoreException extends RuntimeException {

    public DecisionStoreException(String message) {
        super(message);
    }

    public DecisionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
