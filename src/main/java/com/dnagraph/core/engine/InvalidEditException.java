package com.dnagraph.core.engine;

/**
 * Thrown when an edit's old text does not identify exactly one location in a decision body.
 */
public class InvalidEditException extends RuntimeException {

    private final String decisionId;

    public InvalidEditException(String decisionId, String message) {
        super(message);
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
