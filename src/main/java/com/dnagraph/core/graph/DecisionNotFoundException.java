package com.dnagraph.core.graph;

/**
 * Thrown when an operation names a decision that is not in the graph.
 */
public class DecisionNotFoundException extends RuntimeException {

    private final String decisionId;

    public DecisionNotFoundException(String decisionId) {
        super(decisionId + " not found in graph");
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
