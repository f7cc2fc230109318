package com.dnagraph.core.graph;

import com.dnagraph.core.model.Scope;

/**
 * Thrown when the same decision ID is loaded twice. Fatal: nothing is computed
 * over a graph with ambiguous identity.
 */
public class IdCollisionException extends RuntimeException {

    private final String decisionId;

    public IdCollisionException(String decisionId, Scope first, Scope second) {
        super("ID collision — " + decisionId + " exists in both "
                + first.value() + " and " + second.value());
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
