package com.dnagraph.core.model;

import java.util.Optional;

/**
 * Lifecycle state of a decision. Superseded is terminal.
 */
public enum DecisionState {
    SUGGESTED,
    COMMITTED,
    SUPERSEDED;

    /** Lowercase form used in frontmatter. */
    public String value() {
        return name().toLowerCase();
    }

    public static Optional<DecisionState> fromValue(String value) {
        if (value == null) return Optional.empty();
        for (DecisionState state : values()) {
            if (state.value().equals(value)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
