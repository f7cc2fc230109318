package com.dnagraph.core.model;

import java.util.Optional;

/**
 * Optional stakes rating of a decision.
 */
public enum Stakes {
    HIGH,
    MEDIUM,
    LOW;

    public String value() {
        return name().toLowerCase();
    }

    public static Optional<Stakes> fromValue(String value) {
        if (value == null) return Optional.empty();
        for (Stakes stakes : values()) {
            if (stakes.value().equals(value)) {
                return Optional.of(stakes);
            }
        }
        return Optional.empty();
    }
}
