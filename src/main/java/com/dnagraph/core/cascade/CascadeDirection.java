package com.dnagraph.core.cascade;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * DOWNSTREAM follows dependents (what a change affects); UPSTREAM follows
 * dependencies (what constrains a node).
 */
public enum CascadeDirection {
    DOWNSTREAM,
    UPSTREAM;

    public static CascadeDirection of(boolean reverse) {
        return reverse ? UPSTREAM : DOWNSTREAM;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
