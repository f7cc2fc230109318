package com.dnagraph.core.model;

/**
 * Partition a decision was loaded from. Project decisions may depend on
 * constitution decisions, never the reverse.
 */
public enum Scope {
    CONSTITUTION,
    PROJECT;

    public String value() {
        return name().toLowerCase();
    }
}
