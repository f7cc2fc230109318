package com.dnagraph.core.report;

import java.util.Arrays;
import java.util.Optional;

/** Audience of a compile manifest. */
public enum ManifestTarget {
    HUMAN,
    AGENT;

    public String value() {
        return name().toLowerCase();
    }

    public static Optional<ManifestTarget> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value().equals(value)).findFirst();
    }
}
