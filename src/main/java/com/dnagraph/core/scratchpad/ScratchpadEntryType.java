package com.dnagraph.core.scratchpad;

import java.util.Arrays;
import java.util.Optional;

public enum ScratchpadEntryType {
    CONCERN,
    CONSTRAINT,
    IDEA,
    QUESTION;

    public String value() {
        return name().toLowerCase();
    }

    public static Optional<ScratchpadEntryType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value().equals(value)).findFirst();
    }
}
