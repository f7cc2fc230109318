package com.dnagraph.core.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StateTransitionsTest {

    @ParameterizedTest(name = "{0} → {1} is legal")
    @CsvSource({
            "suggested, committed",
            "suggested, superseded",
            "committed, superseded",
            "suggested, suggested",
            "committed, committed",
            "superseded, superseded"
    })
    void legal(String from, String to) {
        assertTrue(StateTransitions.isLegal(from, to));
        assertEquals(Optional.empty(), StateTransitions.check(from, to));
    }

    @ParameterizedTest(name = "{0} → {1} is illegal")
    @CsvSource({
            "committed, suggested",
            "superseded, suggested",
            "superseded, committed",
            "suggested, draft",
            "draft, committed"
    })
    void illegal(String from, String to) {
        assertFalse(StateTransitions.isLegal(from, to));
    }

    @Test
    @DisplayName("the message names both states")
    void message() {
        assertEquals(Optional.of("Illegal state transition: committed → suggested"),
                StateTransitions.check("committed", "suggested"));
    }
}
