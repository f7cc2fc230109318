package com.dnagraph.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEnumsTest {

    @Test
    @DisplayName("states parse from their lowercase names only")
    void stateLookup() {
        assertEquals(DecisionState.COMMITTED, DecisionState.fromValue("committed").orElseThrow());
        assertTrue(DecisionState.fromValue("Committed").isEmpty());
        assertTrue(DecisionState.fromValue("draft").isEmpty());
        assertTrue(DecisionState.fromValue(null).isEmpty());
    }

    @Test
    @DisplayName("stakes parse from their lowercase names only")
    void stakesLookup() {
        assertEquals(Stakes.HIGH, Stakes.fromValue("high").orElseThrow());
        assertTrue(Stakes.fromValue("critical").isEmpty());
    }

    @Test
    @DisplayName("levels 1-4 map to their names, anything else is invalid")
    void levels() {
        assertEquals("Identity", DecisionLevel.fromRank(1).orElseThrow().displayName());
        assertEquals("Tactics", DecisionLevel.fromRank(4).orElseThrow().displayName());
        assertFalse(DecisionLevel.isValid(0));
        assertFalse(DecisionLevel.isValid(5));
        assertFalse(DecisionLevel.isValid(null));
    }

    @Test
    @DisplayName("draft defaults to suggested in the project partition")
    void draftDefaults() {
        var draft = new DecisionDraft("DEC-001", "T", null, 1, null, null, null, null);
        assertEquals("suggested", draft.state());
        assertEquals(Scope.PROJECT, draft.scope());
        assertTrue(draft.dependsOn().isEmpty());
    }
}
