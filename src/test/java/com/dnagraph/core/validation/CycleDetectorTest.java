package com.dnagraph.core.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.dnagraph.core.DecisionFixtures.graph;
import static com.dnagraph.core.DecisionFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    @Test
    @DisplayName("an acyclic graph has no cycles")
    void acyclic() {
        var g = graph(project("DEC-001", 1, "committed"),
                project("DEC-002", 2, "suggested", "DEC-001"),
                project("DEC-003", 3, "suggested", "DEC-001", "DEC-002"));
        assertTrue(CycleDetector.findCycles(g).isEmpty());
    }

    @Test
    @DisplayName("two disjoint cycles are both found")
    void disjointCycles() {
        var g = graph(project("DEC-001", 1, "suggested", "DEC-002"),
                project("DEC-002", 1, "suggested", "DEC-001"),
                project("DEC-003", 1, "suggested", "DEC-004"),
                project("DEC-004", 1, "suggested", "DEC-003"));

        assertEquals(List.of(
                List.of("DEC-001", "DEC-002", "DEC-001"),
                List.of("DEC-003", "DEC-004", "DEC-003")), CycleDetector.findCycles(g));
    }

    @Test
    @DisplayName("the cycle path starts where the back-edge target appears")
    void cycleBelowRoot() {
        var g = graph(project("DEC-001", 1, "suggested", "DEC-002"),
                project("DEC-002", 1, "suggested", "DEC-003"),
                project("DEC-003", 1, "suggested", "DEC-002"));

        assertEquals(List.of(List.of("DEC-002", "DEC-003", "DEC-002")), CycleDetector.findCycles(g));
    }

    @Test
    @DisplayName("dangling references are ignored")
    void danglingIgnored() {
        var g = graph(project("DEC-001", 1, "suggested", "DEC-404"));
        assertTrue(CycleDetector.findCycles(g).isEmpty());
    }

    @Test
    @DisplayName("reaches follows edges transitively")
    void reaches() {
        Map<String, Set<String>> adj = Map.of("A", Set.of("B"), "B", Set.of("C"), "C", Set.of());
        assertTrue(CycleDetector.reaches(adj, "A", "C"));
        assertFalse(CycleDetector.reaches(adj, "C", "A"));
        assertTrue(CycleDetector.reaches(adj, "A", "A"));
    }

    @Test
    @DisplayName("reaches treats a node missing from the adjacency as a leaf")
    void reachesMissingNode() {
        Map<String, Set<String>> adj = Map.of("A", Set.of("B"));
        assertFalse(CycleDetector.reaches(adj, "A", "C"));
        assertFalse(CycleDetector.reaches(adj, "X", "A"));
    }

    @Test
    @DisplayName("adjacency can leave out one node's outgoing edges")
    void adjacencyExclusion() {
        var g = graph(project("DEC-001", 1, "committed"),
                project("DEC-002", 2, "suggested", "DEC-001"));

        assertEquals(Set.of("DEC-001"), CycleDetector.adjacency(g, null).get("DEC-002"));
        assertFalse(CycleDetector.adjacency(g, "DEC-002").containsKey("DEC-002"));
    }
}
