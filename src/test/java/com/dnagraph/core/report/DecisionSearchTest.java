package com.dnagraph.core.report;

import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.dnagraph.core.DecisionFixtures.FULL_BODY;
import static com.dnagraph.core.DecisionFixtures.decision;
import static com.dnagraph.core.DecisionFixtures.graph;
import static com.dnagraph.core.DecisionFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class DecisionSearchTest {

    private final DecisionSearch search = new DecisionSearch();

    private static final String KAFKA_BODY = """

            ## Decision

            Adopt Kafka for the event bus.

            ## Reasoning

            Replay matters.

            ## Tradeoffs

            Kafka is heavy to operate.
            """;

    @Test
    @DisplayName("matches are case-insensitive and name the sections they hit")
    void sections() {
        var g = graph(decision("DEC-001", 2, "suggested", Scope.PROJECT, KAFKA_BODY), project("DEC-002", 1, "committed"));

        var result = search.search(g, List.of("KAFKA"));

        assertEquals(1, result.count());
        var hit = result.results().get(0);
        assertEquals("DEC-001", hit.id());
        assertEquals(List.of("Decision", "Tradeoffs"), hit.matchedSections());
        assertEquals(List.of("kafka"), result.query());
    }

    @Test
    @DisplayName("terms are OR-matched and titles count")
    void orMatching() {
        var g = graph(decision("DEC-001", 2, "suggested", Scope.PROJECT, KAFKA_BODY),
                new Decision("DEC-002", "Postgres everywhere", "2025-01-15", 1, "1", "committed", null,
                        List.of(), Scope.CONSTITUTION, null, FULL_BODY));

        var result = search.search(g, List.of("postgres", "replay"));

        assertEquals(List.of("DEC-001", "DEC-002"), result.results().stream().map(SearchHit::id).toList());
        assertEquals(List.of("Reasoning"), result.results().get(0).matchedSections());
        assertEquals(List.of("title"), result.results().get(1).matchedSections());
        assertEquals("constitution", result.results().get(1).scope());
    }

    @Test
    @DisplayName("blank terms match nothing")
    void blankTerms() {
        var result = search.search(graph(project("DEC-001", 1, "committed")), List.of(" "));
        assertEquals(0, result.count());
    }

    @Test
    @DisplayName("section text stops at the next level-two heading")
    void sectionText() {
        String reasoning = DecisionSearch.sectionText(KAFKA_BODY, "Reasoning").orElseThrow();
        assertEquals("Replay matters.", reasoning.strip());
        assertEquals(Optional.empty(), DecisionSearch.sectionText(KAFKA_BODY, "Assumptions"));
    }
}
