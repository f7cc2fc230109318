package com.dnagraph.dispatch.cli;

import com.dnagraph.core.cascade.CascadeDirection;
import com.dnagraph.core.cascade.CascadeEngine;
import com.dnagraph.core.frontier.FrontierAnalyzer;
import com.dnagraph.core.frontier.FrontierEntry;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.report.SearchResult;
import com.dnagraph.core.scratchpad.ScratchpadEntry;
import com.dnagraph.core.scratchpad.ScratchpadService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dnagraph.core.DecisionFixtures.constitution;
import static com.dnagraph.core.DecisionFixtures.graph;
import static com.dnagraph.core.DecisionFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class ReportFormatterTest {

    private static DecisionGraph sample() {
        return graph(
                constitution("DEC-001", 1, "committed"),
                project("DEC-002", 2, "suggested", "DEC-001"),
                project("DEC-003", 3, "suggested", "DEC-002"),
                project("DEC-004", 4, "suggested", "DEC-003"));
    }

    @Test
    @DisplayName("cascade table lists waves and totals")
    void cascadeTable() {
        var result = new CascadeEngine().cascade(sample(), "DEC-001", CascadeDirection.DOWNSTREAM);
        List<String> lines = ReportFormatter.cascadeTable(result);

        assertTrue(lines.contains("=== Wave 1 ==="));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("DEC-002") && l.endsWith("depends on DEC-001 [cross-dir]")));
        assertEquals("Total: 3 decisions need review across 3 wave(s).", lines.get(lines.size() - 1));
    }

    @Test
    @DisplayName("empty cascades say so in either direction")
    void emptyCascade() {
        var engine = new CascadeEngine();
        assertEquals(List.of("No downstream dependents for DEC-004."),
                ReportFormatter.cascadeTable(engine.cascade(sample(), "DEC-004", CascadeDirection.DOWNSTREAM)));
        assertEquals(List.of("No upstream dependencies for DEC-001."),
                ReportFormatter.cascadeTable(engine.cascade(sample(), "DEC-001", CascadeDirection.UPSTREAM)));
    }

    @Test
    @DisplayName("cascade markdown titles the start node")
    void cascadeMarkdown() {
        var g = sample();
        var result = new CascadeEngine().cascade(g, "DEC-004", CascadeDirection.UPSTREAM);
        List<String> lines = ReportFormatter.cascadeMarkdown(result, g);

        assertEquals("### Upstream: DEC-004 — Title of DEC-004", lines.get(0));
        assertTrue(lines.contains("**3 upstream decisions** across 3 wave(s)."));
    }

    @Test
    @DisplayName("critical path ends at the blocked decision")
    void criticalPath() {
        var report = new FrontierAnalyzer().analyze(sample(), 10);
        FrontierEntry blocked = report.blocked().stream().filter(e -> e.id().equals("DEC-004")).findFirst().orElseThrow();

        assertEquals("DEC-002 → DEC-003 → DEC-004", ReportFormatter.criticalPath(blocked));
    }

    @Test
    @DisplayName("frontier table has every section")
    void frontierTable() {
        List<String> lines = ReportFormatter.frontierTable(new FrontierAnalyzer().analyze(sample(), 2));

        assertEquals("Decision Frontier — 4 decisions, 3 suggested, 1 committable, 2 blocked", lines.get(0));
        assertTrue(lines.contains("=== Committable Now (1) ==="));
        assertTrue(lines.contains("=== Blocked (2) ==="));
        assertTrue(lines.contains("=== Level Gaps ==="));
        assertTrue(lines.contains("=== High-Weight Nodes (top 2) ==="));
    }

    @Test
    @DisplayName("search and scratchpad tables handle empty results")
    void emptyTables() {
        assertEquals(List.of("No decisions match: kafka"),
                ReportFormatter.searchTable(new SearchResult(List.of("kafka"), 0, List.of())));
        assertEquals(List.of("Scratchpad is empty."),
                ReportFormatter.scratchpadTable(new ScratchpadService.Listing(List.of(), List.of())));
    }

    @Test
    @DisplayName("matured scratchpad entries show their decision")
    void maturedEntries() {
        var matured = new ScratchpadEntry("SP-001", "idea", "Cache", "2025-01-01", List.of(), "DEC-002");
        List<String> lines = ReportFormatter.scratchpadTable(new ScratchpadService.Listing(List.of(), List.of(matured)));

        assertTrue(lines.contains("  SP-001 [idea] → DEC-002"));
    }
}
