package com.dnagraph.core.frontier;

import com.dnagraph.core.graph.DecisionGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.dnagraph.core.DecisionFixtures.graph;
import static com.dnagraph.core.DecisionFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class FrontierAnalyzerTest {

    private final FrontierAnalyzer analyzer = new FrontierAnalyzer();

    // DEC-001 committed
    // DEC-002 suggested -> DEC-001           (committable)
    // DEC-003 suggested -> DEC-002           (blocked by 002)
    // DEC-004 suggested -> DEC-003           (blocked, chain 002, 003)
    // DEC-005 suggested, no deps             (committable)
    // DEC-006 superseded
    private static DecisionGraph chain() {
        return graph(
                project("DEC-001", 1, "committed"),
                project("DEC-002", 2, "suggested", "DEC-001"),
                project("DEC-003", 3, "suggested", "DEC-002"),
                project("DEC-004", 4, "suggested", "DEC-003"),
                project("DEC-005", 2, "suggested"),
                project("DEC-006", 4, "superseded", "DEC-001"));
    }

    // ── Partition ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Committable and blocked")
    class Partition {

        @Test
        @DisplayName("every suggested node is exactly one of committable or blocked")
        void partitionIsComplete() {
            var report = analyzer.analyze(chain(), FrontierAnalyzer.DEFAULT_TOP);

            var committable = report.committable().stream().map(FrontierEntry::id).toList();
            var blocked = report.blocked().stream().map(FrontierEntry::id).toList();
            var union = new HashSet<>(committable);
            union.addAll(blocked);

            assertEquals(Set.of("DEC-002", "DEC-003", "DEC-004", "DEC-005"), union);
            assertEquals(committable.size() + blocked.size(), union.size());
            assertEquals(4, report.summary().suggested());
        }

        @Test
        @DisplayName("committable is ordered by downstream weight, then level")
        void committableOrder() {
            var report = analyzer.analyze(chain(), FrontierAnalyzer.DEFAULT_TOP);

            assertEquals(List.of("DEC-002", "DEC-005"),
                    report.committable().stream().map(FrontierEntry::id).toList());
            assertEquals(2, report.committable().get(0).downstreamWeight());
            assertNull(report.committable().get(0).blockers());
        }

        @Test
        @DisplayName("blocked entries carry blockers and a critical path, shortest path first")
        void blockedEntries() {
            var report = analyzer.analyze(chain(), FrontierAnalyzer.DEFAULT_TOP);

            var first = report.blocked().get(0);
            assertEquals("DEC-003", first.id());
            assertEquals(List.of("DEC-002"), first.blockers());
            assertEquals(List.of("DEC-002"), first.criticalPath());

            var second = report.blocked().get(1);
            assertEquals("DEC-004", second.id());
            assertEquals(List.of("DEC-003"), second.blockers());
            assertEquals(2, second.criticalPathLength());
        }
    }

    // ── Critical path ────────────────────────────────────────────────

    @Nested
    @DisplayName("Critical path")
    class CriticalPath {

        @Test
        @DisplayName("runs from the deepest uncommitted ancestor down to the target")
        void deepestFirst() {
            // A committed <- B suggested <- C suggested <- D suggested
            var g = graph(
                    project("DEC-001", 1, "committed"),
                    project("DEC-002", 2, "suggested", "DEC-001"),
                    project("DEC-003", 3, "suggested", "DEC-002"),
                    project("DEC-004", 4, "suggested", "DEC-003"));

            assertEquals(List.of("DEC-002", "DEC-003"), analyzer.criticalPath(g, "DEC-004"));
        }

        @Test
        @DisplayName("stops at committed nodes")
        void committedStops() {
            var g = graph(
                    project("DEC-001", 1, "suggested"),
                    project("DEC-002", 2, "committed", "DEC-001"),
                    project("DEC-003", 3, "suggested", "DEC-002"));

            assertEquals(List.of(), analyzer.criticalPath(g, "DEC-003"));
        }

        @Test
        @DisplayName("of two equally deep branches the first discovered wins")
        void tieBreak() {
            var g = graph(
                    project("DEC-001", 1, "suggested"),
                    project("DEC-002", 1, "suggested"),
                    project("DEC-003", 2, "suggested", "DEC-002", "DEC-001"));

            assertEquals(List.of("DEC-002"), analyzer.criticalPath(g, "DEC-003"));
        }
    }

    @Test
    @DisplayName("transitive downstream counts every descendant once")
    void transitiveDownstream() {
        var downstream = analyzer.transitiveDownstream(chain());

        assertEquals(Set.of("DEC-002", "DEC-003", "DEC-004", "DEC-006"), downstream.get("DEC-001"));
        assertEquals(Set.of("DEC-004"), downstream.get("DEC-003"));
        assertEquals(Set.of(), downstream.get("DEC-005"));
    }

    @Test
    @DisplayName("level gaps flag levels without commitments or dominated by suggestions")
    void levelGaps() {
        var gaps = analyzer.analyze(chain(), FrontierAnalyzer.DEFAULT_TOP).levelGaps();

        assertEquals(4, gaps.size());
        assertEquals(List.of(), gaps.get(0).flags());
        assertEquals(List.of(LevelGap.MORE_SUGGESTED, LevelGap.NONE_COMMITTED), gaps.get(1).flags());
        assertEquals(2, gaps.get(3).total());
        assertEquals(1, gaps.get(3).superseded());
    }

    @Test
    @DisplayName("high weight honours the top limit")
    void highWeight() {
        var report = analyzer.analyze(chain(), 2);

        assertEquals(List.of("DEC-001", "DEC-002"),
                report.highWeight().stream().map(WeightedNode::id).toList());
        assertEquals(4, report.highWeight().get(0).downstreamWeight());
    }

    @Test
    @DisplayName("an empty graph gives an empty report")
    void emptyGraph() {
        var report = analyzer.analyze(DecisionGraph.empty(), 5);

        assertTrue(report.committable().isEmpty());
        assertTrue(report.blocked().isEmpty());
        assertTrue(report.highWeight().isEmpty());
        assertEquals(0, report.summary().levelGapCount());
    }
}
