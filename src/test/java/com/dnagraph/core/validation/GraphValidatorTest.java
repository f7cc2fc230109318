package com.dnagraph.core.validation;

import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dnagraph.core.DecisionFixtures.FULL_BODY;
import static com.dnagraph.core.DecisionFixtures.constitution;
import static com.dnagraph.core.DecisionFixtures.decision;
import static com.dnagraph.core.DecisionFixtures.graph;
import static com.dnagraph.core.DecisionFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator();

    // ── Structure ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("a three-node cycle is reported once, starting at the lowest ID")
        void threeNodeCycle() {
            var result = validator.validate(graph(
                    project("DEC-001", 1, "suggested", "DEC-002"),
                    project("DEC-002", 1, "suggested", "DEC-003"),
                    project("DEC-003", 1, "suggested", "DEC-001")));

            assertEquals(List.of("Cycle detected: DEC-001 → DEC-002 → DEC-003 → DEC-001"), result.errors());
        }

        @Test
        @DisplayName("removing one edge of the loop clears the cycle error")
        void brokenCycle() {
            var result = validator.validate(graph(
                    project("DEC-001", 1, "suggested"),
                    project("DEC-002", 1, "suggested", "DEC-003"),
                    project("DEC-003", 1, "suggested", "DEC-001")));

            assertTrue(result.errors().stream().noneMatch(e -> e.startsWith("Cycle detected")));
        }

        @Test
        @DisplayName("a self-reference is reported as a cycle")
        void selfReference() {
            var result = validator.validate(graph(project("DEC-001", 1, "suggested", "DEC-001")));
            assertEquals(List.of("Cycle detected: DEC-001 → DEC-001"), result.errors());
        }

        @Test
        @DisplayName("dangling references are errors")
        void danglingReference() {
            var result = validator.validate(graph(project("DEC-001", 1, "suggested", "DEC-404")));
            assertEquals(List.of("DEC-001: depends_on references non-existent DEC-404"), result.errors());
        }

        @Test
        @DisplayName("a graph with no edges has no errors, only orphan warnings")
        void noEdges() {
            var result = validator.validate(graph(
                    project("DEC-001", 1, "suggested"),
                    project("DEC-002", 3, "committed")));

            assertTrue(result.errors().isEmpty());
            assertEquals(List.of(
                    "DEC-001: orphan (no upstream or downstream edges)",
                    "DEC-002: orphan (no upstream or downstream edges)"), result.warnings());
        }

        @Test
        @DisplayName("a minimal well-formed pair validates clean")
        void cleanPair() {
            var result = validator.validate(graph(
                    project("DEC-001", 1, "committed"),
                    project("DEC-002", 2, "suggested", "DEC-001")));

            assertTrue(result.isClean(), () -> result.toString());
        }
    }

    // ── Fields ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        @DisplayName("invalid level, state and stakes are errors")
        void invalidValues() {
            var bad = new Decision("DEC-001", "T", "2025-01-15", null, "7", "draft", "huge",
                    List.of(), Scope.PROJECT, null, FULL_BODY);
            var result = validator.validate(graph(bad));

            assertTrue(result.errors().contains("DEC-001: invalid level '7' (must be 1-4)"));
            assertTrue(result.errors().contains("DEC-001: invalid state 'draft' (must be suggested/committed/superseded)"));
            assertTrue(result.errors().contains("DEC-001: invalid stakes 'huge' (must be high/medium/low)"));
        }

        @Test
        @DisplayName("missing title, date and state are warnings; missing level is an error")
        void missingFields() {
            var bare = new Decision("DEC-001", null, null, null, null, null, null,
                    List.of(), Scope.PROJECT, null, FULL_BODY);
            var result = validator.validate(graph(bare));

            assertEquals(List.of("DEC-001: missing level"), result.errors());
            assertTrue(result.warnings().contains("DEC-001: missing title"));
            assertTrue(result.warnings().contains("DEC-001: missing date"));
            assertTrue(result.warnings().contains("DEC-001: missing state"));
        }

        @Test
        @DisplayName("IDs must carry the DEC- prefix")
        void idPrefix() {
            var result = validator.validate(graph(project("ADR-001", 1, "suggested")));
            assertTrue(result.errors().contains("ADR-001: ID must start with DEC-"));
        }

        @Test
        @DisplayName("each missing body section is a warning")
        void missingSections() {
            var node = decision("DEC-001", 1, "suggested", Scope.PROJECT, "\n## Decision\n\nX\n");
            var result = validator.validate(graph(node));

            assertTrue(result.warnings().contains("DEC-001: missing required section ## Reasoning"));
            assertTrue(result.warnings().contains("DEC-001: missing required section ## Assumptions"));
            assertTrue(result.warnings().contains("DEC-001: missing required section ## Tradeoffs"));
            assertFalse(result.warnings().contains("DEC-001: missing required section ## Decision"));
        }
    }

    // ── Hierarchy and state ──────────────────────────────────────────

    @Nested
    @DisplayName("Hierarchy and state")
    class HierarchyAndState {

        @Test
        @DisplayName("constitution depending on project breaks the iron rule")
        void ironRule() {
            var result = validator.validate(graph(
                    constitution("DEC-001", 1, "suggested", "DEC-002"),
                    project("DEC-002", 1, "suggested")));

            assertEquals(List.of("DEC-001: constitution depends on project DEC-002 (iron rule violation)"),
                    result.errors());
        }

        @Test
        @DisplayName("project depending on constitution is allowed")
        void projectOnConstitution() {
            var result = validator.validate(graph(
                    constitution("DEC-001", 1, "committed"),
                    project("DEC-002", 2, "suggested", "DEC-001")));
            assertTrue(result.errors().isEmpty());
        }

        @Test
        @DisplayName("depending on a deeper level is a level inversion warning")
        void levelInversion() {
            var result = validator.validate(graph(
                    project("DEC-001", 3, "committed"),
                    project("DEC-002", 1, "suggested", "DEC-001")));

            assertTrue(result.warnings().contains(
                    "DEC-002 (level 1): depends on DEC-001 (level 3) — level inversion"));
            assertTrue(result.errors().isEmpty());
        }

        @Test
        @DisplayName("committed on top of suggested or superseded is an error")
        void committedOnUnsettledUpstream() {
            var result = validator.validate(graph(
                    project("DEC-001", 1, "suggested"),
                    project("DEC-002", 1, "superseded"),
                    project("DEC-003", 2, "committed", "DEC-001", "DEC-002")));

            assertEquals(List.of(
                    "DEC-003: committed but upstream DEC-001 is still suggested",
                    "DEC-003: committed but upstream DEC-002 is superseded"), result.errors());
        }

        @Test
        @DisplayName("non-orphan L2+ nodes without depends_on get a missing-dep warning")
        void missingDependency() {
            var result = validator.validate(graph(
                    project("DEC-001", 2, "suggested"),
                    project("DEC-002", 2, "suggested", "DEC-001")));

            assertTrue(result.warnings().contains(
                    "DEC-001 [missing-dep]: no depends_on — L2 decisions should have upstream dependencies"));
        }
    }

    @Test
    @DisplayName("lint findings are appended as warnings")
    void includesLint() {
        var node = decision("DEC-001", 1, "committed", Scope.PROJECT, FULL_BODY + "\nSee DEC-099.\n");
        var dependent = project("DEC-002", 2, "suggested", "DEC-001");
        var result = validator.validate(graph(node, dependent), LintConfig.empty());

        assertEquals(List.of("DEC-001 [broken-ref]: body references non-existent DEC-099"), result.warnings());
    }

    @Test
    @DisplayName("running twice gives identical output")
    void deterministic() {
        var g = graph(
                project("DEC-003", 2, "committed", "DEC-001"),
                project("DEC-001", 1, "suggested", "DEC-404"),
                project("DEC-002", 4, "suggested"));
        assertEquals(validator.validate(g), validator.validate(g));
    }
}
