package com.dnagraph.core.validation;

import com.dnagraph.core.model.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.dnagraph.core.DecisionFixtures.decision;
import static com.dnagraph.core.DecisionFixtures.graph;
import static com.dnagraph.core.DecisionFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class BodyLinterTest {

    private static List<String> lint(LintConfig config, String body) {
        var node = decision("DEC-005", 2, "suggested", Scope.PROJECT, body);
        var g = graph(node, project("DEC-001", 1, "committed"), project("DEC-002", 1, "superseded"));
        return new BodyLinter(config).lint(node, g);
    }

    @Test
    @DisplayName("an empty body produces nothing")
    void emptyBody() {
        assertEquals(List.of(), lint(LintConfig.empty(), ""));
    }

    @Test
    @DisplayName("stale INF and CTX IDs are counted once each")
    void staleRefs() {
        var warnings = lint(null, "See INF-002, INF-001 and INF-002. Also CTX-007.");
        assertEquals(List.of(
                "DEC-005 [stale-ref]: body references 2 stale INF ID(s) (INF-001, INF-002)",
                "DEC-005 [stale-ref]: body references 1 stale CTX ID(s) (CTX-007)"), warnings);
    }

    @Test
    @DisplayName("references to unknown decisions are broken; self and known ones are fine")
    void brokenRefs() {
        var warnings = lint(null, "DEC-005 builds on DEC-001 and DEC-077, DEC-042.");
        assertEquals(List.of("DEC-005 [broken-ref]: body references non-existent DEC-042, DEC-077"), warnings);
    }

    @Test
    @DisplayName("a supersession claim on a live decision is flagged")
    void supersession() {
        var warnings = lint(null, "This supersedes DEC-001.\nSupersede DEC-002 as well.");
        assertEquals(List.of("DEC-005 [supersession]: claims to supersede DEC-001, but DEC-001 state is 'committed'"),
                warnings);
    }

    @Test
    @DisplayName("flagged terms are counted per line unless exempted")
    void terminology() {
        var config = new LintConfig(new LintConfig.Terminology("service", List.of("legacy"), null), null);
        var warnings = lint(config, "The Service boundary.\nA legacy service stays.\nservice mesh\nservices plural");
        assertEquals(List.of("DEC-005 [terminology]: 2 line(s) with unexempted 'service' in body text"), warnings);
    }

    @Test
    @DisplayName("exempt decisions skip the terminology scan")
    void terminologyExemptId() {
        var config = new LintConfig(new LintConfig.Terminology("service", null, Set.of("DEC-005")), null);
        assertEquals(List.of(), lint(config, "service"));
    }

    @Test
    @DisplayName("deleted artifacts report their label or pattern")
    void deletedArtifacts() {
        var config = new LintConfig(null, List.of(
                new LintConfig.DeletedArtifact("old-gateway", "Old gateway"),
                new LintConfig.DeletedArtifact("billing\\.v1", null),
                new LintConfig.DeletedArtifact("unused", null)));
        var warnings = lint(config, "Routes through old-gateway into billing.v1.");
        assertEquals(List.of("DEC-005 [deleted-artifact]: body references deleted artifacts: Old gateway, billing\\.v1"),
                warnings);
    }
}
