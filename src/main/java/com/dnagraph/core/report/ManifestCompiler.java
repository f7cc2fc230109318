package com.dnagraph.core.report;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionLevel;
import com.dnagraph.core.model.DecisionState;
import com.dnagraph.core.model.Scope;
import com.dnagraph.core.model.Stakes;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Produces the deterministic skeleton a contract is compiled from. The same graph always
 * yields the same manifest.
 */
@Service
public class ManifestCompiler {

    public HumanManifest human(DecisionGraph graph) {
        var levels = new LinkedHashMap<String, HumanManifest.LevelSection>();
        for (DecisionLevel level : DecisionLevel.values()) {
            var committed = new ArrayList<ManifestEntry>();
            var suggested = new ArrayList<ManifestEntry>();
            for (Decision n : graph.decisions()) {
                if (n.level() == null || n.level() != level.rank()) continue;
                if (n.isCommitted()) committed.add(ManifestEntry.of(n));
                else if (n.isIn(DecisionState.SUGGESTED)) suggested.add(ManifestEntry.of(n));
            }
            levels.put(String.valueOf(level.rank()),
                    new HumanManifest.LevelSection(level.displayName(), List.copyOf(committed), List.copyOf(suggested)));
        }
        return new HumanManifest(ManifestTarget.HUMAN.value(), levels, counts(graph));
    }

    public AgentManifest agent(DecisionGraph graph) {
        var constitution = new ArrayList<ManifestEntry>();
        var highStakes = new ArrayList<ManifestEntry>();
        var committed = new ArrayList<ManifestEntry>();
        var suggested = new ArrayList<ManifestEntry>();
        for (Decision n : graph.decisions()) {
            ManifestEntry entry = ManifestEntry.of(n);
            if (n.scope() == Scope.CONSTITUTION) constitution.add(entry);
            if (Stakes.HIGH.value().equals(n.stakes())) highStakes.add(entry);
            if (n.isCommitted()) committed.add(entry);
            else if (n.isIn(DecisionState.SUGGESTED)) suggested.add(entry);
        }
        return new AgentManifest(ManifestTarget.AGENT.value(), List.copyOf(constitution), List.copyOf(highStakes),
                List.copyOf(committed), List.copyOf(suggested), counts(graph));
    }

    ManifestCounts counts(DecisionGraph graph) {
        Map<String, Long> byLevel = graph.decisions().stream()
                .collect(Collectors.groupingBy(
                        d -> d.level() != null ? String.valueOf(d.level()) : "?",
                        TreeMap::new, Collectors.counting()));
        return new ManifestCounts(graph.size(),
                count(graph, DecisionState.COMMITTED),
                count(graph, DecisionState.SUGGESTED),
                count(graph, DecisionState.SUPERSEDED),
                byLevel);
    }

    public String renderHuman(HumanManifest manifest) {
        var lines = new ArrayList<String>();
        lines.add("# Compile Manifest — Human Contract");
        lines.add("");
        manifest.levels().forEach((rank, section) -> {
            lines.add("## " + section.name() + " (Level " + rank + ")");
            lines.add("");
            section.committed().forEach(d -> lines.add("  - " + d.id() + ": " + d.title() + d.stakesTag()));
            if (!section.suggested().isEmpty()) {
                lines.add("  Suggested:");
                section.suggested().forEach(d -> lines.add("  - " + d.id() + ": " + d.title() + d.stakesTag()));
            }
            lines.add("");
        });
        lines.add(totalLine(manifest.counts()));
        return String.join("\n", lines);
    }

    public String renderAgent(AgentManifest manifest) {
        var lines = new ArrayList<String>();
        lines.add("# Compile Manifest — Agent Contract");
        lines.add("");
        lines.add("## Constitution (" + manifest.constitution().size() + " decisions)");
        manifest.constitution().forEach(d -> lines.add("  - " + d.id() + ": " + d.title() + " [" + d.state() + "]"));
        lines.add("");
        lines.add("## High Stakes (" + manifest.highStakes().size() + " decisions)");
        manifest.highStakes().forEach(d -> lines.add("  - " + d.id() + ": " + d.title() + " [" + d.state() + "]"));
        lines.add("");
        lines.add("## All Committed (" + manifest.allCommitted().size() + " decisions)");
        manifest.allCommitted().forEach(d -> lines.add("  - " + d.id() + ": " + d.title() + d.stakesTag()));
        lines.add("");
        if (!manifest.allSuggested().isEmpty()) {
            lines.add("## All Suggested (" + manifest.allSuggested().size() + " decisions)");
            manifest.allSuggested().forEach(d -> lines.add("  - " + d.id() + ": " + d.title() + d.stakesTag()));
            lines.add("");
        }
        lines.add(totalLine(manifest.counts()));
        return String.join("\n", lines);
    }

    private static String totalLine(ManifestCounts counts) {
        return "Total: " + counts.total() + " decisions (" + counts.committed() + " committed, "
                + counts.suggested() + " suggested)";
    }

    private static long count(DecisionGraph graph, DecisionState state) {
        return graph.decisions().stream().filter(d -> d.isIn(state)).count();
    }
}
