package com.dnagraph.core.report;

import com.dnagraph.core.config.DnaProperties;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionState;
import com.dnagraph.core.model.Scope;
import com.dnagraph.core.persistence.AtomicFiles;
import com.dnagraph.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Regenerates {@code HEALTH.md}: node counts per partition, flagged items, and any
 * hand-written {@code ## Manual Flags} section carried over from the previous file.
 */
@Service
public class HealthReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(HealthReportGenerator.class);

    private static final Pattern MANUAL_FLAGS =
            Pattern.compile("^## Manual Flags\\s*\\n(.*?)(?=^## |\\z)", Pattern.MULTILINE | Pattern.DOTALL);

    private final DnaProperties properties;

    public HealthReportGenerator(DnaProperties properties) {
        this.properties = properties;
    }

    public record HealthSummary(Path path, int decisions, List<String> flagged) {}

    public HealthSummary write(DecisionGraph graph, ValidationResult validation) {
        Path path = properties.healthPath();
        String manualFlags = readManualFlags(path);
        List<String> flagged = flaggedItems(graph, validation);
        AtomicFiles.writeString(path, render(graph, flagged, manualFlags, LocalDate.now()));
        log.info("HEALTH.md updated: {} decisions, {} flagged items", graph.size(), flagged.size());
        return new HealthSummary(path, graph.size(), flagged);
    }

    public String render(DecisionGraph graph, List<String> flagged, String manualFlags, LocalDate today) {
        List<Decision> constitution = IndexGenerator.partition(graph, Scope.CONSTITUTION);
        List<Decision> project = IndexGenerator.partition(graph, Scope.PROJECT);

        var lines = new ArrayList<String>();
        lines.add("# System Health");
        lines.add("");
        lines.add("Last updated: " + today);
        lines.add("");
        lines.add("## Node Counts");
        lines.add("");

        if (!constitution.isEmpty()) {
            lines.add("### Constitution");
            lines.add("- Decisions: " + constitution.size() + " — " + stateSummary(constitution));
            lines.add("- Levels: " + levelSummary(constitution));
            lines.add("");
            lines.add("### DNA");
        }
        lines.add("- Decisions: " + project.size() + " — " + stateSummary(project));
        lines.add("- Levels: " + levelSummary(project));
        lines.add("- **Total: " + graph.size() + " decisions**");
        lines.add("");

        lines.add("## Flagged Items");
        lines.add("");
        if (flagged.isEmpty()) {
            lines.add("- No issues found.");
        } else {
            flagged.forEach(item -> lines.add("- " + item));
        }
        lines.add("");

        if (manualFlags != null && !manualFlags.isBlank()) {
            lines.add("## Manual Flags");
            lines.add("");
            lines.add(manualFlags);
            lines.add("");
        }

        lines.add("## Last Session");
        lines.add("");
        lines.add(today + " — Health regenerated by dna-graph");
        lines.add("");
        return String.join("\n", lines);
    }

    public List<String> flaggedItems(DecisionGraph graph, ValidationResult validation) {
        var flagged = new ArrayList<String>();
        for (DecisionState state : List.of(DecisionState.SUGGESTED, DecisionState.SUPERSEDED)) {
            List<String> ids = graph.decisions().stream().filter(d -> d.isIn(state)).map(Decision::id).toList();
            if (!ids.isEmpty()) {
                flagged.add(ids.size() + " decisions at `" + state.value() + "` (" + String.join(", ", ids) + ")");
            }
        }
        if (validation.hasErrors()) {
            flagged.add(validation.errors().size() + " validation error(s) — run `dna-graph validate` for details");
        }
        return flagged;
    }

    /**
     * Body of the {@code ## Manual Flags} section of an existing health file, trimmed; empty when absent.
     */
    public String readManualFlags(Path healthFile) {
        if (!Files.exists(healthFile)) {
            return "";
        }
        return extractManualFlags(AtomicFiles.readString(healthFile));
    }

    static String extractManualFlags(String content) {
        Matcher m = MANUAL_FLAGS.matcher(content);
        return m.find() ? m.group(1).strip() : "";
    }

    static String stateSummary(Collection<Decision> decisions) {
        if (decisions.isEmpty()) {
            return "—";
        }
        Map<String, Long> counts = decisions.stream()
                .collect(Collectors.groupingBy(Decision::stateOrUnknown, TreeMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> (e.getValue() == decisions.size() ? "all" : String.valueOf(e.getValue()))
                        + " `" + e.getKey() + "`")
                .collect(Collectors.joining(", "));
    }

    static String levelSummary(Collection<Decision> decisions) {
        Map<String, Long> counts = decisions.stream()
                .collect(Collectors.groupingBy(HealthReportGenerator::levelKey, TreeMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> "L" + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }

    private static String levelKey(Decision d) {
        if (d.level() != null) return String.valueOf(d.level());
        return d.rawLevel() != null ? d.rawLevel() : "?";
    }
}
