package com.dnagraph.dispatch.cli;

import com.dnagraph.core.cascade.CascadeDirection;
import com.dnagraph.core.cascade.CascadeEffect;
import com.dnagraph.core.cascade.CascadeResult;
import com.dnagraph.core.cascade.CascadeWave;
import com.dnagraph.core.frontier.FrontierEntry;
import com.dnagraph.core.frontier.FrontierReport;
import com.dnagraph.core.frontier.LevelGap;
import com.dnagraph.core.frontier.WeightedNode;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.report.SearchHit;
import com.dnagraph.core.report.SearchResult;
import com.dnagraph.core.scratchpad.ScratchpadEntry;
import com.dnagraph.core.scratchpad.ScratchpadService;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text and markdown renderings of query results. JSON output goes through Jackson instead.
 */
final class ReportFormatter {

    private static final String NONE = "—";

    private ReportFormatter() {}

    // cascade

    static List<String> cascadeTable(CascadeResult result) {
        boolean upstream = result.direction() == CascadeDirection.UPSTREAM;
        var out = new ArrayList<String>();
        if (result.isEmpty()) {
            out.add((upstream ? "No upstream dependencies for " : "No downstream dependents for ")
                    + result.startNode() + ".");
            return out;
        }
        for (CascadeWave wave : result.waves()) {
            out.add("");
            out.add("=== Wave " + wave.wave() + " ===");
            out.add(String.format("%-12s %-14s Reason", "Node", "State"));
            out.add("-".repeat(60));
            for (CascadeEffect e : wave.effects()) {
                out.add(String.format("%-12s %-14s %s%s", e.node(), e.currentState(), e.reason(), crossTag(e)));
            }
        }
        out.add("");
        out.add("Total: " + totalLabel(result) + " across " + result.summary().waveCount() + " wave(s).");
        return out;
    }

    static List<String> cascadeMarkdown(CascadeResult result, DecisionGraph graph) {
        boolean upstream = result.direction() == CascadeDirection.UPSTREAM;
        String startTitle = graph.find(result.startNode())
                .map(d -> d.title() != null ? d.title() : "(no title)")
                .orElse("(no title)");
        var out = new ArrayList<String>();
        out.add("### " + (upstream ? "Upstream" : "Cascade") + ": " + result.startNode() + " — " + startTitle);
        out.add("");
        if (result.isEmpty()) {
            out.add(upstream ? "No upstream dependencies." : "No downstream dependents.");
            return out;
        }
        out.add("**" + totalLabel(result) + "** across " + result.summary().waveCount() + " wave(s).");
        out.add("");
        for (CascadeWave wave : result.waves()) {
            out.add("#### Wave " + wave.wave());
            out.add("");
            out.add("| Node | Title | State | Reason |");
            out.add("|------|-------|-------|--------|");
            for (CascadeEffect e : wave.effects()) {
                String title = graph.find(e.node()).map(d -> d.titleOrEmpty()).orElse("?");
                out.add("| " + e.node() + " | " + title + " | " + e.currentState() + " | " + e.reason() + crossTag(e) + " |");
            }
            out.add("");
        }
        return out;
    }

    private static String totalLabel(CascadeResult result) {
        return result.direction() == CascadeDirection.UPSTREAM
                ? result.summary().uniqueAffected() + " upstream decisions"
                : result.summary().totalAffected() + " decisions need review";
    }

    private static String crossTag(CascadeEffect e) {
        return e.crossScope() ? " [cross-dir]" : "";
    }

    // frontier

    static List<String> frontierTable(FrontierReport report) {
        var s = report.summary();
        var out = new ArrayList<String>();
        out.add("Decision Frontier — " + s.totalDecisions() + " decisions, " + s.suggested() + " suggested, "
                + s.committableCount() + " committable, " + s.blockedCount() + " blocked");

        out.add("");
        out.add("=== Committable Now (" + report.committable().size() + ") ===");
        if (report.committable().isEmpty()) {
            out.add("  None — all suggested decisions have uncommitted upstream.");
        } else {
            out.add(String.format("%-12s %-7s %-8s %-8s Title", "ID", "Level", "Stakes", "Weight"));
            out.add("-".repeat(70));
            for (FrontierEntry c : report.committable()) {
                out.add(String.format("%-12s %-7s %-8s %-8d %s", c.id(), level(c.level()), orNone(c.stakes()),
                        c.downstreamWeight(), c.title()));
            }
        }

        out.add("");
        out.add("=== Blocked (" + report.blocked().size() + ") ===");
        if (report.blocked().isEmpty()) {
            out.add("  None — all suggested decisions are committable.");
        } else {
            out.add(String.format("%-12s %-7s %-10s %-25s Critical Path", "ID", "Level", "Path Len", "Blockers"));
            out.add("-".repeat(90));
            for (FrontierEntry b : report.blocked()) {
                out.add(String.format("%-12s %-7s %-10d %-25s %s", b.id(), level(b.level()), b.criticalPathLength(),
                        String.join(", ", b.blockers()), criticalPath(b)));
            }
        }

        out.add("");
        out.add("=== Level Gaps ===");
        out.add(String.format("%-8s %-12s %-11s %-11s Flags", "Level", "Name", "Committed", "Suggested"));
        out.add("-".repeat(60));
        for (LevelGap g : report.levelGaps()) {
            out.add(String.format("%-8s %-12s %-11d %-11d %s", "L" + g.level(), g.levelName(), g.committed(),
                    g.suggested(), flags(g)));
        }

        out.add("");
        out.add("=== High-Weight Nodes (top " + report.topN() + ") ===");
        if (!report.highWeight().isEmpty()) {
            out.add(String.format("%-12s %-7s %-12s %-8s Title", "ID", "Level", "State", "Weight"));
            out.add("-".repeat(70));
            for (WeightedNode w : report.highWeight()) {
                out.add(String.format("%-12s %-7s %-12s %-8d %s", w.id(), level(w.level()), w.state(),
                        w.downstreamWeight(), w.title()));
            }
        }
        return out;
    }

    static List<String> frontierMarkdown(FrontierReport report) {
        var s = report.summary();
        var out = new ArrayList<String>();
        out.add("# Decision Frontier");
        out.add("");
        out.add("**" + s.totalDecisions() + " decisions** — " + s.suggested() + " suggested, "
                + s.committableCount() + " committable, " + s.blockedCount() + " blocked");
        out.add("");

        out.add("## Committable Now");
        out.add("");
        if (report.committable().isEmpty()) {
            out.add("None — all suggested decisions have uncommitted upstream.");
        } else {
            out.add("| ID | Title | Level | Stakes | Downstream |");
            out.add("|----|-------|-------|--------|------------|");
            for (FrontierEntry c : report.committable()) {
                out.add("| " + c.id() + " | " + c.title() + " | " + level(c.level()) + " | " + orNone(c.stakes())
                        + " | " + c.downstreamWeight() + " |");
            }
        }
        out.add("");

        out.add("## Blocked");
        out.add("");
        if (report.blocked().isEmpty()) {
            out.add("None — all suggested decisions are committable.");
        } else {
            out.add("| ID | Title | Level | Blockers | Critical Path |");
            out.add("|----|-------|-------|----------|---------------|");
            for (FrontierEntry b : report.blocked()) {
                out.add("| " + b.id() + " | " + b.title() + " | " + level(b.level()) + " | "
                        + String.join(", ", b.blockers()) + " | " + criticalPath(b) + " |");
            }
        }
        out.add("");

        out.add("## Level Gaps");
        out.add("");
        out.add("| Level | Name | Committed | Suggested | Flags |");
        out.add("|-------|------|-----------|-----------|-------|");
        for (LevelGap g : report.levelGaps()) {
            out.add("| L" + g.level() + " | " + g.levelName() + " | " + g.committed() + " | " + g.suggested()
                    + " | " + flags(g) + " |");
        }
        out.add("");

        out.add("## High-Weight Nodes (top " + report.topN() + ")");
        out.add("");
        out.add("| ID | Title | Level | State | Downstream |");
        out.add("|----|-------|-------|-------|------------|");
        for (WeightedNode w : report.highWeight()) {
            out.add("| " + w.id() + " | " + w.title() + " | " + level(w.level()) + " | " + w.state() + " | "
                    + w.downstreamWeight() + " |");
        }
        return out;
    }

    /** Critical path followed by the blocked decision itself, e.g. {@code B → C → D}. */
    static String criticalPath(FrontierEntry entry) {
        if (entry.criticalPath() == null || entry.criticalPath().isEmpty()) {
            return NONE;
        }
        return String.join(" → ", entry.criticalPath()) + " → " + entry.id();
    }

    private static String flags(LevelGap gap) {
        return gap.flags().isEmpty() ? NONE : String.join(", ", gap.flags());
    }

    // search

    static List<String> searchTable(SearchResult result) {
        String query = String.join(" ", result.query());
        var out = new ArrayList<String>();
        if (result.results().isEmpty()) {
            out.add("No decisions match: " + query);
            return out;
        }
        out.add("Found " + result.count() + " decision(s) matching: " + query);
        out.add("");
        out.add(String.format("%-12s %-7s %-12s %-30s Title", "ID", "Level", "State", "Sections"));
        out.add("-".repeat(90));
        for (SearchHit hit : result.results()) {
            String sections = hit.matchedSections().isEmpty() ? NONE : String.join(", ", hit.matchedSections());
            out.add(String.format("%-12s %-7s %-12s %-30s %s", hit.id(), level(hit.level()), hit.state(), sections,
                    hit.title()));
        }
        return out;
    }

    // scratchpad

    static List<String> scratchpadTable(ScratchpadService.Listing listing) {
        var out = new ArrayList<String>();
        if (listing.isEmpty()) {
            out.add("Scratchpad is empty.");
            return out;
        }
        if (!listing.active().isEmpty()) {
            out.add("Active (" + listing.active().size() + "):");
            out.add(String.format("%-10s %-12s %-12s Content", "ID", "Type", "Created"));
            out.add("-".repeat(70));
            for (ScratchpadEntry e : listing.active()) {
                String links = e.links().isEmpty() ? "" : " → " + String.join(", ", e.links());
                out.add(String.format("%-10s %-12s %-12s %s%s", e.id(), e.type(), e.created(), e.content(), links));
            }
        }
        if (!listing.matured().isEmpty()) {
            out.add("");
            out.add("Matured (" + listing.matured().size() + "):");
            for (ScratchpadEntry e : listing.matured()) {
                out.add("  " + e.id() + " [" + e.type() + "] → " + e.maturedTo());
            }
        }
        return out;
    }

    private static String level(Integer level) {
        return "L" + (level != null ? level : "?");
    }

    private static String orNone(String value) {
        return value != null && !value.isEmpty() ? value : NONE;
    }
}
