package com.dnagraph.core.validation;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionLevel;
import com.dnagraph.core.model.DecisionState;
import com.dnagraph.core.model.Scope;
import com.dnagraph.core.model.Stakes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Runs the full battery of whole-graph checks and collects every finding.
 * <p>
 * No check short-circuits another: a single run surfaces the complete defect list.
 * Nodes are visited in ID order so output is deterministic.
 */
@Service
public class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    public static final List<String> REQUIRED_SECTIONS = List.of("Decision", "Reasoning", "Assumptions", "Tradeoffs");

    private static final List<Pattern> SECTION_HEADINGS = REQUIRED_SECTIONS.stream()
            .map(s -> Pattern.compile("^## " + Pattern.quote(s) + "\\s*$", Pattern.MULTILINE))
            .toList();

    public ValidationResult validate(DecisionGraph graph) {
        return validate(graph, LintConfig.empty());
    }

    public ValidationResult validate(DecisionGraph graph, LintConfig lintConfig) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        for (Decision n : graph.decisions()) {
            checkFields(n, errors, warnings);
            checkReferences(n, graph, errors);
            checkSections(n, warnings);
        }

        for (List<String> cycle : CycleDetector.findCycles(graph)) {
            errors.add("Cycle detected: " + String.join(" → ", cycle));
        }

        Set<String> orphans = checkOrphans(graph, warnings);
        checkLevelOrdering(graph, warnings);
        checkIronRule(graph, errors);
        checkStateHealth(graph, errors);

        var linter = new BodyLinter(lintConfig);
        for (Decision n : graph.decisions()) {
            warnings.addAll(linter.lint(n, graph));
        }

        checkMissingDeps(graph, orphans, warnings);

        log.debug("Validated {} decisions: {} errors, {} warnings", graph.size(), errors.size(), warnings.size());
        return new ValidationResult(errors, warnings);
    }

    private void checkFields(Decision n, List<String> errors, List<String> warnings) {
        String nid = n.id();
        if (!nid.startsWith("DEC-")) {
            errors.add(nid + ": ID must start with DEC-");
        }
        if (n.title() == null || n.title().isBlank()) {
            warnings.add(nid + ": missing title");
        }
        if (n.date() == null || n.date().isBlank()) {
            warnings.add(nid + ": missing date");
        }

        if (n.rawLevel() == null) {
            errors.add(nid + ": missing level");
        } else if (!DecisionLevel.isValid(n.level())) {
            errors.add(invalidLevel(nid, n.rawLevel()));
        }

        if (n.state() == null) {
            warnings.add(nid + ": missing state");
        } else if (n.lifecycleState().isEmpty()) {
            errors.add(invalidState(nid, n.state()));
        }

        if (n.stakes() != null && Stakes.fromValue(n.stakes()).isEmpty()) {
            errors.add(invalidStakes(nid, n.stakes()));
        }
    }

    private void checkReferences(Decision n, DecisionGraph graph, List<String> errors) {
        for (String dep : n.dependsOn()) {
            if (!graph.contains(dep)) {
                errors.add(n.id() + ": depends_on references non-existent " + dep);
            }
        }
    }

    private void checkSections(Decision n, List<String> warnings) {
        for (int i = 0; i < REQUIRED_SECTIONS.size(); i++) {
            if (!SECTION_HEADINGS.get(i).matcher(n.body()).find()) {
                warnings.add(n.id() + ": missing required section ## " + REQUIRED_SECTIONS.get(i));
            }
        }
    }

    private Set<String> checkOrphans(DecisionGraph graph, List<String> warnings) {
        var orphans = new HashSet<String>();
        for (Decision n : graph.decisions()) {
            if (n.dependsOn().isEmpty() && graph.getDependents(n.id()).isEmpty()) {
                orphans.add(n.id());
                warnings.add(n.id() + ": orphan (no upstream or downstream edges)");
            }
        }
        return orphans;
    }

    private void checkLevelOrdering(DecisionGraph graph, List<String> warnings) {
        for (Decision n : graph.decisions()) {
            if (n.level() == null) continue;
            for (String dep : graph.resolvedDeps(n.id())) {
                Integer depLevel = graph.require(dep).level();
                if (depLevel != null && depLevel > n.level()) {
                    warnings.add(levelInversion(n.id(), n.level(), dep, depLevel));
                }
            }
        }
    }

    private void checkIronRule(DecisionGraph graph, List<String> errors) {
        for (Decision n : graph.decisions()) {
            if (n.scope() != Scope.CONSTITUTION) continue;
            for (String dep : graph.resolvedDeps(n.id())) {
                if (graph.require(dep).scope() == Scope.PROJECT) {
                    errors.add(ironRule(n.id(), dep));
                }
            }
        }
    }

    private void checkStateHealth(DecisionGraph graph, List<String> errors) {
        for (Decision n : graph.decisions()) {
            if (!n.isCommitted()) continue;
            for (String dep : graph.resolvedDeps(n.id())) {
                Decision upstream = graph.require(dep);
                if (upstream.isIn(DecisionState.SUPERSEDED)) {
                    errors.add(n.id() + ": committed but upstream " + dep + " is superseded");
                } else if (upstream.isIn(DecisionState.SUGGESTED)) {
                    errors.add(n.id() + ": committed but upstream " + dep + " is still suggested");
                }
            }
        }
    }

    private void checkMissingDeps(DecisionGraph graph, Set<String> orphans, List<String> warnings) {
        for (Decision n : graph.decisions()) {
            Integer level = n.level();
            if (level != null && level >= 2 && n.dependsOn().isEmpty() && !orphans.contains(n.id())) {
                warnings.add(n.id() + " [missing-dep]: no depends_on — L" + level
                        + " decisions should have upstream dependencies");
            }
        }
    }

    // Messages shared with the mutation pre-validators

    static String invalidLevel(String nid, Object level) {
        return nid + ": invalid level '" + level + "' (must be 1-4)";
    }

    static String invalidState(String nid, String state) {
        return nid + ": invalid state '" + state + "' (must be suggested/committed/superseded)";
    }

    static String invalidStakes(String nid, String stakes) {
        return nid + ": invalid stakes '" + stakes + "' (must be high/medium/low)";
    }

    static String levelInversion(String nid, int level, String dep, int depLevel) {
        return nid + " (level " + level + "): depends on " + dep + " (level " + depLevel + ") — level inversion";
    }

    static String ironRule(String nid, String dep) {
        return nid + ": constitution depends on project " + dep + " (iron rule violation)";
    }
}
