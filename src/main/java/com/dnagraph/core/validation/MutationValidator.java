package com.dnagraph.core.validation;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionDraft;
import com.dnagraph.core.model.DecisionLevel;
import com.dnagraph.core.model.DecisionState;
import com.dnagraph.core.model.Scope;
import com.dnagraph.core.model.Stakes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a proposed creation or single-field update against the current graph
 * before anything is written.
 * <p>
 * A mutation may proceed only when the returned errors are empty. Cycle checks
 * reason about the graph as it would exist after the change.
 */
@Service
public class MutationValidator {

    private static final Logger log = LoggerFactory.getLogger(MutationValidator.class);

    public static final Pattern ID_PATTERN = Pattern.compile("^DEC-\\d{3}$");

    public static final List<String> SETTABLE_FIELDS = List.of("state", "depends_on", "level", "stakes", "title");

    /**
     * Pre-validates a new decision.
     */
    public ValidationResult validateForCreate(DecisionDraft draft, DecisionGraph graph) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        String nid = draft.id();

        if (nid == null || !ID_PATTERN.matcher(nid).matches()) {
            errors.add(nid + ": ID must match DEC-NNN (3 digits)");
        }
        graph.find(nid).ifPresent(existing -> errors.add(nid + ": ID already exists at "
                + (existing.filePath() != null ? existing.filePath() : existing.scope().value())));

        if (draft.title() == null || draft.title().isBlank()) {
            errors.add(nid + ": title cannot be empty");
        }
        if (!DecisionLevel.isValid(draft.level())) {
            errors.add(GraphValidator.invalidLevel(nid, draft.level()));
        }
        if (DecisionState.fromValue(draft.state()).isEmpty()) {
            errors.add(GraphValidator.invalidState(nid, draft.state()));
        }
        if (draft.stakes() != null && Stakes.fromValue(draft.stakes()).isEmpty()) {
            errors.add(GraphValidator.invalidStakes(nid, draft.stakes()));
        }

        checkDependencies(nid, draft.level(), draft.scope(), draft.dependsOn(), graph, errors, warnings);

        if (DecisionState.COMMITTED.value().equals(draft.state())) {
            for (String dep : draft.dependsOn()) {
                graph.find(dep)
                        .filter(d -> !d.isCommitted())
                        .ifPresent(d -> errors.add(nid + ": cannot create as committed — upstream "
                                + dep + " is '" + d.stateOrUnknown() + "'"));
            }
        }

        if (!draft.dependsOn().isEmpty() && errors.isEmpty()) {
            var adjacency = CycleDetector.adjacency(graph, null);
            adjacency.put(nid, new HashSet<>(draft.dependsOn()));
            for (String dep : new LinkedHashSet<>(draft.dependsOn())) {
                if (CycleDetector.reaches(adjacency, dep, nid)) {
                    errors.add(nid + ": adding this node would create a cycle through " + dep);
                }
            }
        }

        log.debug("Create pre-validation for {}: {} errors, {} warnings", nid, errors.size(), warnings.size());
        return new ValidationResult(errors, warnings);
    }

    /**
     * Pre-validates an update of one field on an existing decision.
     *
     * @param value typed value: {@code String} for state, stakes and title,
     *              {@code Integer} for level, {@code List<String>} for depends_on
     */
    public ValidationResult validateForSet(String nid, String field, Object value, DecisionGraph graph) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        var found = graph.find(nid);
        if (found.isEmpty()) {
            errors.add(nid + ": not found in graph");
            return new ValidationResult(errors, warnings);
        }
        Decision node = found.get();

        switch (field == null ? "" : field) {
            case "state" -> validateState(node, value, graph, errors);
            case "depends_on" -> validateDependsOn(node, value, graph, errors, warnings);
            case "level" -> validateLevel(node, value, graph, errors, warnings);
            case "stakes" -> {
                String stakes = value == null ? null : value.toString();
                if (Stakes.fromValue(stakes).isEmpty()) {
                    errors.add(GraphValidator.invalidStakes(nid, stakes));
                }
            }
            case "title" -> {
                if (value == null || value.toString().isBlank()) {
                    errors.add(nid + ": title cannot be empty");
                }
            }
            default -> errors.add("Unknown field: " + field + " (valid: " + String.join(", ", SETTABLE_FIELDS) + ")");
        }

        log.debug("Set pre-validation for {}.{}: {} errors, {} warnings", nid, field, errors.size(), warnings.size());
        return new ValidationResult(errors, warnings);
    }

    private void validateState(Decision node, Object value, DecisionGraph graph, List<String> errors) {
        String oldState = node.state() != null ? node.state() : DecisionState.SUGGESTED.value();
        String newState = value == null ? null : value.toString();
        StateTransitions.check(oldState, newState).ifPresent(msg -> errors.add(node.id() + ": " + msg));

        if (DecisionState.COMMITTED.value().equals(newState) && errors.isEmpty()) {
            for (String dep : graph.resolvedDeps(node.id())) {
                Decision upstream = graph.require(dep);
                if (!upstream.isCommitted()) {
                    errors.add(node.id() + ": cannot commit — upstream " + dep + " is '" + upstream.stateOrUnknown() + "'");
                }
            }
        }
    }

    private void validateDependsOn(Decision node, Object value, DecisionGraph graph,
                                   List<String> errors, List<String> warnings) {
        List<String> deps = toIdList(value);
        String nid = node.id();
        checkDependencies(nid, node.level(), node.scope(), deps, graph, errors, warnings);

        if (!deps.isEmpty() && errors.isEmpty()) {
            // the node's current outgoing edges are replaced, not extended
            Map<String, Set<String>> adjacency = CycleDetector.adjacency(graph, nid);
            adjacency.put(nid, new HashSet<>(deps));
            for (String dep : new LinkedHashSet<>(deps)) {
                if (CycleDetector.reaches(adjacency, dep, nid)) {
                    errors.add(nid + ": this change would create a cycle through " + dep);
                }
            }
        }
    }

    private void validateLevel(Decision node, Object value, DecisionGraph graph,
                               List<String> errors, List<String> warnings) {
        Integer level = value instanceof Integer i ? i : null;
        if (!DecisionLevel.isValid(level)) {
            errors.add(GraphValidator.invalidLevel(node.id(), value));
            return;
        }
        for (String dep : graph.resolvedDeps(node.id())) {
            Integer depLevel = graph.require(dep).level();
            if (depLevel != null && depLevel > level) {
                warnings.add(GraphValidator.levelInversion(node.id(), level, dep, depLevel));
            }
        }
    }

    /**
     * Existence, self-reference, level ordering and scope isolation of a proposed dependency list.
     */
    private void checkDependencies(String nid, Integer level, Scope scope, List<String> deps,
                                   DecisionGraph graph, List<String> errors, List<String> warnings) {
        for (String dep : deps) {
            if (dep.equals(nid)) {
                errors.add(nid + ": self-dependency");
            } else if (!graph.contains(dep)) {
                errors.add(nid + ": depends_on references non-existent " + dep);
            } else {
                Integer depLevel = graph.require(dep).level();
                if (depLevel != null && level != null && depLevel > level) {
                    warnings.add(GraphValidator.levelInversion(nid, level, dep, depLevel));
                }
            }
        }

        if (scope == Scope.CONSTITUTION) {
            for (String dep : deps) {
                graph.find(dep)
                        .filter(d -> d.scope() == Scope.PROJECT)
                        .ifPresent(d -> errors.add(GraphValidator.ironRule(nid, dep)));
            }
        }
    }

    private static List<String> toIdList(Object value) {
        var ids = new ArrayList<String>();
        if (value instanceof List<?> list) {
            for (Object o : list) {
                if (o != null && !o.toString().isBlank()) ids.add(o.toString().trim());
            }
        }
        return ids;
    }
}
