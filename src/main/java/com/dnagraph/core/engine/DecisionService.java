package com.dnagraph.core.engine;

import com.dnagraph.core.cascade.CascadeDirection;
import com.dnagraph.core.cascade.CascadeEngine;
import com.dnagraph.core.cascade.CascadeResult;
import com.dnagraph.core.config.DnaProperties;
import com.dnagraph.core.frontier.FrontierAnalyzer;
import com.dnagraph.core.frontier.FrontierReport;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.graph.GraphLoader;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionDraft;
import com.dnagraph.core.model.DecisionRecord;
import com.dnagraph.core.model.Scope;
import com.dnagraph.core.persistence.DecisionRepository;
import com.dnagraph.core.validation.GraphValidator;
import com.dnagraph.core.validation.LintConfig;
import com.dnagraph.core.validation.LintConfigLoader;
import com.dnagraph.core.validation.MutationValidator;
import com.dnagraph.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Entry point for every graph operation. Each call re-reads the partitions from disk,
 * so results always reflect the files as they are now.
 * <p>
 * Mutations are pre-validated against the loaded graph and written only when the
 * validation has no errors. Body edits are the exception: they are checked for a
 * unique match, written, and then reported as a before/after validation delta.
 */
@Service
public class DecisionService {

    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    static final String SCAFFOLD_BODY = """

            ## Decision



            ## Reasoning



            ## Assumptions



            ## Tradeoffs

            """;

    private final DnaProperties properties;
    private final DecisionRepository repository;
    private final GraphLoader graphLoader;
    private final GraphValidator graphValidator;
    private final MutationValidator mutationValidator;
    private final CascadeEngine cascadeEngine;
    private final FrontierAnalyzer frontierAnalyzer;
    private final LintConfigLoader lintConfigLoader;

    public DecisionService(DnaProperties properties,
                           DecisionRepository repository,
                           GraphLoader graphLoader,
                           GraphValidator graphValidator,
                           MutationValidator mutationValidator,
                           CascadeEngine cascadeEngine,
                           FrontierAnalyzer frontierAnalyzer,
                           LintConfigLoader lintConfigLoader) {
        this.properties = properties;
        this.repository = repository;
        this.graphLoader = graphLoader;
        this.graphValidator = graphValidator;
        this.mutationValidator = mutationValidator;
        this.cascadeEngine = cascadeEngine;
        this.frontierAnalyzer = frontierAnalyzer;
        this.lintConfigLoader = lintConfigLoader;
    }

    /**
     * @throws com.dnagraph.core.graph.IdCollisionException if an ID occurs twice across the partitions
     */
    public DecisionGraph loadGraph() {
        List<DecisionRecord> constitution = repository.loadPartition(Scope.CONSTITUTION);
        List<DecisionRecord> project = repository.loadPartition(Scope.PROJECT);
        return graphLoader.load(constitution, project);
    }

    public LintConfig lintConfig() {
        return lintConfigLoader.load(properties.configPath());
    }

    public ValidationResult validate() {
        return validate(loadGraph());
    }

    public ValidationResult validate(DecisionGraph graph) {
        return graphValidator.validate(graph, lintConfig());
    }

    public CascadeResult cascade(String id, boolean reverse) {
        return cascade(loadGraph(), id, reverse);
    }

    /**
     * @throws com.dnagraph.core.graph.DecisionNotFoundException if the start node is not in the graph
     */
    public CascadeResult cascade(DecisionGraph graph, String id, boolean reverse) {
        return cascadeEngine.cascade(graph, id, CascadeDirection.of(reverse));
    }

    public FrontierReport frontier(int top) {
        return frontierAnalyzer.analyze(loadGraph(), top);
    }

    /**
     * Pre-validates and writes a new decision with an empty section scaffold.
     * The draft's date defaults to today.
     */
    public MutationOutcome<Decision> create(DecisionDraft draft) {
        if (draft.date() == null) {
            draft = new DecisionDraft(draft.id(), draft.title(), LocalDate.now().toString(), draft.level(),
                    draft.state(), draft.stakes(), draft.dependsOn(), draft.scope());
        }
        DecisionGraph graph = loadGraph();
        ValidationResult result = mutationValidator.validateForCreate(draft, graph);

        Path file = repository.pathFor(draft.id(), draft.scope());
        if (!result.hasErrors() && Files.exists(file)) {
            result = new ValidationResult(List.of(draft.id() + ": file already exists at " + file), result.warnings());
        }
        if (result.hasErrors()) {
            log.info("Create of {} rejected with {} error(s)", draft.id(), result.errors().size());
            return MutationOutcome.rejected(draft.id(), result);
        }

        var fields = new LinkedHashMap<String, Object>();
        fields.put("id", draft.id());
        fields.put("title", draft.title());
        fields.put("date", draft.date());
        fields.put("level", draft.level());
        fields.put("state", draft.state());
        fields.put("stakes", draft.stakes());
        fields.put("depends_on", draft.dependsOn());
        repository.write(file, fields, SCAFFOLD_BODY);

        log.info("Created {} (level {}, {}) in {}", draft.id(), draft.level(), draft.state(), draft.scope().value());
        Decision created = new Decision(draft.id(), draft.title(), draft.date(), draft.level(),
                String.valueOf(draft.level()), draft.state(), draft.stakes(), draft.dependsOn(), draft.scope(),
                file, SCAFFOLD_BODY);
        return new MutationOutcome<>(draft.id(), result, null, created, file);
    }

    /**
     * Updates one frontmatter field from its command-line text form.
     * {@code depends_on} takes a comma-separated list or {@code []}; {@code level} takes an integer.
     */
    public MutationOutcome<Object> set(String id, String field, String rawValue) {
        Object value;
        try {
            value = coerce(field, rawValue);
        } catch (NumberFormatException e) {
            return MutationOutcome.rejected(id, new ValidationResult(
                    List.of(id + ": level must be a number, got '" + rawValue + "'"), List.of()));
        }

        DecisionGraph graph = loadGraph();
        ValidationResult result = mutationValidator.validateForSet(id, field, value, graph);
        if (result.hasErrors()) {
            log.info("Set {}.{} rejected with {} error(s)", id, field, result.errors().size());
            return MutationOutcome.rejected(id, result);
        }

        Decision node = graph.require(id);
        DecisionRecord current = repository.read(node.filePath(), node.scope());
        Map<String, Object> fields = new LinkedHashMap<>(current.fields());
        Object previous = fields.put(field, value);
        repository.write(node.filePath(), fields, current.body());

        log.info("{}: {} {} -> {}", id, field, previous, value);
        return new MutationOutcome<>(id, result, previous, value, node.filePath());
    }

    /**
     * Replaces {@code oldText} with {@code newText} in a decision body. The old text must occur
     * exactly once. The edit is persisted even when it introduces validation errors; the
     * returned report says so.
     *
     * @throws com.dnagraph.core.graph.DecisionNotFoundException if the decision does not exist
     * @throws InvalidEditException if the old text is empty, missing or ambiguous
     */
    public EditReport edit(String id, String oldText, String newText) {
        DecisionGraph before = loadGraph();
        Decision node = before.require(id);
        DecisionRecord current = repository.read(node.filePath(), node.scope());
        String body = current.body();

        if (oldText == null || oldText.isEmpty()) {
            throw new InvalidEditException(id, "old text must not be empty");
        }
        int matches = countOccurrences(body, oldText);
        if (matches == 0) {
            throw new InvalidEditException(id, "old text not found in body of " + id);
        }
        if (matches > 1) {
            throw new InvalidEditException(id, "old text matches " + matches + " locations in " + id
                    + " body — must be unique");
        }

        LintConfig lint = lintConfig();
        ValidationResult pre = graphValidator.validate(before, lint);

        int at = body.indexOf(oldText);
        String replacement = newText == null ? "" : newText;
        String newBody = body.substring(0, at) + replacement + body.substring(at + oldText.length());
        repository.write(node.filePath(), current.fields(), newBody);

        ValidationResult post = graphValidator.validate(loadGraph(), lint);
        var report = new EditReport(id, oldText.length(), replacement.length(),
                difference(post.warnings(), pre.warnings()),
                difference(pre.warnings(), post.warnings()),
                difference(post.errors(), pre.errors()));
        log.info("{}: body edited, {} new warning(s), {} resolved, {} new error(s)", id,
                report.newWarnings().size(), report.resolvedWarnings().size(), report.newErrors().size());
        return report;
    }

    static Object coerce(String field, String raw) {
        if ("depends_on".equals(field)) {
            if (raw == null || raw.isBlank() || "[]".equals(raw.trim())) {
                return List.of();
            }
            return Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
        if ("level".equals(field)) {
            return Integer.parseInt(raw == null ? "" : raw.trim());
        }
        return raw;
    }

    static int countOccurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) != -1) {
            count++;
            from += needle.length();
        }
        return count;
    }

    /** Sorted, distinct entries of {@code a} absent from {@code b}. */
    private static List<String> difference(List<String> a, List<String> b) {
        var result = new TreeSet<>(a);
        result.removeAll(new TreeSet<>(b));
        return new ArrayList<>(result);
    }
}
