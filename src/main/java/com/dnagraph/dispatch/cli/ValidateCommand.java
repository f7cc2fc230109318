package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.validation.ValidationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph validate
 * <p>
 * Checks frontmatter, graph topology and body content. Exits 1 when any error is found;
 * warnings alone do not fail.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Check frontmatter, graph topology, and body content")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Option(names = "--json", description = "Print errors and warnings as JSON")
    private boolean json;

    private final DecisionService decisionService;
    private final JsonOutput jsonOutput;

    public ValidateCommand(DecisionService decisionService, JsonOutput jsonOutput) {
        this.decisionService = decisionService;
        this.jsonOutput = jsonOutput;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("validate");
        try {
            DecisionGraph graph = decisionService.loadGraph();
            ValidationResult result = decisionService.validate(graph);
            List<String> errors = result.errors().stream().sorted().toList();
            List<String> warnings = result.warnings().stream().sorted().toList();

            if (json) {
                var out = new LinkedHashMap<String, Object>();
                out.put("decisions", graph.size());
                out.put("errors", errors);
                out.put("warnings", warnings);
                jsonOutput.print(out);
            } else {
                if (!errors.isEmpty()) {
                    ConsoleOutput.heading("ERRORS (" + errors.size() + "):");
                    errors.forEach(e -> ConsoleOutput.line("  " + e));
                }
                if (!warnings.isEmpty()) {
                    ConsoleOutput.line("");
                    ConsoleOutput.heading("WARNINGS (" + warnings.size() + "):");
                    warnings.forEach(w -> ConsoleOutput.line("  " + w));
                }
                if (result.isClean()) {
                    ConsoleOutput.success("Validation passed: " + graph.size() + " decisions, 0 errors, 0 warnings.");
                }
            }
            return result.hasErrors() ? CliExceptionHandler.EXIT_FAILURE : 0;
        } finally {
            MdcContext.clear();
        }
    }
}
