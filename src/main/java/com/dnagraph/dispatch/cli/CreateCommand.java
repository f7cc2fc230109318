package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.engine.MutationOutcome;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionDraft;
import com.dnagraph.core.model.DecisionState;
import com.dnagraph.core.model.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph create DEC-NNN --title ... --level N
 * <p>
 * Writes a new decision with a section scaffold, only if pre-validation finds no errors.
 */
@Command(name = "create", mixinStandardHelpOptions = true,
        description = "Create a new decision with pre-validated frontmatter")
@Component
public class CreateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "New decision ID (DEC-NNN)")
    private String decisionId;

    @Option(names = "--title", required = true, description = "Decision title")
    private String title;

    @Option(names = "--level", required = true, description = "Hierarchy level, 1 (Identity) to 4 (Tactics)")
    private Integer level;

    @Option(names = "--state", defaultValue = "suggested", description = "Initial state (default: ${DEFAULT-VALUE})")
    private String state = DecisionState.SUGGESTED.value();

    @Option(names = "--stakes", description = "high, medium or low")
    private String stakes;

    @Option(names = "--depends-on", split = ",", description = "Comma-separated upstream decision IDs")
    private List<String> dependsOn = new ArrayList<>();

    @Option(names = "--constitution", description = "Create in the constitution partition")
    private boolean constitution;

    private final DecisionService decisionService;

    public CreateCommand(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @Override
    public Integer call() {
        MdcContext.setDecision("create", decisionId);
        try {
            List<String> deps = dependsOn == null ? List.of()
                    : dependsOn.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
            Scope scope = constitution ? Scope.CONSTITUTION : Scope.PROJECT;
            var draft = new DecisionDraft(decisionId, title, null, level, state, stakes, deps, scope);

            MutationOutcome<Decision> outcome = decisionService.create(draft);
            ConsoleOutput.findings(outcome.validation().errors(), outcome.validation().warnings());
            if (!outcome.applied()) {
                return CliExceptionHandler.EXIT_FAILURE;
            }
            String dir = scope == Scope.CONSTITUTION ? "constitution" : "dna";
            ConsoleOutput.success("Created " + decisionId + " (level " + level + ", " + draft.state() + ") in " + dir + "/");
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
