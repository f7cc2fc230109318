package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.engine.MutationOutcome;
import com.dnagraph.core.logging.MdcContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph set DEC-NNN FIELD VALUE
 * <p>
 * {@code depends_on} takes {@code DEC-001,DEC-003} or {@code []}; a title may span several words.
 */
@Command(name = "set", mixinStandardHelpOptions = true,
        description = "Update a single frontmatter field with pre-validation")
@Component
public class SetCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Decision ID")
    private String decisionId;

    @Parameters(index = "1", description = "Field: state, depends_on, level, stakes or title")
    private String field;

    @Parameters(index = "2..*", arity = "1..*", description = "New value")
    private List<String> value;

    private final DecisionService decisionService;

    public SetCommand(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @Override
    public Integer call() {
        MdcContext.setDecision("set", decisionId);
        try {
            String raw = "title".equals(field) ? String.join(" ", value) : value.get(0);
            MutationOutcome<Object> outcome = decisionService.set(decisionId, field, raw);
            ConsoleOutput.findings(outcome.validation().errors(), outcome.validation().warnings());
            if (!outcome.applied()) {
                return CliExceptionHandler.EXIT_FAILURE;
            }
            ConsoleOutput.success(decisionId + ": " + field + " " + display(outcome.previousValue())
                    + " → " + display(outcome.newValue()));
            return 0;
        } finally {
            MdcContext.clear();
        }
    }

    static String display(Object value) {
        if (value instanceof List<?> list) {
            return list.isEmpty() ? "[]" : String.join(", ", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }
}
