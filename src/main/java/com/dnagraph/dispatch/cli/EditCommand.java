package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.engine.EditReport;
import com.dnagraph.core.logging.MdcContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph edit DEC-NNN "old text" "new text"
 * <p>
 * Replaces body text only; the frontmatter is never touched. Reports the warnings the edit
 * resolved or introduced, and exits 1 if it introduced errors.
 */
@Command(name = "edit", mixinStandardHelpOptions = true,
        description = "Replace body text with a pre/post validation delta")
@Component
public class EditCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Decision ID")
    private String decisionId;

    @Parameters(index = "1", description = "Text to replace; must occur exactly once in the body")
    private String oldText;

    @Parameters(index = "2", description = "Replacement text")
    private String newText;

    private final DecisionService decisionService;

    public EditCommand(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @Override
    public Integer call() {
        MdcContext.setDecision("edit", decisionId);
        try {
            EditReport report = decisionService.edit(decisionId, oldText, newText);
            ConsoleOutput.success(decisionId + ": body edited (" + report.charsRemoved() + " chars → "
                    + report.charsAdded() + " chars)");

            if (!report.resolvedWarnings().isEmpty()) {
                ConsoleOutput.line("  Resolved " + report.resolvedWarnings().size() + " warning(s):");
                report.resolvedWarnings().forEach(w -> ConsoleOutput.line("    - " + w));
            }
            if (!report.newWarnings().isEmpty()) {
                ConsoleOutput.line("  Introduced " + report.newWarnings().size() + " new warning(s):");
                report.newWarnings().forEach(w -> ConsoleOutput.line("    + " + w));
            }
            if (report.introducedErrors()) {
                ConsoleOutput.error("introduced " + report.newErrors().size() + " new error(s):");
                report.newErrors().forEach(e -> ConsoleOutput.line("    ! " + e));
                return CliExceptionHandler.EXIT_FAILURE;
            }
            if (report.isNeutral()) {
                ConsoleOutput.line("  No new issues introduced.");
            }
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
