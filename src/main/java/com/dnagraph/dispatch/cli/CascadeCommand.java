package com.dnagraph.dispatch.cli;

import com.dnagraph.core.cascade.CascadeResult;
import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.logging.MdcContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph cascade &lt;id&gt; [--reverse]
 * <p>
 * Shows, wave by wave, which decisions need review when the given one changes, or with
 * {@code --reverse} which decisions constrain it.
 */
@Command(name = "cascade", mixinStandardHelpOptions = true,
        description = "Compute propagation downstream, or upstream with --reverse")
@Component
public class CascadeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Decision ID to start from")
    private String decisionId;

    @Option(names = "--reverse", description = "Walk dependencies instead of dependents")
    private boolean reverse;

    @Option(names = "--json", description = "Print as JSON")
    private boolean json;

    @Option(names = "--markdown", description = "Print as markdown")
    private boolean markdown;

    private final DecisionService decisionService;
    private final JsonOutput jsonOutput;

    public CascadeCommand(DecisionService decisionService, JsonOutput jsonOutput) {
        this.decisionService = decisionService;
        this.jsonOutput = jsonOutput;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setDecision("cascade", decisionId);
        try {
            DecisionGraph graph = decisionService.loadGraph();
            CascadeResult result = decisionService.cascade(graph, decisionId, reverse);
            if (json) {
                jsonOutput.print(result);
            } else if (markdown) {
                ConsoleOutput.lines(ReportFormatter.cascadeMarkdown(result, graph));
            } else {
                ConsoleOutput.lines(ReportFormatter.cascadeTable(result));
            }
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
