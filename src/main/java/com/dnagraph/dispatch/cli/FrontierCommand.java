package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.frontier.FrontierAnalyzer;
import com.dnagraph.core.frontier.FrontierReport;
import com.dnagraph.core.logging.MdcContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph frontier [--top N]
 * <p>
 * What to think about next: committable suggestions, blocked ones with their critical
 * path, per-level gaps, and the decisions with the most downstream weight.
 */
@Command(name = "frontier", mixinStandardHelpOptions = true,
        description = "Compute the decision frontier: what to think about next")
@Component
public class FrontierCommand implements Callable<Integer> {

    @Option(names = "--top", defaultValue = "" + FrontierAnalyzer.DEFAULT_TOP,
            description = "Number of high-weight nodes to show (default: ${DEFAULT-VALUE})")
    private int top;

    @Option(names = "--json", description = "Print as JSON")
    private boolean json;

    @Option(names = "--markdown", description = "Print as markdown")
    private boolean markdown;

    private final DecisionService decisionService;
    private final JsonOutput jsonOutput;

    public FrontierCommand(DecisionService decisionService, JsonOutput jsonOutput) {
        this.decisionService = decisionService;
        this.jsonOutput = jsonOutput;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("frontier");
        try {
            FrontierReport report = decisionService.frontier(top);
            if (json) {
                var frontier = new LinkedHashMap<String, Object>();
                frontier.put("committable_now", report.committable());
                frontier.put("blocked", report.blocked());
                frontier.put("level_gaps", report.levelGaps());
                frontier.put("high_weight", report.highWeight());
                var out = new LinkedHashMap<String, Object>();
                out.put("frontier", frontier);
                out.put("summary", report.summary());
                jsonOutput.print(out);
            } else if (markdown) {
                ConsoleOutput.lines(ReportFormatter.frontierMarkdown(report));
            } else {
                ConsoleOutput.lines(ReportFormatter.frontierTable(report));
            }
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
