package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.report.HealthReportGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph health
 * <p>
 * Regenerates HEALTH.md from the current graph, keeping any manual flags already in it.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Generate HEALTH.md from current state")
@Component
public class HealthCommand implements Callable<Integer> {

    private final DecisionService decisionService;
    private final HealthReportGenerator healthReportGenerator;

    public HealthCommand(DecisionService decisionService, HealthReportGenerator healthReportGenerator) {
        this.decisionService = decisionService;
        this.healthReportGenerator = healthReportGenerator;
    }

    @Override
    public Integer call() {
        MdcContext.setCommand("health");
        try {
            DecisionGraph graph = decisionService.loadGraph();
            var summary = healthReportGenerator.write(graph, decisionService.validate(graph));
            ConsoleOutput.success("HEALTH.md updated: " + summary.decisions() + " decisions, "
                    + summary.flagged().size() + " flagged items");
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
