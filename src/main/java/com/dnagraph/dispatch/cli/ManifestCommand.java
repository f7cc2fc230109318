package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.report.ManifestCompiler;
import com.dnagraph.core.report.ManifestTarget;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph compile-manifest [--target human|agent]
 * <p>
 * Without a target, both manifests are printed, human first.
 */
@Command(name = "compile-manifest", mixinStandardHelpOptions = true,
        description = "Produce deterministic skeleton for contract compilation")
@Component
public class ManifestCommand implements Callable<Integer> {

    @Option(names = "--target", description = "human or agent")
    private String target;

    @Option(names = "--json", description = "Print as JSON")
    private boolean json;

    private final DecisionService decisionService;
    private final ManifestCompiler manifestCompiler;
    private final JsonOutput jsonOutput;

    public ManifestCommand(DecisionService decisionService, ManifestCompiler manifestCompiler, JsonOutput jsonOutput) {
        this.decisionService = decisionService;
        this.manifestCompiler = manifestCompiler;
        this.jsonOutput = jsonOutput;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("compile-manifest");
        try {
            List<ManifestTarget> targets;
            if (target == null) {
                targets = List.of(ManifestTarget.HUMAN, ManifestTarget.AGENT);
            } else {
                var parsed = ManifestTarget.fromValue(target);
                if (parsed.isEmpty()) {
                    ConsoleOutput.error("--target must be 'human' or 'agent', got '" + target + "'");
                    return CliExceptionHandler.EXIT_FAILURE;
                }
                targets = List.of(parsed.get());
            }

            DecisionGraph graph = decisionService.loadGraph();
            for (ManifestTarget t : targets) {
                if (t == ManifestTarget.HUMAN) {
                    var manifest = manifestCompiler.human(graph);
                    if (json) jsonOutput.print(manifest);
                    else ConsoleOutput.line(manifestCompiler.renderHuman(manifest));
                } else {
                    var manifest = manifestCompiler.agent(graph);
                    if (json) jsonOutput.print(manifest);
                    else ConsoleOutput.line(manifestCompiler.renderAgent(manifest));
                }
            }
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
