package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.report.IndexGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph index
 */
@Command(name = "index", mixinStandardHelpOptions = true, description = "Regenerate INDEX.md per directory")
@Component
public class IndexCommand implements Callable<Integer> {

    private final DecisionService decisionService;
    private final IndexGenerator indexGenerator;

    public IndexCommand(DecisionService decisionService, IndexGenerator indexGenerator) {
        this.decisionService = decisionService;
        this.indexGenerator = indexGenerator;
    }

    @Override
    public Integer call() {
        MdcContext.setCommand("index");
        try {
            for (var written : indexGenerator.writeAll(decisionService.loadGraph())) {
                ConsoleOutput.success(written.path() + ": " + written.count() + " decisions");
            }
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
