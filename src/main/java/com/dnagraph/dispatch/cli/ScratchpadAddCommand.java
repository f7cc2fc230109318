package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.scratchpad.ScratchpadEntry;
import com.dnagraph.core.scratchpad.ScratchpadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "add", mixinStandardHelpOptions = true, description = "Add a scratchpad entry")
@Component
public class ScratchpadAddCommand implements Callable<Integer> {

    @Option(names = "--type", required = true, description = "idea, constraint, question or concern")
    private String type;

    @Option(names = "--links", split = ",", description = "Comma-separated related decision IDs")
    private List<String> links = new ArrayList<>();

    @Parameters(index = "0", description = "Entry text")
    private String content;

    private final DecisionService decisionService;
    private final ScratchpadService scratchpadService;

    public ScratchpadAddCommand(DecisionService decisionService, ScratchpadService scratchpadService) {
        this.decisionService = decisionService;
        this.scratchpadService = scratchpadService;
    }

    @Override
    public Integer call() {
        MdcContext.setCommand("scratchpad add");
        try {
            List<String> linkIds = links == null ? List.of()
                    : links.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
            DecisionGraph graph = linkIds.isEmpty() ? DecisionGraph.empty() : decisionService.loadGraph();
            ScratchpadEntry entry = scratchpadService.add(type, content, linkIds, graph);
            String linkDisplay = entry.links().isEmpty() ? "" : " (links: " + String.join(", ", entry.links()) + ")";
            ConsoleOutput.success("Added " + entry.id() + " [" + entry.type() + "]: " + entry.content() + linkDisplay);
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
