package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.scratchpad.ScratchpadEntry;
import com.dnagraph.core.scratchpad.ScratchpadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "mature", mixinStandardHelpOptions = true, description = "Graduate a scratchpad entry to a decision")
@Component
public class ScratchpadMatureCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Scratchpad entry ID (SP-NNN)")
    private String entryId;

    @Parameters(index = "1", description = "Decision ID it became (DEC-NNN)")
    private String decisionId;

    private final DecisionService decisionService;
    private final ScratchpadService scratchpadService;

    public ScratchpadMatureCommand(DecisionService decisionService, ScratchpadService scratchpadService) {
        this.decisionService = decisionService;
        this.scratchpadService = scratchpadService;
    }

    @Override
    public Integer call() {
        MdcContext.setDecision("scratchpad mature", decisionId);
        try {
            ScratchpadEntry entry = scratchpadService.mature(entryId, decisionId, decisionService.loadGraph());
            ConsoleOutput.success("Matured " + entry.id() + " [" + entry.type() + "] → " + decisionId);
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
