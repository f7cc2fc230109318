package com.dnagraph.dispatch.cli;

import com.dnagraph.core.scratchpad.ScratchpadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * Prints nothing when the scratchpad has no active entries.
 */
@Command(name = "summary", mixinStandardHelpOptions = true,
        description = "One-line summary of active scratchpad entries")
@Component
public class ScratchpadSummaryCommand implements Runnable {

    private final ScratchpadService scratchpadService;

    public ScratchpadSummaryCommand(ScratchpadService scratchpadService) {
        this.scratchpadService = scratchpadService;
    }

    @Override
    public void run() {
        String summary = scratchpadService.summary();
        if (!summary.isEmpty()) {
            ConsoleOutput.line("Scratchpad: " + summary);
        }
    }
}
