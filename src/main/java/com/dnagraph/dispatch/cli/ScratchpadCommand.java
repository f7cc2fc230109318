package com.dnagraph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: dna-graph scratchpad {add|list|mature|summary}
 */
@Command(name = "scratchpad", mixinStandardHelpOptions = true,
        description = "Pre-decision entries: ideas, constraints, questions, concerns",
        subcommands = {
                ScratchpadAddCommand.class,
                ScratchpadListCommand.class,
                ScratchpadMatureCommand.class,
                ScratchpadSummaryCommand.class
        })
@Component
public class ScratchpadCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
