package com.dnagraph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for dna-graph.
 */
@Command(
        name = "dna-graph",
        mixinStandardHelpOptions = true,
        version = "dna-graph 0.1.0",
        description = "Graph operations over a directory of decision records",
        subcommands = {
                ValidateCommand.class,
                CascadeCommand.class,
                FrontierCommand.class,
                SearchCommand.class,
                IndexCommand.class,
                HealthCommand.class,
                CreateCommand.class,
                SetCommand.class,
                EditCommand.class,
                ManifestCommand.class,
                ScratchpadCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DnaGraphCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        // no subcommand: show usage
        spec.commandLine().usage(System.out);
    }
}
