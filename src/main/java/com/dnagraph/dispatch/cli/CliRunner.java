package com.dnagraph.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DnaGraphCommand rootCommand;
    private final IFactory factory;
    private final CliExceptionHandler exceptionHandler;
    private int exitCode;

    public CliRunner(DnaGraphCommand rootCommand, IFactory factory, CliExceptionHandler exceptionHandler) {
        this.rootCommand = rootCommand;
        this.factory = factory;
        this.exceptionHandler = exceptionHandler;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(rootCommand, factory)
                .setExecutionExceptionHandler(exceptionHandler)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
