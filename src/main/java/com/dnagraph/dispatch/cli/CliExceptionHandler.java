package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.InvalidEditException;
import com.dnagraph.core.graph.DecisionNotFoundException;
import com.dnagraph.core.graph.IdCollisionException;
import com.dnagraph.core.persistence.DecisionStoreException;
import com.dnagraph.core.scratchpad.ScratchpadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;

/**
 * Turns the expected failures of a command into an error line and exit code 1.
 * Anything else propagates to picocli's default handling.
 */
@Component
public class CliExceptionHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CliExceptionHandler.class);

    static final int EXIT_FAILURE = 1;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine,
                                        CommandLine.ParseResult parseResult) throws Exception {
        if (ex instanceof IdCollisionException
                || ex instanceof DecisionNotFoundException
                || ex instanceof InvalidEditException
                || ex instanceof ScratchpadException) {
            ConsoleOutput.error(ex.getMessage());
            return EXIT_FAILURE;
        }
        if (ex instanceof DecisionStoreException) {
            log.error("Store failure in {}", commandLine.getCommandName(), ex);
            ConsoleOutput.error(ex.getMessage());
            return EXIT_FAILURE;
        }
        throw ex;
    }
}
