package com.dnagraph.dispatch.cli;

import com.dnagraph.core.engine.DecisionService;
import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.report.DecisionSearch;
import com.dnagraph.core.report.SearchResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: dna-graph search TERM [TERM ...]
 */
@Command(name = "search", mixinStandardHelpOptions = true,
        description = "Search decisions by title and body content (case-insensitive, terms OR-matched)")
@Component
public class SearchCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Search terms")
    private List<String> terms;

    @Option(names = "--json", description = "Print as JSON")
    private boolean json;

    private final DecisionService decisionService;
    private final DecisionSearch decisionSearch;
    private final JsonOutput jsonOutput;

    public SearchCommand(DecisionService decisionService, DecisionSearch decisionSearch, JsonOutput jsonOutput) {
        this.decisionService = decisionService;
        this.decisionSearch = decisionSearch;
        this.jsonOutput = jsonOutput;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("search");
        try {
            SearchResult result = decisionSearch.search(decisionService.loadGraph(), terms);
            if (json) {
                jsonOutput.print(result);
            } else {
                ConsoleOutput.lines(ReportFormatter.searchTable(result));
            }
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
