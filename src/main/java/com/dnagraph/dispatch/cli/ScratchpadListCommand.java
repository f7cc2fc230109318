package com.dnagraph.dispatch.cli;

import com.dnagraph.core.logging.MdcContext;
import com.dnagraph.core.scratchpad.ScratchpadService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.concurrent.Callable;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List scratchpad entries (active and matured)")
@Component
public class ScratchpadListCommand implements Callable<Integer> {

    @Option(names = "--type", description = "Only entries of this type")
    private String type;

    @Option(names = "--json", description = "Print as JSON")
    private boolean json;

    private final ScratchpadService scratchpadService;
    private final JsonOutput jsonOutput;

    public ScratchpadListCommand(ScratchpadService scratchpadService, JsonOutput jsonOutput) {
        this.scratchpadService = scratchpadService;
        this.jsonOutput = jsonOutput;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("scratchpad list");
        try {
            var listing = scratchpadService.list(type);
            if (json) {
                var out = new LinkedHashMap<String, Object>();
                out.put("active", listing.active());
                out.put("matured", listing.matured());
                jsonOutput.print(out);
            } else {
                ConsoleOutput.lines(ReportFormatter.scratchpadTable(listing));
            }
            return 0;
        } finally {
            MdcContext.clear();
        }
    }
}
