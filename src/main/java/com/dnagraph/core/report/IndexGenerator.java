package com.dnagraph.core.report;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.Scope;
import com.dnagraph.core.persistence.AtomicFiles;
import com.dnagraph.core.persistence.DecisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Regenerates the derived {@code INDEX.md} table of each partition.
 */
@Service
public class IndexGenerator {

    private static final Logger log = LoggerFactory.getLogger(IndexGenerator.class);

    public static final String INDEX_FILE = "INDEX.md";

    private final DecisionRepository repository;

    public IndexGenerator(DecisionRepository repository) {
        this.repository = repository;
    }

    public record WrittenIndex(Scope scope, Path path, int count) {}

    /**
     * Writes the project index, and the constitution index when that partition has decisions.
     */
    public List<WrittenIndex> writeAll(DecisionGraph graph) {
        var written = new ArrayList<WrittenIndex>();
        List<Decision> constitution = partition(graph, Scope.CONSTITUTION);
        Path constitutionDir = repository.directoryFor(Scope.CONSTITUTION);
        if (!constitution.isEmpty() && Files.isDirectory(constitutionDir)) {
            written.add(write(constitution, Scope.CONSTITUTION, "Constitution Index"));
        }
        written.add(write(partition(graph, Scope.PROJECT), Scope.PROJECT, "DNA Index"));
        return written;
    }

    private WrittenIndex write(List<Decision> decisions, Scope scope, String title) {
        Path path = repository.directoryFor(scope).resolve(INDEX_FILE);
        AtomicFiles.writeString(path, render(decisions, title));
        log.info("{}: {} decisions", path, decisions.size());
        return new WrittenIndex(scope, path, decisions.size());
    }

    public String render(List<Decision> decisions, String title) {
        var lines = new ArrayList<String>();
        lines.add("# " + title);
        lines.add("");
        lines.add("Derived index. Regenerate via `dna-graph index`. Do not edit directly.");
        lines.add("");
        lines.add("**Total:** " + decisions.size() + " decisions");
        lines.add("");
        lines.add("| ID | Title | Level | State | Stakes | Depends On |");
        lines.add("|----|-------|-------|-------|--------|------------|");
        for (Decision n : decisions) {
            String deps = n.dependsOn().isEmpty() ? "—" : String.join(", ", n.dependsOn());
            lines.add("| " + n.id()
                    + " | " + n.titleOrEmpty().replace("|", "\\|")
                    + " | " + orEmpty(n.rawLevel())
                    + " | " + orEmpty(n.state())
                    + " | " + orEmpty(n.stakes())
                    + " | " + deps + " |");
        }
        lines.add("");
        return String.join("\n", lines);
    }

    static List<Decision> partition(DecisionGraph graph, Scope scope) {
        return graph.decisions().stream().filter(d -> d.scope() == scope).toList();
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
