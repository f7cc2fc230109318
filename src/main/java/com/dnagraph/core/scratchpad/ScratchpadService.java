package com.dnagraph.core.scratchpad;

import com.dnagraph.core.graph.DecisionGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Holding area for ideas, constraints, questions and concerns that are not yet decisions.
 */
@Service
public class ScratchpadService {

    private static final Logger log = LoggerFactory.getLogger(ScratchpadService.class);

    private static final Pattern SP_ID = Pattern.compile("^SP-(\\d{3})$");

    private final ScratchpadStore store;

    public ScratchpadService(ScratchpadStore store) {
        this.store = store;
    }

    public record Listing(List<ScratchpadEntry> active, List<ScratchpadEntry> matured) {

        public boolean isEmpty() {
            return active.isEmpty() && matured.isEmpty();
        }
    }

    /**
     * @throws ScratchpadException if the type is invalid, the content is empty, or a link is not in the graph
     */
    public ScratchpadEntry add(String type, String content, List<String> links, DecisionGraph graph) {
        if (type == null || type.isBlank()) {
            throw new ScratchpadException("--type is required");
        }
        if (ScratchpadEntryType.fromValue(type).isEmpty()) {
            String valid = Arrays.stream(ScratchpadEntryType.values())
                    .map(ScratchpadEntryType::value)
                    .collect(Collectors.joining(", "));
            throw new ScratchpadException("invalid type '" + type + "' (must be one of: " + valid + ")");
        }
        if (content == null || content.isBlank()) {
            throw new ScratchpadException("content string is required");
        }
        List<String> linkIds = links == null ? List.of() : links;
        for (String link : linkIds) {
            if (!graph.contains(link)) {
                throw new ScratchpadException("linked decision " + link + " not found in graph");
            }
        }

        var entries = new ArrayList<>(store.load());
        var entry = new ScratchpadEntry(nextId(entries), type, content, LocalDate.now().toString(), linkIds, null);
        entries.add(entry);
        store.save(entries);
        log.info("Added {} [{}]", entry.id(), type);
        return entry;
    }

    public Listing list(String typeFilter) {
        var active = new ArrayList<ScratchpadEntry>();
        var matured = new ArrayList<ScratchpadEntry>();
        for (ScratchpadEntry e : store.load()) {
            if (typeFilter != null && !typeFilter.equals(e.type())) continue;
            (e.isActive() ? active : matured).add(e);
        }
        return new Listing(List.copyOf(active), List.copyOf(matured));
    }

    /**
     * Marks an active entry as having become the given decision.
     *
     * @throws ScratchpadException if the entry is missing or already matured, or the decision is not in the graph
     */
    public ScratchpadEntry mature(String entryId, String decisionId, DecisionGraph graph) {
        var entries = new ArrayList<>(store.load());
        int index = -1;
        for (int i = 0; i < entries.size(); i++) {
            if (entryId.equals(entries.get(i).id())) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new ScratchpadException(entryId + " not found in scratchpad");
        }
        ScratchpadEntry entry = entries.get(index);
        if (!entry.isActive()) {
            throw new ScratchpadException(entryId + " already matured to " + entry.maturedTo());
        }
        if (!graph.contains(decisionId)) {
            throw new ScratchpadException(decisionId + " not found in graph");
        }

        ScratchpadEntry matured = entry.withMaturedTo(decisionId);
        entries.set(index, matured);
        store.save(entries);
        log.info("Matured {} -> {}", entryId, decisionId);
        return matured;
    }

    /**
     * One-line count of active entries by type, e.g. {@code 3 active — 1 idea(s), 2 question(s)};
     * empty when nothing is active.
     */
    public String summary() {
        List<ScratchpadEntry> active = store.load().stream().filter(ScratchpadEntry::isActive).toList();
        if (active.isEmpty()) {
            return "";
        }
        Map<String, Long> byType = active.stream()
                .collect(Collectors.groupingBy(e -> e.type() != null ? e.type() : "unknown",
                        TreeMap::new, Collectors.counting()));
        String parts = byType.entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey() + "(s)")
                .collect(Collectors.joining(", "));
        return active.size() + " active — " + parts;
    }

    static String nextId(List<ScratchpadEntry> entries) {
        int max = 0;
        for (ScratchpadEntry e : entries) {
            Matcher m = SP_ID.matcher(e.id() == null ? "" : e.id());
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return String.format("SP-%03d", max + 1);
    }
}
