package com.dnagraph.core.scratchpad;

import com.dnagraph.core.config.DnaProperties;
import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.persistence.DecisionStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.dnagraph.core.DecisionFixtures.graph;
import static com.dnagraph.core.DecisionFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class ScratchpadServiceTest {

    @TempDir
    Path tempDir;

    private ScratchpadService service;
    private DecisionGraph graph;

    @BeforeEach
    void setUp() {
        service = new ScratchpadService(new ScratchpadStore(new ObjectMapper(), DnaProperties.rootedAt(tempDir)));
        graph = graph(project("DEC-001", 1, "committed"), project("DEC-002", 2, "suggested", "DEC-001"));
    }

    // ── Add ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("add")
    class Add {

        @Test
        @DisplayName("assigns sequential IDs and persists to the scratchpad file")
        void sequentialIds() throws IOException {
            var first = service.add("idea", "Cache hot paths", List.of("DEC-002"), graph);
            var second = service.add("question", "Who owns billing?", null, graph);

            assertEquals("SP-001", first.id());
            assertEquals("SP-002", second.id());
            assertEquals(List.of("DEC-002"), first.links());
            assertTrue(first.isActive());

            String json = Files.readString(tempDir.resolve(".dna/scratchpad.json"));
            assertTrue(json.contains("\"entries\""));
            assertTrue(json.contains("\"matured_to\" : null"));
            assertTrue(json.endsWith("\n"));
        }

        @Test
        @DisplayName("rejects unknown types, empty content and dangling links")
        void rejects() {
            var type = assertThrows(ScratchpadException.class, () -> service.add("wish", "x", null, graph));
            assertEquals("invalid type 'wish' (must be one of: concern, constraint, idea, question)", type.getMessage());

            assertThrows(ScratchpadException.class, () -> service.add(null, "x", null, graph));
            assertThrows(ScratchpadException.class, () -> service.add("idea", " ", null, graph));

            var link = assertThrows(ScratchpadException.class,
                    () -> service.add("idea", "x", List.of("DEC-404"), graph));
            assertEquals("linked decision DEC-404 not found in graph", link.getMessage());
            assertFalse(Files.exists(tempDir.resolve(".dna/scratchpad.json")));
        }
    }

    // ── Mature ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("mature")
    class Mature {

        @Test
        @DisplayName("links an active entry to a decision once")
        void matureOnce() {
            service.add("idea", "Cache hot paths", null, graph);

            var matured = service.mature("SP-001", "DEC-002", graph);
            assertEquals("DEC-002", matured.maturedTo());
            assertFalse(matured.isActive());

            var again = assertThrows(ScratchpadException.class, () -> service.mature("SP-001", "DEC-001", graph));
            assertEquals("SP-001 already matured to DEC-002", again.getMessage());
        }

        @Test
        @DisplayName("rejects unknown entries and unknown decisions")
        void rejects() {
            service.add("idea", "Cache hot paths", null, graph);

            assertEquals("SP-009 not found in scratchpad",
                    assertThrows(ScratchpadException.class, () -> service.mature("SP-009", "DEC-001", graph)).getMessage());
            assertEquals("DEC-404 not found in graph",
                    assertThrows(ScratchpadException.class, () -> service.mature("SP-001", "DEC-404", graph)).getMessage());
            assertTrue(service.list(null).matured().isEmpty());
        }

        @Test
        @DisplayName("a hand-edited entry without an ID does not stop the lookup")
        void entryWithoutId() throws IOException {
            Files.createDirectories(tempDir.resolve(".dna"));
            Files.writeString(tempDir.resolve(".dna/scratchpad.json"), """
                    {"entries": [
                      {"type": "idea", "content": "no id here", "created": "2025-01-01", "matured_to": null},
                      {"id": "SP-001", "type": "question", "content": "Who owns it?", "created": "2025-01-02", "matured_to": null}
                    ]}
                    """);

            assertEquals("DEC-002", service.mature("SP-001", "DEC-002", graph).maturedTo());
            assertEquals("SP-404 not found in scratchpad",
                    assertThrows(ScratchpadException.class, () -> service.mature("SP-404", "DEC-001", graph)).getMessage());
        }
    }

    @Test
    @DisplayName("list splits active from matured and filters by type")
    void list() {
        service.add("idea", "one", null, graph);
        service.add("concern", "two", null, graph);
        service.add("idea", "three", null, graph);
        service.mature("SP-003", "DEC-001", graph);

        var all = service.list(null);
        assertEquals(List.of("SP-001", "SP-002"), all.active().stream().map(ScratchpadEntry::id).toList());
        assertEquals(List.of("SP-003"), all.matured().stream().map(ScratchpadEntry::id).toList());

        var ideas = service.list("idea");
        assertEquals(1, ideas.active().size());
        assertEquals(1, ideas.matured().size());
    }

    @Test
    @DisplayName("summary counts active entries by type")
    void summary() {
        assertEquals("", service.summary());

        service.add("question", "a", null, graph);
        service.add("idea", "b", null, graph);
        service.add("question", "c", null, graph);

        assertEquals("3 active — 1 idea(s), 2 question(s)", service.summary());
    }

    @Test
    @DisplayName("next ID continues after the highest existing number")
    void nextId() {
        var entries = List.of(
                new ScratchpadEntry("SP-004", "idea", "a", "2025-01-01", null, null),
                new ScratchpadEntry("SP-002", "idea", "b", "2025-01-01", null, null),
                new ScratchpadEntry("note", "idea", "c", "2025-01-01", null, null));
        assertEquals("SP-005", ScratchpadService.nextId(entries));
        assertEquals("SP-001", ScratchpadService.nextId(List.of()));
    }

    @Test
    @DisplayName("a corrupt scratchpad file is a store error")
    void corruptFile() throws IOException {
        Files.createDirectories(tempDir.resolve(".dna"));
        Files.writeString(tempDir.resolve(".dna/scratchpad.json"), "[oops");
        assertThrows(DecisionStoreException.class, () -> service.list(null));
    }
}
