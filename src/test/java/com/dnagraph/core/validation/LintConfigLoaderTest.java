package com.dnagraph.core.validation;

import com.dnagraph.core.persistence.DecisionStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LintConfigLoaderTest {

    private final LintConfigLoader loader = new LintConfigLoader(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("missing file yields the empty config")
    void missingFile() {
        assertEquals(LintConfig.empty(), loader.load(tempDir.resolve("config.json")));
    }

    @Test
    @DisplayName("reads terminology and deleted artifacts, ignoring unknown keys")
    void readsConfig() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, """
                {
                  "terminology": {
                    "flagged_term": "node",
                    "exemptions": ["graph node"],
                    "exempt_ids": ["DEC-001"]
                  },
                  "deleted_artifacts": [{"pattern": "v1-api", "label": "v1 API"}],
                  "theme": "dark"
                }
                """);

        LintConfig config = loader.load(file);

        assertEquals("node", config.terminology().flaggedTerm());
        assertEquals(List.of("graph node"), config.terminology().exemptions());
        assertEquals(Set.of("DEC-001"), config.terminology().exemptIds());
        assertEquals(List.of(new LintConfig.DeletedArtifact("v1-api", "v1 API")), config.deletedArtifacts());
    }

    @Test
    @DisplayName("malformed JSON is a store error")
    void malformedJson() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ not json");
        assertThrows(DecisionStoreException.class, () -> loader.load(file));
    }

    @Test
    @DisplayName("an invalid regex is reported with the file name")
    void invalidPattern() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"deleted_artifacts\": [{\"pattern\": \"([a-z\"}]}");
        var ex = assertThrows(DecisionStoreException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().contains("config.json"));
    }
}
