package com.dnagraph.core.scratchpad;

import com.dnagraph.core.config.DnaProperties;
import com.dnagraph.core.persistence.AtomicFiles;
import com.dnagraph.core.persistence.DecisionStoreException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes the scratchpad file, {@code {"entries": [...]}}.
 */
@Component
public class ScratchpadStore {

    private static final Logger log = LoggerFactory.getLogger(ScratchpadStore.class);

    private final ObjectMapper objectMapper;
    private final DnaProperties properties;

    public ScratchpadStore(ObjectMapper objectMapper, DnaProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScratchpadDocument(@JsonProperty("entries") List<ScratchpadEntry> entries) {

        ScratchpadDocument {
            entries = entries == null ? List.of() : List.copyOf(entries);
        }
    }

    public List<ScratchpadEntry> load() {
        Path path = properties.scratchpadPath();
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(AtomicFiles.readString(path), ScratchpadDocument.class).entries();
        } catch (JsonProcessingException e) {
            throw new DecisionStoreException("Cannot parse scratchpad " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    public void save(List<ScratchpadEntry> entries) {
        Path path = properties.scratchpadPath();
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new ScratchpadDocument(entries));
            AtomicFiles.writeString(path, json + "\n");
        } catch (JsonProcessingException e) {
            throw new DecisionStoreException("Cannot serialise scratchpad: " + e.getOriginalMessage(), e);
        }
        log.debug("Saved {} scratchpad entries to {}", entries.size(), path);
    }
}
