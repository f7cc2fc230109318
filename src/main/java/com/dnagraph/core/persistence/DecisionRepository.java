package com.dnagraph.core.persistence;

import com.dnagraph.core.config.DnaProperties;
import com.dnagraph.core.model.DecisionRecord;
import com.dnagraph.core.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * File-backed source and sink of decision records.
 * <p>
 * Each partition is a directory of {@code DEC-*.md} files. Files without a frontmatter
 * block are not decisions and are skipped.
 */
@Component
public class DecisionRepository {

    private static final Logger log = LoggerFactory.getLogger(DecisionRepository.class);

    static final String FILE_GLOB = "DEC-*.md";

    private final DnaProperties properties;
    private final FrontmatterCodec codec;

    public DecisionRepository(DnaProperties properties, FrontmatterCodec codec) {
        this.properties = properties;
        this.codec = codec;
    }

    public List<DecisionRecord> loadPartition(Scope scope) {
        Path dir = directoryFor(scope);
        if (!Files.isDirectory(dir)) {
            log.debug("No {} directory at {}", scope.value(), dir);
            return List.of();
        }

        var files = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, FILE_GLOB)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new DecisionStoreException("Cannot list " + dir + ": " + e.getMessage(), e);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));

        var records = new ArrayList<DecisionRecord>();
        for (Path file : files) {
            var doc = codec.parse(AtomicFiles.readString(file));
            if (!doc.hasFrontmatter()) {
                log.warn("Skipping {}: no frontmatter", file);
                continue;
            }
            records.add(new DecisionRecord(doc.fields(), doc.body(), scope, file));
        }
        log.debug("Read {} {} records from {}", records.size(), scope.value(), dir);
        return records;
    }

    /**
     * Re-reads a single file, for mutations that must preserve everything they do not touch.
     */
    public DecisionRecord read(Path file, Scope scope) {
        var doc = codec.parse(AtomicFiles.readString(file));
        if (!doc.hasFrontmatter()) {
            throw new DecisionStoreException("Could not parse frontmatter from " + file);
        }
        return new DecisionRecord(doc.fields(), doc.body(), scope, file);
    }

    public void write(Path file, Map<String, Object> fields, String body) {
        AtomicFiles.writeString(file, codec.serialize(fields, body));
        log.debug("Wrote {}", file);
    }

    public Path directoryFor(Scope scope) {
        return scope == Scope.CONSTITUTION ? properties.constitutionPath() : properties.decisionsPath();
    }

    public Path pathFor(String id, Scope scope) {
        return directoryFor(scope).resolve(id + ".md");
    }
}
