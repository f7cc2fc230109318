package com.dnagraph.core.model;

import java.nio.file.Path;
import java.util.Map;

/**
 * A decision file as produced by the record source: the parsed frontmatter fields,
 * the raw body, and the partition it came from.
 */
public record DecisionRecord(
    Map<String, Object> fields,
    String body,
    Scope scope,
    Path path
) {}
