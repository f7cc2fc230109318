package com.dnagraph.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Decisions grouped by hierarchy level, keyed "1" to "4".
 */
public record HumanManifest(
    @JsonProperty("target") String target,
    @JsonProperty("levels") Map<String, LevelSection> levels,
    @JsonProperty("counts") ManifestCounts counts
) {

    public record LevelSection(
        @JsonProperty("name") String name,
        @JsonProperty("committed") List<ManifestEntry> committed,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("suggested") List<ManifestEntry> suggested
    ) {}
}
