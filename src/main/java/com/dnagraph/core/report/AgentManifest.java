package com.dnagraph.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Decisions classified for an agent: the constitution, high-stakes decisions, and everything
 * committed or still suggested.
 */
public record AgentManifest(
    @JsonProperty("target") String target,
    @JsonProperty("constitution") List<ManifestEntry> constitution,
    @JsonProperty("high_stakes") List<ManifestEntry> highStakes,
    @JsonProperty("all_committed") List<ManifestEntry> allCommitted,
    @JsonProperty("all_suggested") List<ManifestEntry> allSuggested,
    @JsonProperty("counts") ManifestCounts counts
) {}
