package com.dnagraph.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A decision matching a search, with the parts of it that matched.
 */
public record SearchHit(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("level") Integer level,
    @JsonProperty("state") String state,
    @JsonProperty("scope") String scope,
    @JsonProperty("matched_sections") List<String> matchedSections
) {}
