package com.dnagraph.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ManifestCounts(
    @JsonProperty("total") int total,
    @JsonProperty("committed") long committed,
    @JsonProperty("suggested") long suggested,
    @JsonProperty("superseded") long superseded,
    @JsonProperty("by_level") Map<String, Long> byLevel
) {}
