package com.dnagraph.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SearchResult(
    @JsonProperty("query") List<String> query,
    @JsonProperty("count") int count,
    @JsonProperty("results") List<SearchHit> results
) {}
