package com.dnagraph.core.frontier;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A decision ranked by its transitive downstream weight.
 */
public record WeightedNode(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("level") Integer level,
    @JsonProperty("state") String state,
    @JsonProperty("stakes") String stakes,
    @JsonProperty("scope") String scope,
    @JsonProperty("downstream_weight") int downstreamWeight,
    @JsonProperty("direct_dependents") List<String> directDependents
) {}
