package com.dnagraph.core.frontier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A suggested decision on the frontier, either committable now or blocked.
 *
 * @param downstreamWeight number of decisions transitively depending on this one
 * @param blockers         direct dependencies that are not committed; null when committable
 * @param criticalPath     uncommitted upstream chain, deepest first; null when committable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FrontierEntry(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("level") Integer level,
    @JsonProperty("stakes") String stakes,
    @JsonProperty("scope") String scope,
    @JsonProperty("downstream_weight") int downstreamWeight,
    @JsonProperty("downstream_ids") List<String> downstreamIds,
    @JsonProperty("blockers") List<String> blockers,
    @JsonProperty("critical_path") List<String> criticalPath
) {

    @JsonIgnore
    public boolean isBlocked() {
        return blockers != null && !blockers.isEmpty();
    }

    @JsonProperty("critical_path_length")
    public Integer criticalPathLength() {
        return criticalPath == null ? null : criticalPath.size();
    }
}
