package com.dnagraph.core.cascade;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wave-ordered closure of nodes reached from a start node.
 */
public record CascadeResult(
    @JsonProperty("start_node") String startNode,
    @JsonProperty("direction") CascadeDirection direction,
    @JsonProperty("waves") List<CascadeWave> waves,
    @JsonProperty("summary") Summary summary
) {

    /**
     * @param totalAffected  (node, wave) occurrences across all waves
     * @param uniqueAffected distinct nodes reached
     * @param waveCount      number of non-empty waves
     */
    public record Summary(
        @JsonProperty("total_affected") int totalAffected,
        @JsonProperty("unique_affected") int uniqueAffected,
        @JsonProperty("wave_count") int waveCount
    ) {}

    @JsonIgnore
    public boolean isEmpty() {
        return waves.isEmpty();
    }
}
