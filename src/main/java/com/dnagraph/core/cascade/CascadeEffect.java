package com.dnagraph.core.cascade;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One affected node within a cascade wave.
 *
 * @param node         affected decision ID
 * @param currentState its state at the time of the query
 * @param via          the node that led to it
 * @param reason       human-readable reason referencing {@code via}
 * @param crossScope   true when {@code node} and {@code via} are in different partitions
 */
public record CascadeEffect(
    @JsonProperty("node") String node,
    @JsonProperty("current_state") String currentState,
    @JsonProperty("via") String via,
    @JsonProperty("reason") String reason,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    @JsonProperty("cross_directory") boolean crossScope
) {}
