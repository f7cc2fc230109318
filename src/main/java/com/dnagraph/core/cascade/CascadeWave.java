package com.dnagraph.core.cascade;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CascadeWave(
    @JsonProperty("wave") int wave,
    @JsonProperty("effects") List<CascadeEffect> effects
) {}
