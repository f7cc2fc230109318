package com.dnagraph.core.frontier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * State breakdown of one hierarchy level.
 */
public record LevelGap(
    @JsonProperty("level") int level,
    @JsonProperty("level_name") String levelName,
    @JsonProperty("committed") int committed,
    @JsonProperty("suggested") int suggested,
    @JsonProperty("superseded") int superseded,
    @JsonProperty("total") int total,
    @JsonProperty("flags") List<String> flags
) {

    public static final String MORE_SUGGESTED = "more suggested than committed";
    public static final String NONE_COMMITTED = "no committed decisions";

    @JsonIgnore
    public boolean isFlagged() {
        return !flags.isEmpty();
    }
}
