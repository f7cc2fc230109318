package com.dnagraph.core.frontier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What is ready to decide next, what blocks the rest, and where the weight sits.
 */
public record FrontierReport(
    @JsonProperty("committable_now") List<FrontierEntry> committable,
    @JsonProperty("blocked") List<FrontierEntry> blocked,
    @JsonProperty("level_gaps") List<LevelGap> levelGaps,
    @JsonProperty("high_weight") List<WeightedNode> highWeight,
    @JsonProperty("summary") Summary summary,
    @JsonIgnore int topN
) {

    public record Summary(
        @JsonProperty("total_decisions") int totalDecisions,
        @JsonProperty("suggested") int suggested,
        @JsonProperty("committable_count") int committableCount,
        @JsonProperty("blocked_count") int blockedCount,
        @JsonProperty("level_gap_count") int levelGapCount
    ) {}
}
