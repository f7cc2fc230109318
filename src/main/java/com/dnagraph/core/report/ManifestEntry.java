package com.dnagraph.core.report;

import com.dnagraph.core.model.Decision;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ManifestEntry(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("level") Integer level,
    @JsonProperty("state") String state,
    @JsonProperty("stakes") String stakes
) {

    static ManifestEntry of(Decision d) {
        return new ManifestEntry(d.id(), d.titleOrEmpty(), d.level(), d.stateOrUnknown(), d.stakes());
    }

    String stakesTag() {
        return stakes != null ? " [" + stakes + "]" : "";
    }
}
