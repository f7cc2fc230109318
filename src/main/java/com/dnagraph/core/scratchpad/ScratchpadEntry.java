package com.dnagraph.core.scratchpad;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A pre-decision thought. It stays active until it matures into a decision.
 *
 * @param type      one of idea, constraint, question, concern
 * @param created   ISO date the entry was added
 * @param links     decisions the entry relates to
 * @param maturedTo decision the entry became, null while active
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScratchpadEntry(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("content") String content,
    @JsonProperty("created") String created,
    @JsonProperty("links") List<String> links,
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonProperty("matured_to") String maturedTo
) {

    public ScratchpadEntry {
        links = links == null ? List.of() : List.copyOf(links);
    }

    @JsonIgnore
    public boolean isActive() {
        return maturedTo == null || maturedTo.isBlank();
    }

    public ScratchpadEntry withMaturedTo(String decisionId) {
        return new ScratchpadEntry(id, type, content, created, links, decisionId);
    }
}
