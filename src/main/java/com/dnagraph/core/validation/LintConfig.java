package com.dnagraph.core.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Project-specific body lint settings, read from {@code .dna/config.json}.
 * Passed explicitly to the validator on every call.
 *
 * @param terminology      flagged-term scan, may be null
 * @param deletedArtifacts patterns naming artifacts that no longer exist
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LintConfig(
    @JsonProperty("terminology") Terminology terminology,
    @JsonProperty("deleted_artifacts") List<DeletedArtifact> deletedArtifacts
) {

    public LintConfig {
        deletedArtifacts = deletedArtifacts == null ? List.of() : List.copyOf(deletedArtifacts);
    }

    public static LintConfig empty() {
        return new LintConfig(null, List.of());
    }

    /**
     * @param flaggedTerm term to flag, matched case-insensitively on word boundaries
     * @param exemptions  regexes; a line matching any of them is not counted
     * @param exemptIds   decisions skipped entirely
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Terminology(
        @JsonProperty("flagged_term") String flaggedTerm,
        @JsonProperty("exemptions") List<String> exemptions,
        @JsonProperty("exempt_ids") Set<String> exemptIds
    ) {
        public Terminology {
            exemptions = exemptions == null ? List.of() : List.copyOf(exemptions);
            exemptIds = exemptIds == null ? Set.of() : Set.copyOf(exemptIds);
        }

        public Optional<Pattern> termPattern() {
            if (flaggedTerm == null || flaggedTerm.isBlank()) return Optional.empty();
            return Optional.of(Pattern.compile("\\b" + Pattern.quote(flaggedTerm) + "\\b", Pattern.CASE_INSENSITIVE));
        }

        public List<Pattern> exemptionPatterns() {
            return exemptions.stream().map(Pattern::compile).toList();
        }
    }

    /**
     * @param pattern regex searched in the body
     * @param label   name reported in the warning; defaults to the pattern
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeletedArtifact(
        @JsonProperty("pattern") String pattern,
        @JsonProperty("label") String label
    ) {
        public String labelOrPattern() {
            return label != null && !label.isBlank() ? label : pattern;
        }
    }
}
