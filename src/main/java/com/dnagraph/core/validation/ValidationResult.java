package com.dnagraph.core.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Findings of a validation run. Errors block a mutation; warnings are advisory.
 */
public record ValidationResult(
    List<String> errors,
    List<String> warnings
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult clean() {
        return new ValidationResult(List.of(), List.of());
    }

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @JsonIgnore
    public boolean isClean() {
        return errors.isEmpty() && warnings.isEmpty();
    }
}
