package com.dnagraph.core.engine;

import com.dnagraph.core.validation.ValidationResult;

import java.nio.file.Path;

/**
 * Result of a create or set. Nothing was written when the validation has errors.
 *
 * @param id            target decision
 * @param validation    pre-validation findings
 * @param previousValue value before the change, null for a create
 * @param newValue      value after the change
 * @param file          file written, null when rejected
 */
public record MutationOutcome<T>(
    String id,
    ValidationResult validation,
    T previousValue,
    T newValue,
    Path file
) {

    public static <T> MutationOutcome<T> rejected(String id, ValidationResult validation) {
        return new MutationOutcome<>(id, validation, null, null, null);
    }

    public boolean applied() {
        return file != null;
    }
}
