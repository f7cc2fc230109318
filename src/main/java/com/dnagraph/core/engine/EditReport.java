package com.dnagraph.core.engine;

import java.util.List;

/**
 * Validation delta of a body edit: findings that appeared or disappeared because of it.
 */
public record EditReport(
    String id,
    int charsRemoved,
    int charsAdded,
    List<String> newWarnings,
    List<String> resolvedWarnings,
    List<String> newErrors
) {

    public EditReport {
        newWarnings = List.copyOf(newWarnings);
        resolvedWarnings = List.copyOf(resolvedWarnings);
        newErrors = List.copyOf(newErrors);
    }

    public boolean introducedErrors() {
        return !newErrors.isEmpty();
    }

    public boolean isNeutral() {
        return newWarnings.isEmpty() && newErrors.isEmpty();
    }
}
