package com.dnagraph.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A decision node as loaded from a record.
 * <p>
 * Values are kept as written so that invalid ones can be reported by the validator
 * rather than rejected at load time.
 *
 * @param id        unique identifier (e.g., "DEC-001")
 * @param title     short title, may be null when missing
 * @param date      creation date as written (ISO yyyy-MM-dd), may be null
 * @param level     parsed hierarchy rank; null when missing or non-numeric
 * @param rawLevel  level exactly as written; null when missing
 * @param state     lifecycle state as written; may be null or invalid
 * @param stakes    stakes rating as written; may be null or invalid
 * @param dependsOn flat, normalised dependency IDs in declaration order
 * @param scope     partition the record was loaded from
 * @param filePath  backing file, null for records not yet persisted
 * @param body      markdown body below the frontmatter
 */
public record Decision(
    String id,
    String title,
    String date,
    Integer level,
    String rawLevel,
    String state,
    String stakes,
    List<String> dependsOn,
    Scope scope,
    Path filePath,
    String body
) {

    public Decision {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        body = body == null ? "" : body;
    }

    public Optional<DecisionState> lifecycleState() {
        return DecisionState.fromValue(state);
    }

    public boolean isIn(DecisionState expected) {
        return expected.value().equals(state);
    }

    public boolean isCommitted() {
        return isIn(DecisionState.COMMITTED);
    }

    public Optional<DecisionLevel> hierarchyLevel() {
        return DecisionLevel.fromRank(level);
    }

    /** State for display, "unknown" when missing. */
    public String stateOrUnknown() {
        return state != null ? state : "unknown";
    }

    public String titleOrEmpty() {
        return title != null ? title : "";
    }

    public Decision withBody(String newBody) {
        return new Decision(id, title, date, level, rawLevel, state, stakes, dependsOn, scope, filePath, newBody);
    }
}
