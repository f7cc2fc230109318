package com.dnagraph.core.model;

import java.util.List;

/**
 * A decision proposed for creation, before it has been validated or written.
 *
 * @param id        proposed ID, must match DEC-NNN
 * @param title     title
 * @param date      creation date (ISO)
 * @param level     hierarchy rank, null when not supplied
 * @param state     initial state, defaults to suggested
 * @param stakes    optional stakes rating
 * @param dependsOn dependency IDs
 * @param scope     partition the decision will be written to
 */
public record DecisionDraft(
    String id,
    String title,
    String date,
    Integer level,
    String state,
    String stakes,
    List<String> dependsOn,
    Scope scope
) {

    public DecisionDraft {
        state = state == null || state.isBlank() ? DecisionState.SUGGESTED.value() : state;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        scope = scope == null ? Scope.PROJECT : scope;
    }

    /** The node this draft becomes once written. */
    public Decision toDecision(String body) {
        return new Decision(id, title, date, level, level == null ? null : String.valueOf(level),
                state, stakes, dependsOn, scope, null, body);
    }
}
