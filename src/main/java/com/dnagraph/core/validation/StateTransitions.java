package com.dnagraph.core.validation;

import com.dnagraph.core.model.DecisionState;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The monotone state lattice: suggested → committed, suggested → superseded,
 * committed → superseded. Staying in the same state is always legal.
 */
public final class StateTransitions {

    private static final Map<DecisionState, Set<DecisionState>> LEGAL = Map.of(
            DecisionState.SUGGESTED, Set.of(DecisionState.COMMITTED, DecisionState.SUPERSEDED),
            DecisionState.COMMITTED, Set.of(DecisionState.SUPERSEDED),
            DecisionState.SUPERSEDED, Set.of()
    );

    private StateTransitions() {}

    public static boolean isLegal(String from, String to) {
        if (Objects.equals(from, to)) {
            return true;
        }
        Optional<DecisionState> source = DecisionState.fromValue(from);
        Optional<DecisionState> target = DecisionState.fromValue(to);
        if (source.isEmpty() || target.isEmpty()) {
            return false;
        }
        return LEGAL.get(source.get()).contains(target.get());
    }

    /**
     * @return an error message for an illegal transition, empty when legal
     */
    public static Optional<String> check(String from, String to) {
        if (isLegal(from, to)) {
            return Optional.empty();
        }
        return Optional.of("Illegal state transition: " + from + " → " + to);
    }
}
