package com.dnagraph.core.model;

import java.util.Optional;

/**
 * The four hierarchy levels. Lower ranks are more foundational; a decision
 * should only depend on decisions at its own rank or below.
 */
public enum DecisionLevel {
    IDENTITY(1, "Identity"),
    DIRECTION(2, "Direction"),
    STRATEGY(3, "Strategy"),
    TACTICS(4, "Tactics");

    private final int rank;
    private final String displayName;

    DecisionLevel(int rank, String displayName) {
        this.rank = rank;
        this.displayName = displayName;
    }

    public int rank() {
        return rank;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<DecisionLevel> fromRank(Integer rank) {
        if (rank == null) return Optional.empty();
        for (DecisionLevel level : values()) {
            if (level.rank == rank) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    public static boolean isValid(Integer rank) {
        return fromRank(rank).isPresent();
    }
}
