package com.devflow.core.model;

/**
 * Queue priority of a command. Higher {@link #rank()} is dequeued first.
 */
public enum CommandPriority {
    HIGH(3),
    NORMAL(2),
    LOW(1);

    private final int rank;

    CommandPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** Parses a priority name, falling back to {@link #NORMAL} for null or blank input. */
    public static CommandPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
