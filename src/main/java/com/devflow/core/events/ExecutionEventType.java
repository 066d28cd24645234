package com.devflow.core.events;

/**
 * Kinds of execution lifecycle events.
 */
public enum ExecutionEventType {
    OUTPUT("output"),
    ERROR("error"),
    PROGRESS("progress"),
    COMPLETE("complete");

    private final String wireName;

    ExecutionEventType(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used for SSE event names and console prefixes. */
    public String wireName() {
        return wireName;
    }
}
