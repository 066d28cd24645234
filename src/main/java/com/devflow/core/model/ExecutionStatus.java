package com.devflow.core.model;

/**
 * Lifecycle status of a command execution.
 * <p>
 * COMPLETED, FAILED and CANCELLED are terminal: no further transition occurs.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
