package com.devflow.core.model;

/**
 * Why a process run did not succeed. {@link #NONE} for successful runs.
 */
public enum FailureReason {
    NONE,
    SPAWN,
    EXIT_CODE,
    TIMEOUT,
    CANCELLED
}
