package com.devflow.core.model;

import java.io.Serializable;

/**
 * Terminal outcome of a single process run. Every path (normal exit, spawn failure,
 * timeout, cancellation) resolves to this shape.
 *
 * @param success  true only for a zero exit code
 * @param exitCode OS exit code; 1 for spawn failures; -1 when killed before an exit code was seen
 * @param output   captured standard output
 * @param error    captured standard error, or the failure message
 * @param duration wall-clock milliseconds from spawn to resolution
 * @param reason   failure tag; {@link FailureReason#NONE} on success
 */
public record ProcessResult(
    boolean success,
    int exitCode,
    String output,
    String error,
    long duration,
    FailureReason reason
) implements Serializable {

    public static ProcessResult exited(int exitCode, String output, String error, long duration) {
        return new ProcessResult(exitCode == 0, exitCode, output, error, duration,
                exitCode == 0 ? FailureReason.NONE : FailureReason.EXIT_CODE);
    }

    public static ProcessResult spawnFailed(String message, String output, long duration) {
        return new ProcessResult(false, 1, output, message, duration, FailureReason.SPAWN);
    }

    public boolean timedOut() {
        return reason == FailureReason.TIMEOUT;
    }

    public boolean cancelled() {
        return reason == FailureReason.CANCELLED;
    }
}
