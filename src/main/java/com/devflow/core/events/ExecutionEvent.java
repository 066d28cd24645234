package com.devflow.core.events;

import com.devflow.core.model.ProcessResult;

import java.io.Serializable;
import java.time.Instant;

/**
 * An event emitted while an execution runs, used for SSE streaming, CLI output and logging.
 *
 * @param type        event kind
 * @param executionId the execution this event belongs to
 * @param text        output or error text (OUTPUT and ERROR only)
 * @param progress    percentage 0-100 (PROGRESS only)
 * @param result      terminal process result (COMPLETE only)
 * @param timestamp   when the event occurred
 */
public record ExecutionEvent(
    ExecutionEventType type,
    String executionId,
    String text,
    Integer progress,
    ProcessResult result,
    Instant timestamp
) implements Serializable {

    public static ExecutionEvent output(String executionId, String text) {
        return new ExecutionEvent(ExecutionEventType.OUTPUT, executionId, text, null, null, Instant.now());
    }

    public static ExecutionEvent error(String executionId, String text) {
        return new ExecutionEvent(ExecutionEventType.ERROR, executionId, text, null, null, Instant.now());
    }

    public static ExecutionEvent progress(String executionId, int percent) {
        int clamped = Math.max(0, Math.min(100, percent));
        return new ExecutionEvent(ExecutionEventType.PROGRESS, executionId, null, clamped, null, Instant.now());
    }

    public static ExecutionEvent complete(String executionId, ProcessResult result) {
        return new ExecutionEvent(ExecutionEventType.COMPLETE, executionId, null, null, result, Instant.now());
    }
}
