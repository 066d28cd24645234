package com.devflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Terminal record of an execution, appended to history and never mutated.
 *
 * @param id         execution identifier
 * @param action     workflow action that ran
 * @param project    target project
 * @param status     terminal status (COMPLETED, FAILED or CANCELLED)
 * @param priority   priority the command was queued with
 * @param startTime  when the execution started
 * @param endTime    when the execution reached its terminal state
 * @param duration   wall-clock milliseconds between start and end
 * @param success    whether the execution succeeded
 * @param exitCode   process exit code, or null when no process exit was observed
 * @param error      error text for failed or cancelled executions
 * @param output     ordered output chunks captured while running
 */
public record CommandResult(
    String id,
    CommandAction action,
    String project,
    ExecutionStatus status,
    CommandPriority priority,
    Instant startTime,
    Instant endTime,
    long duration,
    boolean success,
    Integer exitCode,
    String error,
    List<String> output
) implements Serializable {

    public CommandResult {
        output = output == null ? List.of() : List.copyOf(output);
    }
}
