package com.devflow.core.queue;

import com.devflow.core.model.CommandExecution;
import com.devflow.core.model.CommandResult;
import com.devflow.core.model.QueuedCommand;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of the execution queue at one instant. Active executions are copies,
 * so later progress updates do not show through.
 *
 * @param pending  queued commands in dequeue order
 * @param active   running executions in start order
 * @param history  terminal results, oldest first
 * @param takenAt  when the snapshot was taken
 */
public record QueueSnapshot(
    List<QueuedCommand> pending,
    List<CommandExecution> active,
    List<CommandResult> history,
    Instant takenAt
) {

    public QueueSnapshot {
        pending = List.copyOf(pending);
        active = List.copyOf(active);
        history = List.copyOf(history);
    }
}
