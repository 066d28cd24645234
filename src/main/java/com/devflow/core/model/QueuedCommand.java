package com.devflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A command waiting in the execution queue. Immutable once queued; removed when dequeued.
 *
 * @param id        unique command identifier
 * @param action    workflow action to run
 * @param project   target project (may be null for project-less actions)
 * @param priority  queue priority
 * @param options   caller-supplied options
 * @param timestamp enqueue time, used to break priority ties
 */
public record QueuedCommand(
    String id,
    CommandAction action,
    String project,
    CommandPriority priority,
    CommandOptions options,
    Instant timestamp
) implements Serializable {

    public QueuedCommand {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(action, "action");
        priority = priority == null ? CommandPriority.NORMAL : priority;
        options = options == null ? CommandOptions.defaults() : options;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
