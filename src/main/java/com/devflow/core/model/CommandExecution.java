package com.devflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A command currently being run by the scheduler.
 * <p>
 * Created when a {@link QueuedCommand} is dequeued and mutated in place by progress and
 * output updates while running. Once the status is terminal every mutator is ignored;
 * the only way to get there is {@link #toResult}, which the queue calls on completion.
 */
public class CommandExecution {

    private final String id;
    private final CommandAction action;
    private final String project;
    private final CommandPriority priority;
    private final Instant startTime;
    private final List<String> output = new ArrayList<>();

    private ExecutionStatus status;
    private Instant endTime;
    private int progress;
    private String error;

    public CommandExecution(String id, CommandAction action, String project,
                            CommandPriority priority, Instant startTime) {
        this.id = Objects.requireNonNull(id, "id");
        this.action = Objects.requireNonNull(action, "action");
        this.project = project;
        this.priority = priority == null ? CommandPriority.NORMAL : priority;
        this.startTime = startTime == null ? Instant.now() : startTime;
        this.status = ExecutionStatus.RUNNING;
    }

    /**
     * Creates a running execution for a dequeued command. {@code startTime} should come from
     * the same clock that later stamps the end time.
     */
    public static CommandExecution from(QueuedCommand command, Instant startTime) {
        return new CommandExecution(command.id(), command.action(), command.project(),
                command.priority(), startTime);
    }

    public String getId() { return id; }
    public CommandAction getAction() { return action; }
    public String getProject() { return project; }
    public CommandPriority getPriority() { return priority; }
    public Instant getStartTime() { return startTime; }
    public synchronized ExecutionStatus getStatus() { return status; }
    public synchronized Instant getEndTime() { return endTime; }
    public synchronized int getProgress() { return progress; }
    public synchronized String getError() { return error; }

    public synchronized List<String> getOutput() {
        return Collections.unmodifiableList(new ArrayList<>(output));
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /** Sets progress clamped to [0, 100]. Ignored once terminal. */
    public synchronized void setProgress(int value) {
        if (status.isTerminal()) {
            return;
        }
        progress = Math.max(0, Math.min(100, value));
    }

    /** Appends an output chunk. Ignored once terminal or for null chunks. */
    public synchronized void appendOutput(String chunk) {
        if (status.isTerminal() || chunk == null) {
            return;
        }
        output.add(chunk);
    }

    public synchronized void setError(String message) {
        if (!status.isTerminal()) {
            error = message;
        }
    }

    /** Point-in-time copy, detached from further updates to this execution. */
    public synchronized CommandExecution copy() {
        CommandExecution c = new CommandExecution(id, action, project, priority, startTime);
        c.output.addAll(output);
        c.status = status;
        c.endTime = endTime;
        c.progress = progress;
        c.error = error;
        return c;
    }

    /**
     * Freezes this execution into a terminal {@link CommandResult}.
     * Returns {@code null} if it was already terminal.
     */
    public synchronized CommandResult toResult(ExecutionStatus terminal, boolean success,
                                               Integer exitCode, String errorText, Instant end) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            return null;
        }
        status = terminal;
        endTime = end == null ? Instant.now() : end;
        if (errorText != null) {
            error = errorText;
        }
        long duration = Math.max(0, Duration.between(startTime, endTime).toMillis());
        return new CommandResult(id, action, project, status, priority, startTime, endTime,
                duration, success, exitCode, error, List.copyOf(output));
    }
}
