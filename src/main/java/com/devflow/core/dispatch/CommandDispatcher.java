package com.devflow.core.dispatch;

import com.devflow.core.events.EventBus;
import com.devflow.core.events.ExecutionEvent;
import com.devflow.core.logging.MdcContext;
import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.model.CommandAction;
import com.devflow.core.model.CommandExecution;
import com.devflow.core.model.CommandOptions;
import com.devflow.core.model.CommandPriority;
import com.devflow.core.model.CommandResult;
import com.devflow.core.model.ExecutionStatus;
import com.devflow.core.model.FailureReason;
import com.devflow.core.model.ProcessResult;
import com.devflow.core.model.QueuedCommand;
import com.devflow.core.process.ProcessRunner;
import com.devflow.core.process.RunOptions;
import com.devflow.core.queue.ExecutionQueue;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connects the {@link ExecutionQueue} to a fixed pool of {@link ProcessRunner}s.
 * <p>
 * Each runner carries at most one execution; {@link #pump()} hands the highest priority
 * pending command to an idle runner until either runs out. Runner events are forwarded into
 * the queue's progress and output bookkeeping, and the runner's terminal result is recorded
 * in history before the runner is returned to the pool.
 * <p>
 * Priority only orders the queue. A running execution is never preempted.
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final ExecutionQueue queue;
    private final EventBus eventBus;
    private final CommandCatalog catalog;
    private final DevflowMetrics metrics;
    private final Clock clock;
    private final List<ProcessRunner> runners;
    private final int defaultTimeoutSeconds;
    private final Path workingDirectory;

    private final AtomicLong counter = new AtomicLong();

    // guarded by this
    private final Deque<ProcessRunner> idleRunners;
    private final Map<String, ProcessRunner> assignments = new HashMap<>();
    private final Map<String, EventBus.Subscription> subscriptions = new HashMap<>();
    private final Map<String, CompletableFuture<CommandResult>> waiters = new HashMap<>();
    private final Map<ProcessRunner, String> lastExecution = new HashMap<>();
    // assigned ids cancelled before or while their runner was starting them
    private final Set<String> cancelRequested = new HashSet<>();
    private boolean shutdown;

    public CommandDispatcher(ExecutionQueue queue, EventBus eventBus, CommandCatalog catalog,
                             DevflowMetrics metrics, Clock clock, List<ProcessRunner> runners,
                             int defaultTimeoutSeconds, Path workingDirectory) {
        if (runners.isEmpty()) {
            throw new IllegalArgumentException("At least one runner is required");
        }
        this.queue = queue;
        this.eventBus = eventBus;
        this.catalog = catalog;
        this.metrics = metrics;
        this.clock = clock;
        this.runners = List.copyOf(runners);
        this.idleRunners = new ArrayDeque<>(runners);
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.workingDirectory = workingDirectory;
    }

    // -------------------------------------------------------------------------
    // Submission

    /**
     * Validates and enqueues a command, then starts it if a runner is free.
     *
     * @throws CommandValidationException for an unknown action or a missing project
     */
    public QueuedCommand submit(String actionId, String project, CommandPriority priority,
                                CommandOptions options) {
        if (actionId == null || actionId.isBlank()) {
            throw new CommandValidationException("Action is required");
        }
        CommandAction action = CommandAction.fromId(actionId)
                .orElseThrow(() -> new CommandValidationException("Unknown action: " + actionId));
        return submit(action, project, priority, options);
    }

    public QueuedCommand submit(CommandAction action, String project, CommandPriority priority,
                                CommandOptions options) {
        if (action == null) {
            throw new CommandValidationException("Action is required");
        }
        CommandOptions opts = options == null ? CommandOptions.defaults() : options;
        // rejects a missing project before anything is queued
        catalog.resolve(action, project, opts);

        String id = action.id() + "-" + counter.incrementAndGet() + "-" + clock.millis();
        QueuedCommand command = new QueuedCommand(id, action, blankToNull(project), priority, opts,
                clock.instant());
        synchronized (this) {
            if (shutdown) {
                throw new IllegalStateException("Dispatcher is shut down");
            }
        }
        queue.enqueue(command);
        pump();
        return command;
    }

    /** Starts pending commands on idle runners until one of the two runs out. */
    public void pump() {
        while (true) {
            QueuedCommand command;
            ProcessRunner runner;
            synchronized (this) {
                if (shutdown || idleRunners.isEmpty()) {
                    return;
                }
                Optional<QueuedCommand> next = queue.dequeue();
                if (next.isEmpty()) {
                    return;
                }
                command = next.get();
                runner = idleRunners.poll();
                assignments.put(command.id(), runner);
                lastExecution.put(runner, command.id());
            }
            launch(command, runner);
        }
    }

    private void launch(QueuedCommand command, ProcessRunner runner) {
        String id = command.id();
        CommandExecution execution = CommandExecution.from(command, clock.instant());
        queue.start(execution);

        EventBus.Subscription subscription = eventBus.subscribe(id, event -> forward(execution, event));
        synchronized (this) {
            subscriptions.put(id, subscription);
        }

        MdcContext.setExecution(id, command.action().id(), command.project());
        try {
            List<String> commandLine = catalog.resolve(command.action(), command.project(), command.options());
            int timeoutSeconds = command.options().timeoutSeconds() > 0
                    ? command.options().timeoutSeconds()
                    : defaultTimeoutSeconds;
            RunOptions runOptions = new RunOptions(workingDirectory, command.options().env(),
                    timeoutSeconds * 1000L, id);
            if (isCancelRequested(id)) {
                log.info("{} was cancelled before it started", id);
                onFinished(command, execution, runner, new ProcessResult(false, -1, "",
                        "Cancelled before start", 0, FailureReason.CANCELLED));
                return;
            }
            log.info("Dispatching {} to {}", id, runner.getRunnerId());
            runner.execute(commandLine.get(0), commandLine.subList(1, commandLine.size()), runOptions)
                    .whenComplete((result, ex) -> {
                        ProcessResult r = result != null ? result
                                : ProcessResult.spawnFailed(String.valueOf(ex), "", 0);
                        onFinished(command, execution, runner, r);
                    });
            // a cancel that found the runner still idle is delivered now that it is running
            if (isCancelRequested(id)) {
                runner.cancel();
            }
        } catch (RuntimeException e) {
            log.error("Could not start {}: {}", id, e.getMessage(), e);
            onFinished(command, execution, runner, ProcessResult.spawnFailed(e.getMessage(), "", 0));
        } finally {
            MdcContext.clear();
        }
    }

    private synchronized boolean isCancelRequested(String id) {
        return cancelRequested.contains(id);
    }

    private void forward(CommandExecution execution, ExecutionEvent event) {
        switch (event.type()) {
            case OUTPUT, ERROR -> queue.updateProgress(execution.getId(), execution.getProgress(), event.text());
            case PROGRESS -> queue.updateProgress(execution.getId(), event.progress());
            case COMPLETE -> {
                if (event.result() != null && event.result().success()) {
                    queue.updateProgress(execution.getId(), 100);
                }
            }
        }
    }

    private void onFinished(QueuedCommand command, CommandExecution execution, ProcessRunner runner,
                            ProcessResult result) {
        String id = command.id();
        MdcContext.setExecution(id, command.action().id(), command.project());
        try {
            ExecutionStatus status = result.success() ? ExecutionStatus.COMPLETED
                    : result.cancelled() ? ExecutionStatus.CANCELLED
                    : ExecutionStatus.FAILED;
            String error = result.success() ? null : blankToNull(result.error());
            CommandResult recorded = execution.toResult(status, result.success(), result.exitCode(),
                    error, clock.instant());
            if (recorded != null) {
                queue.complete(id, recorded);
            } else {
                // already frozen by a queue-level cancel; history holds the authoritative result
                recorded = queue.getFromHistory(id).orElse(null);
            }
            if (recorded != null) {
                metrics.recordExecution(command.action().id(),
                        recorded.status().name().toLowerCase(), recorded.duration());
            }

            CompletableFuture<CommandResult> waiter;
            EventBus.Subscription subscription;
            synchronized (this) {
                assignments.remove(id);
                cancelRequested.remove(id);
                if (!shutdown) {
                    idleRunners.addLast(runner);
                }
                subscription = subscriptions.remove(id);
                waiter = waiters.remove(id);
            }
            if (subscription != null) {
                subscription.unsubscribe();
            }
            if (waiter != null && recorded != null) {
                waiter.complete(recorded);
            }
        } finally {
            MdcContext.clear();
        }
        pump();
    }

    // -------------------------------------------------------------------------
    // Control

    /**
     * Cancels a running execution (two-stage process termination plus a cancelled history
     * entry) or drops a pending one.
     *
     * @return true if anything was cancelled
     */
    public boolean cancel(String id) {
        ProcessRunner runner;
        synchronized (this) {
            runner = assignments.get(id);
            if (runner != null) {
                cancelRequested.add(id);
            }
        }
        if (runner != null) {
            runner.cancel();
            Optional<CommandResult> cancelled = queue.cancel(id);
            cancelled.ifPresent(this::completeWaiter);
            return true;
        }
        Optional<CommandResult> dropped = queue.cancelPending(id);
        dropped.ifPresent(this::completeWaiter);
        return dropped.isPresent();
    }

    /** Cancels every running execution and empties the pending queue. */
    public List<CommandResult> cancelAll() {
        List<ProcessRunner> busy;
        synchronized (this) {
            busy = List.copyOf(assignments.values());
            cancelRequested.addAll(assignments.keySet());
        }
        busy.forEach(ProcessRunner::cancel);
        List<CommandResult> cancelled = queue.cancelAll();
        cancelled.forEach(this::completeWaiter);
        return cancelled;
    }

    /** Re-queues a failed or cancelled command from history and pumps. */
    public Optional<QueuedCommand> retry(String id) {
        Optional<QueuedCommand> retried = queue.retryCommand(id);
        retried.ifPresent(c -> pump());
        return retried;
    }

    /** A future completed with the command's terminal result once it is in history. */
    public synchronized CompletableFuture<CommandResult> awaitResult(String id) {
        Optional<CommandResult> done = queue.getFromHistory(id);
        if (done.isPresent()) {
            return CompletableFuture.completedFuture(done.get());
        }
        return waiters.computeIfAbsent(id, k -> new CompletableFuture<>());
    }

    private void completeWaiter(CommandResult result) {
        CompletableFuture<CommandResult> waiter;
        synchronized (this) {
            waiter = waiters.remove(result.id());
        }
        if (waiter != null) {
            waiter.complete(result);
        }
    }

    // -------------------------------------------------------------------------
    // Output

    /**
     * Output of an execution: live runner output while running, the recorded chunks after.
     */
    public Optional<String> getOutput(String id) {
        ProcessRunner runner;
        synchronized (this) {
            runner = assignments.get(id);
        }
        if (runner != null) {
            return Optional.of(runner.getCurrentOutput());
        }
        return queue.getActive(id)
                .map(e -> String.join("", e.getOutput()))
                .or(() -> queue.getFromHistory(id).map(r -> String.join("", r.output())));
    }

    /**
     * Clears the live output buffer of the runner that ran (or is running) the execution.
     * History entries are never modified.
     */
    public boolean clearOutput(String id) {
        ProcessRunner target = null;
        synchronized (this) {
            for (Map.Entry<ProcessRunner, String> e : lastExecution.entrySet()) {
                if (e.getValue().equals(id)) {
                    target = e.getKey();
                }
            }
        }
        if (target == null) {
            return false;
        }
        target.clearOutput();
        return true;
    }

    public synchronized boolean isRunning() {
        return !assignments.isEmpty();
    }

    public synchronized int idleRunnerCount() {
        return idleRunners.size();
    }

    public int poolSize() {
        return runners.size();
    }

    public ExecutionQueue getQueue() {
        return queue;
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        List<CommandResult> cancelled = cancelAll();
        runners.forEach(ProcessRunner::dispose);
        log.info("Dispatcher shut down, {} command(s) cancelled", cancelled.size());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
