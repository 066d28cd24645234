package com.devflow.core.queue;

import com.devflow.core.model.CommandExecution;
import com.devflow.core.model.CommandOptions;
import com.devflow.core.model.CommandPriority;
import com.devflow.core.model.CommandResult;
import com.devflow.core.model.ExecutionStatus;
import com.devflow.core.model.QueuedCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Admission control and bookkeeping for every command: the priority-ordered pending
 * queue, the set of running executions, and a bounded history of terminal results.
 * <p>
 * This class owns all three structures; nothing else mutates them. It has no knowledge
 * of processes. All methods are synchronized on the queue, so callbacks arriving from
 * process I/O threads and timer threads see a consistent state.
 * <p>
 * Every terminal transition goes through {@link #complete}, which also evicts the id from
 * the active set. A late progress update for an id that is no longer active is ignored.
 */
@Service
public class ExecutionQueue {

    private static final Logger log = LoggerFactory.getLogger(ExecutionQueue.class);

    /** Maximum number of terminal results kept; the oldest is evicted first. */
    public static final int MAX_HISTORY = 50;

    /** Priority descending, then enqueue time ascending. */
    static final Comparator<QueuedCommand> DEQUEUE_ORDER =
            Comparator.comparingInt((QueuedCommand c) -> c.priority().rank()).reversed()
                    .thenComparing(QueuedCommand::timestamp);

    private final Clock clock;
    private final List<QueuedCommand> pending = new ArrayList<>();
    private final Map<String, CommandExecution> active = new LinkedHashMap<>();
    private final Deque<CommandResult> history = new ArrayDeque<>();

    public ExecutionQueue(Clock clock) {
        this.clock = clock;
    }

    // -- Queue ----------------------------------------------------------------

    /**
     * Adds a command and re-sorts the pending list. Duplicate ids are accepted here;
     * {@link #start} reconciles them.
     */
    public synchronized void enqueue(QueuedCommand command) {
        pending.add(command);
        pending.sort(DEQUEUE_ORDER);
        log.debug("Queued {} [{} {}], {} pending", command.id(), command.action().id(),
                command.priority(), pending.size());
    }

    /** Removes and returns the highest-priority pending command. */
    public synchronized Optional<QueuedCommand> dequeue() {
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pending.remove(0));
    }

    /** Removes a pending command by id. */
    public synchronized Optional<QueuedCommand> removeFromQueue(String id) {
        for (var it = pending.iterator(); it.hasNext(); ) {
            QueuedCommand c = it.next();
            if (c.id().equals(id)) {
                it.remove();
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    // -- Lifecycle ------------------------------------------------------------

    /**
     * Moves an execution into the active set, dropping any queued entry with the same id.
     * An already-active execution with that id is replaced (last writer wins).
     */
    public synchronized void start(CommandExecution execution) {
        pending.removeIf(q -> q.id().equals(execution.getId()));
        CommandExecution previous = active.put(execution.getId(), execution);
        if (previous != null) {
            log.debug("Execution {} was already active, replacing it", execution.getId());
        }
        log.info("Started {} [{}] for project {}", execution.getId(),
                execution.getAction().id(), execution.getProject());
    }

    /**
     * Clamps and stores progress and appends an output chunk, if the id is active.
     *
     * @return false when the id is not active and the update was ignored
     */
    public synchronized boolean updateProgress(String id, int progress, String outputChunk) {
        CommandExecution execution = active.get(id);
        if (execution == null) {
            return false;
        }
        execution.setProgress(progress);
        if (outputChunk != null) {
            execution.appendOutput(outputChunk);
        }
        return true;
    }

    public synchronized boolean updateProgress(String id, int progress) {
        return updateProgress(id, progress, null);
    }

    /**
     * Removes the id from the active set and appends the result to history, evicting from
     * the front beyond {@link #MAX_HISTORY}. A repeated completion for an id that is no
     * longer active but already in history is ignored.
     *
     * @return true if the result was recorded
     */
    public synchronized boolean complete(String id, CommandResult result) {
        CommandExecution execution = active.remove(id);
        if (execution == null && findInHistory(id).isPresent()) {
            log.debug("Ignoring duplicate completion for {}", id);
            return false;
        }
        if (execution != null && !execution.isTerminal()) {
            // freeze the live object so stale references cannot mutate it
            execution.toResult(result.status(), result.success(), result.exitCode(),
                    result.error(), result.endTime());
        }
        history.addLast(result);
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
        log.info("Completed {}: status={}, duration={}ms", id, result.status(), result.duration());
        return true;
    }

    /**
     * Cancels an active execution by recording a cancelled result for it.
     *
     * @return the cancelled result, or empty if the id was not active
     */
    public synchronized Optional<CommandResult> cancel(String id) {
        CommandExecution execution = active.get(id);
        if (execution == null) {
            return Optional.empty();
        }
        CommandResult result = cancelledResult(execution);
        complete(id, result);
        return Optional.of(result);
    }

    /**
     * Removes a command that has not started yet and records it as cancelled.
     *
     * @return the cancelled result, or empty if the id was not pending
     */
    public synchronized Optional<CommandResult> cancelPending(String id) {
        return removeFromQueue(id).map(this::recordNeverStarted);
    }

    private CommandResult recordNeverStarted(QueuedCommand q) {
        Instant now = clock.instant();
        CommandResult result = new CommandResult(q.id(), q.action(), q.project(),
                ExecutionStatus.CANCELLED, q.priority(), now, now, 0, false, null,
                "Cancelled before start", List.of());
        complete(q.id(), result);
        return result;
    }

    /**
     * Cancels every active execution and clears the pending queue. Pending commands are
     * recorded as cancelled results too, with a zero duration.
     *
     * @return the cancelled results, active executions first
     */
    public synchronized List<CommandResult> cancelAll() {
        List<CommandResult> cancelled = new ArrayList<>();
        for (String id : List.copyOf(active.keySet())) {
            cancel(id).ifPresent(cancelled::add);
        }
        for (QueuedCommand q : pending) {
            cancelled.add(recordNeverStarted(q));
        }
        pending.clear();
        if (!cancelled.isEmpty()) {
            log.info("Cancelled {} command(s)", cancelled.size());
        }
        return cancelled;
    }

    /**
     * Re-queues a failed or cancelled command from history under a derived id
     * ({@code {id}-retry-{millis}}) with normal priority.
     *
     * @return the new queued command, or empty if the original is absent or succeeded
     */
    public synchronized Optional<QueuedCommand> retryCommand(String id) {
        Optional<CommandResult> original = findInHistory(id);
        if (original.isEmpty() || original.get().success()) {
            return Optional.empty();
        }
        CommandResult r = original.get();
        Instant now = clock.instant();
        var retry = new QueuedCommand(id + "-retry-" + now.toEpochMilli(), r.action(), r.project(),
                CommandPriority.NORMAL, CommandOptions.defaults(), now);
        enqueue(retry);
        log.info("Retrying {} as {}", id, retry.id());
        return Optional.of(retry);
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    // -- Queries --------------------------------------------------------------

    public synchronized Optional<CommandExecution> getActive(String id) {
        return Optional.ofNullable(active.get(id));
    }

    public synchronized Optional<CommandResult> getFromHistory(String id) {
        return findInHistory(id);
    }

    public synchronized boolean isActive(String id) {
        return active.containsKey(id);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized int activeCount() {
        return active.size();
    }

    public synchronized QueueSnapshot snapshot() {
        List<CommandExecution> activeCopies = new ArrayList<>(active.size());
        for (CommandExecution e : active.values()) {
            activeCopies.add(e.copy());
        }
        return new QueueSnapshot(pending, activeCopies, new ArrayList<>(history), clock.instant());
    }

    private Optional<CommandResult> findInHistory(String id) {
        for (CommandResult r : history) {
            if (r.id().equals(id)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    private CommandResult cancelledResult(CommandExecution execution) {
        CommandResult result = execution.toResult(ExecutionStatus.CANCELLED, false, null,
                "Cancelled by user", clock.instant());
        if (result != null) {
            return result;
        }
        // already frozen elsewhere; record what it ended as
        return new CommandResult(execution.getId(), execution.getAction(), execution.getProject(),
                execution.getStatus(), execution.getPriority(), execution.getStartTime(),
                execution.getEndTime(),
                Duration.between(execution.getStartTime(), execution.getEndTime()).toMillis(),
                false, null, execution.getError(), execution.getOutput());
    }
}
