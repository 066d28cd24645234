package com.devflow.core.process;

import com.devflow.core.events.EventBus;
import com.devflow.core.events.ExecutionEvent;
import com.devflow.core.model.FailureReason;
import com.devflow.core.model.ProcessResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one external process at a time, streaming its output through the {@link EventBus}.
 *
 * <p>State machine: {@code IDLE -> RUNNING -> IDLE}. A run resolves exactly once, with
 * whichever of natural exit, spawn failure or timeout comes first; the losers find the
 * run already resolved and only cancel their timers. A second {@link #execute} while
 * running fails with {@link RunnerBusyException}.
 *
 * <p>Cancellation is two-stage: a graceful termination request immediately, then a
 * forceful kill if the process is still alive after the grace period. Only one kill is
 * ever sent per run. A cancelled run resolves when the process actually exits; a timed-out
 * run resolves immediately while the kill escalation continues in the background.
 *
 * <p>Every path resolves the returned future normally: failures are encoded in
 * {@link ProcessResult#reason()} rather than thrown.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    /** Delay between the graceful termination request and the forceful kill. */
    public static final long DEFAULT_GRACE_PERIOD_MS = 5000;

    /** How long to keep draining output after exit before resolving anyway. */
    static final long DRAIN_TIMEOUT_MS = 2000;

    static final String CANCELLED_MESSAGE = "Command was cancelled";

    private enum State { IDLE, RUNNING }

    private final String runnerId;
    private final ProcessLauncher launcher;
    private final EventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Executor streamExecutor;
    private final ProgressEstimator progressEstimator;
    private final long gracePeriodMs;
    private final Path defaultWorkingDirectory;

    private final Object lock = new Object();
    private final AtomicLong runCounter = new AtomicLong();

    private State state = State.IDLE;
    private Run current;
    // most recently started run; owns the buffer behind getCurrentOutput()
    private Run lastRun;
    private boolean disposed;

    public ProcessRunner(String runnerId, ProcessLauncher launcher, EventBus eventBus,
                         ScheduledExecutorService scheduler, Executor streamExecutor,
                         ProgressEstimator progressEstimator, long gracePeriodMs,
                         Path defaultWorkingDirectory) {
        if (gracePeriodMs <= 0) {
            throw new IllegalArgumentException("gracePeriodMs must be positive");
        }
        this.runnerId = runnerId;
        this.launcher = launcher;
        this.eventBus = eventBus;
        this.scheduler = scheduler;
        this.streamExecutor = streamExecutor;
        this.progressEstimator = progressEstimator == null ? ProgressEstimator.none() : progressEstimator;
        this.gracePeriodMs = gracePeriodMs;
        this.defaultWorkingDirectory = defaultWorkingDirectory;
    }

    public ProcessRunner(String runnerId, ProcessLauncher launcher, EventBus eventBus,
                         ScheduledExecutorService scheduler, Executor streamExecutor) {
        this(runnerId, launcher, eventBus, scheduler, streamExecutor,
                ProgressEstimator.none(), DEFAULT_GRACE_PERIOD_MS, null);
    }

    // -------------------------------------------------------------------------
    // Execution

    /**
     * Spawns {@code command args...} and returns a future that always completes normally
     * with the terminal result.
     *
     * @throws RunnerBusyException   if a process is already in flight on this runner
     * @throws IllegalStateException if the runner has been disposed
     */
    public CompletableFuture<ProcessResult> execute(String command, List<String> args, RunOptions options) {
        RunOptions opts = options == null ? RunOptions.defaults() : options;
        String executionId = opts.executionId() != null
                ? opts.executionId()
                : runnerId + "-run-" + runCounter.incrementAndGet();

        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        if (args != null) {
            commandLine.addAll(args);
        }

        Run run;
        synchronized (lock) {
            if (disposed) {
                throw new IllegalStateException("Runner " + runnerId + " has been disposed");
            }
            if (state == State.RUNNING) {
                throw new RunnerBusyException(runnerId);
            }
            state = State.RUNNING;
            run = new Run(executionId, System.nanoTime());
            current = run;
            lastRun = run;
        }

        Path cwd = opts.workingDirectory() != null ? opts.workingDirectory() : defaultWorkingDirectory;
        log.info("[{}] Executing {} in {}", executionId, String.join(" ", commandLine),
                cwd != null ? cwd : "<cwd>");

        run.tracker = progressEstimator.begin(percent -> {
            if (!run.resolved.get()) {
                eventBus.publish(ExecutionEvent.progress(executionId, percent));
            }
        });

        LaunchedProcess process;
        try {
            process = launcher.launch(commandLine, cwd, opts.env());
        } catch (IOException | RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("[{}] Failed to start {}: {}", executionId, command, message);
            eventBus.publish(ExecutionEvent.error(executionId, message));
            resolve(run, ProcessResult.spawnFailed(message, "", run.elapsedMs()));
            return run.future;
        }
        synchronized (run) {
            run.process = process;
        }
        if (run.reason.get() != null) {
            // cancelled while the launcher was still spawning
            beginTermination(run);
        }

        CompletableFuture<Void> stdoutDone = CompletableFuture.runAsync(
                () -> drain(run, process.stdout(), false), streamExecutor);
        CompletableFuture<Void> stderrDone = CompletableFuture.runAsync(
                () -> drain(run, process.stderr(), true), streamExecutor);

        if (opts.timeoutMs() > 0) {
            run.timeoutTask = scheduler.schedule(() -> onTimeout(run, opts.timeoutMs()),
                    opts.timeoutMs(), TimeUnit.MILLISECONDS);
        }

        // Resolve only after the process exited and both streams were read to the end,
        // so fast processes never lose trailing output.
        process.onExit()
                .thenCompose(code -> CompletableFuture.allOf(stdoutDone, stderrDone)
                        .completeOnTimeout(null, DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                        .thenApply(v -> code))
                .whenComplete((code, ex) -> {
                    if (ex != null) {
                        log.warn("[{}] Error awaiting process exit: {}", executionId, ex.getMessage());
                        onExited(run, -1);
                    } else {
                        onExited(run, code);
                    }
                });

        return run.future;
    }

    public CompletableFuture<ProcessResult> executeGitCommand(List<String> args, Path cwd) {
        return execute("git", args, RunOptions.in(cwd));
    }

    public CompletableFuture<ProcessResult> executeTestCommand(String command, List<String> args, Path cwd) {
        return execute(command, args, RunOptions.in(cwd));
    }

    public CompletableFuture<ProcessResult> executeLintCommand(String command, List<String> args, Path cwd) {
        return execute(command, args, RunOptions.in(cwd));
    }

    // -------------------------------------------------------------------------
    // Cancellation

    /**
     * Starts the cancellation sequence for the in-flight process. No-op when idle.
     * Returns before the process has necessarily exited.
     *
     * @return true if a running process was signalled
     */
    public boolean cancel() {
        Run run;
        synchronized (lock) {
            if (state != State.RUNNING || current == null) {
                return false;
            }
            run = current;
        }
        run.reason.compareAndSet(null, FailureReason.CANCELLED);
        log.info("[{}] Cancelling", run.executionId);
        beginTermination(run);
        return true;
    }

    /** Cancels any in-flight process and rejects further executions. */
    public void dispose() {
        cancel();
        synchronized (lock) {
            disposed = true;
        }
    }

    // -------------------------------------------------------------------------
    // Queries

    public String getRunnerId() {
        return runnerId;
    }

    public boolean isRunning() {
        synchronized (lock) {
            return state == State.RUNNING;
        }
    }

    /** Id of the execution in flight, or null when idle. */
    public String getCurrentExecutionId() {
        synchronized (lock) {
            return current != null ? current.executionId : null;
        }
    }

    /**
     * Combined stdout and stderr of the current (or most recent) run, in arrival order.
     * Late output of an earlier run that timed out never shows up here.
     */
    public String getCurrentOutput() {
        Run run;
        synchronized (lock) {
            run = lastRun;
        }
        return run != null ? run.combined() : "";
    }

    public void clearOutput() {
        Run run;
        synchronized (lock) {
            run = lastRun;
        }
        if (run != null) {
            run.clearCombined();
        }
    }

    // -------------------------------------------------------------------------
    // Internals

    private void drain(Run run, InputStream in, boolean isStderr) {
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, n);
                run.append(chunk, isStderr);
                run.tracker.onOutput(chunk);
                eventBus.publish(isStderr
                        ? ExecutionEvent.error(run.executionId, chunk)
                        : ExecutionEvent.output(run.executionId, chunk));
            }
        } catch (IOException e) {
            // the exit code decides the outcome; a broken pipe after a kill is expected
            if (run.reason.get() == null) {
                log.warn("[{}] {} stream error: {}", run.executionId, isStderr ? "stderr" : "stdout",
                        e.getMessage());
            }
        }
    }

    private void onTimeout(Run run, long timeoutMs) {
        if (run.resolved.get()) {
            return;
        }
        if (!run.reason.compareAndSet(null, FailureReason.TIMEOUT)) {
            // a user cancellation is already under way and will resolve the run
            return;
        }
        String message = "Command timed out after " + timeoutMs + "ms";
        log.warn("[{}] {}", run.executionId, message);
        beginTermination(run);
        resolve(run, new ProcessResult(false, -1, run.stdout(), message, run.elapsedMs(),
                FailureReason.TIMEOUT));
    }

    private void beginTermination(Run run) {
        synchronized (run) {
            if (run.exited || run.process == null) {
                return;
            }
            run.process.terminate();
            if (run.forceKillTask != null) {
                run.forceKillTask.cancel(false);
            }
            run.forceKillTask = scheduler.schedule(() -> forceKill(run), gracePeriodMs, TimeUnit.MILLISECONDS);
        }
    }

    private void forceKill(Run run) {
        synchronized (run) {
            if (run.exited || run.killSent) {
                return;
            }
            run.killSent = true;
            run.forceKillTask = null;
        }
        log.warn("[{}] Still running after {}ms grace period, killing", run.executionId, gracePeriodMs);
        run.process.kill();
    }

    private void onExited(Run run, int exitCode) {
        synchronized (run) {
            run.exited = true;
            if (run.forceKillTask != null) {
                run.forceKillTask.cancel(false);
                run.forceKillTask = null;
            }
        }
        if (run.resolved.get()) {
            // already resolved by a timeout; the process is now gone
            log.debug("[{}] Process exited with {} after resolution", run.executionId, exitCode);
            return;
        }
        ProcessResult result;
        if (run.reason.get() == FailureReason.CANCELLED) {
            String stderr = run.stderr();
            String error = stderr.isBlank() ? CANCELLED_MESSAGE : CANCELLED_MESSAGE + "\n" + stderr;
            result = new ProcessResult(false, exitCode, run.stdout(), error, run.elapsedMs(),
                    FailureReason.CANCELLED);
        } else {
            result = ProcessResult.exited(exitCode, run.stdout(), run.stderr(), run.elapsedMs());
        }
        resolve(run, result);
    }

    private void resolve(Run run, ProcessResult result) {
        if (!run.resolved.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> timeout = run.timeoutTask;
        if (timeout != null) {
            timeout.cancel(false);
        }
        run.tracker.close();
        synchronized (lock) {
            if (current == run) {
                current = null;
                state = State.IDLE;
            }
        }
        log.info("[{}] Finished: success={}, exitCode={}, reason={}, {}ms", run.executionId,
                result.success(), result.exitCode(), result.reason(), result.duration());
        eventBus.publish(ExecutionEvent.complete(run.executionId, result));
        run.future.complete(result);
    }

    /** Per-run state. The most recent run stays reachable for its output buffer. */
    private static final class Run {
        final String executionId;
        final long startNanos;
        final CompletableFuture<ProcessResult> future = new CompletableFuture<>();
        final AtomicBoolean resolved = new AtomicBoolean();
        final AtomicReference<FailureReason> reason = new AtomicReference<>();
        final StringBuilder out = new StringBuilder();
        final StringBuilder err = new StringBuilder();
        final StringBuilder combined = new StringBuilder();

        volatile LaunchedProcess process;
        volatile ScheduledFuture<?> timeoutTask;
        volatile ProgressEstimator.Tracker tracker;

        // guarded by this
        ScheduledFuture<?> forceKillTask;
        boolean killSent;
        boolean exited;

        Run(String executionId, long startNanos) {
            this.executionId = executionId;
            this.startNanos = startNanos;
        }

        long elapsedMs() {
            return Math.max(0, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }

        synchronized void append(String chunk, boolean isStderr) {
            (isStderr ? err : out).append(chunk);
            combined.append(chunk);
        }

        synchronized String combined() {
            return combined.toString();
        }

        synchronized void clearCombined() {
            combined.setLength(0);
        }

        synchronized String stdout() {
            return out.toString();
        }

        synchronized String stderr() {
            return err.toString();
        }
    }
}
