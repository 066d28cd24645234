package com.devflow.core.process;

import com.devflow.core.events.EventBus;
import com.devflow.core.events.ExecutionEvent;
import com.devflow.core.events.ExecutionEventType;
import com.devflow.core.model.FailureReason;
import com.devflow.core.model.ProcessResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ProcessRunner}.
 * <p>
 * Timers go through a mocked scheduler so that grace periods and timeouts fire only when
 * a test runs them; output draining runs inline.
 */
class ProcessRunnerTest {

    private EventBus eventBus;
    private ScheduledExecutorService scheduler;
    private List<Scheduled> scheduled;
    private List<ExecutionEvent> events;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);

        scheduled = new CopyOnWriteArrayList<>();
        scheduler = mock(ScheduledExecutorService.class);
        doAnswer(inv -> {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            scheduled.add(new Scheduled((Runnable) inv.getArgument(0), (Long) inv.getArgument(1), future));
            return future;
        }).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    private ProcessRunner runner(ProcessLauncher launcher) {
        return new ProcessRunner("r1", launcher, eventBus, scheduler, Runnable::run,
                ProgressEstimator.none(), ProcessRunner.DEFAULT_GRACE_PERIOD_MS, null);
    }

    private long countEvents(ExecutionEventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    @Nested
    @DisplayName("normal completion")
    class CompletionTests {

        @Test
        @DisplayName("resolves with exit code, output and stderr")
        void resolvesOnExit() throws Exception {
            FakeProcess process = new FakeProcess("ok\n", "warn\n");
            process.exit.complete(0);
            ProcessRunner runner = runner((cmd, cwd, env) -> process);

            ProcessResult result = runner.execute("echo", List.of("ok"), RunOptions.defaults())
                    .get(2, TimeUnit.SECONDS);

            assertTrue(result.success());
            assertEquals(0, result.exitCode());
            assertEquals("ok\n", result.output());
            assertEquals("warn\n", result.error());
            assertEquals(FailureReason.NONE, result.reason());
            assertTrue(result.duration() >= 0);
            assertFalse(runner.isRunning());
            assertEquals("ok\nwarn\n", runner.getCurrentOutput());
        }

        @Test
        @DisplayName("nonzero exit is a failure tagged EXIT_CODE")
        void nonZeroExit() throws Exception {
            FakeProcess process = new FakeProcess("", "boom\n");
            process.exit.complete(2);
            ProcessRunner runner = runner((cmd, cwd, env) -> process);

            ProcessResult result = runner.execute("false", List.of(), RunOptions.defaults())
                    .get(2, TimeUnit.SECONDS);

            assertFalse(result.success());
            assertEquals(2, result.exitCode());
            assertEquals(FailureReason.EXIT_CODE, result.reason());
        }

        @Test
        @DisplayName("streams output and error events under the execution id")
        void streamsEvents() throws Exception {
            FakeProcess process = new FakeProcess("out", "err");
            process.exit.complete(0);
            ProcessRunner runner = runner((cmd, cwd, env) -> process);

            runner.execute("x", List.of(), RunOptions.defaults().withExecutionId("E-7")).get(2, TimeUnit.SECONDS);

            assertTrue(events.stream().allMatch(e -> "E-7".equals(e.executionId())));
            assertEquals(1, countEvents(ExecutionEventType.OUTPUT));
            assertEquals(1, countEvents(ExecutionEventType.ERROR));
            assertEquals(1, countEvents(ExecutionEventType.COMPLETE));
        }

        @Test
        @DisplayName("passes the full command line to the launcher")
        void passesCommandLine() throws Exception {
            List<String> seen = new ArrayList<>();
            FakeProcess process = new FakeProcess("", "");
            process.exit.complete(0);
            ProcessRunner runner = runner((cmd, cwd, env) -> {
                seen.addAll(cmd);
                return process;
            });

            runner.executeGitCommand(List.of("diff", "--stat"), null).get(2, TimeUnit.SECONDS);

            assertEquals(List.of("git", "diff", "--stat"), seen);
        }

        @Test
        @DisplayName("late output of a timed-out run stays out of the next run's buffer")
        void timedOutRunOutputIsIsolated() throws Exception {
            ExecutorService drains = Executors.newCachedThreadPool();
            try {
                PipedOutputStream lateWriter = new PipedOutputStream();
                PipedInputStream lateStdout = new PipedInputStream(lateWriter);
                FakeProcess slow = new FakeProcess("", "") {
                    @Override
                    public InputStream stdout() {
                        return lateStdout;
                    }
                };
                FakeProcess quick = new FakeProcess("second\n", "");
                quick.exit.complete(0);
                List<FakeProcess> processes = new CopyOnWriteArrayList<>(List.of(slow, quick));
                ProcessRunner runner = new ProcessRunner("r1", (cmd, cwd, env) -> processes.remove(0), eventBus,
                        scheduler, drains, ProgressEstimator.none(), ProcessRunner.DEFAULT_GRACE_PERIOD_MS, null);

                CompletableFuture<ProcessResult> first = runner.execute("slow", List.of(),
                        RunOptions.defaults().withTimeout(100).withExecutionId("first"));
                scheduled.get(0).task.run();
                assertEquals(FailureReason.TIMEOUT, first.get(2, TimeUnit.SECONDS).reason());

                ProcessResult second = runner.execute("quick", List.of(),
                        RunOptions.defaults().withExecutionId("second")).get(2, TimeUnit.SECONDS);

                lateWriter.write("LATE\n".getBytes(StandardCharsets.UTF_8));
                lateWriter.close();
                long deadline = System.currentTimeMillis() + 2000;
                while (events.stream().noneMatch(e -> "first".equals(e.executionId())
                        && e.type() == ExecutionEventType.OUTPUT)
                        && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10);
                }

                assertTrue(events.stream().anyMatch(e -> "first".equals(e.executionId())
                        && "LATE\n".equals(e.text())));
                assertEquals("second\n", second.output());
                assertEquals("second\n", runner.getCurrentOutput());
            } finally {
                drains.shutdownNow();
            }
        }

        @Test
        @DisplayName("clearOutput empties the cumulative buffer")
        void clearOutput() throws Exception {
            FakeProcess process = new FakeProcess("data", "");
            process.exit.complete(0);
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            runner.execute("x", List.of(), RunOptions.defaults()).get(2, TimeUnit.SECONDS);

            runner.clearOutput();

            assertEquals("", runner.getCurrentOutput());
        }
    }

    @Nested
    @DisplayName("failure paths")
    class FailureTests {

        @Test
        @DisplayName("spawn failure resolves with exit code 1 and the launcher message")
        void spawnFailure() throws Exception {
            ProcessRunner runner = runner((cmd, cwd, env) -> {
                throw new IOException("Cannot run program \"nope\"");
            });

            ProcessResult result = runner.execute("nope", List.of(), RunOptions.defaults())
                    .get(2, TimeUnit.SECONDS);

            assertFalse(result.success());
            assertEquals(1, result.exitCode());
            assertEquals(FailureReason.SPAWN, result.reason());
            assertTrue(result.error().contains("Cannot run program"));
            assertFalse(runner.isRunning());
            assertEquals(1, countEvents(ExecutionEventType.ERROR));
            assertEquals(1, countEvents(ExecutionEventType.COMPLETE));
        }

        @Test
        @DisplayName("a second execute while running fails immediately")
        void busy() {
            FakeProcess process = new FakeProcess("", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            runner.execute("sleep", List.of("10"), RunOptions.defaults());

            assertThrows(RunnerBusyException.class,
                    () -> runner.execute("sleep", List.of("10"), RunOptions.defaults()));
            assertTrue(runner.isRunning());
        }

        @Test
        @DisplayName("timeout resolves at once and starts the kill sequence")
        void timeout() throws Exception {
            FakeProcess process = new FakeProcess("partial", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            CompletableFuture<ProcessResult> future =
                    runner.execute("slow", List.of(), RunOptions.defaults().withTimeout(1000));

            Scheduled timeout = scheduled.get(0);
            assertEquals(1000, timeout.delayMs);
            timeout.task.run();

            ProcessResult result = future.get(2, TimeUnit.SECONDS);
            assertEquals(FailureReason.TIMEOUT, result.reason());
            assertEquals("Command timed out after 1000ms", result.error());
            assertEquals(-1, result.exitCode());
            assertEquals("partial", result.output());
            assertEquals(1, process.terminates.get());
            assertFalse(runner.isRunning());

            // the process exits later; no second terminal event
            process.exit.complete(143);
            assertEquals(1, countEvents(ExecutionEventType.COMPLETE));
        }

        @Test
        @DisplayName("natural exit cancels the pending timeout")
        void exitCancelsTimeout() throws Exception {
            FakeProcess process = new FakeProcess("", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            CompletableFuture<ProcessResult> future =
                    runner.execute("x", List.of(), RunOptions.defaults().withTimeout(5000));

            process.exit.complete(0);

            assertTrue(future.get(2, TimeUnit.SECONDS).success());
            verify(scheduled.get(0).future).cancel(false);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancel while idle is a no-op")
        void idleCancel() {
            ProcessRunner runner = runner((cmd, cwd, env) -> new FakeProcess("", ""));
            assertFalse(runner.cancel());
            assertTrue(scheduled.isEmpty());
        }

        @Test
        @DisplayName("sends terminate at once and exactly one kill after the grace period")
        void escalates() throws Exception {
            FakeProcess process = new FakeProcess("", "");
            process.exitOnKill = true;
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            CompletableFuture<ProcessResult> future = runner.execute("stubborn", List.of(), RunOptions.defaults());

            assertTrue(runner.cancel());

            assertEquals(1, process.terminates.get());
            assertEquals(0, process.kills.get());
            assertEquals(1, scheduled.size());
            assertEquals(ProcessRunner.DEFAULT_GRACE_PERIOD_MS, scheduled.get(0).delayMs);
            assertFalse(future.isDone());

            scheduled.get(0).task.run();
            scheduled.get(0).task.run();

            assertEquals(1, process.kills.get());
            ProcessResult result = future.get(2, TimeUnit.SECONDS);
            assertEquals(FailureReason.CANCELLED, result.reason());
            assertEquals(ProcessRunner.CANCELLED_MESSAGE, result.error());
            assertFalse(result.success());
            assertEquals(137, result.exitCode());
        }

        @Test
        @DisplayName("a cancel that arrives while the process is spawning terminates it once it exists")
        void cancelDuringSpawn() throws Exception {
            CountDownLatch launching = new CountDownLatch(1);
            CountDownLatch cancelSent = new CountDownLatch(1);
            FakeProcess process = new FakeProcess("", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> {
                launching.countDown();
                try {
                    cancelSent.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return process;
            });

            CompletableFuture<CompletableFuture<ProcessResult>> started = CompletableFuture.supplyAsync(
                    () -> runner.execute("slow-start", List.of(), RunOptions.defaults()));
            assertTrue(launching.await(2, TimeUnit.SECONDS));
            assertTrue(runner.cancel());
            assertEquals(0, process.terminates.get());
            cancelSent.countDown();

            CompletableFuture<ProcessResult> future = started.get(2, TimeUnit.SECONDS);
            assertEquals(1, process.terminates.get());
            assertEquals(1, scheduled.size());
            assertEquals(ProcessRunner.DEFAULT_GRACE_PERIOD_MS, scheduled.get(0).delayMs);

            process.exit.complete(143);
            ProcessResult result = future.get(2, TimeUnit.SECONDS);
            assertEquals(FailureReason.CANCELLED, result.reason());
            assertFalse(runner.isRunning());
        }

        @Test
        @DisplayName("no kill when the process exits during the grace period")
        void exitsGracefully() throws Exception {
            FakeProcess process = new FakeProcess("", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            CompletableFuture<ProcessResult> future = runner.execute("polite", List.of(), RunOptions.defaults());

            runner.cancel();
            process.exit.complete(143);
            scheduled.get(0).task.run();

            assertEquals(0, process.kills.get());
            assertEquals(FailureReason.CANCELLED, future.get(2, TimeUnit.SECONDS).reason());
            verify(scheduled.get(0).future).cancel(false);
        }

        @Test
        @DisplayName("a second cancel replaces the pending force-kill timer")
        void secondCancelReplacesTimer() {
            FakeProcess process = new FakeProcess("", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            runner.execute("stubborn", List.of(), RunOptions.defaults());

            runner.cancel();
            runner.cancel();

            assertEquals(2, process.terminates.get());
            assertEquals(2, scheduled.size());
            verify(scheduled.get(0).future).cancel(false);
            verify(scheduled.get(1).future, never()).cancel(false);

            scheduled.get(1).task.run();
            assertEquals(1, process.kills.get());
        }

        @Test
        @DisplayName("a timeout during cancellation does not resolve the run early")
        void timeoutAfterCancel() {
            FakeProcess process = new FakeProcess("", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            CompletableFuture<ProcessResult> future =
                    runner.execute("x", List.of(), RunOptions.defaults().withTimeout(100));

            runner.cancel();
            scheduled.get(0).task.run();

            assertFalse(future.isDone());
            assertEquals(1, process.terminates.get());
        }

        @Test
        @DisplayName("dispose cancels and rejects new executions")
        void dispose() {
            FakeProcess process = new FakeProcess("", "");
            ProcessRunner runner = runner((cmd, cwd, env) -> process);
            runner.execute("x", List.of(), RunOptions.defaults());

            runner.dispose();

            assertEquals(1, process.terminates.get());
            assertThrows(IllegalStateException.class,
                    () -> runner.execute("x", List.of(), RunOptions.defaults()));
        }
    }

    @Nested
    @DisplayName("real processes")
    @DisabledOnOs(OS.WINDOWS)
    class RealProcessTests {

        private ScheduledExecutorService realScheduler;
        private ExecutorService streams;

        @BeforeEach
        void startExecutors() {
            realScheduler = Executors.newScheduledThreadPool(2);
            streams = Executors.newCachedThreadPool();
        }

        @AfterEach
        void stopExecutors() {
            realScheduler.shutdownNow();
            streams.shutdownNow();
        }

        @Test
        @DisplayName("round trip: printf ok")
        void roundTrip() throws Exception {
            ProcessRunner runner = new ProcessRunner("real", new DefaultProcessLauncher(), eventBus,
                    realScheduler, streams);

            ProcessResult result = runner.execute("sh", List.of("-c", "printf 'ok\\n'"), RunOptions.defaults())
                    .get(10, TimeUnit.SECONDS);

            assertTrue(result.success());
            assertEquals(0, result.exitCode());
            assertEquals("ok\n", result.output());
            assertTrue(result.duration() >= 0);
        }

        @Test
        @DisplayName("child sees overlaid environment variables")
        void environment() throws Exception {
            ProcessRunner runner = new ProcessRunner("real", new DefaultProcessLauncher(), eventBus,
                    realScheduler, streams);
            RunOptions options = new RunOptions(null, Map.of("DEVFLOW_TEST", "yes"), 0, null);

            ProcessResult result = runner.execute("sh", List.of("-c", "printf \"$DEVFLOW_TEST\""), options)
                    .get(10, TimeUnit.SECONDS);

            assertEquals("yes", result.output());
        }

        @Test
        @DisplayName("missing executable resolves as a spawn failure")
        void missingExecutable() throws Exception {
            ProcessRunner runner = new ProcessRunner("real", new DefaultProcessLauncher(), eventBus,
                    realScheduler, streams);

            ProcessResult result = runner.execute("devflow-no-such-binary", List.of(), RunOptions.defaults())
                    .get(10, TimeUnit.SECONDS);

            assertEquals(FailureReason.SPAWN, result.reason());
            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("cancel terminates a sleeping process")
        void cancelSleep() throws Exception {
            ProcessRunner runner = new ProcessRunner("real", new DefaultProcessLauncher(), eventBus,
                    realScheduler, streams, ProgressEstimator.none(), 500, null);
            CompletableFuture<ProcessResult> future =
                    runner.execute("sleep", List.of("30"), RunOptions.defaults());

            runner.cancel();

            ProcessResult result = future.get(10, TimeUnit.SECONDS);
            assertEquals(FailureReason.CANCELLED, result.reason());
            assertFalse(runner.isRunning());
        }
    }

    private record Scheduled(Runnable task, long delayMs, ScheduledFuture<?> future) {}

    /** Scripted process: fixed output streams and an exit the test completes. */
    static class FakeProcess implements LaunchedProcess {

        final CompletableFuture<Integer> exit = new CompletableFuture<>();
        final AtomicInteger terminates = new AtomicInteger();
        final AtomicInteger kills = new AtomicInteger();
        private final String out;
        private final String err;
        volatile boolean exitOnKill;

        FakeProcess(String out, String err) {
            this.out = out;
            this.err = err;
        }

        @Override
        public InputStream stdout() {
            return new ByteArrayInputStream(out.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public InputStream stderr() {
            return new ByteArrayInputStream(err.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void terminate() {
            terminates.incrementAndGet();
        }

        @Override
        public void kill() {
            kills.incrementAndGet();
            if (exitOnKill) {
                exit.complete(137);
            }
        }

        @Override
        public boolean isAlive() {
            return !exit.isDone();
        }

        @Override
        public long pid() {
            return 42;
        }
    }
}
