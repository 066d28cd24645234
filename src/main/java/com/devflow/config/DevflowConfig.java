package com.devflow.config;

import com.devflow.core.batch.BatchCoordinator;
import com.devflow.core.batch.BatchNotifier;
import com.devflow.core.batch.BatchSummaryFormatter;
import com.devflow.core.batch.FileSystemOutputStore;
import com.devflow.core.batch.OutputFileStore;
import com.devflow.core.dispatch.CommandCatalog;
import com.devflow.core.dispatch.CommandDispatcher;
import com.devflow.core.events.EventBus;
import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.process.DefaultProcessLauncher;
import com.devflow.core.process.ProcessLauncher;
import com.devflow.core.process.ProcessRunner;
import com.devflow.core.process.ProgressEstimator;
import com.devflow.core.process.TimeBasedProgressEstimator;
import com.devflow.core.queue.ExecutionQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DevflowConfig {

    private static final Logger log = LoggerFactory.getLogger(DevflowConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessLauncher processLauncher() {
        return new DefaultProcessLauncher();
    }

    /** Timeout, grace-period and progress timers. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService devflowScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("devflow-timer-"));
    }

    /** Drains process stdout/stderr; two threads per busy runner. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService devflowStreamExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("devflow-stream-"));
    }

    @Bean
    public ProgressEstimator progressEstimator(ScheduledExecutorService devflowScheduler, DevflowProperties properties) {
        return new TimeBasedProgressEstimator(devflowScheduler,
                properties.getRunner().getProgressTickMs(),
                properties.getRunner().getProgressDurationMs());
    }

    @Bean
    public CommandDispatcher commandDispatcher(ExecutionQueue queue, EventBus eventBus, CommandCatalog catalog,
                                               DevflowMetrics metrics, Clock clock, ProcessLauncher launcher,
                                               ScheduledExecutorService devflowScheduler,
                                               ExecutorService devflowStreamExecutor,
                                               ProgressEstimator progressEstimator,
                                               DevflowProperties properties) {
        Path workingDirectory = workingDirectory(properties);
        int poolSize = properties.getEffectiveMaxConcurrent();
        List<ProcessRunner> runners = new ArrayList<>(poolSize);
        for (int i = 1; i <= poolSize; i++) {
            runners.add(new ProcessRunner("runner-" + i, launcher, eventBus, devflowScheduler,
                    devflowStreamExecutor, progressEstimator, properties.getRunner().getGracePeriodMs(),
                    workingDirectory));
        }
        log.info("Runner pool: {} runner(s), working directory {}", poolSize, workingDirectory);
        return new CommandDispatcher(queue, eventBus, catalog, metrics, clock, runners,
                properties.getRunner().getTimeoutSeconds(), workingDirectory);
    }

    /** Standalone runner for ad-hoc commands outside the queue. */
    @Bean(destroyMethod = "dispose")
    public ProcessRunner adhocProcessRunner(ProcessLauncher launcher, EventBus eventBus,
                                            ScheduledExecutorService devflowScheduler,
                                            ExecutorService devflowStreamExecutor,
                                            ProgressEstimator progressEstimator,
                                            DevflowProperties properties) {
        return new ProcessRunner("adhoc", launcher, eventBus, devflowScheduler, devflowStreamExecutor,
                progressEstimator, properties.getRunner().getGracePeriodMs(), workingDirectory(properties));
    }

    @Bean
    public OutputFileStore outputFileStore(DevflowProperties properties, ObjectMapper objectMapper, Clock clock) {
        Path base = workingDirectory(properties);
        return new FileSystemOutputStore(base.resolve(properties.getOutput().getDirectory()),
                base.resolve(properties.getOutput().getBackupDirectory()), objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchNotifier batchNotifier() {
        return (success, message) -> {
            if (success) {
                log.info(message);
            } else {
                log.warn(message);
            }
        };
    }

    @Bean
    public BatchCoordinator batchCoordinator(OutputFileStore store, BatchNotifier notifier, ObjectMapper objectMapper,
                                             DevflowMetrics metrics, Clock clock, DevflowProperties properties) {
        return new BatchCoordinator(store, notifier, new BatchSummaryFormatter(store, objectMapper, clock),
                metrics, clock, properties.getBatch().getRetryDelayMs(),
                Duration.ofMinutes(properties.getBatch().getMaxAgeMinutes()));
    }

    private static Path workingDirectory(DevflowProperties properties) {
        String configured = properties.getRunner().getWorkingDirectory();
        return (configured == null || configured.isBlank() ? Path.of("") : Path.of(configured))
                .toAbsolutePath().normalize();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
