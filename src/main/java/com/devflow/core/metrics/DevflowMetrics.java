package com.devflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for command executions and file batches.
 */
@Service
public class DevflowMetrics {

    private final MeterRegistry registry;

    public DevflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(String action, String status, long durationMs) {
        Counter.builder("devflow.executions.total")
                .tag("action", action)
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("devflow.execution.duration")
                .tag("action", action)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0, durationMs)));
    }

    /**
     * Records the outcome of one file in a batch.
     *
     * @param result "written" or "failed"
     */
    public void recordBatchFile(String result) {
        Counter.builder("devflow.batch.files")
                .description("Files processed by batch operations")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordBatchRetry() {
        Counter.builder("devflow.batch.retries")
                .description("Retried file writes within batch operations")
                .register(registry)
                .increment();
    }
}
