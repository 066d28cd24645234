package com.devflow.core.process;

import java.nio.file.Path;
import java.util.Map;

/**
 * Options for a single {@link ProcessRunner} execution.
 *
 * @param workingDirectory directory to run in, or null for the runner's default
 * @param env              variables overlaid on the inherited environment
 * @param timeoutMs        milliseconds before the run is timed out; 0 disables the timeout
 * @param executionId      id events are published under, or null to let the runner pick one
 */
public record RunOptions(
    Path workingDirectory,
    Map<String, String> env,
    long timeoutMs,
    String executionId
) {

    public RunOptions {
        env = env == null ? Map.of() : Map.copyOf(env);
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
    }

    public static RunOptions defaults() {
        return new RunOptions(null, Map.of(), 0, null);
    }

    public static RunOptions in(Path workingDirectory) {
        return new RunOptions(workingDirectory, Map.of(), 0, null);
    }

    public RunOptions withTimeout(long millis) {
        return new RunOptions(workingDirectory, env, millis, executionId);
    }

    public RunOptions withExecutionId(String id) {
        return new RunOptions(workingDirectory, env, timeoutMs, id);
    }
}
