package com.devflow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Per-command options supplied by the caller.
 *
 * @param timeoutSeconds per-command timeout; 0 falls back to the configured default
 * @param extraArgs      additional arguments appended to the resolved command line
 * @param env            environment variables overlaid on the inherited environment
 */
public record CommandOptions(
    int timeoutSeconds,
    List<String> extraArgs,
    Map<String, String> env
) implements Serializable {

    public CommandOptions {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must be >= 0");
        }
        extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static CommandOptions defaults() {
        return new CommandOptions(0, List.of(), Map.of());
    }
}
