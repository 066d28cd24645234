package com.devflow.core.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over spawning a child process.
 * Implementations: {@link DefaultProcessLauncher} (real processes); tests supply scripted fakes.
 */
public interface ProcessLauncher {

    /**
     * Starts a process.
     *
     * @param command          executable followed by its arguments (no shell expansion)
     * @param workingDirectory directory to run in, or null for the JVM working directory
     * @param env              variables overlaid on the inherited environment
     * @return a handle to the running process
     * @throws IOException if the process cannot be started (missing executable, permissions)
     */
    LaunchedProcess launch(List<String> command, Path workingDirectory, Map<String, String> env)
            throws IOException;
}
