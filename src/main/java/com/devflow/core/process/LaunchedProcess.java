package com.devflow.core.process;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a spawned OS process as seen by {@link ProcessRunner}.
 */
public interface LaunchedProcess {

    InputStream stdout();

    InputStream stderr();

    /** Completes with the exit code once the process has exited. */
    CompletableFuture<Integer> onExit();

    /** Sends a graceful termination request (SIGTERM on Unix). */
    void terminate();

    /** Forcibly kills the process (SIGKILL on Unix). */
    void kill();

    boolean isAlive();

    long pid();
}
