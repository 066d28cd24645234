package com.devflow.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder}. No shell is involved; the
 * command is passed directly to the OS. Termination signals are also sent to descendants,
 * since workflow tools such as {@code npx} fork their own children.
 */
public class DefaultProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessLauncher.class);

    @Override
    public LaunchedProcess launch(List<String> command, Path workingDirectory, Map<String, String> env)
            throws IOException {
        var builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        if (env != null && !env.isEmpty()) {
            builder.environment().putAll(env);
        }
        Process process = builder.start();
        log.debug("Spawned PID {}: {}", process.pid(), String.join(" ", command));
        return new OsProcess(process);
    }

    private record OsProcess(Process process) implements LaunchedProcess {

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public void terminate() {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public long pid() {
            return process.pid();
        }
    }
}
