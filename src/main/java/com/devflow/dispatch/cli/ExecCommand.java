package com.devflow.dispatch.cli;

import com.devflow.core.events.EventBus;
import com.devflow.core.events.ExecutionEventType;
import com.devflow.core.model.ProcessResult;
import com.devflow.core.process.ProcessRunner;
import com.devflow.core.process.RunOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: devflow exec [--timeout ms] -- &lt;command&gt; [args...]
 * <p>
 * Runs an arbitrary command on a standalone runner, bypassing the queue. Exits with the
 * child's exit code.
 */
@Command(name = "exec", mixinStandardHelpOptions = true, description = "Run an arbitrary command with streaming output")
@Component
public class ExecCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Command and its arguments")
    private List<String> commandLine = new ArrayList<>();

    @Option(names = "--timeout", description = "Timeout in milliseconds; 0 for none", defaultValue = "0")
    private long timeoutMs;

    private final ProcessRunner runner;
    private final EventBus eventBus;

    public ExecCommand(@Qualifier("adhocProcessRunner") ProcessRunner runner, EventBus eventBus) {
        this.runner = runner;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() throws InterruptedException {
        String executionId = "exec-" + System.currentTimeMillis();
        EventBus.Subscription subscription = eventBus.subscribe(executionId, event -> {
            if (event.type() == ExecutionEventType.OUTPUT) {
                ConsoleOutput.stream(event.text());
            } else if (event.type() == ExecutionEventType.ERROR) {
                ConsoleOutput.streamError(event.text());
            }
        });
        try {
            RunOptions options = RunOptions.defaults().withTimeout(timeoutMs).withExecutionId(executionId);
            ProcessResult result = runner.execute(commandLine.get(0),
                    commandLine.subList(1, commandLine.size()), options).get();
            ConsoleOutput.processResult(result);
            return result.success() ? 0 : Math.max(1, result.exitCode());
        } catch (ExecutionException e) {
            ConsoleOutput.error(e.getCause().getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }
}
