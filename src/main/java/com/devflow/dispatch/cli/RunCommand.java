package com.devflow.dispatch.cli;

import com.devflow.core.dispatch.CommandDispatcher;
import com.devflow.core.events.EventBus;
import com.devflow.core.events.ExecutionEventType;
import com.devflow.core.model.CommandOptions;
import com.devflow.core.model.CommandPriority;
import com.devflow.core.model.CommandResult;
import com.devflow.core.model.QueuedCommand;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: devflow run &lt;action&gt; [-p project]
 * <p>
 * Queues a workflow action, streams its output to the terminal and exits with 0 only if
 * the command succeeded.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow action")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Action: aiDebug, nxTest, gitDiff, prepareToPush")
    private String action;

    @Option(names = {"--project", "-p"}, description = "Target project")
    private String project;

    @Option(names = "--priority", description = "high, normal or low (default: ${DEFAULT-VALUE})",
            defaultValue = "normal")
    private String priority;

    @Option(names = "--timeout", description = "Timeout in seconds; 0 uses the configured default",
            defaultValue = "0")
    private int timeoutSeconds;

    @Option(names = "--arg", description = "Extra argument appended to the command line (repeatable)")
    private List<String> extraArgs = new ArrayList<>();

    private final CommandDispatcher dispatcher;
    private final EventBus eventBus;

    public RunCommand(CommandDispatcher dispatcher, EventBus eventBus) {
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.printBanner();

        // only this command runs in the CLI process, so every event belongs to it
        EventBus.Subscription subscription = eventBus.subscribeAll(event -> {
            if (event.type() == ExecutionEventType.OUTPUT) {
                ConsoleOutput.stream(event.text());
            } else if (event.type() == ExecutionEventType.ERROR) {
                ConsoleOutput.streamError(event.text());
            }
        });
        try {
            QueuedCommand queued = dispatcher.submit(action, project, CommandPriority.parse(priority),
                    new CommandOptions(timeoutSeconds, extraArgs, Map.of()));
            ConsoleOutput.info("Running " + queued.id());
            CommandResult result = dispatcher.awaitResult(queued.id()).get();
            System.out.println();
            ConsoleOutput.result(result);
            return result.success() ? 0 : 1;
        } catch (ExecutionException e) {
            ConsoleOutput.error("Execution failed: " + e.getCause().getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }
}
