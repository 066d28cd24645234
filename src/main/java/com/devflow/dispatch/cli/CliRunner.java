package com.devflow.dispatch.cli;

import com.devflow.core.dispatch.CommandValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * <p>
 * Exit codes: 0 success, 1 failed command or unexpected error, 2 rejected input
 * (unknown action or output type, missing project, malformed option).
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_INPUT = 2;

    private final DevflowCommand devflowCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DevflowCommand devflowCommand, IFactory factory) {
        this.devflowCommand = devflowCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve mode: the web server keeps the JVM alive
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(devflowCommand, factory)
                .setExecutionExceptionHandler(CliRunner::handleExecutionException)
                .execute(args);
    }

    static int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof CommandValidationException || ex instanceof IllegalArgumentException) {
            ConsoleOutput.error(ex.getMessage());
            return EXIT_INVALID_INPUT;
        }
        log.error("{} failed", commandLine.getCommandName(), ex);
        ConsoleOutput.error(commandLine.getCommandName() + " failed: " + ex.getMessage());
        return EXIT_FAILURE;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
