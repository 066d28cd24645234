package com.devflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for devflow.
 * Routes to subcommands: run, exec, validate, serve.
 */
@Command(
        name = "devflow",
        mixinStandardHelpOptions = true,
        version = "devflow 0.1.0",
        description = "Runs developer-workflow commands and manages their generated output files",
        subcommands = {
                RunCommand.class,
                ExecCommand.class,
                ValidateCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DevflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
