package com.foundry.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Foundry.
 * Routes to subcommands: run, recover, status, inspect, logs, reset.
 */
@Command(
        name = "foundry",
        mixinStandardHelpOptions = true,
        version = "Foundry 0.1.0",
        description = "Crash-tolerant orchestration engine for multi-phase agent pipelines",
        subcommands = {
                RunCommand.class,
                RecoverCommand.class,
                StatusCommand.class,
                InspectCommand.class,
                LogsCommand.class,
                ResetCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FoundryCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
