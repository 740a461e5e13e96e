package com.foundry.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final FoundryCommand foundryCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FoundryCommand foundryCommand, IFactory factory) {
        this.foundryCommand = foundryCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Spring property overrides (--foundry.pool.max-workers=3) are not picocli options
        String[] commandArgs = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--foundry.") && !arg.startsWith("--spring.") && !arg.startsWith("--logging."))
                .toArray(String[]::new);
        exitCode = new CommandLine(foundryCommand, factory).execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
