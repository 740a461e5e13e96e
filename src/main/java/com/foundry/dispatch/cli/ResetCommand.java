package com.foundry.dispatch.cli;

import com.foundry.core.persistence.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: foundry reset --yes
 * <p>
 * Deletes every milestone, work item, executor and log record. Requires explicit
 * confirmation.
 */
@Command(name = "reset", mixinStandardHelpOptions = true, description = "Delete all pipeline state")
@Component
public class ResetCommand implements Runnable {

    @Option(names = {"--yes", "-y"}, description = "Confirm deletion of all state")
    private boolean confirmed;

    private final StateStore store;

    public ResetCommand(StateStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (!confirmed) {
            ConsoleOutput.error("Refusing to reset without --yes");
            return;
        }
        store.reset();
        ConsoleOutput.success("State store cleared.");
    }
}
