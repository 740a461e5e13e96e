package com.foundry.dispatch.cli;

import com.foundry.core.model.LogEntry;
import com.foundry.core.model.WorkItem;
import com.foundry.core.persistence.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: foundry inspect &lt;item-id&gt;
 * <p>
 * Shows the details of a single work item, including its last failure and the
 * recent log of the executor assigned to it.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a work item")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Work item ID")
    private String workItemId;

    @Option(names = {"--limit", "-n"}, description = "Log entries to show (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int limit;

    private final StateStore store;

    public InspectCommand(StateStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Optional<WorkItem> found = store.getWorkItem(workItemId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Work item not found: " + workItemId);
            return;
        }
        WorkItem item = found.get();

        System.out.println();
        System.out.println("WORK ITEM " + item.id());
        System.out.println("  Description:  " + item.description());
        System.out.println("  Milestone:    " + (item.milestoneId() != null ? item.milestoneId() : "-"));
        System.out.println("  Status:       " + ConsoleOutput.status(item.status()));
        System.out.println("  Executor:     " + (item.assignedExecutor() != null ? item.assignedExecutor() : "-"));
        System.out.println("  Retries:      " + item.retryCount());
        System.out.println("  Usage:        " + item.resourceUsage());
        System.out.println("  Dependencies: " + (item.dependencies().isEmpty() ? "-" : String.join(", ", item.dependencies())));
        if (!item.metadata().isEmpty()) {
            System.out.println("  Metadata:     " + item.metadata());
        }
        if (item.lastError() != null) {
            System.out.println();
            ConsoleOutput.error("Last error: " + item.lastError());
        }

        if (item.assignedExecutor() != null) {
            List<LogEntry> entries = store.listLogs(item.assignedExecutor(), limit);
            if (!entries.isEmpty()) {
                System.out.println();
                System.out.println("Recent log of " + item.assignedExecutor() + ":");
                for (LogEntry entry : entries) {
                    System.out.printf("  %s %-5s %s%n", entry.timestamp(), entry.level(), entry.message());
                }
            }
        }
    }
}
