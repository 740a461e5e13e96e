package com.foundry.dispatch.cli;

import com.foundry.core.model.Milestone;
import com.foundry.core.model.Statistics;
import com.foundry.core.model.WorkItemStatus;
import com.foundry.core.persistence.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: foundry status
 * <p>
 * Shows milestone progress, work item counts and executors from the state store.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show pipeline progress")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--items", "-i"}, description = "List every work item")
    private boolean listItems;

    private final StateStore store;

    public StatusCommand(StateStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var milestones = store.listMilestones();
        if (milestones.isEmpty()) {
            ConsoleOutput.info("No pipeline in the state store.");
            return;
        }

        System.out.println();
        System.out.printf("  %-10s %-6s %-12s %-8s %s%n", "MILESTONE", "PHASE", "STATUS", "ITEMS", "NAME");
        System.out.println("  " + "-".repeat(64));
        for (Milestone m : milestones) {
            System.out.printf("  %-10s %-6d %-12s %-8d %s%n",
                    m.id(), m.phase(), m.status(), m.memberIds().size(), ConsoleOutput.truncate(m.name(), 30));
        }

        Statistics stats = store.statistics();
        System.out.println();
        ConsoleOutput.info(String.format("Work items: %d merged, %d in progress, %d in review, %d pending, %d blocked, %d failed",
                stats.workItems(WorkItemStatus.MERGED),
                stats.workItems(WorkItemStatus.IN_PROGRESS),
                stats.workItems(WorkItemStatus.REVIEW),
                stats.workItems(WorkItemStatus.PENDING),
                stats.workItems(WorkItemStatus.BLOCKED),
                stats.workItems(WorkItemStatus.FAILED)));
        ConsoleOutput.info("Executors: " + (stats.executorsByStatus().isEmpty() ? "none" : stats.executorsByStatus()));
        ConsoleOutput.info("Resource usage: " + stats.totalResourceUsage());

        if (listItems) {
            System.out.println();
            System.out.printf("  %-10s %-10s %-12s %-6s %-12s %s%n",
                    "ITEM", "MILESTONE", "STATUS", "RETRY", "EXECUTOR", "DESCRIPTION");
            System.out.println("  " + "-".repeat(72));
            for (var item : store.listWorkItems()) {
                System.out.printf("  %-10s %-10s %-12s %-6d %-12s %s%n",
                        item.id(), item.milestoneId(), item.status(), item.retryCount(),
                        item.assignedExecutor() != null ? item.assignedExecutor() : "-",
                        ConsoleOutput.truncate(item.description(), 30));
            }
        }

        int blocked = stats.workItems(WorkItemStatus.BLOCKED);
        if (blocked > 0) {
            System.out.println();
            ConsoleOutput.warn(blocked + " work item(s) escalated; use 'inspect <item-id>' for details");
        }
    }
}
