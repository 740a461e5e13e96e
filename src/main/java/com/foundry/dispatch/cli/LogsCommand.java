package com.foundry.dispatch.cli;

import com.foundry.core.model.LogEntry;
import com.foundry.core.persistence.StateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CLI command: foundry logs [--executor &lt;id&gt;] [--limit &lt;n&gt;]
 * <p>
 * Prints executor log entries from the state store, oldest first.
 */
@Command(name = "logs", mixinStandardHelpOptions = true, description = "Show executor logs")
@Component
public class LogsCommand implements Runnable {

    @Option(names = {"--executor", "-e"}, description = "Only show entries of this executor")
    private String executorId;

    @Option(names = {"--limit", "-n"}, description = "Maximum entries to show (default: ${DEFAULT-VALUE})",
            defaultValue = "50")
    private int limit;

    private final StateStore store;

    public LogsCommand(StateStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<LogEntry> entries = new ArrayList<>(store.listLogs(executorId, limit));
        if (entries.isEmpty()) {
            ConsoleOutput.info(executorId != null ? "No log entries for executor " + executorId : "No log entries");
            return;
        }
        Collections.reverse(entries);
        for (LogEntry entry : entries) {
            String line = String.format("%s %-14s %-5s %s",
                    entry.timestamp(), entry.executorId(), entry.level(), entry.message());
            if ("ERROR".equals(entry.level())) {
                ConsoleOutput.error(line);
            } else {
                System.out.println("  " + line);
            }
        }
    }
}
