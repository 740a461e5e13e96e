package com.foundry.agent;

import com.foundry.core.config.FoundryProperties;
import com.foundry.core.model.WorkItem;
import com.foundry.core.persistence.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Executes a work item by running the shell command stored in its {@code command}
 * metadata entry, from the project root.
 * <p>
 * Exit code 0 is success. Output lines are appended to the executor's log in the
 * state store. Resource usage is the item's {@code cost} metadata value, if any.
 * Items without a command succeed without doing anything.
 */
@Component
public class CommandExecutionSession implements ExecutionSession {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutionSession.class);

    static final String COMMAND_KEY = "command";
    static final String COST_KEY = "cost";
    static final int MAX_LOG_LENGTH = 500;
    static final int MAX_LOGGED_LINES = 100;

    private final StateStore store;
    private final Path workDir;
    private final Duration timeout;

    @Autowired
    public CommandExecutionSession(StateStore store, FoundryProperties properties) {
        this(store, Path.of(properties.getProjectRoot()), properties.getTaskTimeout());
    }

    CommandExecutionSession(StateStore store, Path workDir, Duration timeout) {
        this.store = store;
        this.workDir = workDir;
        this.timeout = timeout;
    }

    @Override
    public ExecutionResult run(WorkItem item, String executorId) {
        long cost = cost(item);
        String command = item.metadataString(COMMAND_KEY);
        if (command == null || command.isBlank()) {
            log.info("Work item {} has no command, nothing to execute", item.id());
            return ExecutionResult.succeeded(cost, "no command");
        }

        log.info("Executing work item {}: {}", item.id(), command);
        ShellCommand.Result result = ShellCommand.run(command, workDir, timeout);
        appendOutput(executorId, item.id(), result.lines());

        if (result.timedOut()) {
            return ExecutionResult.failed(cost, "Timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            return ExecutionResult.failed(cost, "Exit code " + result.exitCode() + ": " + truncate(result.tail(5)));
        }
        return ExecutionResult.succeeded(cost, truncate(result.tail(5)));
    }

    private void appendOutput(String executorId, String itemId, List<String> lines) {
        int from = Math.max(0, lines.size() - MAX_LOGGED_LINES);
        for (String line : lines.subList(from, lines.size())) {
            store.appendLog(executorId, "INFO", truncate(line), Map.of("workItemId", itemId));
        }
    }

    static long cost(WorkItem item) {
        Object value = item.metadata().get(COST_KEY);
        if (value instanceof Number number) {
            return Math.max(0L, number.longValue());
        }
        if (value != null) {
            try {
                return Math.max(0L, Long.parseLong(value.toString().trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric cost '{}' on work item {}", value, item.id());
            }
        }
        return 0L;
    }

    static String truncate(String text) {
        return text.length() <= MAX_LOG_LENGTH ? text : text.substring(0, MAX_LOG_LENGTH);
    }
}
