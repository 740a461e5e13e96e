package com.foundry.agent;

import com.foundry.core.config.FoundryProperties;
import com.foundry.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Reviews a work item by running its optional {@code reviewCommand} metadata entry.
 * Approves when there is no review command or when it exits with code 0.
 */
@Component
public class CommandReviewer implements Reviewer {

    private static final Logger log = LoggerFactory.getLogger(CommandReviewer.class);

    static final String REVIEW_COMMAND_KEY = "reviewCommand";

    private final Path workDir;
    private final Duration timeout;

    @Autowired
    public CommandReviewer(FoundryProperties properties) {
        this(Path.of(properties.getProjectRoot()), properties.getTaskTimeout());
    }

    CommandReviewer(Path workDir, Duration timeout) {
        this.workDir = workDir;
        this.timeout = timeout;
    }

    @Override
    public ReviewResult review(WorkItem item) {
        String command = item.metadataString(REVIEW_COMMAND_KEY);
        if (command == null || command.isBlank()) {
            return ReviewResult.approve("No review command configured");
        }

        ShellCommand.Result result = ShellCommand.run(command, workDir, timeout);
        if (result.succeeded()) {
            log.info("Review of {} approved", item.id());
            return ReviewResult.approve(CommandExecutionSession.truncate(result.tail(5)));
        }
        String reason = result.timedOut()
                ? "Review timed out after " + timeout.toSeconds() + "s"
                : "Review command exited with code " + result.exitCode() + ": " + result.tail(5);
        log.info("Review of {} rejected: {}", item.id(), reason);
        return ReviewResult.reject(CommandExecutionSession.truncate(reason));
    }
}
