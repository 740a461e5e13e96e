package com.foundry.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a shell command line with {@code sh -c}, bounded by a timeout.
 * <p>
 * Output (stdout and stderr merged) is captured in a temporary file, so a command
 * that stops producing output never blocks the caller past the timeout.
 */
final class ShellCommand {

    private static final Logger log = LoggerFactory.getLogger(ShellCommand.class);

    /**
     * @param exitCode process exit code, -1 when the command timed out
     * @param lines    captured output lines
     * @param timedOut whether the process was killed after the timeout
     */
    record Result(int exitCode, List<String> lines, boolean timedOut) {

        boolean succeeded() {
            return !timedOut && exitCode == 0;
        }

        String tail(int maxLines) {
            int from = Math.max(0, lines.size() - maxLines);
            return String.join("\n", lines.subList(from, lines.size()));
        }
    }

    private ShellCommand() {}

    static Result run(String commandLine, Path workDir, Duration timeout) {
        log.debug("Running: {}", commandLine);
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("foundry-cmd-", ".log");
            process = new ProcessBuilder("sh", "-c", commandLine)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), commandLine);
            }
            List<String> lines = Files.readAllLines(outputFile, StandardCharsets.UTF_8);
            return new Result(finished ? process.exitValue() : -1, lines, !finished);
        } catch (IOException e) {
            log.error("Command failed to run: {}", commandLine, e);
            throw new IllegalStateException("Command failed to run: " + commandLine, e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running: " + commandLine, e);
        } finally {
            if (outputFile != null) {
                try {
                    Files.deleteIfExists(outputFile);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", outputFile, e.getMessage());
                }
            }
        }
    }
}
