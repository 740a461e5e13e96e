package com.foundry.dispatch.cli;

import com.foundry.core.events.PipelineEvent;
import com.foundry.core.model.PipelineReport;
import com.foundry.core.model.WorkItemStatus;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for Foundry CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FOUNDRY v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FOUNDRY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static String status(WorkItemStatus status) {
        String color = switch (status) {
            case MERGED -> "fg(green)";
            case BLOCKED, FAILED -> "fg(red)";
            case IN_PROGRESS, REVIEW -> "fg(yellow)";
            case PENDING -> "fg(white)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status + "|@");
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.type()) {
            case PIPELINE_STARTED, PLANNING_STARTED, PLANNING_COMPLETED -> "@|fg(cyan) [PIPELINE]|@";
            case MILESTONE_STARTED, MILESTONE_COMPLETED -> "@|bold,fg(yellow) [MILESTONE]|@";
            case MILESTONE_STALLED -> "@|bold,fg(red) [STALLED]|@";
            case TASK_STARTED, TASK_COMPLETED -> "@|fg(blue) [TASK]|@";
            case TASK_FAILED -> "@|fg(red) [TASK]|@";
            case REVIEW_STARTED, REVIEW_COMPLETED -> "@|fg(magenta) [REVIEW]|@";
            case ESCALATION -> "@|fg(red),bold [ESCALATION]|@";
            case PIPELINE_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case PIPELINE_FAILED -> "@|fg(red),bold [FAILED]|@";
            case PAUSED, RESUMED -> "@|fg(white) [CONTROL]|@";
        };
        StringBuilder line = new StringBuilder(prefix).append(' ').append(event.type().wireName());
        if (event.milestoneId() != null) {
            line.append(' ').append(event.milestoneId());
        }
        if (event.workItemId() != null) {
            line.append(' ').append(event.workItemId());
        }
        if (!event.payload().isEmpty()) {
            line.append(' ').append(formatPayload(event.payload()));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
    }

    public static void report(PipelineReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Pipeline " + report.pipelineId() + "|@"));
        for (var milestone : report.milestones()) {
            System.out.println("  " + milestone.id() + " " + milestone.name() + " " + status(milestone.status()));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Work items: @|fg(green) " + report.completedCount() + " completed|@, @|fg(red) "
                        + report.failedIds().size() + " failed|@"));
        if (!report.failedIds().isEmpty()) {
            System.out.println("  Needs attention: " + String.join(", ", report.failedIds()));
        }
        System.out.println("  Resource usage: " + report.totalResourceUsage());
        if (PipelineReport.COMPLETED.equals(report.outcome())) {
            success("Pipeline completed.");
        } else {
            warn("Pipeline completed with failures.");
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String formatPayload(Map<String, Object> payload) {
        StringBuilder sb = new StringBuilder();
        payload.forEach((key, value) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(key).append('=').append(truncate(String.valueOf(value), 80));
        });
        return "(" + sb + ")";
    }
}
