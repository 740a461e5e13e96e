package com.foundry.core.model;

import java.time.Instant;

/**
 * Durable record of a live or historical executor instance.
 * Records are kept after termination for audit and statistics.
 *
 * @param id              executor id (e.g. "worker-003", "planner-001")
 * @param kind            role tag: PLANNER, DECOMPOSER, IMPLEMENTER, REVIEWER
 * @param status          lifecycle status
 * @param currentWorkItem work item being handled, null when idle
 * @param resourceUsage   accumulated resource units
 * @param startedAt       when the executor started
 * @param lastActivity    last status or usage change
 */
public record ExecutorRecord(
    String id,
    String kind,
    ExecutorStatus status,
    String currentWorkItem,
    long resourceUsage,
    Instant startedAt,
    Instant lastActivity
) {

    public static ExecutorRecord running(String id, String kind, String currentWorkItem) {
        Instant now = Instant.now();
        return new ExecutorRecord(id, kind, ExecutorStatus.RUNNING, currentWorkItem, 0L, now, now);
    }
}
