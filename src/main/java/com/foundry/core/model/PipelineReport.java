package com.foundry.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Final report returned when a pipeline completes.
 *
 * @param pipelineId         pipeline identifier
 * @param outcome            "completed" or "completed_with_failures"
 * @param statistics         store statistics at completion
 * @param completedCount     work items completed during this run
 * @param failedIds          work items escalated or failed
 * @param milestones         per-milestone summary
 * @param totalResourceUsage sum of work item resource usage
 * @param finishedAt         completion time
 */
public record PipelineReport(
    String pipelineId,
    String outcome,
    Statistics statistics,
    int completedCount,
    List<String> failedIds,
    List<MilestoneSummary> milestones,
    long totalResourceUsage,
    Instant finishedAt
) {

    public static final String COMPLETED = "completed";
    public static final String COMPLETED_WITH_FAILURES = "completed_with_failures";

    public record MilestoneSummary(String id, String name, WorkItemStatus status) {}
}
