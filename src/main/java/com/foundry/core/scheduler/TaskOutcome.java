package com.foundry.core.scheduler;

/**
 * Result of one attempt at a work item, produced on a worker thread.
 *
 * @param workItemId   the work item
 * @param executorId   the executor that ran it
 * @param success      true when executed and approved
 * @param reason       failure reason, null on success
 * @param resourceUsed resource units consumed by the attempt
 * @param elapsedMs    wall time of the attempt
 */
public record TaskOutcome(
    String workItemId,
    String executorId,
    boolean success,
    String reason,
    long resourceUsed,
    long elapsedMs
) {

    public static TaskOutcome succeeded(String workItemId, String executorId, long resourceUsed, long elapsedMs) {
        return new TaskOutcome(workItemId, executorId, true, null, resourceUsed, elapsedMs);
    }

    public static TaskOutcome failed(String workItemId, String executorId, String reason,
                                     long resourceUsed, long elapsedMs) {
        return new TaskOutcome(workItemId, executorId, false, reason, resourceUsed, elapsedMs);
    }
}
