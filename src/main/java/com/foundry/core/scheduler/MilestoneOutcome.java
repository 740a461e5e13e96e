package com.foundry.core.scheduler;

import java.util.List;

/**
 * Result of running the scheduler loop over one milestone.
 *
 * @param milestoneId  the milestone
 * @param completedIds items completed during this run of the loop
 * @param failedIds    items escalated during this run of the loop
 * @param stalledIds   items left PENDING because they could never become ready
 */
public record MilestoneOutcome(
    String milestoneId,
    List<String> completedIds,
    List<String> failedIds,
    List<String> stalledIds
) {

    public MilestoneOutcome {
        completedIds = List.copyOf(completedIds);
        failedIds = List.copyOf(failedIds);
        stalledIds = List.copyOf(stalledIds);
    }

    public boolean isStalled() {
        return !stalledIds.isEmpty();
    }
}
