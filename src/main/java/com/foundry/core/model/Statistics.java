package com.foundry.core.model;

import java.util.Map;

/**
 * Aggregate counters over the state store.
 *
 * @param workItemsByStatus  work item count per status name
 * @param executorsByStatus  executor count per status name
 * @param totalResourceUsage larger of the work item sum and the executor sum
 */
public record Statistics(
    Map<String, Integer> workItemsByStatus,
    Map<String, Integer> executorsByStatus,
    long totalResourceUsage
) {

    public Statistics {
        workItemsByStatus = Map.copyOf(workItemsByStatus);
        executorsByStatus = Map.copyOf(executorsByStatus);
    }

    public int workItems(WorkItemStatus status) {
        return workItemsByStatus.getOrDefault(status.name(), 0);
    }
}
