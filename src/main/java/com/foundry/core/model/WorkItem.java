package com.foundry.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A unit of implementation work scheduled within a milestone.
 * <p>
 * Instances are working copies of a persisted record. Status, retry count and
 * resource usage only change through the state store.
 *
 * @param id               globally unique identifier, stable across restarts (e.g. "T-001")
 * @param milestoneId      milestone the item belongs to, null until attached
 * @param description      what this item should accomplish
 * @param status           current execution status
 * @param assignedExecutor executor currently running the item (reference, not ownership)
 * @param retryCount       failed attempts so far, only ever increases
 * @param resourceUsage    accumulated resource units, only ever increases
 * @param dependencies     ids of items that must be completed first; may name ids that do not exist
 * @param metadata         opaque key/value bag owned by collaborators
 * @param lastError        reason of the most recent failure, kept for manual inspection
 * @param createdAt        creation time
 * @param updatedAt        time of the last persisted change
 */
public record WorkItem(
    String id,
    String milestoneId,
    String description,
    WorkItemStatus status,
    String assignedExecutor,
    int retryCount,
    long resourceUsage,
    List<String> dependencies,
    Map<String, Object> metadata,
    String lastError,
    Instant createdAt,
    Instant updatedAt
) {

    public WorkItem {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a new PENDING item as produced by a decomposer.
     */
    public static WorkItem pending(String id, String description, List<String> dependencies,
                                   Map<String, Object> metadata) {
        Instant now = Instant.now();
        return new WorkItem(id, null, description, WorkItemStatus.PENDING, null, 0, 0L,
                dependencies, metadata, null, now, now);
    }

    public WorkItem withMilestone(String milestoneId) {
        return new WorkItem(id, milestoneId, description, status, assignedExecutor, retryCount,
                resourceUsage, dependencies, metadata, lastError, createdAt, updatedAt);
    }

    public WorkItem withStatus(WorkItemStatus status) {
        return new WorkItem(id, milestoneId, description, status, assignedExecutor, retryCount,
                resourceUsage, dependencies, metadata, lastError, createdAt, updatedAt);
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
