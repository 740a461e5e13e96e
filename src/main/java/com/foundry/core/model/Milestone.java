package com.foundry.core.model;

import java.time.Instant;
import java.util.List;

/**
 * An ordered phase grouping work items. Milestones run strictly one phase after another.
 *
 * @param id             unique identifier (e.g. "M-1")
 * @param name           short human-readable name
 * @param description    what the milestone delivers
 * @param phase          ordering key; lower phases finish before higher ones start
 * @param status         PENDING until its items resolve, then MERGED
 * @param memberIds      ids of the work items belonging to this milestone
 * @param estimatedUsage planner estimate of resource units, informational
 * @param createdAt      creation time
 */
public record Milestone(
    String id,
    String name,
    String description,
    int phase,
    WorkItemStatus status,
    List<String> memberIds,
    long estimatedUsage,
    Instant createdAt
) {

    public Milestone {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }

    public static Milestone pending(String id, String name, String description, int phase) {
        return new Milestone(id, name, description, phase, WorkItemStatus.PENDING, List.of(), 0L, Instant.now());
    }
}
