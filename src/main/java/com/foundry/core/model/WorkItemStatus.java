package com.foundry.core.model;

/**
 * Status of a single work item.
 * <p>
 * Transitions driven by the scheduler:
 *   PENDING → IN_PROGRESS → REVIEW → MERGED
 *   IN_PROGRESS | REVIEW → PENDING (retry) or BLOCKED (escalated)
 * <p>
 * MERGED, FAILED and BLOCKED are terminal: an item in one of them is never
 * admitted to scheduling again.
 */
public enum WorkItemStatus {
    PENDING,
    IN_PROGRESS,
    REVIEW,
    MERGED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == MERGED || this == FAILED || this == BLOCKED;
    }
}
