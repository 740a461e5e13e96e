package com.foundry.core.events;

/**
 * Lifecycle events published on the {@link EventBus}, with their wire names.
 */
public enum EventType {
    PIPELINE_STARTED("pipeline.started"),
    PLANNING_STARTED("planning.started"),
    PLANNING_COMPLETED("planning.completed"),
    MILESTONE_STARTED("milestone.started"),
    MILESTONE_COMPLETED("milestone.completed"),
    MILESTONE_STALLED("milestone.stalled"),
    TASK_STARTED("task.started"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    REVIEW_STARTED("review.started"),
    REVIEW_COMPLETED("review.completed"),
    ESCALATION("escalation"),
    PIPELINE_COMPLETED("pipeline.completed"),
    PIPELINE_FAILED("pipeline.failed"),
    PAUSED("paused"),
    RESUMED("resumed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
