package com.foundry.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during pipeline execution, consumed by the CLI and by observers.
 *
 * @param type        event type
 * @param pipelineId  the pipeline this event belongs to
 * @param milestoneId the milestone this event relates to (nullable for pipeline-level events)
 * @param workItemId  the work item this event relates to (nullable)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record PipelineEvent(
    EventType type,
    String pipelineId,
    String milestoneId,
    String workItemId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public PipelineEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static PipelineEvent of(EventType type, String pipelineId, Map<String, Object> payload) {
        return new PipelineEvent(type, pipelineId, null, null, payload, Instant.now());
    }

    public static PipelineEvent forMilestone(EventType type, String pipelineId, String milestoneId,
                                             Map<String, Object> payload) {
        return new PipelineEvent(type, pipelineId, milestoneId, null, payload, Instant.now());
    }

    public static PipelineEvent forWorkItem(EventType type, String pipelineId, String milestoneId,
                                            String workItemId, Map<String, Object> payload) {
        return new PipelineEvent(type, pipelineId, milestoneId, workItemId, payload, Instant.now());
    }
}
