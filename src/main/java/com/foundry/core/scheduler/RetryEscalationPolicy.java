package com.foundry.core.scheduler;

import com.foundry.core.config.FoundryProperties;
import com.foundry.core.events.EventBus;
import com.foundry.core.events.EventType;
import com.foundry.core.events.PipelineEvent;
import com.foundry.core.metrics.FoundryMetrics;
import com.foundry.core.model.WorkItemStatus;
import com.foundry.core.persistence.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Decides what happens to a work item after a failed attempt.
 * <p>
 * Every failure counts the same, whatever its cause: the persisted retry count is
 * incremented and the item goes back to PENDING until the count reaches
 * {@code maxRetries}, at which point it is BLOCKED and escalated for manual handling.
 */
@Service
public class RetryEscalationPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryEscalationPolicy.class);

    public enum Decision {
        /** Item is PENDING again and may be re-admitted. */
        RETRY,
        /** Item is BLOCKED and never retried automatically. */
        ESCALATED
    }

    private final StateStore store;
    private final EventBus eventBus;
    private final FoundryMetrics metrics;
    private final int maxRetries;

    @Autowired
    public RetryEscalationPolicy(StateStore store, EventBus eventBus, FoundryMetrics metrics,
                                 FoundryProperties properties) {
        this(store, eventBus, metrics, properties.getMaxRetries());
    }

    public RetryEscalationPolicy(StateStore store, EventBus eventBus, FoundryMetrics metrics, int maxRetries) {
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Decision onFailure(String pipelineId, String milestoneId, String workItemId, String reason) {
        String cause = reason != null ? reason : "unknown failure";
        store.recordFailure(workItemId, cause);
        int retries = store.incrementRetry(workItemId);

        if (retries >= maxRetries) {
            store.transitionWorkItem(workItemId, WorkItemStatus.BLOCKED, null);
            log.warn("Work item {} escalated after {} failed attempt(s): {}", workItemId, retries, cause);
            eventBus.publish(PipelineEvent.forWorkItem(EventType.ESCALATION, pipelineId, milestoneId, workItemId,
                    Map.of("retryCount", retries, "reason", cause)));
            metrics.incrementEscalations();
            return Decision.ESCALATED;
        }

        store.transitionWorkItem(workItemId, WorkItemStatus.PENDING, null);
        log.info("Work item {} failed (attempt {}/{}), will retry: {}", workItemId, retries, maxRetries, cause);
        metrics.incrementRetries();
        return Decision.RETRY;
    }
}
