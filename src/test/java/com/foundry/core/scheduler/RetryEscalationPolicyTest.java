package com.foundry.core.scheduler;

import com.foundry.core.events.EventBus;
import com.foundry.core.events.EventType;
import com.foundry.core.events.PipelineEvent;
import com.foundry.core.metrics.FoundryMetrics;
import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;
import com.foundry.core.persistence.JdbcStateStore;
import com.foundry.core.persistence.StoreConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetryEscalationPolicyTest {

    @TempDir
    Path tempDir;

    private JdbcStateStore store;
    private SimpleMeterRegistry registry;
    private final List<PipelineEvent> events = new ArrayList<>();
    private RetryEscalationPolicy policy;

    @BeforeEach
    void setUp() {
        store = new JdbcStateStore(StoreConfig.sqliteDataSource(tempDir.resolve("state.db")));
        store.createTables();
        registry = new SimpleMeterRegistry();
        var eventBus = new EventBus();
        eventBus.subscribe(events::add);
        policy = new RetryEscalationPolicy(store, eventBus, new FoundryMetrics(registry), 3);

        store.createWorkItem(WorkItem.pending("T-1", "Do it", List.of(), Map.of()).withMilestone("M-1"));
        store.transitionWorkItem("T-1", WorkItemStatus.IN_PROGRESS, "worker-001");
    }

    @Test
    @DisplayName("failure below the threshold returns the item to PENDING")
    void retryBelowThreshold() {
        var decision = policy.onFailure("P-1", "M-1", "T-1", "exit code 1");

        assertEquals(RetryEscalationPolicy.Decision.RETRY, decision);
        var item = store.getWorkItem("T-1").orElseThrow();
        assertEquals(WorkItemStatus.PENDING, item.status());
        assertEquals(1, item.retryCount());
        assertEquals("exit code 1", item.lastError());
        assertNull(item.assignedExecutor());
        assertEquals(1.0, registry.find("foundry.retries.total").counter().count());
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("the third failure blocks and escalates the item")
    void escalatesAtThreshold() {
        policy.onFailure("P-1", "M-1", "T-1", "first");
        store.transitionWorkItem("T-1", WorkItemStatus.IN_PROGRESS, "worker-002");
        policy.onFailure("P-1", "M-1", "T-1", "second");
        store.transitionWorkItem("T-1", WorkItemStatus.IN_PROGRESS, "worker-003");
        var decision = policy.onFailure("P-1", "M-1", "T-1", "Review rejected: tests missing");

        assertEquals(RetryEscalationPolicy.Decision.ESCALATED, decision);
        var item = store.getWorkItem("T-1").orElseThrow();
        assertEquals(WorkItemStatus.BLOCKED, item.status());
        assertEquals(3, item.retryCount());
        assertEquals("Review rejected: tests missing", item.lastError());

        assertEquals(1, events.size());
        var event = events.get(0);
        assertEquals(EventType.ESCALATION, event.type());
        assertEquals("T-1", event.workItemId());
        assertEquals("M-1", event.milestoneId());
        assertEquals(3, event.payload().get("retryCount"));
        assertEquals(1.0, registry.find("foundry.escalations.total").counter().count());
        assertEquals(2.0, registry.find("foundry.retries.total").counter().count());
    }

    @Test
    @DisplayName("with maxRetries 1 the first failure escalates")
    void singleAttempt() {
        var strict = new RetryEscalationPolicy(store, new EventBus(), new FoundryMetrics(registry), 1);

        assertEquals(RetryEscalationPolicy.Decision.ESCALATED, strict.onFailure("P-1", "M-1", "T-1", null));
        var item = store.getWorkItem("T-1").orElseThrow();
        assertEquals(WorkItemStatus.BLOCKED, item.status());
        assertEquals("unknown failure", item.lastError());
    }
}
