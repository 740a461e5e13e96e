package com.foundry.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FoundryMetricsTest {

    private SimpleMeterRegistry registry;
    private FoundryMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FoundryMetrics(registry);
    }

    @Test
    @DisplayName("recordPlanningDuration records a timer")
    void planningDuration() {
        metrics.recordPlanningDuration(250);
        var timer = registry.find("foundry.planning.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(250, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
    }

    @Test
    @DisplayName("recordWorkItemExecution tags the outcome")
    void workItemExecution() {
        metrics.recordWorkItemExecution(true, 100);
        metrics.recordWorkItemExecution(false, 40);
        metrics.recordWorkItemExecution(false, 60);

        assertEquals(1, registry.find("foundry.workitem.duration").tag("outcome", "success").timer().count());
        assertEquals(2, registry.find("foundry.workitem.duration").tag("outcome", "failure").timer().count());
    }

    @Test
    @DisplayName("recordReviewResult counts approvals and rejections separately")
    void reviewResult() {
        metrics.recordReviewResult(true);
        metrics.recordReviewResult(true);
        metrics.recordReviewResult(false);

        assertEquals(2.0, registry.find("foundry.review.evaluations").tag("result", "approved").counter().count());
        assertEquals(1.0, registry.find("foundry.review.evaluations").tag("result", "rejected").counter().count());
    }

    @Test
    @DisplayName("retry and escalation counters increment")
    void retriesAndEscalations() {
        metrics.incrementRetries();
        metrics.incrementRetries();
        metrics.incrementEscalations();

        assertEquals(2.0, registry.find("foundry.retries.total").counter().count());
        assertEquals(1.0, registry.find("foundry.escalations.total").counter().count());
    }

    @Test
    @DisplayName("recordPipelineResult tags the final status")
    void pipelineResult() {
        metrics.recordPipelineResult("completed");
        metrics.recordPipelineResult("failed");

        assertEquals(1.0, registry.find("foundry.pipelines.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("foundry.pipelines.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordActiveWorkers feeds a distribution summary")
    void activeWorkers() {
        metrics.recordActiveWorkers(3);
        metrics.recordActiveWorkers(5);

        var summary = registry.find("foundry.pool.active_workers").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(5.0, summary.max());
    }
}
