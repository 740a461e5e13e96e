package com.foundry.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Foundry pipeline execution.
 */
@Service
public class FoundryMetrics {

    private final MeterRegistry registry;

    public FoundryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("foundry.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWorkItemExecution(boolean success, long ms) {
        Timer.builder("foundry.workitem.duration")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordReviewResult(boolean approved) {
        Counter.builder("foundry.review.evaluations")
                .tag("result", approved ? "approved" : "rejected")
                .register(registry)
                .increment();
    }

    public void incrementRetries() {
        Counter.builder("foundry.retries.total")
                .description("Work items returned to PENDING after a failure")
                .register(registry)
                .increment();
    }

    public void incrementEscalations() {
        Counter.builder("foundry.escalations.total")
                .description("Work items blocked after exhausting their retries")
                .register(registry)
                .increment();
    }

    public void recordPipelineResult(String status) {
        Counter.builder("foundry.pipelines.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records the number of busy worker slots after an admission round.
     *
     * @param count number of workers in flight
     */
    public void recordActiveWorkers(int count) {
        DistributionSummary.builder("foundry.pool.active_workers")
                .description("Workers in flight after each admission round")
                .register(registry)
                .record(count);
    }
}
