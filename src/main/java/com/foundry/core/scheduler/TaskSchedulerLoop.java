package com.foundry.core.scheduler;

import com.foundry.agent.ExecutionResult;
import com.foundry.agent.ExecutionSession;
import com.foundry.agent.ReviewResult;
import com.foundry.agent.Reviewer;
import com.foundry.core.config.FoundryProperties;
import com.foundry.core.engine.PipelineException;
import com.foundry.core.events.EventBus;
import com.foundry.core.events.EventType;
import com.foundry.core.events.PipelineEvent;
import com.foundry.core.logging.MdcContext;
import com.foundry.core.metrics.FoundryMetrics;
import com.foundry.core.model.Milestone;
import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;
import com.foundry.core.persistence.StateStore;
import com.foundry.core.persistence.StoreException;
import com.foundry.core.pool.WorkerHandle;
import com.foundry.core.pool.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives the work items of one milestone to completion.
 * <p>
 * The loop runs on the caller's thread and is the only place that admits or harvests
 * work. Each pass admits ready items into free pool slots (unless paused), waits for
 * at least one in-flight item to finish and harvests every finished one, feeding
 * failures through the {@link RetryEscalationPolicy}. Every id is in exactly one of
 * pending, in-flight, or the run's completed and failed sets.
 * <p>
 * On cancellation the loop stops admitting and keeps harvesting until the in-flight
 * items finish or the grace period ends; whatever is still running then is interrupted.
 * <p>
 * When nothing is in flight, nothing is paused and no pending item can be admitted,
 * the remaining items wait on dependencies that will never complete. The loop stops
 * and reports them as stalled; they stay PENDING in the store.
 */
@Service
public class TaskSchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerLoop.class);

    private static final int MAX_LOG_LENGTH = 500;

    private final StateStore store;
    private final WorkerPool pool;
    private final DependencyResolver resolver;
    private final RetryEscalationPolicy retryPolicy;
    private final ExecutionSession executionSession;
    private final Reviewer reviewer;
    private final EventBus eventBus;
    private final FoundryMetrics metrics;
    private final Duration pollInterval;

    @Autowired
    public TaskSchedulerLoop(StateStore store, WorkerPool pool, DependencyResolver resolver,
                             RetryEscalationPolicy retryPolicy, ExecutionSession executionSession,
                             Reviewer reviewer, EventBus eventBus, FoundryMetrics metrics,
                             FoundryProperties properties) {
        this(store, pool, resolver, retryPolicy, executionSession, reviewer, eventBus, metrics,
                properties.getPollInterval());
    }

    public TaskSchedulerLoop(StateStore store, WorkerPool pool, DependencyResolver resolver,
                             RetryEscalationPolicy retryPolicy, ExecutionSession executionSession,
                             Reviewer reviewer, EventBus eventBus, FoundryMetrics metrics,
                             Duration pollInterval) {
        this.store = store;
        this.pool = pool;
        this.resolver = resolver;
        this.retryPolicy = retryPolicy;
        this.executionSession = executionSession;
        this.reviewer = reviewer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
    }

    /**
     * Runs the milestone's items until none is pending or in flight, or until the
     * remaining ones stall.
     *
     * @throws CancellationException if the pipeline is cancelled
     * @throws PipelineException     on a reviewer or store failure inside a worker
     */
    public MilestoneOutcome run(RunContext ctx, Milestone milestone, List<WorkItem> items) {
        var pending = new LinkedHashMap<String, WorkItem>();
        var resumeAtReview = new HashSet<String>();
        var inFlight = new LinkedHashMap<String, WorkerHandle>();
        var completedHere = new ArrayList<String>();
        var failedHere = new ArrayList<String>();
        boolean draining = false;

        seed(ctx, items, pending, resumeAtReview);
        log.info("Milestone {}: {} item(s) pending ({} resumed at review), {} completed so far",
                milestone.id(), pending.size(), resumeAtReview.size(), ctx.completed().size());

        try {
            while (!pending.isEmpty() || !inFlight.isEmpty()) {
                if (ctx.stateMachine().isCancelled()) {
                    if (inFlight.isEmpty() || ctx.stateMachine().isGraceExpired()) {
                        throw new CancellationException("Pipeline " + ctx.pipelineId() + " cancelled");
                    }
                    if (!draining) {
                        log.info("Milestone {}: cancellation requested, waiting for {} running item(s)",
                                milestone.id(), inFlight.size());
                        draining = true;
                    }
                    awaitAny(inFlight.values());
                    harvest(ctx, milestone, pending, resumeAtReview, inFlight, completedHere, failedHere);
                    continue;
                }

                boolean paused = ctx.stateMachine().isPaused();
                int admitted = paused ? 0 : admit(ctx, milestone, pending, resumeAtReview, inFlight);

                if (!inFlight.isEmpty()) {
                    awaitAny(inFlight.values());
                    harvest(ctx, milestone, pending, resumeAtReview, inFlight, completedHere, failedHere);
                } else if (paused) {
                    awaitResume(ctx);
                } else if (admitted == 0) {
                    List<String> stalled = List.copyOf(pending.keySet());
                    log.warn("Milestone {} stalled: {} item(s) can never become ready: {}",
                            milestone.id(), stalled.size(), stalled);
                    eventBus.publish(PipelineEvent.forMilestone(EventType.MILESTONE_STALLED,
                            ctx.pipelineId(), milestone.id(), Map.of("stalled", stalled)));
                    return new MilestoneOutcome(milestone.id(), completedHere, failedHere, stalled);
                }
            }
        } catch (RuntimeException e) {
            abandon(inFlight);
            throw e;
        }

        log.info("Milestone {}: {} completed, {} escalated", milestone.id(), completedHere.size(), failedHere.size());
        return new MilestoneOutcome(milestone.id(), completedHere, failedHere, List.of());
    }

    private void seed(RunContext ctx, List<WorkItem> items, Map<String, WorkItem> pending,
                      Set<String> resumeAtReview) {
        for (var item : items) {
            if (ctx.completed().contains(item.id()) || ctx.failed().contains(item.id())) {
                continue;
            }
            switch (item.status()) {
                case PENDING -> pending.put(item.id(), item);
                case REVIEW -> {
                    pending.put(item.id(), item.withStatus(WorkItemStatus.PENDING));
                    resumeAtReview.add(item.id());
                }
                case MERGED -> ctx.completed().add(item.id());
                case BLOCKED, FAILED -> ctx.failed().add(item.id());
                case IN_PROGRESS -> log.warn("Work item {} is IN_PROGRESS in the store and is not re-admitted; "
                        + "run recovery to reset stale items", item.id());
            }
        }
    }

    private int admit(RunContext ctx, Milestone milestone, Map<String, WorkItem> pending,
                      Set<String> resumeAtReview, Map<String, WorkerHandle> inFlight) {
        List<WorkItem> ready = resolver.readyItems(pending.values(), ctx.completed());
        int progressed = 0;
        for (var item : ready) {
            if (pool.availableSlots() <= 0) {
                break;
            }
            boolean reviewOnly = resumeAtReview.contains(item.id());
            String executorId = pool.nextExecutorId();
            pending.remove(item.id());
            progressed++;

            WorkItemStatus target = reviewOnly ? WorkItemStatus.REVIEW : WorkItemStatus.IN_PROGRESS;
            if (!store.transitionWorkItem(item.id(), target, executorId)) {
                reconcile(ctx, item.id());
                continue;
            }

            WorkerHandle handle = pool.spawn(executorId, item,
                    id -> process(ctx, milestone, item, id, reviewOnly));
            inFlight.put(item.id(), handle);
            log.info("Dispatched work item {} to {}{}", item.id(), executorId, reviewOnly ? " (review only)" : "");
            eventBus.publish(PipelineEvent.forWorkItem(EventType.TASK_STARTED, ctx.pipelineId(),
                    milestone.id(), item.id(),
                    Map.of("executorId", executorId, "description", item.description())));
        }
        if (progressed > 0) {
            metrics.recordActiveWorkers(inFlight.size());
        }
        return progressed;
    }

    /**
     * Settles an item the store refused to transition because it is already terminal.
     */
    private void reconcile(RunContext ctx, String workItemId) {
        Optional<WorkItem> stored = store.getWorkItem(workItemId);
        if (stored.isPresent() && stored.get().status() == WorkItemStatus.MERGED) {
            log.info("Work item {} is already MERGED", workItemId);
            ctx.completed().add(workItemId);
        } else {
            log.warn("Work item {} could not be admitted (store status: {})", workItemId,
                    stored.map(i -> i.status().name()).orElse("missing"));
            ctx.failed().add(workItemId);
        }
    }

    // -- Worker side ----------------------------------------------------------

    private TaskOutcome process(RunContext ctx, Milestone milestone, WorkItem item, String executorId,
                                boolean reviewOnly) {
        MdcContext.setWorkItem(ctx.pipelineId(), item.id(), executorId);
        long startMs = System.currentTimeMillis();
        long used = 0;
        try {
            if (!reviewOnly) {
                ExecutionResult result;
                try {
                    result = executionSession.run(item, executorId);
                } catch (StoreException e) {
                    throw e;
                } catch (Exception e) {
                    log.warn("Execution of {} threw: {}", item.id(), e.getMessage(), e);
                    String reason = "Execution error: " + e.getMessage();
                    store.appendLog(executorId, "ERROR", truncate(reason), Map.of("workItemId", item.id()));
                    return TaskOutcome.failed(item.id(), executorId, reason, 0, elapsedSince(startMs));
                }
                if (result == null) {
                    return TaskOutcome.failed(item.id(), executorId, "Execution returned no result", 0,
                            elapsedSince(startMs));
                }

                used = Math.max(0, result.resourceUsed());
                if (used > 0) {
                    store.addWorkItemUsage(item.id(), used);
                    store.addExecutorUsage(executorId, used);
                }
                String output = result.output() != null ? result.output() : "";
                if (!result.success()) {
                    store.appendLog(executorId, "ERROR", truncate("Failed: " + output), Map.of("workItemId", item.id()));
                    String reason = output.isBlank() ? "Execution failed" : output;
                    return TaskOutcome.failed(item.id(), executorId, reason, used, elapsedSince(startMs));
                }
                store.appendLog(executorId, "INFO", truncate("Completed: " + output), Map.of("workItemId", item.id()));
                store.transitionWorkItem(item.id(), WorkItemStatus.REVIEW, executorId);
            }
            return review(ctx, milestone, item, executorId, used, startMs);
        } finally {
            MdcContext.clear();
        }
    }

    private TaskOutcome review(RunContext ctx, Milestone milestone, WorkItem item, String executorId,
                               long used, long startMs) {
        ReviewResult verdict;
        ctx.stateMachine().beginReview();
        try {
            eventBus.publish(PipelineEvent.forWorkItem(EventType.REVIEW_STARTED, ctx.pipelineId(),
                    milestone.id(), item.id(), Map.of("executorId", executorId)));
            WorkItem current = store.getWorkItem(item.id()).orElse(item);
            verdict = reviewer.review(current);
        } finally {
            ctx.stateMachine().endReview();
        }
        if (verdict == null) {
            throw new IllegalStateException("Reviewer returned no result for " + item.id());
        }

        metrics.recordReviewResult(verdict.approved());
        var payload = new HashMap<String, Object>();
        payload.put("approved", verdict.approved());
        if (verdict.feedback() != null) {
            payload.put("feedback", verdict.feedback());
        }
        eventBus.publish(PipelineEvent.forWorkItem(EventType.REVIEW_COMPLETED, ctx.pipelineId(),
                milestone.id(), item.id(), payload));

        if (!verdict.approved()) {
            String reason = "Review rejected: " + (verdict.feedback() != null ? verdict.feedback() : "no feedback");
            store.appendLog(executorId, "WARN", truncate(reason), Map.of("workItemId", item.id()));
            return TaskOutcome.failed(item.id(), executorId, reason, used, elapsedSince(startMs));
        }
        store.transitionWorkItem(item.id(), WorkItemStatus.MERGED, executorId);
        log.info("Work item {} merged", item.id());
        return TaskOutcome.succeeded(item.id(), executorId, used, elapsedSince(startMs));
    }

    // -- Loop side ------------------------------------------------------------

    private void awaitAny(Collection<WorkerHandle> handles) {
        CompletableFuture<?>[] futures = handles.stream()
                .map(WorkerHandle::future)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.anyOf(futures).get(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.trace("No worker finished within {}ms", pollInterval.toMillis());
        } catch (ExecutionException e) {
            log.debug("Worker finished exceptionally: {}", e.getCause() != null ? e.getCause().getMessage() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for workers");
        }
    }

    private void awaitResume(RunContext ctx) {
        try {
            ctx.stateMachine().pauseGate().awaitOpen(pollInterval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while paused");
        }
    }

    private void harvest(RunContext ctx, Milestone milestone, Map<String, WorkItem> pending,
                         Set<String> resumeAtReview, Map<String, WorkerHandle> inFlight,
                         List<String> completedHere, List<String> failedHere) {
        List<WorkerHandle> finished = inFlight.values().stream().filter(WorkerHandle::isDone).toList();
        for (var handle : finished) {
            String id = handle.workItemId();
            inFlight.remove(id);
            pool.release(id);

            TaskOutcome outcome;
            try {
                outcome = handle.future().join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new PipelineException("Fatal error while processing work item " + id + ": "
                        + cause.getMessage(), cause);
            }

            metrics.recordWorkItemExecution(outcome.success(), outcome.elapsedMs());
            if (outcome.success()) {
                ctx.completed().add(id);
                completedHere.add(id);
                eventBus.publish(PipelineEvent.forWorkItem(EventType.TASK_COMPLETED, ctx.pipelineId(),
                        milestone.id(), id,
                        Map.of("executorId", outcome.executorId(), "resourceUsed", outcome.resourceUsed())));
                continue;
            }

            String reason = outcome.reason() != null ? outcome.reason() : "unknown failure";
            eventBus.publish(PipelineEvent.forWorkItem(EventType.TASK_FAILED, ctx.pipelineId(),
                    milestone.id(), id, Map.of("executorId", outcome.executorId(), "reason", reason)));

            RetryEscalationPolicy.Decision decision = retryPolicy.onFailure(ctx.pipelineId(), milestone.id(), id, reason);
            if (decision == RetryEscalationPolicy.Decision.RETRY) {
                resumeAtReview.remove(id);
                WorkItem refreshed = store.getWorkItem(id)
                        .orElseThrow(() -> new StoreException("Work item " + id + " disappeared from the store"));
                if (refreshed.status().isTerminal()) {
                    reconcile(ctx, id);
                } else {
                    pending.put(id, refreshed);
                }
            } else {
                ctx.failed().add(id);
                failedHere.add(id);
            }
        }
    }

    private void abandon(Map<String, WorkerHandle> inFlight) {
        for (String id : List.copyOf(inFlight.keySet())) {
            try {
                pool.release(id);
            } catch (Exception e) {
                log.warn("Failed to release worker for {}: {}", id, e.getMessage(), e);
            }
        }
        inFlight.clear();
    }

    private static long elapsedSince(long startMs) {
        return System.currentTimeMillis() - startMs;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_LOG_LENGTH ? text : text.substring(0, MAX_LOG_LENGTH);
    }
}
