package com.foundry.core.engine;

import com.foundry.agent.Decomposer;
import com.foundry.agent.PlanResult;
import com.foundry.agent.Planner;
import com.foundry.core.config.FoundryProperties;
import com.foundry.core.events.EventBus;
import com.foundry.core.events.EventType;
import com.foundry.core.events.PipelineEvent;
import com.foundry.core.logging.MdcContext;
import com.foundry.core.metrics.FoundryMetrics;
import com.foundry.core.model.ExecutorRecord;
import com.foundry.core.model.ExecutorStatus;
import com.foundry.core.model.Milestone;
import com.foundry.core.model.PipelineReport;
import com.foundry.core.model.PipelineState;
import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;
import com.foundry.core.persistence.StateStore;
import com.foundry.core.pool.WorkerPool;
import com.foundry.core.scheduler.MilestoneOutcome;
import com.foundry.core.scheduler.RunContext;
import com.foundry.core.scheduler.TaskSchedulerLoop;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sequences a pipeline run: planning, then each milestone in phase order through the
 * {@link TaskSchedulerLoop}, then the final report.
 * <p>
 * A run is resumable: {@link #recover(String)} resets records left over by a crashed
 * process and continues from whatever the state store already holds. Only one run
 * may be active at a time.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final AtomicInteger PIPELINE_COUNTER = new AtomicInteger(0);
    private static final Duration TEARDOWN_MARGIN = Duration.ofSeconds(1);

    static final String PLANNER_ID = "planner-001";
    static final String DECOMPOSER_ID = "decomposer-001";
    static final String REVIEWER_ID = "reviewer-001";

    private final StateStore store;
    private final Planner planner;
    private final Decomposer decomposer;
    private final TaskSchedulerLoop schedulerLoop;
    private final WorkerPool pool;
    private final EventBus eventBus;
    private final FoundryMetrics metrics;
    private final Duration gracefulTimeout;

    private final PipelineStateMachine stateMachine = new PipelineStateMachine();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile String currentPipelineId;
    private CountDownLatch runFinished = new CountDownLatch(0);

    @Autowired
    public PipelineEngine(StateStore store, Planner planner, Decomposer decomposer,
                          TaskSchedulerLoop schedulerLoop, WorkerPool pool, EventBus eventBus,
                          FoundryMetrics metrics, FoundryProperties properties) {
        this(store, planner, decomposer, schedulerLoop, pool, eventBus, metrics, properties.getGracefulTimeout());
    }

    public PipelineEngine(StateStore store, Planner planner, Decomposer decomposer,
                          TaskSchedulerLoop schedulerLoop, WorkerPool pool, EventBus eventBus,
                          FoundryMetrics metrics, Duration gracefulTimeout) {
        this.store = store;
        this.planner = planner;
        this.decomposer = decomposer;
        this.schedulerLoop = schedulerLoop;
        this.pool = pool;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.gracefulTimeout = gracefulTimeout;
    }

    /**
     * Plans and executes a new pipeline. The state store must not hold an earlier pipeline.
     *
     * @param requirements requirements handed to the planner
     * @return the final report
     * @throws PipelineException     if the run ends in FAILED
     * @throws IllegalStateException if a run is already active or the store is not empty
     */
    public PipelineReport run(String requirements) {
        return execute(requirements, false);
    }

    /**
     * Resumes after an abrupt termination. Stale IN_PROGRESS items and RUNNING executors
     * are reset first. Stored milestones are reused and planning is skipped; MERGED
     * milestones are not run again. With an empty store this behaves like {@link #run}.
     */
    public PipelineReport recover(String requirements) {
        return execute(requirements, true);
    }

    private PipelineReport execute(String requirements, boolean recover) {
        CountDownLatch finished;
        synchronized (this) {
            if (!running.compareAndSet(false, true)) {
                throw new IllegalStateException("A pipeline is already running: " + currentPipelineId);
            }
            finished = new CountDownLatch(1);
            runFinished = finished;
        }
        String pipelineId = generatePipelineId();
        MdcContext.setPipeline(pipelineId);
        try {
            if (!recover && !store.listMilestones().isEmpty()) {
                throw new IllegalStateException(
                        "State store already holds a pipeline; use recover to resume it or reset to discard it");
            }
            if (stateMachine.state().isTerminal() || stateMachine.isCancelled()) {
                stateMachine.reset();
            }
            currentPipelineId = pipelineId;
            return drive(pipelineId, requirements, recover);
        } finally {
            running.set(false);
            finished.countDown();
            MdcContext.clear();
        }
    }

    private PipelineReport drive(String pipelineId, String requirements, boolean recover) {
        log.info("Starting pipeline {} ({}) with requirements: {}", pipelineId, recover ? "recover" : "run", requirements);
        stateMachine.startPlanning();
        eventBus.publish(PipelineEvent.of(EventType.PIPELINE_STARTED, pipelineId,
                Map.of("requirements", String.valueOf(requirements), "recover", recover)));

        var ctx = new RunContext(pipelineId, stateMachine);
        try {
            List<Milestone> milestones = List.of();
            if (recover) {
                int cleaned = store.cleanupStaleStates();
                log.info("Recovery reset {} stale record(s)", cleaned);
                milestones = store.listMilestones();
            }
            boolean planned = milestones.isEmpty();
            if (planned) {
                milestones = plan(pipelineId, requirements);
            } else {
                log.info("Resuming {} stored milestone(s), planning skipped", milestones.size());
            }

            stateMachine.startExecuting();
            store.registerExecutor(ExecutorRecord.running(REVIEWER_ID, "REVIEWER", null));

            boolean decomposerPrepared = planned;
            for (Milestone milestone : ordered(milestones)) {
                if (milestone.status() == WorkItemStatus.MERGED) {
                    log.info("Milestone {} already merged, skipping", milestone.id());
                    absorbFinishedItems(ctx, milestone);
                    continue;
                }
                if (milestone.memberIds().isEmpty() && !decomposerPrepared) {
                    decomposer.prepare(requirements);
                    decomposerPrepared = true;
                }
                runMilestone(ctx, milestone);
                if (stateMachine.isCancelled()) {
                    throw new CancellationException("Pipeline " + pipelineId + " cancelled after milestone "
                            + milestone.id());
                }
            }

            terminateRole(REVIEWER_ID);
            stateMachine.complete();
            PipelineReport report = buildReport(ctx);
            log.info("Pipeline {} {}: {} completed, {} failed, {} resource units",
                    pipelineId, report.outcome(), report.completedCount(), report.failedIds().size(),
                    report.totalResourceUsage());
            eventBus.publish(PipelineEvent.of(EventType.PIPELINE_COMPLETED, pipelineId,
                    Map.of("outcome", report.outcome(),
                           "completed", report.completedCount(),
                           "failed", report.failedIds().size())));
            metrics.recordPipelineResult(report.outcome());
            return report;
        } catch (CancellationException e) {
            throw fail(pipelineId, "Pipeline cancelled", e);
        } catch (PipelineException e) {
            throw fail(pipelineId, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw fail(pipelineId, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private List<Milestone> plan(String pipelineId, String requirements) {
        eventBus.publish(PipelineEvent.of(EventType.PLANNING_STARTED, pipelineId, Map.of()));
        store.registerExecutor(ExecutorRecord.running(PLANNER_ID, "PLANNER", null));

        long startMs = System.currentTimeMillis();
        PlanResult result;
        try {
            result = planner.plan(requirements);
        } finally {
            terminateRole(PLANNER_ID);
        }
        metrics.recordPlanningDuration(System.currentTimeMillis() - startMs);

        if (result == null || !result.valid()) {
            String reason = result != null && result.reason() != null ? result.reason() : "planner returned no plan";
            throw new PipelineException("Plan rejected: " + reason);
        }
        if (result.milestones().isEmpty()) {
            throw new PipelineException("Plan rejected: no milestones");
        }

        for (Milestone milestone : result.milestones()) {
            store.createMilestone(milestone);
        }
        log.info("Planned {} milestone(s) in {}ms", result.milestones().size(), System.currentTimeMillis() - startMs);
        eventBus.publish(PipelineEvent.of(EventType.PLANNING_COMPLETED, pipelineId,
                Map.of("milestones", result.milestones().size())));
        return store.listMilestones();
    }

    private void runMilestone(RunContext ctx, Milestone milestone) {
        String pipelineId = ctx.pipelineId();
        MdcContext.setMilestone(pipelineId, milestone.id());
        try {
            requireEarlierPhasesMerged(milestone);
            log.info("Starting milestone {} '{}' (phase {})", milestone.id(), milestone.name(), milestone.phase());
            eventBus.publish(PipelineEvent.forMilestone(EventType.MILESTONE_STARTED, pipelineId, milestone.id(),
                    Map.of("name", milestone.name(), "phase", milestone.phase())));

            List<WorkItem> items = milestone.memberIds().isEmpty()
                    ? decompose(milestone)
                    : store.listWorkItemsForMilestone(milestone.id());

            MilestoneOutcome outcome = schedulerLoop.run(ctx, milestone, items);
            if (outcome.isStalled()) {
                throw new PipelineException("Milestone " + milestone.id() + " stalled: work items "
                        + outcome.stalledIds() + " depend on items that can never complete");
            }

            store.updateMilestoneStatus(milestone.id(), WorkItemStatus.MERGED);
            log.info("Milestone {} merged: {} completed, {} escalated",
                    milestone.id(), outcome.completedIds().size(), outcome.failedIds().size());
            eventBus.publish(PipelineEvent.forMilestone(EventType.MILESTONE_COMPLETED, pipelineId, milestone.id(),
                    Map.of("completed", outcome.completedIds().size(), "failed", outcome.failedIds().size())));
        } finally {
            MdcContext.clearMilestone();
        }
    }

    private void requireEarlierPhasesMerged(Milestone milestone) {
        for (Milestone other : store.listMilestones()) {
            if (other.phase() < milestone.phase() && other.status() != WorkItemStatus.MERGED) {
                throw new PipelineException("Milestone " + milestone.id() + " (phase " + milestone.phase()
                        + ") cannot start before milestone " + other.id() + " (phase " + other.phase() + ") is merged");
            }
        }
    }

    /**
     * Persists the decomposer's items for a milestone. Items that already exist are kept,
     * so a decomposition interrupted by a crash can be repeated.
     */
    private List<WorkItem> decompose(Milestone milestone) {
        store.registerExecutor(ExecutorRecord.running(DECOMPOSER_ID, "DECOMPOSER", null));
        List<WorkItem> produced;
        try {
            produced = decomposer.decompose(milestone);
        } finally {
            terminateRole(DECOMPOSER_ID);
        }

        var memberIds = new ArrayList<String>();
        for (WorkItem item : produced) {
            if (store.getWorkItem(item.id()).isEmpty()) {
                store.createWorkItem(item.withMilestone(milestone.id()));
            }
            memberIds.add(item.id());
        }
        store.updateMilestoneMembers(milestone.id(), memberIds);
        log.info("Milestone {} decomposed into {} work item(s)", milestone.id(), memberIds.size());
        return store.listWorkItemsForMilestone(milestone.id());
    }

    /**
     * Seeds the run's completed and failed sets from a milestone that is not run again,
     * so later items depending on its items stay schedulable.
     */
    private void absorbFinishedItems(RunContext ctx, Milestone milestone) {
        for (WorkItem item : store.listWorkItemsForMilestone(milestone.id())) {
            if (item.status() == WorkItemStatus.MERGED) {
                ctx.completed().add(item.id());
            } else if (item.status() == WorkItemStatus.BLOCKED || item.status() == WorkItemStatus.FAILED) {
                ctx.failed().add(item.id());
            }
        }
    }

    private PipelineReport buildReport(RunContext ctx) {
        long totalUsage = store.listWorkItems().stream().mapToLong(WorkItem::resourceUsage).sum();
        var failedIds = List.copyOf(ctx.failed());
        var summaries = store.listMilestones().stream()
                .map(m -> new PipelineReport.MilestoneSummary(m.id(), m.name(), m.status()))
                .toList();
        String outcome = failedIds.isEmpty() ? PipelineReport.COMPLETED : PipelineReport.COMPLETED_WITH_FAILURES;
        return new PipelineReport(ctx.pipelineId(), outcome, store.statistics(), ctx.completed().size(),
                failedIds, summaries, totalUsage, Instant.now());
    }

    private PipelineException fail(String pipelineId, String reason, RuntimeException cause) {
        log.error("Pipeline {} failed: {}", pipelineId, reason, cause);
        stateMachine.fail(reason);
        teardown();
        eventBus.publish(PipelineEvent.of(EventType.PIPELINE_FAILED, pipelineId,
                Map.of("reason", reason != null ? reason : "unknown")));
        metrics.recordPipelineResult("failed");
        return cause instanceof PipelineException pe ? pe : new PipelineException(reason, cause);
    }

    /**
     * Best-effort release of every live executor after a failure.
     */
    private void teardown() {
        pool.releaseAll();
        try {
            for (ExecutorRecord executor : store.listExecutors()) {
                if (executor.status() == ExecutorStatus.RUNNING) {
                    store.updateExecutorStatus(executor.id(), ExecutorStatus.TERMINATED, null);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Could not terminate executors during teardown: {}", e.getMessage(), e);
        }
    }

    private void terminateRole(String executorId) {
        store.updateExecutorStatus(executorId, ExecutorStatus.TERMINATED, null);
    }

    private static List<Milestone> ordered(List<Milestone> milestones) {
        return milestones.stream()
                .sorted(Comparator.comparingInt(Milestone::phase).thenComparing(Milestone::id))
                .toList();
    }

    // -- Control --------------------------------------------------------------

    /**
     * Stops admission of new work. Running work items continue to completion.
     */
    public void pause() {
        stateMachine.pause();
        log.info("Pipeline {} paused", currentPipelineId);
        publishControl(EventType.PAUSED);
    }

    public void resume() {
        stateMachine.resume();
        log.info("Pipeline {} resumed", currentPipelineId);
        publishControl(EventType.RESUMED);
    }

    /**
     * Requests cancellation of the active run. The scheduler loop stops admitting work,
     * interrupts running items and the run ends in FAILED.
     */
    public void cancel() {
        log.info("Cancelling pipeline {}", currentPipelineId);
        stateMachine.cancel();
    }

    /**
     * Operator shutdown. Admission stops at once, running work items get {@code graceful}
     * to finish, anything still running after that is interrupted and the worker pool is
     * shut down. The active run ends in FAILED. Never throws.
     */
    public void shutdown(Duration graceful) {
        long deadline = System.nanoTime() + graceful.toNanos();
        try {
            CountDownLatch finished;
            synchronized (this) {
                finished = running.get() ? runFinished : null;
            }
            if (finished != null) {
                log.info("Shutting down pipeline {}: waiting up to {}ms for running work items",
                        currentPipelineId, graceful.toMillis());
                stateMachine.cancel(graceful);
                if (!finished.await(graceful.plus(TEARDOWN_MARGIN).toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Pipeline {} did not stop within {}ms", currentPipelineId, graceful.toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("Error during shutdown: {}", e.getMessage(), e);
        }
        pool.shutdown(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
    }

    @PreDestroy
    public void shutdown() {
        shutdown(gracefulTimeout);
    }

    public PipelineState state() {
        return stateMachine.state();
    }

    public String failureReason() {
        return stateMachine.failureReason();
    }

    public boolean isPaused() {
        return stateMachine.isPaused();
    }

    public boolean isRunning() {
        return running.get();
    }

    public String currentPipelineId() {
        return currentPipelineId;
    }

    private void publishControl(EventType type) {
        String pipelineId = currentPipelineId;
        if (pipelineId != null) {
            eventBus.publish(PipelineEvent.of(type, pipelineId, Map.of()));
        }
    }

    /**
     * Generates a pipeline ID in the format FNDY-YYYY-NNNN.
     */
    public String generatePipelineId() {
        int count = PIPELINE_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("FNDY-%d-%04d", year, count);
    }
}
