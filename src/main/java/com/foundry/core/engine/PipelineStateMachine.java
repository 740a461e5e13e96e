package com.foundry.core.engine;

import com.foundry.core.model.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the lifecycle of one pipeline run.
 * <p>
 * Allowed transitions:
 * <pre>
 *   IDLE      → PLANNING
 *   PLANNING  → EXECUTING
 *   EXECUTING ⇄ REVIEWING
 *   EXECUTING | REVIEWING → COMPLETED
 *   any non-terminal      → FAILED
 * </pre>
 * REVIEWING is held while at least one review is running. Pausing and cancellation
 * are orthogonal to the state: the pause gate only stops admission of new work.
 * All methods are thread-safe; reviews begin and end on worker threads.
 */
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private static final Map<PipelineState, Set<PipelineState>> ALLOWED = Map.of(
            PipelineState.IDLE, EnumSet.of(PipelineState.PLANNING, PipelineState.FAILED),
            PipelineState.PLANNING, EnumSet.of(PipelineState.EXECUTING, PipelineState.FAILED),
            PipelineState.EXECUTING, EnumSet.of(PipelineState.REVIEWING, PipelineState.COMPLETED, PipelineState.FAILED),
            PipelineState.REVIEWING, EnumSet.of(PipelineState.EXECUTING, PipelineState.COMPLETED, PipelineState.FAILED),
            PipelineState.COMPLETED, EnumSet.noneOf(PipelineState.class),
            PipelineState.FAILED, EnumSet.noneOf(PipelineState.class)
    );

    private final PauseGate pauseGate = new PauseGate();
    private PipelineState state = PipelineState.IDLE;
    private String failureReason;
    private int activeReviews;
    private volatile boolean cancelled;
    private volatile long graceDeadlineNanos;

    public synchronized PipelineState state() {
        return state;
    }

    public synchronized String failureReason() {
        return failureReason;
    }

    public PauseGate pauseGate() {
        return pauseGate;
    }

    public boolean isPaused() {
        return !pauseGate.isOpen();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * True once cancellation was requested and its grace period for running work is over.
     */
    public boolean isGraceExpired() {
        return cancelled && System.nanoTime() - graceDeadlineNanos >= 0;
    }

    public synchronized void startPlanning() {
        transition(PipelineState.PLANNING);
    }

    public synchronized void startExecuting() {
        transition(PipelineState.EXECUTING);
    }

    public synchronized void complete() {
        transition(PipelineState.COMPLETED);
    }

    /**
     * Moves to FAILED from any non-terminal state.
     *
     * @return false if the pipeline was already terminal
     */
    public synchronized boolean fail(String reason) {
        if (state.isTerminal()) {
            log.debug("Ignoring failure '{}': pipeline already {}", reason, state);
            return false;
        }
        transition(PipelineState.FAILED);
        failureReason = reason;
        return true;
    }

    /**
     * Marks the start of a review. The first concurrent review moves EXECUTING to REVIEWING.
     */
    public synchronized void beginReview() {
        activeReviews++;
        if (activeReviews == 1 && state == PipelineState.EXECUTING) {
            transition(PipelineState.REVIEWING);
        }
    }

    /**
     * Marks the end of a review. The last concurrent review moves REVIEWING back to EXECUTING.
     */
    public synchronized void endReview() {
        activeReviews = Math.max(0, activeReviews - 1);
        if (activeReviews == 0 && state == PipelineState.REVIEWING) {
            transition(PipelineState.EXECUTING);
        }
    }

    public void pause() {
        pauseGate.close();
    }

    public void resume() {
        pauseGate.open();
    }

    /**
     * Requests cancellation without a grace period: running work is interrupted.
     */
    public void cancel() {
        cancel(Duration.ZERO);
    }

    /**
     * Requests cancellation. No new work is admitted; work already running may finish
     * within {@code grace}. The pause gate is opened so a paused loop notices.
     */
    public void cancel(Duration grace) {
        graceDeadlineNanos = System.nanoTime() + grace.toNanos();
        cancelled = true;
        pauseGate.open();
    }

    /**
     * Returns a terminal machine to IDLE for an explicit re-invocation.
     */
    public synchronized void reset() {
        if (!state.isTerminal() && state != PipelineState.IDLE) {
            throw new IllegalStateException("Cannot reset a pipeline in state " + state);
        }
        state = PipelineState.IDLE;
        failureReason = null;
        activeReviews = 0;
        cancelled = false;
        pauseGate.open();
    }

    private void transition(PipelineState target) {
        if (!ALLOWED.get(state).contains(target)) {
            throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + target);
        }
        log.debug("Pipeline state {} -> {}", state, target);
        state = target;
    }
}
