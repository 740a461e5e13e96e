package com.foundry.core.pool;

import com.foundry.core.scheduler.TaskOutcome;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A worker slot occupied by one work item.
 *
 * @param executorId executor id registered in the state store
 * @param workItemId the work item being processed
 * @param startedAt  when the worker was spawned
 * @param future     completes with the outcome, or exceptionally on a fatal error
 */
public record WorkerHandle(
    String executorId,
    String workItemId,
    Instant startedAt,
    CompletableFuture<TaskOutcome> future
) {

    public boolean isDone() {
        return future.isDone();
    }
}
