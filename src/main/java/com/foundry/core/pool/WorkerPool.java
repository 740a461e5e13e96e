package com.foundry.core.pool;

import com.foundry.core.config.FoundryProperties;
import com.foundry.core.model.ExecutorRecord;
import com.foundry.core.model.ExecutorStatus;
import com.foundry.core.model.WorkItem;
import com.foundry.core.persistence.StateStore;
import com.foundry.core.scheduler.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded pool of implementation workers.
 * <p>
 * At most {@code maxWorkers} work items occupy a slot at any time. Each spawned
 * worker is registered as an IMPLEMENTER executor in the state store and marked
 * TERMINATED when its slot is released.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    public static final String EXECUTOR_KIND = "IMPLEMENTER";

    private final StateStore store;
    private final int maxWorkers;
    private final ExecutorService executor;
    private final AtomicInteger executorCounter = new AtomicInteger(0);

    /** Occupied slots keyed by work item id. */
    private final Map<String, WorkerHandle> active = new LinkedHashMap<>();
    private final Map<String, Future<?>> running = new LinkedHashMap<>();
    private boolean accepting = true;

    @Autowired
    public WorkerPool(StateStore store, FoundryProperties properties) {
        this(store, properties.getMaxWorkers());
    }

    public WorkerPool(StateStore store, int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1: " + maxWorkers);
        }
        this.store = store;
        this.maxWorkers = maxWorkers;
        // Continue numbering after workers recorded by earlier runs.
        this.executorCounter.set((int) store.listExecutors().stream()
                .filter(e -> EXECUTOR_KIND.equals(e.kind()))
                .count());
        var threadCounter = new AtomicInteger(0);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "foundry-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public synchronized int activeCount() {
        return active.size();
    }

    public synchronized int availableSlots() {
        return accepting ? maxWorkers - active.size() : 0;
    }

    /**
     * Allocates the next executor id ({@code worker-001}, {@code worker-002}, ...).
     */
    public String nextExecutorId() {
        return "worker-%03d".formatted(executorCounter.incrementAndGet());
    }

    /**
     * Occupies a slot and starts {@code work} on a worker thread. The function receives
     * the executor id and should report failures as outcomes; an exception completes
     * the handle's future exceptionally.
     *
     * @throws PoolAtCapacityException when no slot is free
     */
    public synchronized WorkerHandle spawn(String executorId, WorkItem item,
                                           Function<String, TaskOutcome> work) {
        if (!accepting) {
            throw new IllegalStateException("Worker pool is shut down");
        }
        if (active.size() >= maxWorkers) {
            throw new PoolAtCapacityException(maxWorkers);
        }
        if (active.containsKey(item.id())) {
            throw new IllegalStateException("Work item " + item.id() + " already has a worker");
        }

        store.registerExecutor(ExecutorRecord.running(executorId, EXECUTOR_KIND, item.id()));

        var future = new CompletableFuture<TaskOutcome>();
        var handle = new WorkerHandle(executorId, item.id(), Instant.now(), future);
        active.put(item.id(), handle);
        running.put(item.id(), executor.submit(() -> {
            try {
                future.complete(work.apply(executorId));
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }));
        log.debug("Spawned {} for work item {} ({}/{} slots used)",
                executorId, item.id(), active.size(), maxWorkers);
        return handle;
    }

    /**
     * Frees the slot of a work item, cancelling its worker if still running, and marks
     * the executor TERMINATED. Unknown ids are ignored.
     */
    public synchronized void release(String workItemId) {
        WorkerHandle handle = active.remove(workItemId);
        Future<?> task = running.remove(workItemId);
        if (handle == null) {
            return;
        }
        if (!handle.isDone()) {
            handle.future().cancel(true);
            if (task != null) {
                task.cancel(true);
            }
            log.info("Cancelled running worker {} for work item {}", handle.executorId(), workItemId);
        }
        store.updateExecutorStatus(handle.executorId(), ExecutorStatus.TERMINATED, null);
        log.debug("Released {} (work item {})", handle.executorId(), workItemId);
    }

    /**
     * Releases every occupied slot. Errors are logged and do not stop the sweep.
     */
    public void releaseAll() {
        for (String workItemId : activeWorkItems()) {
            try {
                release(workItemId);
            } catch (Exception e) {
                log.warn("Failed to release worker for {}: {}", workItemId, e.getMessage(), e);
            }
        }
    }

    public synchronized List<String> activeWorkItems() {
        return new ArrayList<>(active.keySet());
    }

    /**
     * Stops accepting work, waits up to {@code graceful} for running workers, then
     * interrupts the rest. Every live executor is marked TERMINATED. Never throws.
     */
    public void shutdown(Duration graceful) {
        synchronized (this) {
            if (!accepting) {
                return;
            }
            accepting = false;
        }
        log.info("Shutting down worker pool ({} active)", activeCount());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(graceful.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still running after {}s, forcing termination", graceful.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        releaseAll();
    }

    public synchronized boolean isShutdown() {
        return !accepting;
    }
}
