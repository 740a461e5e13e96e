package com.foundry.core.pool;

import com.foundry.core.model.ExecutorRecord;
import com.foundry.core.model.ExecutorStatus;
import com.foundry.core.model.WorkItem;
import com.foundry.core.persistence.JdbcStateStore;
import com.foundry.core.persistence.StateStore;
import com.foundry.core.persistence.StoreConfig;
import com.foundry.core.scheduler.TaskOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    @TempDir
    Path tempDir;

    private StateStore store;
    private WorkerPool pool;
    private final CountDownLatch gate = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        var jdbc = new JdbcStateStore(StoreConfig.sqliteDataSource(tempDir.resolve("state.db")));
        jdbc.createTables();
        store = jdbc;
        pool = new WorkerPool(store, 2);
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
        pool.shutdown(Duration.ofSeconds(1));
    }

    private WorkItem item(String id) {
        return WorkItem.pending(id, "Do " + id, List.of(), Map.of());
    }

    private TaskOutcome blockUntilReleased(String itemId, String executorId) {
        try {
            gate.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return TaskOutcome.succeeded(itemId, executorId, 0, 0);
    }

    @Test
    @DisplayName("executor ids are sequential and zero padded")
    void executorIds() {
        assertEquals("worker-001", pool.nextExecutorId());
        assertEquals("worker-002", pool.nextExecutorId());
    }

    @Test
    @DisplayName("numbering continues after workers recorded by an earlier run")
    void executorIdsContinue() {
        store.registerExecutor(ExecutorRecord.running("worker-001", WorkerPool.EXECUTOR_KIND, null));
        store.registerExecutor(ExecutorRecord.running("worker-002", WorkerPool.EXECUTOR_KIND, null));
        store.registerExecutor(ExecutorRecord.running("planner-001", "PLANNER", null));

        var restarted = new WorkerPool(store, 2);
        try {
            assertEquals("worker-003", restarted.nextExecutorId());
        } finally {
            restarted.shutdown(Duration.ofMillis(100));
        }
    }

    @Test
    @DisplayName("spawn registers a RUNNING executor and completes the future")
    void spawnRuns() throws Exception {
        var handle = pool.spawn("worker-001", item("T-1"),
                id -> TaskOutcome.succeeded("T-1", id, 3, 1));

        TaskOutcome outcome = handle.future().get(5, TimeUnit.SECONDS);
        assertTrue(outcome.success());
        assertEquals("worker-001", outcome.executorId());

        var executor = store.getExecutor("worker-001").orElseThrow();
        assertEquals(WorkerPool.EXECUTOR_KIND, executor.kind());
        assertEquals("T-1", executor.currentWorkItem());
    }

    @Test
    @DisplayName("pool never exceeds its capacity")
    void capacityEnforced() {
        pool.spawn("worker-001", item("T-1"), id -> blockUntilReleased("T-1", id));
        pool.spawn("worker-002", item("T-2"), id -> blockUntilReleased("T-2", id));

        assertEquals(0, pool.availableSlots());
        var ex = assertThrows(PoolAtCapacityException.class,
                () -> pool.spawn("worker-003", item("T-3"), id -> blockUntilReleased("T-3", id)));
        assertTrue(ex.getMessage().contains("2"));
        assertEquals(2, pool.activeCount());
    }

    @Test
    @DisplayName("the same work item cannot hold two slots")
    void duplicateWorkItem() {
        pool.spawn("worker-001", item("T-1"), id -> blockUntilReleased("T-1", id));
        assertThrows(IllegalStateException.class,
                () -> pool.spawn("worker-002", item("T-1"), id -> blockUntilReleased("T-1", id)));
    }

    @Test
    @DisplayName("release frees the slot and terminates the executor")
    void releaseFreesSlot() throws Exception {
        var handle = pool.spawn("worker-001", item("T-1"), id -> TaskOutcome.succeeded("T-1", id, 0, 0));
        handle.future().get(5, TimeUnit.SECONDS);

        pool.release("T-1");

        assertEquals(2, pool.availableSlots());
        assertTrue(pool.activeWorkItems().isEmpty());
        assertEquals(ExecutorStatus.TERMINATED, store.getExecutor("worker-001").orElseThrow().status());
        assertDoesNotThrow(() -> pool.release("T-1"));
    }

    @Test
    @DisplayName("releasing a running worker cancels it")
    void releaseCancelsRunning() {
        var handle = pool.spawn("worker-001", item("T-1"), id -> blockUntilReleased("T-1", id));

        pool.release("T-1");

        assertTrue(handle.future().isCancelled());
        assertEquals(ExecutorStatus.TERMINATED, store.getExecutor("worker-001").orElseThrow().status());
    }

    @Test
    @DisplayName("an exception in the work completes the future exceptionally")
    void workThrows() {
        var handle = pool.spawn("worker-001", item("T-1"), id -> {
            throw new IllegalStateException("reviewer down");
        });

        var ex = assertThrows(ExecutionException.class, () -> handle.future().get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisplayName("shutdown terminates every executor and refuses new work")
    void shutdownTerminates() {
        pool.spawn("worker-001", item("T-1"), id -> blockUntilReleased("T-1", id));

        pool.shutdown(Duration.ofMillis(50));

        assertTrue(pool.isShutdown());
        assertEquals(0, pool.availableSlots());
        assertEquals(ExecutorStatus.TERMINATED, store.getExecutor("worker-001").orElseThrow().status());
        assertThrows(IllegalStateException.class,
                () -> pool.spawn("worker-002", item("T-2"), id -> TaskOutcome.succeeded("T-2", id, 0, 0)));
    }

    @Test
    @DisplayName("maxWorkers below one is rejected")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(store, 0));
    }
}
