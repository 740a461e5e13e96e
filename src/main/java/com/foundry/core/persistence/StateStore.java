package com.foundry.core.persistence;

import com.foundry.core.model.ExecutorRecord;
import com.foundry.core.model.ExecutorStatus;
import com.foundry.core.model.LogEntry;
import com.foundry.core.model.Milestone;
import com.foundry.core.model.Statistics;
import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store for work items, milestones, executors and logs.
 * <p>
 * The store is the single source of truth across restarts. Every operation is
 * atomic with respect to a single record; counters are updated relatively
 * ({@code += delta}) so concurrent callers never lose an update. Storage failures
 * surface as {@link StoreException}.
 */
public interface StateStore {

    // -- Work items ---------------------------------------------------------

    /**
     * Persists a new work item. Fails if the id already exists.
     */
    WorkItem createWorkItem(WorkItem item);

    Optional<WorkItem> getWorkItem(String id);

    /** All work items in creation order. */
    List<WorkItem> listWorkItems();

    List<WorkItem> listWorkItems(WorkItemStatus status);

    List<WorkItem> listWorkItemsForMilestone(String milestoneId);

    /**
     * Updates the collaborator-owned fields (description, dependencies, metadata).
     * Status, counters and assignment are left untouched.
     */
    void updateWorkItem(WorkItem item);

    /**
     * Moves a work item to a new status and assigns (or clears, when null) its executor.
     * A record whose current status is terminal is never changed.
     *
     * @return true if the record was updated
     */
    boolean transitionWorkItem(String id, WorkItemStatus status, String executorId);

    /**
     * Increments the retry count by one.
     *
     * @return the new retry count
     */
    int incrementRetry(String id);

    void addWorkItemUsage(String id, long delta);

    /** Stores the reason of the latest failure for manual inspection. */
    void recordFailure(String id, String reason);

    // -- Milestones ---------------------------------------------------------

    Milestone createMilestone(Milestone milestone);

    Optional<Milestone> getMilestone(String id);

    /** All milestones by ascending phase, then id. */
    List<Milestone> listMilestones();

    void updateMilestoneStatus(String id, WorkItemStatus status);

    void updateMilestoneMembers(String id, List<String> memberIds);

    // -- Executors ----------------------------------------------------------

    /**
     * Registers an executor. Re-registering an existing id overwrites its mutable
     * fields instead of creating a duplicate.
     */
    ExecutorRecord registerExecutor(ExecutorRecord record);

    Optional<ExecutorRecord> getExecutor(String id);

    List<ExecutorRecord> listExecutors();

    void updateExecutorStatus(String id, ExecutorStatus status, String currentWorkItem);

    void addExecutorUsage(String id, long delta);

    // -- Logs ---------------------------------------------------------------

    void appendLog(String executorId, String level, String message, Map<String, Object> metadata);

    /**
     * Most recent log entries first.
     *
     * @param executorId restrict to one executor, or null for all
     * @param limit      maximum number of entries
     */
    List<LogEntry> listLogs(String executorId, int limit);

    // -- Maintenance --------------------------------------------------------

    Statistics statistics();

    /**
     * Crash recovery sweep: RUNNING executors become IDLE and IN_PROGRESS work items
     * become PENDING with no assigned executor. Other statuses are untouched.
     *
     * @return number of records changed
     */
    int cleanupStaleStates();

    /** Deletes every record. Only invoked by an explicit reset. */
    void reset();
}
