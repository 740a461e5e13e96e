package com.foundry.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundry.core.model.ExecutorRecord;
import com.foundry.core.model.ExecutorStatus;
import com.foundry.core.model.LogEntry;
import com.foundry.core.model.Milestone;
import com.foundry.core.model.Statistics;
import com.foundry.core.model.WorkItem;
import com.foundry.core.model.WorkItemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JDBC-based {@link StateStore} persisting to an SQLite database file.
 * <p>
 * All operations are serialized through a single lock, so a read-modify-write on
 * one record is never interleaved with another writer. JSON-valued columns
 * (dependencies, metadata, milestone members) are serialized with Jackson.
 * <p>
 * Tables are created automatically via {@link #createTables()}.
 */
public class JdbcStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    private static final String TERMINAL_STATUSES = "('MERGED', 'FAILED', 'BLOCKED')";

    private static final String[] CREATE_TABLES_SQL = {
            """
            CREATE TABLE IF NOT EXISTS work_items (
                seq               INTEGER PRIMARY KEY AUTOINCREMENT,
                id                TEXT UNIQUE NOT NULL,
                milestone_id      TEXT,
                description       TEXT NOT NULL,
                status            TEXT NOT NULL DEFAULT 'PENDING',
                assigned_executor TEXT,
                retry_count       INTEGER NOT NULL DEFAULT 0,
                resource_usage    INTEGER NOT NULL DEFAULT 0,
                dependencies      TEXT NOT NULL DEFAULT '[]',
                metadata          TEXT NOT NULL DEFAULT '{}',
                last_error        TEXT,
                created_at        TEXT NOT NULL,
                updated_at        TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS milestones (
                seq             INTEGER PRIMARY KEY AUTOINCREMENT,
                id              TEXT UNIQUE NOT NULL,
                name            TEXT NOT NULL,
                description     TEXT,
                phase           INTEGER NOT NULL DEFAULT 0,
                status          TEXT NOT NULL DEFAULT 'PENDING',
                member_ids      TEXT NOT NULL DEFAULT '[]',
                estimated_usage INTEGER NOT NULL DEFAULT 0,
                created_at      TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS executors (
                seq               INTEGER PRIMARY KEY AUTOINCREMENT,
                id                TEXT UNIQUE NOT NULL,
                kind              TEXT NOT NULL,
                status            TEXT NOT NULL DEFAULT 'IDLE',
                current_work_item TEXT,
                resource_usage    INTEGER NOT NULL DEFAULT 0,
                started_at        TEXT,
                last_activity     TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS logs (
                id          INTEGER PRIMARY KEY AUTOINCREMENT,
                executor_id TEXT NOT NULL,
                level       TEXT NOT NULL DEFAULT 'INFO',
                message     TEXT NOT NULL,
                metadata    TEXT NOT NULL DEFAULT '{}',
                timestamp   TEXT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_work_items_status ON work_items(status)",
            "CREATE INDEX IF NOT EXISTS idx_work_items_milestone ON work_items(milestone_id)",
            "CREATE INDEX IF NOT EXISTS idx_executors_status ON executors(status)",
            "CREATE INDEX IF NOT EXISTS idx_logs_executor ON logs(executor_id)"
    };

    private static final String INSERT_WORK_ITEM_SQL = """
            INSERT INTO work_items (id, milestone_id, description, status, assigned_executor,
                                    retry_count, resource_usage, dependencies, metadata,
                                    last_error, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_WORK_ITEMS_SQL = "SELECT * FROM work_items";

    private static final String UPDATE_WORK_ITEM_SQL = """
            UPDATE work_items
            SET description = ?, milestone_id = ?, dependencies = ?, metadata = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String TRANSITION_WORK_ITEM_SQL = """
            UPDATE work_items
            SET status = ?, assigned_executor = ?, updated_at = ?
            WHERE id = ? AND status NOT IN %s
            """.formatted(TERMINAL_STATUSES);

    private static final String INCREMENT_RETRY_SQL = """
            UPDATE work_items SET retry_count = retry_count + 1, updated_at = ? WHERE id = ?
            """;

    private static final String ADD_WORK_ITEM_USAGE_SQL = """
            UPDATE work_items SET resource_usage = resource_usage + ?, updated_at = ? WHERE id = ?
            """;

    private static final String RECORD_FAILURE_SQL = """
            UPDATE work_items SET last_error = ?, updated_at = ? WHERE id = ?
            """;

    private static final String INSERT_MILESTONE_SQL = """
            INSERT INTO milestones (id, name, description, phase, status, member_ids,
                                    estimated_usage, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPSERT_EXECUTOR_SQL = """
            INSERT INTO executors (id, kind, status, current_work_item, resource_usage,
                                   started_at, last_activity)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET kind = excluded.kind,
                          status = excluded.status,
                          current_work_item = excluded.current_work_item,
                          started_at = excluded.started_at,
                          last_activity = excluded.last_activity
            """;

    private static final String UPDATE_EXECUTOR_STATUS_SQL = """
            UPDATE executors SET status = ?, current_work_item = ?, last_activity = ? WHERE id = ?
            """;

    private static final String ADD_EXECUTOR_USAGE_SQL = """
            UPDATE executors SET resource_usage = resource_usage + ?, last_activity = ? WHERE id = ?
            """;

    private static final String INSERT_LOG_SQL = """
            INSERT INTO logs (executor_id, level, message, metadata, timestamp) VALUES (?, ?, ?, ?, ?)
            """;

    private static final String RESET_RUNNING_EXECUTORS_SQL = """
            UPDATE executors SET status = 'IDLE', current_work_item = NULL, last_activity = ?
            WHERE status = 'RUNNING'
            """;

    private static final String RESET_IN_PROGRESS_ITEMS_SQL = """
            UPDATE work_items SET status = 'PENDING', assigned_executor = NULL, updated_at = ?
            WHERE status = 'IN_PROGRESS'
            """;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public JdbcStateStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the tables and indexes if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        inLock("create tables", conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String sql : CREATE_TABLES_SQL) {
                    stmt.execute(sql);
                }
            }
            log.info("State store tables ensured");
            return null;
        });
    }

    // ── Work items ────────────────────────────────────────────────────────

    @Override
    public WorkItem createWorkItem(WorkItem item) {
        return inLock("create work item " + item.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_WORK_ITEM_SQL)) {
                Instant now = Instant.now();
                stmt.setString(1, item.id());
                stmt.setString(2, item.milestoneId());
                stmt.setString(3, item.description());
                stmt.setString(4, item.status().name());
                stmt.setString(5, item.assignedExecutor());
                stmt.setInt(6, item.retryCount());
                stmt.setLong(7, item.resourceUsage());
                stmt.setString(8, toJson(item.dependencies()));
                stmt.setString(9, toJson(item.metadata()));
                stmt.setString(10, item.lastError());
                stmt.setString(11, timestamp(item.createdAt() != null ? item.createdAt() : now));
                stmt.setString(12, timestamp(now));
                stmt.executeUpdate();
            }
            log.debug("Created work item '{}'", item.id());
            return item;
        });
    }

    @Override
    public Optional<WorkItem> getWorkItem(String id) {
        List<WorkItem> items = queryWorkItems(SELECT_WORK_ITEMS_SQL + " WHERE id = ?", id);
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    @Override
    public List<WorkItem> listWorkItems() {
        return queryWorkItems(SELECT_WORK_ITEMS_SQL + " ORDER BY seq");
    }

    @Override
    public List<WorkItem> listWorkItems(WorkItemStatus status) {
        return queryWorkItems(SELECT_WORK_ITEMS_SQL + " WHERE status = ? ORDER BY seq", status.name());
    }

    @Override
    public List<WorkItem> listWorkItemsForMilestone(String milestoneId) {
        return queryWorkItems(SELECT_WORK_ITEMS_SQL + " WHERE milestone_id = ? ORDER BY seq", milestoneId);
    }

    @Override
    public void updateWorkItem(WorkItem item) {
        inLock("update work item " + item.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_WORK_ITEM_SQL)) {
                stmt.setString(1, item.description());
                stmt.setString(2, item.milestoneId());
                stmt.setString(3, toJson(item.dependencies()));
                stmt.setString(4, toJson(item.metadata()));
                stmt.setString(5, timestamp(Instant.now()));
                stmt.setString(6, item.id());
                requireRow(stmt.executeUpdate(), "work item", item.id());
            }
            return null;
        });
    }

    @Override
    public boolean transitionWorkItem(String id, WorkItemStatus status, String executorId) {
        return inLock("transition work item " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(TRANSITION_WORK_ITEM_SQL)) {
                stmt.setString(1, status.name());
                stmt.setString(2, executorId);
                stmt.setString(3, timestamp(Instant.now()));
                stmt.setString(4, id);
                boolean updated = stmt.executeUpdate() > 0;
                if (updated) {
                    log.debug("Work item '{}' -> {} (executor={})", id, status, executorId);
                } else {
                    log.debug("Work item '{}' not moved to {}: missing or terminal", id, status);
                }
                return updated;
            }
        });
    }

    @Override
    public int incrementRetry(String id) {
        return inLock("increment retry " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INCREMENT_RETRY_SQL)) {
                stmt.setString(1, timestamp(Instant.now()));
                stmt.setString(2, id);
                requireRow(stmt.executeUpdate(), "work item", id);
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT retry_count FROM work_items WHERE id = ?")) {
                stmt.setString(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getInt("retry_count") : 0;
                }
            }
        });
    }

    @Override
    public void addWorkItemUsage(String id, long delta) {
        requireNonNegative(delta);
        updateById("add usage to work item " + id, ADD_WORK_ITEM_USAGE_SQL, delta, id);
    }

    @Override
    public void recordFailure(String id, String reason) {
        inLock("record failure " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(RECORD_FAILURE_SQL)) {
                stmt.setString(1, reason);
                stmt.setString(2, timestamp(Instant.now()));
                stmt.setString(3, id);
                requireRow(stmt.executeUpdate(), "work item", id);
            }
            return null;
        });
    }

    // ── Milestones ────────────────────────────────────────────────────────

    @Override
    public Milestone createMilestone(Milestone milestone) {
        return inLock("create milestone " + milestone.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_MILESTONE_SQL)) {
                stmt.setString(1, milestone.id());
                stmt.setString(2, milestone.name());
                stmt.setString(3, milestone.description());
                stmt.setInt(4, milestone.phase());
                stmt.setString(5, milestone.status().name());
                stmt.setString(6, toJson(milestone.memberIds()));
                stmt.setLong(7, milestone.estimatedUsage());
                stmt.setString(8, timestamp(milestone.createdAt() != null ? milestone.createdAt() : Instant.now()));
                stmt.executeUpdate();
            }
            log.debug("Created milestone '{}' (phase {})", milestone.id(), milestone.phase());
            return milestone;
        });
    }

    @Override
    public Optional<Milestone> getMilestone(String id) {
        List<Milestone> milestones = queryMilestones("SELECT * FROM milestones WHERE id = ?", id);
        return milestones.isEmpty() ? Optional.empty() : Optional.of(milestones.get(0));
    }

    @Override
    public List<Milestone> listMilestones() {
        return queryMilestones("SELECT * FROM milestones ORDER BY phase, id");
    }

    @Override
    public void updateMilestoneStatus(String id, WorkItemStatus status) {
        updateById("update milestone status " + id,
                "UPDATE milestones SET status = ? WHERE id = ?", status.name(), id);
    }

    @Override
    public void updateMilestoneMembers(String id, List<String> memberIds) {
        updateById("update milestone members " + id,
                "UPDATE milestones SET member_ids = ? WHERE id = ?", toJson(memberIds), id);
    }

    // ── Executors ─────────────────────────────────────────────────────────

    @Override
    public ExecutorRecord registerExecutor(ExecutorRecord record) {
        return inLock("register executor " + record.id(), conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(UPSERT_EXECUTOR_SQL)) {
                stmt.setString(1, record.id());
                stmt.setString(2, record.kind());
                stmt.setString(3, record.status().name());
                stmt.setString(4, record.currentWorkItem());
                stmt.setLong(5, record.resourceUsage());
                stmt.setString(6, record.startedAt() != null ? timestamp(record.startedAt()) : null);
                stmt.setString(7, timestamp(record.lastActivity() != null ? record.lastActivity() : Instant.now()));
                stmt.executeUpdate();
            }
            log.debug("Registered executor '{}' ({}, {})", record.id(), record.kind(), record.status());
            return record;
        });
    }

    @Override
    public Optional<ExecutorRecord> getExecutor(String id) {
        List<ExecutorRecord> records = queryExecutors("SELECT * FROM executors WHERE id = ?", id);
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    @Override
    public List<ExecutorRecord> listExecutors() {
        return queryExecutors("SELECT * FROM executors ORDER BY seq");
    }

    @Override
    public void updateExecutorStatus(String id, ExecutorStatus status, String currentWorkItem) {
        updateById("update executor status " + id, UPDATE_EXECUTOR_STATUS_SQL,
                status.name(), currentWorkItem, timestamp(Instant.now()), id);
    }

    @Override
    public void addExecutorUsage(String id, long delta) {
        requireNonNegative(delta);
        updateById("add usage to executor " + id, ADD_EXECUTOR_USAGE_SQL,
                delta, timestamp(Instant.now()), id);
    }

    // ── Logs ──────────────────────────────────────────────────────────────

    @Override
    public void appendLog(String executorId, String level, String message, Map<String, Object> metadata) {
        inLock("append log for " + executorId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_LOG_SQL)) {
                stmt.setString(1, executorId);
                stmt.setString(2, level);
                stmt.setString(3, message);
                stmt.setString(4, toJson(metadata != null ? metadata : Map.of()));
                stmt.setString(5, timestamp(Instant.now()));
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<LogEntry> listLogs(String executorId, int limit) {
        return inLock("list logs", conn -> {
            String sql = executorId != null
                    ? "SELECT * FROM logs WHERE executor_id = ? ORDER BY id DESC LIMIT ?"
                    : "SELECT * FROM logs ORDER BY id DESC LIMIT ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int index = 1;
                if (executorId != null) {
                    stmt.setString(index++, executorId);
                }
                stmt.setInt(index, limit);
                List<LogEntry> entries = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new LogEntry(
                                rs.getLong("id"),
                                rs.getString("executor_id"),
                                rs.getString("level"),
                                rs.getString("message"),
                                fromJson(rs.getString("metadata"), OBJECT_MAP),
                                parseTimestamp(rs.getString("timestamp"))));
                    }
                }
                return entries;
            }
        });
    }

    // ── Maintenance ───────────────────────────────────────────────────────

    @Override
    public Statistics statistics() {
        return inLock("statistics", conn -> {
            Map<String, Integer> items = countByStatus(conn, "work_items");
            Map<String, Integer> executors = countByStatus(conn, "executors");
            long itemUsage = sumUsage(conn, "work_items");
            long executorUsage = sumUsage(conn, "executors");
            // Executors track usage as it happens, items carry final totals; report the larger.
            return new Statistics(items, executors, Math.max(itemUsage, executorUsage));
        });
    }

    @Override
    public int cleanupStaleStates() {
        return inLock("cleanup stale states", conn -> {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                String now = timestamp(Instant.now());
                int cleaned = 0;
                try (PreparedStatement stmt = conn.prepareStatement(RESET_RUNNING_EXECUTORS_SQL)) {
                    stmt.setString(1, now);
                    cleaned += stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(RESET_IN_PROGRESS_ITEMS_SQL)) {
                    stmt.setString(1, now);
                    cleaned += stmt.executeUpdate();
                }
                conn.commit();
                log.info("Cleaned up {} stale record(s)", cleaned);
                return cleaned;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        });
    }

    @Override
    public void reset() {
        inLock("reset", conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("DELETE FROM work_items");
                stmt.executeUpdate("DELETE FROM milestones");
                stmt.executeUpdate("DELETE FROM executors");
                stmt.executeUpdate("DELETE FROM logs");
            }
            log.warn("State store reset: all records deleted");
            return null;
        });
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private <T> T inLock(String operation, SqlWork<T> work) {
        lock.lock();
        try (Connection conn = dataSource.getConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            log.error("State store operation failed: {}", operation, e);
            throw new StoreException("Failed to " + operation, e);
        } finally {
            lock.unlock();
        }
    }

    private void updateById(String operation, String sql, Object... params) {
        inLock(operation, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setObject(i + 1, params[i]);
                }
                String id = (String) params[params.length - 1];
                requireRow(stmt.executeUpdate(), "record", id);
            }
            return null;
        });
    }

    private List<WorkItem> queryWorkItems(String sql, String... params) {
        return inLock("query work items", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setString(i + 1, params[i]);
                }
                List<WorkItem> items = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        items.add(toWorkItem(rs));
                    }
                }
                return items;
            }
        });
    }

    private List<Milestone> queryMilestones(String sql, String... params) {
        return inLock("query milestones", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setString(i + 1, params[i]);
                }
                List<Milestone> milestones = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        milestones.add(new Milestone(
                                rs.getString("id"),
                                rs.getString("name"),
                                rs.getString("description"),
                                rs.getInt("phase"),
                                WorkItemStatus.valueOf(rs.getString("status")),
                                fromJson(rs.getString("member_ids"), STRING_LIST),
                                rs.getLong("estimated_usage"),
                                parseTimestamp(rs.getString("created_at"))));
                    }
                }
                return milestones;
            }
        });
    }

    private List<ExecutorRecord> queryExecutors(String sql, String... params) {
        return inLock("query executors", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setString(i + 1, params[i]);
                }
                List<ExecutorRecord> records = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        records.add(new ExecutorRecord(
                                rs.getString("id"),
                                rs.getString("kind"),
                                ExecutorStatus.valueOf(rs.getString("status")),
                                rs.getString("current_work_item"),
                                rs.getLong("resource_usage"),
                                parseTimestamp(rs.getString("started_at")),
                                parseTimestamp(rs.getString("last_activity"))));
                    }
                }
                return records;
            }
        });
    }

    private WorkItem toWorkItem(ResultSet rs) throws SQLException {
        return new WorkItem(
                rs.getString("id"),
                rs.getString("milestone_id"),
                rs.getString("description"),
                WorkItemStatus.valueOf(rs.getString("status")),
                rs.getString("assigned_executor"),
                rs.getInt("retry_count"),
                rs.getLong("resource_usage"),
                fromJson(rs.getString("dependencies"), STRING_LIST),
                fromJson(rs.getString("metadata"), OBJECT_MAP),
                rs.getString("last_error"),
                parseTimestamp(rs.getString("created_at")),
                parseTimestamp(rs.getString("updated_at")));
    }

    private static Map<String, Integer> countByStatus(Connection conn, String table) throws SQLException {
        Map<String, Integer> counts = new LinkedHashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT status, COUNT(*) AS count FROM " + table + " GROUP BY status ORDER BY status");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString("status"), rs.getInt("count"));
            }
        }
        return counts;
    }

    private static long sumUsage(Connection conn, String table) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT COALESCE(SUM(resource_usage), 0) AS total FROM " + table);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong("total") : 0L;
        }
    }

    private static void requireRow(int updated, String kind, String id) {
        if (updated == 0) {
            throw new StoreException("No " + kind + " found with id '" + id + "'");
        }
    }

    private static void requireNonNegative(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Resource usage delta must be non-negative: " + delta);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize column value", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new StoreException("Failed to deserialize column value", e);
        }
    }

    private static String timestamp(Instant instant) {
        return instant.toString();
    }

    private static Instant parseTimestamp(String value) {
        return value != null ? Instant.parse(value) : null;
    }
}
