package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskledger.core.model.JsonPayloads;
import com.taskledger.core.model.TaskComplexity;
import com.taskledger.core.model.TaskPlan;
import com.taskledger.core.model.TaskStats;
import com.taskledger.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL-backed {@link TaskPlanRepository} over the {@code task_plans} table.
 */
public class JdbcTaskPlanRepository implements TaskPlanRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskPlanRepository.class);

    private static final String TABLE_NAME = "task_plans";

    private static final String COLUMNS = """
            plan_id, batch_index, task_id, tool_name, description, parameters, complexity,
            is_required_validate_by_database, status, result, error_message,
            created_at, updated_at, started_at, completed_at""";

    static final String UPSERT_SQL = """
            INSERT INTO %s (plan_id, batch_index, task_id, tool_name, description, parameters,
                            complexity, is_required_validate_by_database, status, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (task_id)
            DO UPDATE SET batch_index = EXCLUDED.batch_index,
                          tool_name = EXCLUDED.tool_name,
                          description = EXCLUDED.description,
                          parameters = EXCLUDED.parameters,
                          complexity = EXCLUDED.complexity,
                          is_required_validate_by_database = EXCLUDED.is_required_validate_by_database,
                          updated_at = NOW()
            WHERE %s.plan_id = EXCLUDED.plan_id
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE task_id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_BATCH_SQL = """
            SELECT %s FROM %s
            WHERE plan_id = ? AND batch_index = ?
            ORDER BY created_at ASC, id ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_PLAN_SQL = """
            SELECT %s FROM %s
            WHERE plan_id = ?
            ORDER BY batch_index ASC, created_at ASC, id ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE task_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_PLAN_SQL = """
            DELETE FROM %s WHERE plan_id = ?
            """.formatted(TABLE_NAME);

    private static final String STATS_SQL = """
            SELECT status, complexity, COUNT(*) AS cnt
            FROM %s
            WHERE plan_id = ?
            GROUP BY status, complexity
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcTaskPlanRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(String planId, TaskPlan task) {
        TaskIds.requireValid(task.taskId());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            bindUpsert(stmt, planId, task);
            if (stmt.executeUpdate() == 0) {
                throw ownedByOtherPlan(task.taskId());
            }
            log.debug("Saved task '{}' for plan '{}' batch {}", task.taskId(), planId, task.batchIndex());
        } catch (SQLException e) {
            throw SqlErrors.translate("save task plan", task.taskId(), e);
        }
    }

    @Override
    public void saveBatch(String planId, List<TaskPlan> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (TaskPlan task : tasks) {
            TaskIds.requireValid(task.taskId());
            if (!seen.add(task.taskId())) {
                throw new ConstraintViolationException(task.taskId(),
                        "Duplicate task id '" + task.taskId() + "' within one batch");
            }
        }

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            String current = null;
            try (PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
                for (TaskPlan task : tasks) {
                    current = task.taskId();
                    bindUpsert(stmt, planId, task);
                    if (stmt.executeUpdate() == 0) {
                        throw ownedByOtherPlan(task.taskId());
                    }
                }
                conn.commit();
                log.debug("Saved {} tasks for plan '{}' in one transaction", tasks.size(), planId);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                if (e instanceof SQLException sqlException) {
                    throw SqlErrors.translate("save task plan batch", current, sqlException);
                }
                throw (RuntimeException) e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("save task plan batch", e);
        }
    }

    @Override
    public Optional<TaskPlan> get(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("get task plan", taskId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<TaskPlan> getByBatch(String planId, int batchIndex) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_BATCH_SQL)) {
            stmt.setString(1, planId);
            stmt.setInt(2, batchIndex);
            return readAll(stmt);
        } catch (SQLException e) {
            throw SqlErrors.translate("get task plans by batch", planId, e);
        }
    }

    @Override
    public List<TaskPlan> getByPlan(String planId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_PLAN_SQL)) {
            stmt.setString(1, planId);
            return readAll(stmt);
        } catch (SQLException e) {
            throw SqlErrors.translate("get task plans by plan", planId, e);
        }
    }

    @Override
    public boolean updateStatus(String taskId, TaskStatus status, JsonNode result, String errorMessage) {
        var sql = new StringBuilder("UPDATE " + TABLE_NAME + " SET status = ?, updated_at = NOW()");
        if (status == TaskStatus.RUNNING) {
            sql.append(", started_at = NOW()");
        } else if (status.isTerminal()) {
            sql.append(", completed_at = NOW()");
        }
        if (result != null) {
            sql.append(", result = ?::jsonb");
        }
        if (errorMessage != null) {
            sql.append(", error_message = ?");
        }
        sql.append(" WHERE task_id = ?");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            stmt.setString(idx++, status.value());
            if (result != null) {
                stmt.setString(idx++, JsonColumns.write(objectMapper, result));
            }
            if (errorMessage != null) {
                stmt.setString(idx++, errorMessage);
            }
            stmt.setString(idx, taskId);
            boolean updated = stmt.executeUpdate() > 0;
            log.debug("Task '{}' status -> {} (updated={})", taskId, status.value(), updated);
            return updated;
        } catch (SQLException e) {
            throw SqlErrors.translate("update task plan status", taskId, e);
        }
    }

    @Override
    public boolean delete(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, taskId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("delete task plan", taskId, e);
        }
    }

    @Override
    public int deleteByPlan(String planId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_PLAN_SQL)) {
            stmt.setString(1, planId);
            int deleted = stmt.executeUpdate();
            log.info("Deleted {} tasks of plan '{}'", deleted, planId);
            return deleted;
        } catch (SQLException e) {
            throw SqlErrors.translate("delete task plans by plan", planId, e);
        }
    }

    @Override
    public TaskStats statsForPlan(String planId) {
        var stats = new TaskStatsAccumulator();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(STATS_SQL)) {
            stmt.setString(1, planId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    stats.add(TaskStatus.fromValue(rs.getString("status")),
                            complexityOf(rs.getString("complexity")),
                            rs.getInt("cnt"));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("compute task stats", planId, e);
        }
        return stats.build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void bindUpsert(PreparedStatement stmt, String planId, TaskPlan task) throws SQLException {
        stmt.setString(1, planId);
        stmt.setInt(2, task.batchIndex());
        stmt.setString(3, task.taskId());
        stmt.setString(4, task.toolName());
        stmt.setString(5, task.description());
        stmt.setString(6, JsonColumns.write(objectMapper, task.parameters().toJson()));
        stmt.setString(7, task.complexity().value());
        stmt.setBoolean(8, task.requiresValidation());
        stmt.setString(9, task.status().value());
    }

    private static ConstraintViolationException ownedByOtherPlan(String taskId) {
        return new ConstraintViolationException(taskId,
                "Task id '" + taskId + "' already belongs to another plan");
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.warn("Rollback failed: {}", rollbackError.getMessage());
        }
    }

    private static TaskComplexity complexityOf(String value) {
        return value != null ? TaskComplexity.fromValue(value) : TaskComplexity.MEDIUM;
    }

    private List<TaskPlan> readAll(PreparedStatement stmt) throws SQLException {
        List<TaskPlan> tasks = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tasks.add(fromResultSet(rs));
            }
        }
        return tasks;
    }

    private TaskPlan fromResultSet(ResultSet rs) throws SQLException {
        return new TaskPlan(
                rs.getString("plan_id"),
                rs.getInt("batch_index"),
                rs.getString("task_id"),
                rs.getString("tool_name"),
                rs.getString("description"),
                JsonPayloads.fromStored(JsonColumns.read(objectMapper, rs.getString("parameters"))),
                complexityOf(rs.getString("complexity")),
                rs.getBoolean("is_required_validate_by_database"),
                TaskStatus.fromValue(rs.getString("status")),
                JsonColumns.read(objectMapper, rs.getString("result")),
                rs.getString("error_message"),
                JsonColumns.getInstant(rs, "created_at"),
                JsonColumns.getInstant(rs, "updated_at"),
                JsonColumns.getInstant(rs, "started_at"),
                JsonColumns.getInstant(rs, "completed_at"));
    }
}
