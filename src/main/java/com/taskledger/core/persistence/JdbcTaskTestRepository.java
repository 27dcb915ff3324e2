package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskledger.core.model.JsonPayloads;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link TaskTestRepository} over the {@code task_test} table.
 */
public class JdbcTaskTestRepository implements TaskTestRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskTestRepository.class);

    private static final String TABLE_NAME = "task_test";

    private static final String COLUMNS = """
            test_id, task_id, thread_id, tool_name, test_data, test_result, evaluation_result,
            status, error_message, execution_time_ms, created_at, updated_at, started_at, completed_at""";

    static final String UPSERT_SQL = """
            INSERT INTO %1$s (test_id, task_id, thread_id, tool_name, test_data, test_result,
                              evaluation_result, status, error_message, execution_time_ms,
                              started_at, completed_at, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?,
                    COALESCE(?, CASE WHEN ? = 'running' THEN NOW() END),
                    COALESCE(?, CASE WHEN ? IN ('completed', 'failed') THEN NOW() END),
                    NOW(), NOW())
            ON CONFLICT (test_id)
            DO UPDATE SET task_id = EXCLUDED.task_id,
                          thread_id = EXCLUDED.thread_id,
                          tool_name = EXCLUDED.tool_name,
                          test_data = EXCLUDED.test_data,
                          test_result = EXCLUDED.test_result,
                          evaluation_result = EXCLUDED.evaluation_result,
                          status = EXCLUDED.status,
                          error_message = EXCLUDED.error_message,
                          execution_time_ms = EXCLUDED.execution_time_ms,
                          started_at = COALESCE(EXCLUDED.started_at, %1$s.started_at),
                          completed_at = COALESCE(EXCLUDED.completed_at, %1$s.completed_at),
                          updated_at = NOW()
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE test_id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_TASK_SQL = """
            SELECT %s FROM %s WHERE task_id = ? ORDER BY created_at ASC, id ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_THREAD_SQL = """
            SELECT %s FROM %s WHERE thread_id = ? ORDER BY created_at DESC, id DESC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String DELETE_SQL = "DELETE FROM " + TABLE_NAME + " WHERE test_id = ?";
    private static final String DELETE_BY_TASK_SQL = "DELETE FROM " + TABLE_NAME + " WHERE task_id = ?";
    private static final String DELETE_BY_THREAD_SQL = "DELETE FROM " + TABLE_NAME + " WHERE thread_id = ?";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcTaskTestRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(TaskTest test) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            bindUpsert(stmt, test);
            stmt.executeUpdate();
            log.debug("Saved test '{}' for task '{}' ({})", test.testId(), test.taskId(), test.status().value());
        } catch (SQLException e) {
            throw SqlErrors.translate("save task test", test.testId(), e);
        }
    }

    @Override
    public void saveBatch(List<TaskTest> tests) {
        for (TaskTest test : tests) {
            save(test);
        }
    }

    @Override
    public Optional<TaskTest> get(String testId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, testId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("get task test", testId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<TaskTest> getByTaskId(String taskId) {
        return query(SELECT_BY_TASK_SQL, taskId, "get task tests by task");
    }

    @Override
    public List<TaskTest> getByThreadId(String threadId) {
        return query(SELECT_BY_THREAD_SQL, threadId, "get task tests by thread");
    }

    @Override
    public boolean updateStatus(String testId, TaskStatus status, JsonNode testResult, String errorMessage,
                                Long executionTimeMs, JsonNode evaluationResult) {
        var sql = new StringBuilder("UPDATE " + TABLE_NAME + " SET status = ?, updated_at = NOW()");
        if (status == TaskStatus.RUNNING) {
            sql.append(", started_at = NOW()");
        } else if (status.isTerminal()) {
            sql.append(", completed_at = NOW()");
        }
        if (testResult != null) {
            sql.append(", test_result = ?::jsonb");
        }
        if (errorMessage != null) {
            sql.append(", error_message = ?");
        }
        if (executionTimeMs != null) {
            sql.append(", execution_time_ms = ?");
        }
        if (evaluationResult != null) {
            sql.append(", evaluation_result = ?::jsonb");
        }
        sql.append(" WHERE test_id = ?");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            stmt.setString(idx++, status.value());
            if (testResult != null) {
                stmt.setString(idx++, JsonColumns.write(objectMapper, testResult));
            }
            if (errorMessage != null) {
                stmt.setString(idx++, errorMessage);
            }
            if (executionTimeMs != null) {
                stmt.setLong(idx++, executionTimeMs);
            }
            if (evaluationResult != null) {
                stmt.setString(idx++, JsonColumns.write(objectMapper, evaluationResult));
            }
            stmt.setString(idx, testId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("update task test status", testId, e);
        }
    }

    @Override
    public boolean delete(String testId) {
        return update(DELETE_SQL, testId, "delete task test") > 0;
    }

    @Override
    public int deleteByTaskId(String taskId) {
        return update(DELETE_BY_TASK_SQL, taskId, "delete task tests by task");
    }

    @Override
    public int deleteByThreadId(String threadId) {
        return update(DELETE_BY_THREAD_SQL, threadId, "delete task tests by thread");
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void bindUpsert(PreparedStatement stmt, TaskTest test) throws SQLException {
        stmt.setString(1, test.testId());
        stmt.setString(2, test.taskId());
        stmt.setString(3, test.threadId());
        stmt.setString(4, test.toolName());
        stmt.setString(5, JsonColumns.write(objectMapper, test.testData().toJson()));
        JsonColumns.setJson(stmt, 6, objectMapper, test.testResult());
        JsonColumns.setJson(stmt, 7, objectMapper, test.evaluationResult());
        stmt.setString(8, test.status().value());
        stmt.setString(9, test.errorMessage());
        if (test.executionTimeMs() != null) {
            stmt.setLong(10, test.executionTimeMs());
        } else {
            stmt.setNull(10, Types.INTEGER);
        }
        JsonColumns.setInstant(stmt, 11, test.startedAt());
        stmt.setString(12, test.status().value());
        JsonColumns.setInstant(stmt, 13, test.completedAt());
        stmt.setString(14, test.status().value());
    }

    private List<TaskTest> query(String sql, String param, String operation) {
        List<TaskTest> tests = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tests.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, param, e);
        }
        return tests;
    }

    private int update(String sql, String param, String operation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, param, e);
        }
    }

    private TaskTest fromResultSet(ResultSet rs) throws SQLException {
        long executionTime = rs.getLong("execution_time_ms");
        Long executionTimeMs = rs.wasNull() ? null : executionTime;
        return new TaskTest(
                rs.getString("test_id"),
                rs.getString("task_id"),
                rs.getString("thread_id"),
                rs.getString("tool_name"),
                JsonPayloads.fromStored(JsonColumns.read(objectMapper, rs.getString("test_data"))),
                JsonColumns.read(objectMapper, rs.getString("test_result")),
                JsonColumns.read(objectMapper, rs.getString("evaluation_result")),
                TaskStatus.fromValue(rs.getString("status")),
                rs.getString("error_message"),
                executionTimeMs,
                JsonColumns.getInstant(rs, "created_at"),
                JsonColumns.getInstant(rs, "updated_at"),
                JsonColumns.getInstant(rs, "started_at"),
                JsonColumns.getInstant(rs, "completed_at"));
    }
}
