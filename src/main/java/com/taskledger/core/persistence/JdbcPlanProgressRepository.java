package com.taskledger.core.persistence;

import com.taskledger.core.model.PlanProgress;
import com.taskledger.core.model.PlanStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * PostgreSQL-backed {@link PlanProgressRepository} over the {@code plan_progress} table.
 */
public class JdbcPlanProgressRepository implements PlanProgressRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPlanProgressRepository.class);

    private static final String TABLE_NAME = "plan_progress";

    private static final String COLUMNS = """
            plan_id, total_batches, completed_batches, failed_batches, current_batch_index,
            overall_success_rate, status, last_updated""";

    private static final String UPSERT_SQL = """
            INSERT INTO %s (plan_id, total_batches, completed_batches, failed_batches,
                            current_batch_index, overall_success_rate, status, last_updated)
            VALUES (?, ?, ?, ?, ?, ?, ?, NOW())
            ON CONFLICT (plan_id)
            DO UPDATE SET total_batches = EXCLUDED.total_batches,
                          completed_batches = EXCLUDED.completed_batches,
                          failed_batches = EXCLUDED.failed_batches,
                          current_batch_index = EXCLUDED.current_batch_index,
                          overall_success_rate = EXCLUDED.overall_success_rate,
                          status = EXCLUDED.status,
                          last_updated = NOW()
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT %s FROM %s WHERE plan_id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    static final String ADVANCE_SQL = """
            UPDATE %s
            SET current_batch_index = LEAST(current_batch_index + 1, total_batches),
                last_updated = NOW()
            WHERE plan_id = ?
            RETURNING current_batch_index
            """.formatted(TABLE_NAME);

    private static final String SET_INDEX_SQL = """
            UPDATE %s
            SET current_batch_index = LEAST(GREATEST(?, 0), total_batches),
                last_updated = NOW()
            WHERE plan_id = ?
            """.formatted(TABLE_NAME);

    static final String SETTLE_BATCH_SQL = """
            UPDATE %s
            SET completed_batches = completed_batches + ?,
                failed_batches = failed_batches + ?,
                overall_success_rate = ROUND((completed_batches + ?)::numeric * 100
                        / (completed_batches + failed_batches + 1), 2),
                current_batch_index = LEAST(current_batch_index + 1, total_batches),
                last_updated = NOW()
            WHERE plan_id = ? AND current_batch_index = ? AND current_batch_index < total_batches
            RETURNING current_batch_index
            """.formatted(TABLE_NAME);

    private static final String INCREMENT_COMPLETED_SQL = """
            UPDATE %s SET completed_batches = completed_batches + 1, last_updated = NOW()
            WHERE plan_id = ?
            """.formatted(TABLE_NAME);

    private static final String INCREMENT_FAILED_SQL = """
            UPDATE %s SET failed_batches = failed_batches + 1, last_updated = NOW()
            WHERE plan_id = ?
            """.formatted(TABLE_NAME);

    static final String SUCCESS_RATE_SQL = """
            UPDATE %s
            SET overall_success_rate = CASE
                    WHEN completed_batches + failed_batches = 0 THEN 0
                    ELSE ROUND(completed_batches::numeric * 100 / (completed_batches + failed_batches), 2)
                END,
                last_updated = NOW()
            WHERE plan_id = ?
            RETURNING overall_success_rate
            """.formatted(TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s SET status = ?, last_updated = NOW() WHERE plan_id = ?
            """.formatted(TABLE_NAME);

    private static final String LIST_SQL = """
            SELECT %s FROM %s ORDER BY last_updated DESC, id DESC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String LIST_BY_STATUS_SQL = """
            SELECT %s FROM %s WHERE status = ? ORDER BY last_updated DESC, id DESC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE plan_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcPlanProgressRepository(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    @Override
    public void save(PlanProgress progress) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, progress.planId());
            stmt.setInt(2, progress.totalBatches());
            stmt.setInt(3, progress.completedBatches());
            stmt.setInt(4, progress.failedBatches());
            stmt.setInt(5, progress.currentBatchIndex());
            stmt.setBigDecimal(6, progress.overallSuccessRate());
            stmt.setString(7, progress.status().value());
            stmt.executeUpdate();
            log.debug("Saved progress for plan '{}': batch {}/{}", progress.planId(),
                    progress.currentBatchIndex(), progress.totalBatches());
        } catch (SQLException e) {
            throw SqlErrors.translate("save plan progress", progress.planId(), e);
        }
    }

    @Override
    public Optional<PlanProgress> get(String planId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, planId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("get plan progress", planId, e);
        }
        return Optional.empty();
    }

    @Override
    public OptionalInt advance(String planId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(ADVANCE_SQL)) {
            stmt.setString(1, planId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return OptionalInt.of(rs.getInt(1));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("advance plan batch", planId, e);
        }
        return OptionalInt.empty();
    }

    @Override
    public boolean setCurrentBatchIndex(String planId, int batchIndex) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SET_INDEX_SQL)) {
            stmt.setInt(1, batchIndex);
            stmt.setString(2, planId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("set current batch index", planId, e);
        }
    }

    @Override
    public OptionalInt settleBatch(String planId, int batchIndex, boolean failed) {
        int completedDelta = failed ? 0 : 1;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SETTLE_BATCH_SQL)) {
            stmt.setInt(1, completedDelta);
            stmt.setInt(2, failed ? 1 : 0);
            stmt.setInt(3, completedDelta);
            stmt.setString(4, planId);
            stmt.setInt(5, batchIndex);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return OptionalInt.of(rs.getInt(1));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("settle plan batch", planId, e);
        }
        log.debug("Batch {} of plan '{}' is not current, nothing settled", batchIndex, planId);
        return OptionalInt.empty();
    }

    @Override
    public boolean incrementCompleted(String planId) {
        return executeForPlan(INCREMENT_COMPLETED_SQL, planId, "increment completed batches");
    }

    @Override
    public boolean incrementFailed(String planId) {
        return executeForPlan(INCREMENT_FAILED_SQL, planId, "increment failed batches");
    }

    @Override
    public Optional<BigDecimal> recomputeSuccessRate(String planId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SUCCESS_RATE_SQL)) {
            stmt.setString(1, planId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getBigDecimal(1));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("recompute success rate", planId, e);
        }
        return Optional.empty();
    }

    @Override
    public boolean updateStatus(String planId, PlanStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS_SQL)) {
            stmt.setString(1, status.value());
            stmt.setString(2, planId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("update plan status", planId, e);
        }
    }

    @Override
    public List<PlanProgress> list(PlanStatus status) {
        List<PlanProgress> plans = new ArrayList<>();
        String sql = status != null ? LIST_BY_STATUS_SQL : LIST_SQL;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (status != null) {
                stmt.setString(1, status.value());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    plans.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("list plan progress", e);
        }
        return plans;
    }

    @Override
    public boolean delete(String planId) {
        return executeForPlan(DELETE_SQL, planId, "delete plan progress");
    }

    private boolean executeForPlan(String sql, String planId, String operation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, planId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, planId, e);
        }
    }

    private PlanProgress fromResultSet(ResultSet rs) throws SQLException {
        return new PlanProgress(
                rs.getString("plan_id"),
                rs.getInt("total_batches"),
                rs.getInt("completed_batches"),
                rs.getInt("failed_batches"),
                rs.getInt("current_batch_index"),
                rs.getBigDecimal("overall_success_rate"),
                PlanStatus.fromValue(rs.getString("status")),
                JsonColumns.getInstant(rs, "last_updated"));
    }
}
