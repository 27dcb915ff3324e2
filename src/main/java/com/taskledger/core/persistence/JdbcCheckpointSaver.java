package com.taskledger.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link BaseCheckpointSaver} for the planning and execution graphs.
 * <p>
 * Rows are keyed by {@code (thread_id, checkpoint_id)}; the graph state is stored as JSON.
 * Unlike the ledger tables, a checkpoint is only a record of the last graph step, so a worker
 * that loses its checkpoints still resumes correctly from the ledger.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    static final String TABLE_NAME = "graph_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                thread_id     VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                node_id       VARCHAR(255),
                next_node_id  VARCHAR(255),
                state         JSONB NOT NULL,
                saved_at      TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (thread_id, checkpoint_id)
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (thread_id, checkpoint_id, node_id, next_node_id, state)
            VALUES (?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (thread_id, checkpoint_id)
            DO UPDATE SET node_id = EXCLUDED.node_id,
                          next_node_id = EXCLUDED.next_node_id,
                          state = EXCLUDED.state,
                          saved_at = NOW()
            """.formatted(TABLE_NAME);

    private static final String COLUMNS = "checkpoint_id, node_id, next_node_id, state::text AS state";

    private static final String SELECT_BY_THREAD_SQL =
            "SELECT " + COLUMNS + " FROM " + TABLE_NAME + " WHERE thread_id = ? ORDER BY saved_at DESC";

    private static final String SELECT_BY_ID_SQL =
            "SELECT " + COLUMNS + " FROM " + TABLE_NAME + " WHERE thread_id = ? AND checkpoint_id = ?";

    private static final String SELECT_LATEST_SQL =
            "SELECT " + COLUMNS + " FROM " + TABLE_NAME + " WHERE thread_id = ? ORDER BY saved_at DESC LIMIT 1";

    private static final String DELETE_BY_THREAD_SQL = "DELETE FROM " + TABLE_NAME + " WHERE thread_id = ?";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointSaver(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        } catch (SQLException e) {
            throw SqlErrors.translate("create checkpoint table", e);
        }
    }

    /** Newest first. */
    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        List<Checkpoint> checkpoints = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("list checkpoints", threadId, e);
        }
        return checkpoints;
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = resolveThreadId(config);
        Optional<String> checkpointId = config.checkPointId();
        String sql = checkpointId.isPresent() ? SELECT_BY_ID_SQL : SELECT_LATEST_SQL;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, threadId);
            if (checkpointId.isPresent()) {
                stmt.setString(2, checkpointId.get());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("get checkpoint", threadId, e);
        }
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = resolveThreadId(config);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, threadId);
            stmt.setString(2, checkpoint.getId());
            stmt.setString(3, checkpoint.getNodeId());
            stmt.setString(4, checkpoint.getNextNodeId());
            stmt.setString(5, serializeState(checkpoint.getState()));
            stmt.executeUpdate();
            log.debug("Saved checkpoint '{}' for thread '{}'", checkpoint.getId(), threadId);
        } catch (SQLException e) {
            throw SqlErrors.translate("put checkpoint", threadId, e);
        }
        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = resolveThreadId(config);
        Collection<Checkpoint> released = list(config);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            int deleted = stmt.executeUpdate();
            log.debug("Released {} checkpoints for thread '{}'", deleted, threadId);
        } catch (SQLException e) {
            throw SqlErrors.translate("release checkpoints", threadId, e);
        }
        return new Tag(threadId, released);
    }

    private String resolveThreadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private String serializeState(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint state", e);
        }
    }

    private Map<String, Object> deserializeState(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize checkpoint state", e);
        }
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        var builder = Checkpoint.builder()
                .id(rs.getString("checkpoint_id"))
                .state(deserializeState(rs.getString("state")));
        String nodeId = rs.getString("node_id");
        if (nodeId != null) {
            builder.nodeId(nodeId);
        }
        String nextNodeId = rs.getString("next_node_id");
        if (nextNodeId != null) {
            builder.nextNodeId(nextNodeId);
        }
        return builder.build();
    }
}
