package com.taskledger.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskledger.core.model.MemoryItem;
import com.taskledger.core.model.Namespace;
import com.taskledger.core.model.PutOptions;
import com.taskledger.core.persistence.SqlErrors;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link KeyValueStore} over the {@code memory_store} table.
 * <p>
 * Namespaces are stored as {@code TEXT[]}, values and metadata as {@code JSONB}.
 * Expiry is evaluated against the injected {@link Clock}.
 */
public class JdbcKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcKeyValueStore.class);

    private static final String TABLE_NAME = "memory_store";

    private static final String UPSERT_SQL = """
            INSERT INTO %s (namespace_path, key, value, metadata, expires_at, updated_at)
            VALUES (?, ?, ?::jsonb, ?::jsonb, ?, ?)
            ON CONFLICT (namespace_path, key)
            DO UPDATE SET value = EXCLUDED.value,
                          metadata = EXCLUDED.metadata,
                          expires_at = EXCLUDED.expires_at,
                          updated_at = EXCLUDED.updated_at
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT key, value, metadata, expires_at, updated_at
            FROM %s
            WHERE namespace_path = ? AND key = ?
              AND (expires_at IS NULL OR expires_at > ?)
            """.formatted(TABLE_NAME);

    private static final String LIST_SQL = """
            SELECT key, value, metadata, expires_at, updated_at
            FROM %s
            WHERE namespace_path = ?
              AND (expires_at IS NULL OR expires_at > ?)
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE namespace_path = ? AND key = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_EXPIRED_SQL = """
            DELETE FROM %s WHERE expires_at IS NOT NULL AND expires_at <= ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcKeyValueStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void put(Namespace namespace, String key, JsonNode value, PutOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        PutOptions opts = options != null ? options : PutOptions.none();
        Instant now = clock.instant();
        Instant expiresAt = opts.expiresIn() != null ? now.plus(opts.expiresIn()) : null;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setArray(1, namespaceArray(conn, namespace));
            stmt.setString(2, key);
            stmt.setString(3, toJson(value));
            stmt.setString(4, toJson(opts.metadata()));
            if (expiresAt != null) {
                stmt.setTimestamp(5, Timestamp.from(expiresAt));
            } else {
                stmt.setNull(5, Types.TIMESTAMP_WITH_TIMEZONE);
            }
            stmt.setTimestamp(6, Timestamp.from(now));
            stmt.executeUpdate();
            log.debug("Stored '{}' in namespace {}", key, namespace);
        } catch (SQLException e) {
            throw SqlErrors.translate("put memory item", key, e);
        }
    }

    @Override
    public Optional<MemoryItem> get(Namespace namespace, String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setArray(1, namespaceArray(conn, namespace));
            stmt.setString(2, key);
            stmt.setTimestamp(3, Timestamp.from(clock.instant()));
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(namespace, rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("get memory item", key, e);
        }
        return Optional.empty();
    }

    @Override
    public List<MemoryItem> list(Namespace namespace, String prefix, Integer limit, Integer offset) {
        var sql = new StringBuilder(LIST_SQL);
        if (prefix != null && !prefix.isEmpty()) {
            sql.append(" AND key LIKE ? ESCAPE '\\'");
        }
        sql.append(" ORDER BY updated_at DESC, id DESC");
        if (limit != null) {
            sql.append(" LIMIT ?");
        }
        if (offset != null) {
            sql.append(" OFFSET ?");
        }

        List<MemoryItem> items = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            stmt.setArray(idx++, namespaceArray(conn, namespace));
            stmt.setTimestamp(idx++, Timestamp.from(clock.instant()));
            if (prefix != null && !prefix.isEmpty()) {
                stmt.setString(idx++, escapeLike(prefix) + "%");
            }
            if (limit != null) {
                stmt.setInt(idx++, limit);
            }
            if (offset != null) {
                stmt.setInt(idx, offset);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    items.add(fromResultSet(namespace, rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("list memory items", namespace.toString(), e);
        }
        return items;
    }

    @Override
    public boolean delete(Namespace namespace, String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setArray(1, namespaceArray(conn, namespace));
            stmt.setString(2, key);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("delete memory item", key, e);
        }
    }

    @Override
    public int deleteExpired() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_EXPIRED_SQL)) {
            stmt.setTimestamp(1, Timestamp.from(clock.instant()));
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("Removed {} expired memory items", deleted);
            }
            return deleted;
        } catch (SQLException e) {
            throw SqlErrors.translate("delete expired memory items", e);
        }
    }

    @Override
    public StoreDurability durability() {
        return StoreDurability.DURABLE;
    }

    static String escapeLike(String prefix) {
        return prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Array namespaceArray(Connection conn, Namespace namespace) throws SQLException {
        return conn.createArrayOf("text", namespace.toArray());
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memory value", e);
        }
    }

    private JsonNode fromJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize memory value", e);
        }
    }

    private MemoryItem fromResultSet(Namespace namespace, ResultSet rs) throws SQLException {
        JsonNode value = fromJson(rs.getString("value"));
        String metadataJson = rs.getString("metadata");
        ObjectNode metadata = metadataJson != null && fromJson(metadataJson) instanceof ObjectNode object
                ? object
                : objectMapper.createObjectNode();
        Timestamp expiresAt = rs.getTimestamp("expires_at");
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new MemoryItem(namespace, rs.getString("key"), value, metadata,
                expiresAt != null ? expiresAt.toInstant() : null,
                updatedAt != null ? updatedAt.toInstant() : null);
    }
}
