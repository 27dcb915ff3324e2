package com.taskledger.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Binding helpers for JSONB and timestamp columns.
 */
final class JsonColumns {

    private JsonColumns() {}

    static String write(ObjectMapper mapper, JsonNode node) {
        if (node == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON column", e);
        }
    }

    static JsonNode read(ObjectMapper mapper, String json) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize JSON column", e);
        }
    }

    static ObjectNode readObject(ObjectMapper mapper, String json) {
        JsonNode node = read(mapper, json);
        return node instanceof ObjectNode object ? object : mapper.createObjectNode();
    }

    static void setJson(PreparedStatement stmt, int index, ObjectMapper mapper, JsonNode node) throws SQLException {
        String json = write(mapper, node);
        if (json == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, json);
        }
    }

    static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setTimestamp(index, Timestamp.from(instant));
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
