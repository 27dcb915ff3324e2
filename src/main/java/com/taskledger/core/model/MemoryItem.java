package com.taskledger.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * A single entry in the shared key-value store.
 *
 * @param namespace namespace the key lives in
 * @param key       key, unique within the namespace
 * @param value     stored JSON value
 * @param metadata  metadata object (never null, possibly empty)
 * @param expiresAt expiry instant, or {@code null} if the item never expires
 * @param updatedAt last write time
 */
public record MemoryItem(
    Namespace namespace,
    String key,
    JsonNode value,
    ObjectNode metadata,
    Instant expiresAt,
    Instant updatedAt
) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
