package com.taskledger.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;

/**
 * Options for a key-value write.
 *
 * @param expiresIn time to live; {@code null} means the item never expires
 * @param metadata  free-form metadata stored alongside the value
 */
public record PutOptions(Duration expiresIn, ObjectNode metadata) {

    public PutOptions {
        if (expiresIn != null && (expiresIn.isNegative() || expiresIn.isZero())) {
            throw new IllegalArgumentException("expiresIn must be positive: " + expiresIn);
        }
        if (metadata == null) {
            metadata = JsonNodeFactory.instance.objectNode();
        }
    }

    public static PutOptions none() {
        return new PutOptions(null, null);
    }

    public static PutOptions expiringIn(Duration ttl) {
        return new PutOptions(ttl, null);
    }

    public static PutOptions expiringInSeconds(long seconds) {
        return new PutOptions(Duration.ofSeconds(seconds), null);
    }

    public PutOptions withMetadata(ObjectNode metadata) {
        return new PutOptions(expiresIn, metadata);
    }
}
