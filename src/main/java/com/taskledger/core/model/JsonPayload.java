package com.taskledger.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Objects;

/**
 * Task parameters or test data: either a structured JSON object or an opaque
 * string that could not be interpreted as one.
 * <p>
 * Instances are produced by {@link JsonPayloads#normalize(Object, com.fasterxml.jackson.databind.ObjectMapper)} so that callers
 * never have to guess which shape they are holding.
 */
public sealed interface JsonPayload permits JsonPayload.Structured, JsonPayload.Opaque {

    /** JSON representation written to storage. */
    JsonNode toJson();

    static JsonPayload empty() {
        return new Structured(JsonNodeFactory.instance.objectNode());
    }

    record Structured(ObjectNode fields) implements JsonPayload {
        public Structured {
            Objects.requireNonNull(fields, "fields must not be null");
        }

        @Override
        public JsonNode toJson() {
            return fields;
        }
    }

    record Opaque(String raw) implements JsonPayload {
        public Opaque {
            Objects.requireNonNull(raw, "raw must not be null");
        }

        @Override
        public JsonNode toJson() {
            return TextNode.valueOf(raw);
        }
    }
}
