package com.taskledger.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes loosely-typed parameter values into {@link JsonPayload}.
 * <p>
 * Rules:
 * <ul>
 *   <li>{@code null}, blank strings, {@code "."} and strings containing {@code ":={}"} become an empty object</li>
 *   <li>JSON objects (as nodes, maps or parseable strings) become {@link JsonPayload.Structured}</li>
 *   <li>JSON strings are unwrapped and normalized again</li>
 *   <li>anything else is kept verbatim as {@link JsonPayload.Opaque}</li>
 * </ul>
 */
public final class JsonPayloads {

    private static final Logger log = LoggerFactory.getLogger(JsonPayloads.class);

    private JsonPayloads() {}

    public static JsonPayload normalize(Object raw, ObjectMapper mapper) {
        if (raw == null) {
            return JsonPayload.empty();
        }
        if (raw instanceof JsonPayload payload) {
            return payload;
        }
        if (raw instanceof String text) {
            return normalizeText(text, mapper);
        }
        JsonNode node = raw instanceof JsonNode json ? json : mapper.valueToTree(raw);
        return normalizeNode(node, mapper);
    }

    /**
     * Reads a payload back from its stored JSON form.
     */
    public static JsonPayload fromStored(JsonNode stored) {
        if (stored == null || stored.isNull() || stored.isMissingNode()) {
            return JsonPayload.empty();
        }
        if (stored.isObject()) {
            return new JsonPayload.Structured((ObjectNode) stored);
        }
        if (stored.isTextual()) {
            return new JsonPayload.Opaque(stored.textValue());
        }
        return new JsonPayload.Opaque(stored.toString());
    }

    private static JsonPayload normalizeNode(JsonNode node, ObjectMapper mapper) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonPayload.empty();
        }
        if (node.isObject()) {
            return new JsonPayload.Structured((ObjectNode) node);
        }
        if (node.isTextual()) {
            return normalizeText(node.textValue(), mapper);
        }
        log.warn("Unexpected parameter type {}, keeping it as opaque text", node.getNodeType());
        return new JsonPayload.Opaque(node.toString());
    }

    private static JsonPayload normalizeText(String text, ObjectMapper mapper) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equals(".") || trimmed.contains(":={}")) {
            log.warn("Malformed parameters '{}' replaced with an empty object", text);
            return JsonPayload.empty();
        }
        try {
            JsonNode parsed = mapper.readTree(trimmed);
            if (parsed != null && parsed.isObject()) {
                return new JsonPayload.Structured((ObjectNode) parsed);
            }
        } catch (JsonProcessingException e) {
            log.debug("Parameters are not JSON, keeping them as opaque text: {}", e.getOriginalMessage());
        }
        return new JsonPayload.Opaque(text);
    }
}
