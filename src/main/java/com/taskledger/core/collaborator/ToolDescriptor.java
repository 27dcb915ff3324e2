package com.taskledger.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool offered by the system under test.
 *
 * @param name        unique tool name
 * @param description what the tool does
 * @param inputSchema JSON schema of the tool arguments (nullable)
 */
public record ToolDescriptor(String name, String description, JsonNode inputSchema) {
}
