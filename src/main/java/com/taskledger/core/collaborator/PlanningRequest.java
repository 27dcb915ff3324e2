package com.taskledger.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Input handed to a {@link PlanGenerator} for one batch.
 *
 * @param planId        plan being planned
 * @param batchIndex    batch being planned
 * @param tools         the tools of this batch
 * @param priorContext  planning context stored by an earlier run (nullable)
 */
public record PlanningRequest(String planId, int batchIndex, List<ToolDescriptor> tools, JsonNode priorContext) {

    public PlanningRequest {
        tools = List.copyOf(tools);
    }
}
