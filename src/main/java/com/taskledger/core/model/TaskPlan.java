package com.taskledger.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * A planned unit of work against a single tool, grouped by plan and batch.
 *
 * @param planId             plan this task belongs to
 * @param batchIndex         zero-based batch the task was planned in
 * @param taskId             globally unique id, matching {@code ^[A-Za-z0-9_.:-]{1,64}$}
 * @param toolName           tool the task exercises
 * @param description        what the task should verify
 * @param parameters         suggested tool arguments
 * @param complexity         planner's complexity estimate
 * @param requiresValidation whether the outcome must be cross-checked against the database under test
 * @param status             execution status
 * @param result             last recorded result payload (nullable)
 * @param errorMessage       last recorded error (nullable)
 * @param createdAt          creation time (nullable before the first save)
 * @param updatedAt          last update time (nullable before the first save)
 * @param startedAt          time of the latest transition to running (nullable)
 * @param completedAt        time of the latest transition to completed or failed (nullable)
 */
public record TaskPlan(
    String planId,
    int batchIndex,
    String taskId,
    String toolName,
    String description,
    JsonPayload parameters,
    TaskComplexity complexity,
    boolean requiresValidation,
    TaskStatus status,
    JsonNode result,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt
) {

    public TaskPlan {
        Objects.requireNonNull(taskId, "taskId must not be null");
        if (batchIndex < 0) {
            throw new IllegalArgumentException("batchIndex must be >= 0, was " + batchIndex);
        }
        if (parameters == null) {
            parameters = JsonPayload.empty();
        }
        if (complexity == null) {
            complexity = TaskComplexity.MEDIUM;
        }
        if (status == null) {
            status = TaskStatus.PENDING;
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Creates a freshly planned task in {@link TaskStatus#PENDING}.
     */
    public static TaskPlan planned(String planId, int batchIndex, String taskId, String toolName,
                                   String description, JsonPayload parameters,
                                   TaskComplexity complexity, boolean requiresValidation) {
        return new TaskPlan(planId, batchIndex, taskId, toolName, description, parameters,
                complexity, requiresValidation, TaskStatus.PENDING, null, null,
                null, null, null, null);
    }
}
