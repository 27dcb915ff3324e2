package com.taskledger.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded execution attempt (or sub-result) of a planned task.
 *
 * @param testId           unique id of this attempt
 * @param taskId           task the attempt belongs to
 * @param threadId         worker thread that produced it
 * @param toolName         tool that was called
 * @param testData         arguments the tool was called with
 * @param testResult       tool output (nullable until recorded)
 * @param evaluationResult evaluation of the output (nullable)
 * @param status           attempt status
 * @param errorMessage     failure description (nullable)
 * @param executionTimeMs  wall-clock execution time (nullable)
 * @param createdAt        creation time (nullable before the first save)
 * @param updatedAt        last update time (nullable before the first save)
 * @param startedAt        time the attempt started running (nullable)
 * @param completedAt      time the attempt finished (nullable)
 */
public record TaskTest(
    String testId,
    String taskId,
    String threadId,
    String toolName,
    JsonPayload testData,
    JsonNode testResult,
    JsonNode evaluationResult,
    TaskStatus status,
    String errorMessage,
    Long executionTimeMs,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt
) {

    public TaskTest {
        Objects.requireNonNull(testId, "testId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        if (testData == null) {
            testData = JsonPayload.empty();
        }
        if (status == null) {
            status = TaskStatus.PENDING;
        }
    }

    /**
     * A new attempt that has just started running.
     */
    public static TaskTest running(String testId, String taskId, String threadId, String toolName,
                                   JsonPayload testData, Instant startedAt) {
        return new TaskTest(testId, taskId, threadId, toolName, testData, null, null,
                TaskStatus.RUNNING, null, null, null, null, startedAt, null);
    }
}
