package com.taskledger.core.model;

/**
 * Pointer to the next unexecuted task of a batch.
 *
 * @param planId        plan the cursor belongs to
 * @param batchIndex    batch the cursor was written for
 * @param taskIndex     index of the next task to execute within the batch
 * @param currentTestId in-flight test attempt, or {@code null}
 */
public record ExecutionCursor(
    String planId,
    int batchIndex,
    int taskIndex,
    String currentTestId
) {

    public ExecutionCursor {
        if (taskIndex < 0) {
            throw new IllegalArgumentException("taskIndex must be >= 0, was " + taskIndex);
        }
    }

    public static ExecutionCursor fresh(String planId, int batchIndex) {
        return new ExecutionCursor(planId, batchIndex, 0, null);
    }

    public ExecutionCursor advanced() {
        return new ExecutionCursor(planId, batchIndex, taskIndex + 1, null);
    }

    public ExecutionCursor withTestId(String testId) {
        return new ExecutionCursor(planId, batchIndex, taskIndex, testId);
    }
}
