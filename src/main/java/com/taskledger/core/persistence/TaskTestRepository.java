package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskTest;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of execution attempts, keyed by test id. Many attempts may share a task id.
 */
public interface TaskTestRepository {

    /**
     * Upserts by test id. A running attempt without {@code startedAt} is stamped with the
     * current time; a null {@code startedAt}/{@code completedAt} never clears a stored value.
     */
    void save(TaskTest test);

    /**
     * Saves each attempt in turn. Not transactional: a failure stops the loop and leaves
     * the rows written before it in place.
     */
    void saveBatch(List<TaskTest> tests);

    Optional<TaskTest> get(String testId);

    /** Attempts of a task in creation order. */
    List<TaskTest> getByTaskId(String taskId);

    /** Attempts produced by a worker thread, most recent first. */
    List<TaskTest> getByThreadId(String threadId);

    /**
     * Updates status and any non-null outcome fields, with the same timestamp rules as
     * {@link TaskPlanRepository#updateStatus}.
     *
     * @return {@code false} if no such attempt exists
     */
    boolean updateStatus(String testId, TaskStatus status, JsonNode testResult, String errorMessage,
                         Long executionTimeMs, JsonNode evaluationResult);

    boolean delete(String testId);

    int deleteByTaskId(String taskId);

    int deleteByThreadId(String threadId);
}
