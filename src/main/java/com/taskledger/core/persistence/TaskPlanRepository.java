package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.model.TaskPlan;
import com.taskledger.core.model.TaskStats;
import com.taskledger.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of planned tasks, keyed by the globally unique task id.
 */
public interface TaskPlanRepository {

    /**
     * Upserts a task. On conflict the descriptive fields and {@code batchIndex} are
     * overwritten while status, result and timestamps are kept.
     *
     * @throws ConstraintViolationException if the task id is invalid or already owned by another plan
     */
    void save(String planId, TaskPlan task);

    /**
     * Upserts all tasks in one transaction: either every row is written or none is.
     *
     * @throws ConstraintViolationException if a task id is invalid, repeated within the batch,
     *                                      or owned by another plan
     */
    void saveBatch(String planId, List<TaskPlan> tasks);

    Optional<TaskPlan> get(String taskId);

    /** Tasks of one batch in creation order. */
    List<TaskPlan> getByBatch(String planId, int batchIndex);

    /** All tasks of a plan ordered by batch, then creation. */
    List<TaskPlan> getByPlan(String planId);

    /**
     * Sets the status, stamping {@code startedAt} on {@code running} and {@code completedAt}
     * on {@code completed}/{@code failed}. Null result or error leave the stored values alone.
     *
     * @return {@code false} if no such task exists
     */
    boolean updateStatus(String taskId, TaskStatus status, JsonNode result, String errorMessage);

    boolean delete(String taskId);

    int deleteByPlan(String planId);

    TaskStats statsForPlan(String planId);
}
