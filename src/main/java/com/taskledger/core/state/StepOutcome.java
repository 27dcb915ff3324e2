package com.taskledger.core.state;

/**
 * What a single worker step did.
 */
public enum StepOutcome {
    /** Planner wrote tasks for a batch and advanced. */
    PLANNED,
    /** Planner found the batch already planned and only advanced. */
    SKIPPED,
    /** Executor ran a task and recorded its outcome. */
    EXECUTED,
    /** Executor marked a task failed because its tool is not in the catalog. */
    TOOL_NOT_FOUND,
    /** Executor finished a batch and moved to the next one. */
    BATCH_ADVANCED,
    /** Executor is waiting for the planner to fill the current batch. */
    WAITING,
    /** Plan is paused. */
    PAUSED,
    /** Nothing to do: no progress record exists yet. */
    IDLE,
    /** Every batch has been processed. */
    FINISHED
}
