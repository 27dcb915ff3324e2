package com.taskledger.core.collaborator;

import com.taskledger.core.model.TaskPlan;

/**
 * Runs a planned task against the tool it targets.
 * Implementations may throw; the execution worker records a thrown exception as a failure.
 */
@FunctionalInterface
public interface ToolExecutor {

    ToolExecutionResult execute(TaskPlan task);
}
