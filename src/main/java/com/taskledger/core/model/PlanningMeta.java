package com.taskledger.core.model;

/**
 * Batch sizing the planner used when it last initialised a plan. Stored next to the
 * plan so a later run can tell whether the tool catalog changed.
 */
public record PlanningMeta(int toolsPerBatch, int totalTools) {
}
