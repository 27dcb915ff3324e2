package com.taskledger.core.collaborator;

/**
 * A task proposed by a {@link PlanGenerator}, before ids are assigned.
 *
 * @param toolName           tool to exercise
 * @param description        what to verify
 * @param parameters         suggested arguments in whatever shape the generator produced
 * @param complexity         "low", "medium" or "high"; blank means medium
 * @param requiresValidation whether the result must be cross-checked against the database under test
 */
public record CandidateTask(
    String toolName,
    String description,
    Object parameters,
    String complexity,
    boolean requiresValidation
) {
}
