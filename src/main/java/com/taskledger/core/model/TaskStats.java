package com.taskledger.core.model;

import java.util.Map;

/**
 * Task counts for a plan, by status and by complexity.
 */
public record TaskStats(
    int total,
    int pending,
    int running,
    int completed,
    int failed,
    Map<TaskComplexity, Integer> byComplexity
) {

    public TaskStats {
        byComplexity = Map.copyOf(byComplexity);
    }
}
