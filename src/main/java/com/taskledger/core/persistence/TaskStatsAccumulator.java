package com.taskledger.core.persistence;

import com.taskledger.core.model.TaskComplexity;
import com.taskledger.core.model.TaskStats;
import com.taskledger.core.model.TaskStatus;

import java.util.EnumMap;
import java.util.Map;

final class TaskStatsAccumulator {

    private final Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
    private final Map<TaskComplexity, Integer> byComplexity = new EnumMap<>(TaskComplexity.class);
    private int total;

    void add(TaskStatus status, TaskComplexity complexity, int count) {
        total += count;
        byStatus.merge(status, count, Integer::sum);
        byComplexity.merge(complexity, count, Integer::sum);
    }

    TaskStats build() {
        return new TaskStats(total,
                byStatus.getOrDefault(TaskStatus.PENDING, 0),
                byStatus.getOrDefault(TaskStatus.RUNNING, 0),
                byStatus.getOrDefault(TaskStatus.COMPLETED, 0),
                byStatus.getOrDefault(TaskStatus.FAILED, 0),
                byComplexity);
    }
}
