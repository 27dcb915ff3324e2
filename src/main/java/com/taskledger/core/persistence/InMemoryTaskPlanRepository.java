package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.model.TaskPlan;
import com.taskledger.core.model.TaskStats;
import com.taskledger.core.model.TaskStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local {@link TaskPlanRepository} used when no database is configured.
 */
public class InMemoryTaskPlanRepository implements TaskPlanRepository {

    private record Row(TaskPlan task, long sequence) {}

    private final Map<String, Row> rows = new LinkedHashMap<>();
    private final Clock clock;
    private long sequence;

    public InMemoryTaskPlanRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void save(String planId, TaskPlan task) {
        TaskIds.requireValid(task.taskId());
        upsert(rows, planId, task);
    }

    @Override
    public synchronized void saveBatch(String planId, List<TaskPlan> tasks) {
        Set<String> seen = new HashSet<>();
        for (TaskPlan task : tasks) {
            TaskIds.requireValid(task.taskId());
            if (!seen.add(task.taskId())) {
                throw new ConstraintViolationException(task.taskId(),
                        "Duplicate task id '" + task.taskId() + "' within one batch");
            }
        }
        Map<String, Row> staged = new LinkedHashMap<>(rows);
        long savedSequence = sequence;
        try {
            for (TaskPlan task : tasks) {
                upsert(staged, planId, task);
            }
        } catch (RuntimeException e) {
            sequence = savedSequence;
            throw e;
        }
        rows.clear();
        rows.putAll(staged);
    }

    @Override
    public synchronized Optional<TaskPlan> get(String taskId) {
        return Optional.ofNullable(rows.get(taskId)).map(Row::task);
    }

    @Override
    public synchronized List<TaskPlan> getByBatch(String planId, int batchIndex) {
        return rows.values().stream()
                .filter(r -> planId.equals(r.task().planId()) && r.task().batchIndex() == batchIndex)
                .sorted(Comparator.comparingLong(Row::sequence))
                .map(Row::task)
                .toList();
    }

    @Override
    public synchronized List<TaskPlan> getByPlan(String planId) {
        return rows.values().stream()
                .filter(r -> planId.equals(r.task().planId()))
                .sorted(Comparator.comparingInt((Row r) -> r.task().batchIndex())
                        .thenComparingLong(Row::sequence))
                .map(Row::task)
                .toList();
    }

    @Override
    public synchronized boolean updateStatus(String taskId, TaskStatus status, JsonNode result, String errorMessage) {
        Row row = rows.get(taskId);
        if (row == null) {
            return false;
        }
        TaskPlan t = row.task();
        Instant now = clock.instant();
        Instant startedAt = status == TaskStatus.RUNNING ? now : t.startedAt();
        Instant completedAt = status.isTerminal() ? now : t.completedAt();
        var updated = new TaskPlan(t.planId(), t.batchIndex(), t.taskId(), t.toolName(), t.description(),
                t.parameters(), t.complexity(), t.requiresValidation(), status,
                result != null ? result : t.result(),
                errorMessage != null ? errorMessage : t.errorMessage(),
                t.createdAt(), now, startedAt, completedAt);
        rows.put(taskId, new Row(updated, row.sequence()));
        return true;
    }

    @Override
    public synchronized boolean delete(String taskId) {
        return rows.remove(taskId) != null;
    }

    @Override
    public synchronized int deleteByPlan(String planId) {
        int before = rows.size();
        rows.values().removeIf(r -> planId.equals(r.task().planId()));
        return before - rows.size();
    }

    @Override
    public synchronized TaskStats statsForPlan(String planId) {
        var stats = new TaskStatsAccumulator();
        for (Row row : rows.values()) {
            if (planId.equals(row.task().planId())) {
                stats.add(row.task().status(), row.task().complexity(), 1);
            }
        }
        return stats.build();
    }

    private void upsert(Map<String, Row> target, String planId, TaskPlan task) {
        Instant now = clock.instant();
        Row existing = target.get(task.taskId());
        if (existing == null) {
            var created = new TaskPlan(planId, task.batchIndex(), task.taskId(), task.toolName(),
                    task.description(), task.parameters(), task.complexity(), task.requiresValidation(),
                    task.status(), null, null, now, now, null, null);
            target.put(task.taskId(), new Row(created, ++sequence));
            return;
        }
        TaskPlan old = existing.task();
        if (!planId.equals(old.planId())) {
            throw new ConstraintViolationException(task.taskId(),
                    "Task id '" + task.taskId() + "' already belongs to another plan");
        }
        var merged = new TaskPlan(planId, task.batchIndex(), task.taskId(), task.toolName(),
                task.description(), task.parameters(), task.complexity(), task.requiresValidation(),
                old.status(), old.result(), old.errorMessage(),
                old.createdAt(), now, old.startedAt(), old.completedAt());
        target.put(task.taskId(), new Row(merged, existing.sequence()));
    }
}
