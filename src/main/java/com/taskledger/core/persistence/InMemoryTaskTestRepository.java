package com.taskledger.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskTest;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local {@link TaskTestRepository} used when no database is configured.
 */
public class InMemoryTaskTestRepository implements TaskTestRepository {

    private record Row(TaskTest test, long sequence) {}

    private final Map<String, Row> rows = new LinkedHashMap<>();
    private final Clock clock;
    private long sequence;

    public InMemoryTaskTestRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void save(TaskTest test) {
        Instant now = clock.instant();
        Row existing = rows.get(test.testId());
        Instant startedAt = firstNonNull(test.startedAt(),
                test.status() == TaskStatus.RUNNING ? now : null,
                existing != null ? existing.test().startedAt() : null);
        Instant completedAt = firstNonNull(test.completedAt(),
                test.status().isTerminal() ? now : null,
                existing != null ? existing.test().completedAt() : null);
        Instant createdAt = existing != null ? existing.test().createdAt() : now;
        var stored = new TaskTest(test.testId(), test.taskId(), test.threadId(), test.toolName(),
                test.testData(), test.testResult(), test.evaluationResult(), test.status(),
                test.errorMessage(), test.executionTimeMs(), createdAt, now, startedAt, completedAt);
        rows.put(test.testId(), new Row(stored, existing != null ? existing.sequence() : ++sequence));
    }

    @Override
    public synchronized void saveBatch(List<TaskTest> tests) {
        for (TaskTest test : tests) {
            save(test);
        }
    }

    @Override
    public synchronized Optional<TaskTest> get(String testId) {
        return Optional.ofNullable(rows.get(testId)).map(Row::test);
    }

    @Override
    public synchronized List<TaskTest> getByTaskId(String taskId) {
        return rows.values().stream()
                .filter(r -> taskId.equals(r.test().taskId()))
                .sorted(Comparator.comparingLong(Row::sequence))
                .map(Row::test)
                .toList();
    }

    @Override
    public synchronized List<TaskTest> getByThreadId(String threadId) {
        return rows.values().stream()
                .filter(r -> threadId.equals(r.test().threadId()))
                .sorted(Comparator.comparingLong(Row::sequence).reversed())
                .map(Row::test)
                .toList();
    }

    @Override
    public synchronized boolean updateStatus(String testId, TaskStatus status, JsonNode testResult,
                                             String errorMessage, Long executionTimeMs,
                                             JsonNode evaluationResult) {
        Row row = rows.get(testId);
        if (row == null) {
            return false;
        }
        TaskTest t = row.test();
        Instant now = clock.instant();
        var updated = new TaskTest(t.testId(), t.taskId(), t.threadId(), t.toolName(), t.testData(),
                testResult != null ? testResult : t.testResult(),
                evaluationResult != null ? evaluationResult : t.evaluationResult(),
                status,
                errorMessage != null ? errorMessage : t.errorMessage(),
                executionTimeMs != null ? executionTimeMs : t.executionTimeMs(),
                t.createdAt(), now,
                status == TaskStatus.RUNNING ? now : t.startedAt(),
                status.isTerminal() ? now : t.completedAt());
        rows.put(testId, new Row(updated, row.sequence()));
        return true;
    }

    @Override
    public synchronized boolean delete(String testId) {
        return rows.remove(testId) != null;
    }

    @Override
    public synchronized int deleteByTaskId(String taskId) {
        int before = rows.size();
        rows.values().removeIf(r -> taskId.equals(r.test().taskId()));
        return before - rows.size();
    }

    @Override
    public synchronized int deleteByThreadId(String threadId) {
        int before = rows.size();
        rows.values().removeIf(r -> threadId.equals(r.test().threadId()));
        return before - rows.size();
    }

    private static Instant firstNonNull(Instant... candidates) {
        for (Instant candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
