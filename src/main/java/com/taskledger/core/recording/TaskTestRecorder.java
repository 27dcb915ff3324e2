package com.taskledger.core.recording;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.collaborator.ToolExecutionResult;
import com.taskledger.core.metrics.LedgerMetrics;
import com.taskledger.core.model.JsonPayload;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskTest;
import com.taskledger.core.persistence.TaskTestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens execution attempts and records their outcomes.
 * <p>
 * Output carrying an array under {@code results} is fanned out: the first element completes
 * the running attempt and every further element becomes its own row with id
 * {@code <runningTestId>-<ordinal>}, ordinals starting at 2.
 */
@Service
public class TaskTestRecorder {

    private static final Logger log = LoggerFactory.getLogger(TaskTestRecorder.class);

    static final String RESULTS_FIELD = "results";

    private final TaskTestRepository repository;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public TaskTestRecorder(TaskTestRepository repository, LedgerMetrics metrics, Clock clock) {
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Saves a new running attempt for {@code taskId}, numbered one past the highest attempt
     * recorded so far. Fan-out rows do not count as attempts.
     */
    public TaskTest openAttempt(String taskId, String threadId, String toolName, JsonPayload testData) {
        int attempt = highestAttempt(taskId, repository.getByTaskId(taskId)) + 1;
        var running = TaskTest.running(attemptId(taskId, attempt), taskId, threadId, toolName, testData,
                clock.instant());
        repository.save(running);
        log.debug("Opened attempt '{}' for task '{}'", running.testId(), taskId);
        return running;
    }

    /**
     * Records the outcome of a running attempt.
     *
     * @return the rows written, the running attempt first
     */
    public List<TaskTest> recordResult(TaskTest running, ToolExecutionResult result, long executionTimeMs) {
        JsonNode output = result.output();
        JsonNode results = output != null ? output.get(RESULTS_FIELD) : null;
        List<TaskTest> written = new ArrayList<>();

        if (results != null && results.isArray() && !results.isEmpty()) {
            for (int i = 0; i < results.size(); i++) {
                JsonNode element = results.get(i);
                ToolExecutionResult elementResult = result.success()
                        ? ToolExecutionResult.inferFrom(element)
                        : new ToolExecutionResult(false, element, result.errorMessage());
                String testId = i == 0 ? running.testId() : fanOutId(running.testId(), i + 1);
                written.add(write(running, testId, elementResult, executionTimeMs));
            }
            log.debug("Fanned out {} results for attempt '{}'", results.size(), running.testId());
        } else {
            written.add(write(running, running.testId(), result, executionTimeMs));
        }
        return written;
    }

    /** Whether any of the recorded rows failed. */
    public static boolean anyFailed(List<TaskTest> recorded) {
        return recorded.stream().anyMatch(t -> t.status() == TaskStatus.FAILED);
    }

    static String attemptId(String taskId, int attempt) {
        return taskId + "-" + attempt;
    }

    static String fanOutId(String runningTestId, int ordinal) {
        return runningTestId + "-" + ordinal;
    }

    private TaskTest write(TaskTest running, String testId, ToolExecutionResult result, long executionTimeMs) {
        TaskStatus status = result.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        var row = new TaskTest(testId, running.taskId(), running.threadId(), running.toolName(),
                running.testData(), result.output(), null, status, result.errorMessage(), executionTimeMs,
                null, null, testId.equals(running.testId()) ? running.startedAt() : null, null);
        repository.save(row);
        metrics.recordTestRecorded(status.value());
        return repository.get(testId).orElse(row);
    }

    static int highestAttempt(String taskId, List<TaskTest> recorded) {
        String prefix = taskId + "-";
        int highest = 0;
        for (TaskTest test : recorded) {
            String id = test.testId();
            if (!id.startsWith(prefix) || id.length() == prefix.length()) {
                continue;
            }
            String ordinal = id.substring(prefix.length());
            if (ordinal.chars().allMatch(Character::isDigit)) {
                try {
                    highest = Math.max(highest, Integer.parseInt(ordinal));
                } catch (NumberFormatException e) {
                    log.warn("Attempt ordinal of '{}' is out of range, ignoring it", id);
                }
            }
        }
        return highest;
    }
}
