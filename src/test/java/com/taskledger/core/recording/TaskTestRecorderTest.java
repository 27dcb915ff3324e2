package com.taskledger.core.recording;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskledger.core.MutableClock;
import com.taskledger.core.collaborator.ToolExecutionResult;
import com.taskledger.core.metrics.LedgerMetrics;
import com.taskledger.core.model.JsonPayload;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskTest;
import com.taskledger.core.persistence.InMemoryTaskTestRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTestRecorderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryTaskTestRepository repository;
    private SimpleMeterRegistry registry;
    private TaskTestRecorder recorder;

    @BeforeEach
    void setUp() {
        var clock = new MutableClock();
        repository = new InMemoryTaskTestRepository(clock);
        registry = new SimpleMeterRegistry();
        recorder = new TaskTestRecorder(repository, new LedgerMetrics(registry), clock);
    }

    @Test
    @DisplayName("attempts are numbered after the rows already recorded")
    void attemptNumbering() {
        var first = recorder.openAttempt("p1-0-1", "worker-a", "list_tables", JsonPayload.empty());
        var second = recorder.openAttempt("p1-0-1", "worker-a", "list_tables", JsonPayload.empty());

        assertEquals("p1-0-1-1", first.testId());
        assertEquals("p1-0-1-2", second.testId());
        assertEquals(TaskStatus.RUNNING, repository.get("p1-0-1-1").orElseThrow().status());
        assertNotNull(repository.get("p1-0-1-1").orElseThrow().startedAt());
    }

    @Test
    @DisplayName("deleting an earlier attempt never reuses a later attempt's id")
    void numberingSurvivesDeletes() {
        recorder.openAttempt("t", "th", "tool", JsonPayload.empty());
        recorder.openAttempt("t", "th", "tool", JsonPayload.empty());
        var third = recorder.openAttempt("t", "th", "tool", JsonPayload.empty());
        recorder.recordResult(third, ToolExecutionResult.success(mapper.createObjectNode().put("rows", 1)), 5);
        repository.delete("t-1");

        var fourth = recorder.openAttempt("t", "th", "tool", JsonPayload.empty());

        assertEquals("t-4", fourth.testId());
        assertEquals(TaskStatus.COMPLETED, repository.get("t-3").orElseThrow().status());
    }

    @Test
    @DisplayName("fan-out rows are not counted as attempts")
    void fanOutRowsIgnored() {
        var running = recorder.openAttempt("t", "th", "tool", JsonPayload.empty());
        var output = mapper.createObjectNode();
        output.putArray("results").add(mapper.createObjectNode().put("success", true))
                .add(mapper.createObjectNode().put("success", true))
                .add(mapper.createObjectNode().put("success", true));
        recorder.recordResult(running, ToolExecutionResult.success(output), 5);

        assertEquals("t-2", recorder.openAttempt("t", "th", "tool", JsonPayload.empty()).testId());
    }

    @Test
    @DisplayName("a plain result completes the running attempt")
    void plainResult() {
        var running = recorder.openAttempt("t", "th", "tool", JsonPayload.empty());
        var output = mapper.createObjectNode().put("rows", 3);

        List<TaskTest> written = recorder.recordResult(running, ToolExecutionResult.success(output), 15);

        assertEquals(1, written.size());
        var stored = repository.get(running.testId()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, stored.status());
        assertEquals(output, stored.testResult());
        assertEquals(15L, stored.executionTimeMs());
        assertNotNull(stored.completedAt());
        assertEquals(1.0, registry.find("taskledger.tests.recorded").tag("status", "completed").counter().count());
    }

    @Test
    @DisplayName("a results array fans out into one row per element")
    void fanOut() throws Exception {
        var running = recorder.openAttempt("t", "th", "tool", JsonPayload.empty());
        JsonNode output = mapper.readTree("""
                {"results": [
                  {"success": true, "rows": 1},
                  {"success": false, "error": "permission denied"},
                  {"rows": 0}
                ]}""");

        List<TaskTest> written = recorder.recordResult(running, ToolExecutionResult.success(output), 20);

        assertEquals(List.of("t-1", "t-1-2", "t-1-3"), written.stream().map(TaskTest::testId).toList());
        assertEquals(TaskStatus.COMPLETED, repository.get("t-1").orElseThrow().status());
        var failed = repository.get("t-1-2").orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals("permission denied", failed.errorMessage());
        assertEquals(TaskStatus.COMPLETED, repository.get("t-1-3").orElseThrow().status());
        assertTrue(TaskTestRecorder.anyFailed(written));
        assertEquals(3, repository.getByTaskId("t").size());
    }

    @Test
    @DisplayName("a failed call marks every fanned-out row failed")
    void failedFanOut() throws Exception {
        var running = recorder.openAttempt("t", "th", "tool", JsonPayload.empty());
        JsonNode output = mapper.readTree("{\"results\": [{\"rows\": 1}, {\"rows\": 2}]}");

        var written = recorder.recordResult(running, new ToolExecutionResult(false, output, "timeout"), 5);

        assertTrue(written.stream().allMatch(t -> t.status() == TaskStatus.FAILED));
        assertEquals("timeout", repository.get("t-1-2").orElseThrow().errorMessage());
    }

    @Test
    @DisplayName("a failure without output is recorded with its error")
    void failureWithoutOutput() {
        var running = recorder.openAttempt("t", "th", "tool", JsonPayload.empty());

        recorder.recordResult(running, ToolExecutionResult.failure("Tool executor returned no result"), 0);

        var stored = repository.get("t-1").orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals("Tool executor returned no result", stored.errorMessage());
    }
}
