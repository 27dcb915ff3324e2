package com.taskledger.core.nodes;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.taskledger.core.LedgerFixture;
import com.taskledger.core.collaborator.ToolExecutionResult;
import com.taskledger.core.collaborator.ToolExecutor;
import com.taskledger.core.memory.InMemoryKeyValueStore;
import com.taskledger.core.model.JsonPayloads;
import com.taskledger.core.model.PlanStatus;
import com.taskledger.core.model.TaskComplexity;
import com.taskledger.core.model.TaskPlan;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.persistence.InMemoryPlanProgressRepository;
import com.taskledger.core.persistence.TransientStoreException;
import com.taskledger.core.progress.BatchProgressTracker;
import com.taskledger.core.state.LedgerState;
import com.taskledger.core.state.StepOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExecuteTaskNodeTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LedgerFixture fixture;
    private ToolExecutor executor;
    private ExecuteTaskNode node;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture(2).withTools("a", "b");
        executor = mock(ToolExecutor.class);
        when(executor.execute(any())).thenAnswer(invocation -> {
            TaskPlan task = invocation.getArgument(0);
            return ToolExecutionResult.success(fixture.mapper.createObjectNode().put("tool", task.toolName()));
        });
        node = fixture.executeTaskNode(executor);
    }

    /** Two batches: [a, b] and [c]; c is not in the catalog. */
    private void planTwoBatches() {
        planTwoBatches(fixture.tracker);
    }

    private void planTwoBatches(BatchProgressTracker tracker) {
        tracker.initialize("p1", 2, 3);
        fixture.taskPlans.saveBatch("p1", List.of(task(0, "p1-0-1", "a"), task(0, "p1-0-2", "b")));
        fixture.taskPlans.saveBatch("p1", List.of(task(1, "p1-1-1", "c")));
        tracker.advance("p1");
        tracker.advance("p1");
    }

    private static TaskPlan task(int batch, String id, String tool) {
        return TaskPlan.planned("p1", batch, id, tool, "", JsonPayloads.normalize(Map.of("x", 1), MAPPER),
                TaskComplexity.LOW, false);
    }

    private Map<String, Object> step() {
        return node.apply(new LedgerState(Map.of("planId", "p1", "threadId", "worker-1")), null);
    }

    @Test
    @DisplayName("walks every task and batch to completion")
    void fullRun() {
        planTwoBatches();
        List<String> outcomes = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            outcomes.add((String) step().get("lastOutcome"));
        }

        assertEquals(List.of("EXECUTED", "EXECUTED", "BATCH_ADVANCED", "TOOL_NOT_FOUND", "BATCH_ADVANCED", "FINISHED"),
                outcomes);

        var progress = fixture.tracker.get("p1").orElseThrow();
        assertEquals(PlanStatus.COMPLETED, progress.status());
        assertEquals(1, progress.completedBatches());
        assertEquals(1, progress.failedBatches());
        assertEquals(new BigDecimal("50.00"), progress.overallSuccessRate());

        assertEquals(TaskStatus.COMPLETED, fixture.taskPlans.get("p1-0-1").orElseThrow().status());
        var missing = fixture.taskPlans.get("p1-1-1").orElseThrow();
        assertEquals(TaskStatus.FAILED, missing.status());
        assertEquals("Tool not found: c", missing.errorMessage());
        verify(executor, times(2)).execute(any());
    }

    @Test
    @DisplayName("the first execution starts from batch 0 even after planning moved on")
    void firstExecutionResetsBatch() {
        planTwoBatches();
        assertEquals(2, fixture.tracker.get("p1").orElseThrow().currentBatchIndex());

        var result = step();

        assertEquals(StepOutcome.EXECUTED.name(), result.get("lastOutcome"));
        assertEquals("p1-0-1", result.get("lastTaskId"));
        assertEquals(PlanStatus.RUNNING, fixture.tracker.get("p1").orElseThrow().status());
    }

    @Test
    @DisplayName("records the attempt, the raw result and the task outcome")
    void recordsOutcome() {
        planTwoBatches();

        step();

        var attempt = fixture.taskTests.get("p1-0-1-1").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, attempt.status());
        assertEquals("worker-1", attempt.threadId());

        var stored = fixture.durableStore.get(fixture.namespaces.testResults("p1", 0), "p1-0-1").orElseThrow();
        assertEquals("a", stored.value().get("toolName").asText());
        assertEquals(1, stored.value().get("toolArgs").get("x").asInt());

        var result = fixture.taskPlans.get("p1-0-1").orElseThrow().result();
        assertEquals("a", result.get("output").get("tool").asText());
        assertEquals(1, result.get("args").get("x").asInt());

        var cursor = fixture.cursors.find(fixture.durableStore, "p1").orElseThrow();
        assertEquals(1, cursor.taskIndex());
        assertNull(cursor.currentTestId());
    }

    @Test
    @DisplayName("elapsed time and result timestamp come from the injected clock")
    void timedByInjectedClock() {
        planTwoBatches();
        when(executor.execute(any())).thenAnswer(invocation -> {
            fixture.clock.advance(Duration.ofMillis(250));
            return ToolExecutionResult.success(fixture.mapper.createObjectNode().put("tool", "a"));
        });

        step();

        assertEquals(250L, fixture.taskTests.get("p1-0-1-1").orElseThrow().executionTimeMs());
        var stored = fixture.durableStore.get(fixture.namespaces.testResults("p1", 0), "p1-0-1").orElseThrow();
        assertEquals("2024-01-01T00:00:00.250Z", stored.value().get("timestamp").asText());
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a throwing executor fails the task and moves on")
        void executorThrows() {
            planTwoBatches();
            when(executor.execute(any())).thenThrow(new IllegalStateException("connection refused"));

            assertEquals(StepOutcome.EXECUTED.name(), step().get("lastOutcome"));

            var task = fixture.taskPlans.get("p1-0-1").orElseThrow();
            assertEquals(TaskStatus.FAILED, task.status());
            assertTrue(task.errorMessage().contains("connection refused"));
            assertEquals(TaskStatus.FAILED, fixture.taskTests.get("p1-0-1-1").orElseThrow().status());
        }

        @Test
        @DisplayName("error-looking output is treated as a failure")
        void errorOutput() {
            planTwoBatches();
            when(executor.execute(any())).thenReturn(ToolExecutionResult.success(TextNode.valueOf("ERROR: relation missing")));

            step();

            assertEquals(TaskStatus.FAILED, fixture.taskPlans.get("p1-0-1").orElseThrow().status());
        }

        @Test
        @DisplayName("a failed task fails its batch")
        void failedBatch() {
            planTwoBatches();
            when(executor.execute(any())).thenReturn(ToolExecutionResult.failure("timeout"));

            step();
            step();
            assertEquals(StepOutcome.BATCH_ADVANCED.name(), step().get("lastOutcome"));

            var progress = fixture.tracker.get("p1").orElseThrow();
            assertEquals(1, progress.failedBatches());
            assertEquals(new BigDecimal("0.00"), progress.overallSuccessRate());
        }
    }

    @Nested
    @DisplayName("idle states")
    class IdleStates {

        @Test
        @DisplayName("an unknown plan is idle")
        void unknownPlan() {
            assertEquals(StepOutcome.IDLE.name(), step().get("lastOutcome"));
        }

        @Test
        @DisplayName("a batch without tasks waits for the planner")
        void waitsForPlanner() {
            fixture.tracker.initialize("p1", 2, 4);

            assertEquals(StepOutcome.WAITING.name(), step().get("lastOutcome"));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("a paused plan does nothing")
        void paused() {
            planTwoBatches();
            step();
            fixture.tracker.pause("p1");

            assertEquals(StepOutcome.PAUSED.name(), step().get("lastOutcome"));
            verify(executor, times(1)).execute(any());
        }
    }

    @Test
    @DisplayName("an ephemeral caller store still writes the cursor to the durable store")
    void ephemeralCallerStore() {
        planTwoBatches();
        var callerStore = new InMemoryKeyValueStore(fixture.clock);

        node.apply(new LedgerState(Map.of("planId", "p1")), callerStore);

        assertTrue(fixture.cursors.exists(fixture.durableStore, "p1"));
        assertFalse(fixture.cursors.exists(callerStore, "p1"));
    }

    @Nested
    @DisplayName("retried batch settle")
    class RetriedSettle {

        private BatchProgressTracker tracker;
        private ExecuteTaskNode retryingNode;

        private void useRepository(InMemoryPlanProgressRepository repository) {
            tracker = new BatchProgressTracker(repository);
            retryingNode = new ExecuteTaskNode(fixture.resolver, fixture.namespaces, fixture.catalog, executor,
                    fixture.taskPlans, tracker, fixture.cursors, fixture.recorder, fixture.metrics,
                    fixture.mapper, fixture.clock);
            planTwoBatches(tracker);
        }

        private Map<String, Object> retryingStep() {
            return retryingNode.apply(new LedgerState(Map.of("planId", "p1", "threadId", "worker-1")), null);
        }

        private void runToBatchEnd() {
            retryingStep();
            retryingStep();
        }

        @Test
        @DisplayName("a settle that failed before writing counts the batch once on retry")
        void failedBeforeWrite() {
            useRepository(new FlakySettleRepository(fixture.clock, false));
            runToBatchEnd();

            assertThrows(TransientStoreException.class, this::retryingStep);
            assertEquals(StepOutcome.BATCH_ADVANCED.name(), retryingStep().get("lastOutcome"));

            var progress = tracker.get("p1").orElseThrow();
            assertEquals(1, progress.completedBatches());
            assertEquals(0, progress.failedBatches());
            assertEquals(1, progress.currentBatchIndex());
        }

        @Test
        @DisplayName("a settle whose outcome was lost is not counted twice on retry")
        void outcomeLost() {
            useRepository(new FlakySettleRepository(fixture.clock, true));
            runToBatchEnd();

            assertThrows(TransientStoreException.class, this::retryingStep);
            List<String> outcomes = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                outcomes.add((String) retryingStep().get("lastOutcome"));
            }

            assertEquals(List.of("TOOL_NOT_FOUND", "BATCH_ADVANCED", "FINISHED"), outcomes);
            var progress = tracker.get("p1").orElseThrow();
            assertEquals(1, progress.completedBatches());
            assertEquals(1, progress.failedBatches());
            assertEquals(new BigDecimal("50.00"), progress.overallSuccessRate());
        }

        @Test
        @DisplayName("a batch another worker settled first is not counted again")
        void settledByAnotherWorker() {
            useRepository(new RacedSettleRepository(fixture.clock));
            runToBatchEnd();

            var result = retryingStep();

            assertEquals(StepOutcome.BATCH_ADVANCED.name(), result.get("lastOutcome"));
            assertEquals(1, result.get("batchIndex"));
            assertEquals(1, tracker.get("p1").orElseThrow().completedBatches());
            assertEquals(1, fixture.cursors.find(fixture.durableStore, "p1").orElseThrow().batchIndex());
        }
    }

    /** Fails the first settle with a transient error, optionally after applying it. */
    private static class FlakySettleRepository extends InMemoryPlanProgressRepository {

        private final boolean applyBeforeFailing;
        private boolean failedOnce;

        FlakySettleRepository(Clock clock, boolean applyBeforeFailing) {
            super(clock);
            this.applyBeforeFailing = applyBeforeFailing;
        }

        @Override
        public synchronized OptionalInt settleBatch(String planId, int batchIndex, boolean failed) {
            if (!failedOnce) {
                failedOnce = true;
                if (applyBeforeFailing) {
                    super.settleBatch(planId, batchIndex, failed);
                }
                throw new TransientStoreException("settle plan batch failed",
                        new SQLTransientConnectionException("connection reset", "08006"));
            }
            return super.settleBatch(planId, batchIndex, failed);
        }
    }

    /** Lets a competing settle of the same batch win just before ours runs. */
    private static class RacedSettleRepository extends InMemoryPlanProgressRepository {

        RacedSettleRepository(Clock clock) {
            super(clock);
        }

        @Override
        public synchronized OptionalInt settleBatch(String planId, int batchIndex, boolean failed) {
            super.settleBatch(planId, batchIndex, failed);
            return super.settleBatch(planId, batchIndex, failed);
        }
    }
}
