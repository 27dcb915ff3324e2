package com.taskledger.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    private SimpleMeterRegistry registry;
    private LedgerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LedgerMetrics(registry);
    }

    @Test
    @DisplayName("planned tasks accumulate")
    void tasksPlanned() {
        metrics.recordTasksPlanned(3);
        metrics.recordTasksPlanned(2);

        assertEquals(5.0, registry.find("taskledger.tasks.planned").counter().count());
    }

    @Test
    @DisplayName("batch advances are tagged by worker")
    void batchAdvances() {
        metrics.recordBatchAdvance("planner");
        metrics.recordBatchAdvance("executor");
        metrics.recordBatchAdvance("executor");

        assertEquals(1.0, registry.find("taskledger.batch.advances").tag("worker", "planner").counter().count());
        assertEquals(2.0, registry.find("taskledger.batch.advances").tag("worker", "executor").counter().count());
    }

    @Test
    @DisplayName("batch outcomes are tagged completed or failed")
    void batchOutcomes() {
        metrics.recordBatchOutcome(false);
        metrics.recordBatchOutcome(true);

        assertEquals(1.0, registry.find("taskledger.batch.outcomes").tag("result", "completed").counter().count());
        assertEquals(1.0, registry.find("taskledger.batch.outcomes").tag("result", "failed").counter().count());
    }

    @Test
    @DisplayName("task durations are timed per tool")
    void taskDuration() {
        metrics.recordTaskExecution("list_tables", 120);

        var timer = registry.find("taskledger.task.duration").tag("tool", "list_tables").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(120.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }
}
