package com.taskledger.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning and execution.
 */
@Service
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTasksPlanned(int count) {
        Counter.builder("taskledger.tasks.planned")
                .register(registry)
                .increment(count);
    }

    public void recordBatchAdvance(String worker) {
        Counter.builder("taskledger.batch.advances")
                .tag("worker", worker)
                .register(registry)
                .increment();
    }

    /**
     * Records a finished batch.
     *
     * @param failed whether at least one task of the batch failed
     */
    public void recordBatchOutcome(boolean failed) {
        Counter.builder("taskledger.batch.outcomes")
                .tag("result", failed ? "failed" : "completed")
                .register(registry)
                .increment();
    }

    public void recordTestRecorded(String status) {
        Counter.builder("taskledger.tests.recorded")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String toolName, long ms) {
        Timer.builder("taskledger.task.duration")
                .tag("tool", toolName)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordExpiredMemoryCleanup(int removed) {
        DistributionSummary.builder("taskledger.memory.expired_removed")
                .description("Expired memory items removed per sweep")
                .register(registry)
                .record(removed);
    }
}
