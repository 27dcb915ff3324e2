package com.taskledger.core.persistence;

import com.taskledger.core.MutableClock;
import com.taskledger.core.model.PlanProgress;
import com.taskledger.core.model.PlanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPlanProgressRepositoryTest {

    private MutableClock clock;
    private InMemoryPlanProgressRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        repository = new InMemoryPlanProgressRepository(clock);
    }

    private void savePlan(String planId, int total, int completed, int failed, int current, PlanStatus status) {
        repository.save(new PlanProgress(planId, total, completed, failed, current, BigDecimal.ZERO, status, null));
    }

    @Test
    @DisplayName("success rate of 5 completed and 3 failed is 62.50")
    void successRate() {
        savePlan("p1", 12, 5, 3, 8, PlanStatus.RUNNING);

        assertEquals(new BigDecimal("62.50"), repository.recomputeSuccessRate("p1").orElseThrow());
        assertEquals(new BigDecimal("62.50"), repository.get("p1").orElseThrow().overallSuccessRate());
    }

    @Test
    @DisplayName("success rate rounds half up and is zero with no finished batch")
    void successRateRounding() {
        assertEquals(new BigDecimal("66.67"), InMemoryPlanProgressRepository.successRate(2, 1));
        assertEquals(new BigDecimal("33.33"), InMemoryPlanProgressRepository.successRate(1, 2));
        assertEquals(new BigDecimal("0.00"), InMemoryPlanProgressRepository.successRate(0, 0));
        assertEquals(new BigDecimal("100.00"), InMemoryPlanProgressRepository.successRate(4, 0));
    }

    @Test
    @DisplayName("advance never passes the total")
    void advanceClamps() {
        savePlan("p1", 2, 0, 0, 1, PlanStatus.RUNNING);

        assertEquals(OptionalInt.of(2), repository.advance("p1"));
        assertEquals(OptionalInt.of(2), repository.advance("p1"));
        assertEquals(OptionalInt.empty(), repository.advance("missing"));
    }

    @Test
    @DisplayName("setCurrentBatchIndex clamps to the valid range")
    void setIndexClamps() {
        savePlan("p1", 3, 0, 0, 1, PlanStatus.RUNNING);

        repository.setCurrentBatchIndex("p1", 10);
        assertEquals(3, repository.get("p1").orElseThrow().currentBatchIndex());
        repository.setCurrentBatchIndex("p1", -4);
        assertEquals(0, repository.get("p1").orElseThrow().currentBatchIndex());
    }

    @Test
    @DisplayName("counters increment independently")
    void counters() {
        savePlan("p1", 3, 0, 0, 0, PlanStatus.RUNNING);

        assertTrue(repository.incrementCompleted("p1"));
        assertTrue(repository.incrementCompleted("p1"));
        assertTrue(repository.incrementFailed("p1"));
        assertFalse(repository.incrementFailed("missing"));

        var progress = repository.get("p1").orElseThrow();
        assertEquals(2, progress.completedBatches());
        assertEquals(1, progress.failedBatches());
    }

    @Test
    @DisplayName("list filters by status, most recently updated first")
    void listOrdering() {
        savePlan("a", 1, 0, 0, 0, PlanStatus.RUNNING);
        clock.advance(Duration.ofSeconds(1));
        savePlan("b", 1, 0, 0, 0, PlanStatus.PLANNING);
        clock.advance(Duration.ofSeconds(1));
        savePlan("c", 1, 0, 0, 0, PlanStatus.RUNNING);
        clock.advance(Duration.ofSeconds(1));
        repository.updateStatus("a", PlanStatus.RUNNING);

        assertEquals(List.of("a", "c"),
                repository.list(PlanStatus.RUNNING).stream().map(PlanProgress::planId).toList());
        assertEquals(List.of("a", "c", "b"),
                repository.list(null).stream().map(PlanProgress::planId).toList());
    }

    @Test
    @DisplayName("writes stamp lastUpdated from the clock")
    void lastUpdated() {
        savePlan("p1", 2, 0, 0, 0, PlanStatus.PLANNING);
        clock.advance(Duration.ofMinutes(1));
        repository.updateStatus("p1", PlanStatus.RUNNING);

        var progress = repository.get("p1").orElseThrow();
        assertEquals(clock.instant(), progress.lastUpdated());
        assertEquals(PlanStatus.RUNNING, progress.status());
        assertTrue(repository.delete("p1"));
        assertTrue(repository.get("p1").isEmpty());
    }
}
