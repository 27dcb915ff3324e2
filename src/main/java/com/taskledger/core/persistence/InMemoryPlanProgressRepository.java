package com.taskledger.core.persistence;

import com.taskledger.core.model.PlanProgress;
import com.taskledger.core.model.PlanStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link PlanProgressRepository} used when no database is configured.
 */
public class InMemoryPlanProgressRepository implements PlanProgressRepository {

    private record Row(PlanProgress progress, long sequence) {}

    private final Map<String, Row> rows = new HashMap<>();
    private final Clock clock;
    private long sequence;

    public InMemoryPlanProgressRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void save(PlanProgress p) {
        rows.put(p.planId(), new Row(new PlanProgress(p.planId(), p.totalBatches(), p.completedBatches(),
                p.failedBatches(), p.currentBatchIndex(), p.overallSuccessRate(), p.status(),
                clock.instant()), ++sequence));
    }

    @Override
    public synchronized Optional<PlanProgress> get(String planId) {
        return Optional.ofNullable(rows.get(planId)).map(Row::progress);
    }

    @Override
    public synchronized OptionalInt advance(String planId) {
        return modify(planId, p -> withIndex(p, Math.min(p.currentBatchIndex() + 1, p.totalBatches())))
                .map(p -> OptionalInt.of(p.currentBatchIndex()))
                .orElse(OptionalInt.empty());
    }

    @Override
    public synchronized boolean setCurrentBatchIndex(String planId, int batchIndex) {
        return modify(planId, p -> withIndex(p, Math.min(Math.max(batchIndex, 0), p.totalBatches())))
                .isPresent();
    }

    @Override
    public synchronized OptionalInt settleBatch(String planId, int batchIndex, boolean failed) {
        Row row = rows.get(planId);
        if (row == null) {
            return OptionalInt.empty();
        }
        PlanProgress p = row.progress();
        if (p.currentBatchIndex() != batchIndex || p.currentBatchIndex() >= p.totalBatches()) {
            return OptionalInt.empty();
        }
        int completed = p.completedBatches() + (failed ? 0 : 1);
        int failedCount = p.failedBatches() + (failed ? 1 : 0);
        return modify(planId, q -> new PlanProgress(q.planId(), q.totalBatches(), completed, failedCount,
                q.currentBatchIndex() + 1, successRate(completed, failedCount), q.status(), null))
                .map(q -> OptionalInt.of(q.currentBatchIndex()))
                .orElse(OptionalInt.empty());
    }

    @Override
    public synchronized boolean incrementCompleted(String planId) {
        return modify(planId, p -> new PlanProgress(p.planId(), p.totalBatches(), p.completedBatches() + 1,
                p.failedBatches(), p.currentBatchIndex(), p.overallSuccessRate(), p.status(), null))
                .isPresent();
    }

    @Override
    public synchronized boolean incrementFailed(String planId) {
        return modify(planId, p -> new PlanProgress(p.planId(), p.totalBatches(), p.completedBatches(),
                p.failedBatches() + 1, p.currentBatchIndex(), p.overallSuccessRate(), p.status(), null))
                .isPresent();
    }

    @Override
    public synchronized Optional<BigDecimal> recomputeSuccessRate(String planId) {
        return modify(planId, p -> new PlanProgress(p.planId(), p.totalBatches(), p.completedBatches(),
                p.failedBatches(), p.currentBatchIndex(),
                successRate(p.completedBatches(), p.failedBatches()), p.status(), null))
                .map(PlanProgress::overallSuccessRate);
    }

    @Override
    public synchronized boolean updateStatus(String planId, PlanStatus status) {
        return modify(planId, p -> new PlanProgress(p.planId(), p.totalBatches(), p.completedBatches(),
                p.failedBatches(), p.currentBatchIndex(), p.overallSuccessRate(), status, null))
                .isPresent();
    }

    @Override
    public synchronized List<PlanProgress> list(PlanStatus status) {
        return rows.values().stream()
                .filter(r -> status == null || r.progress().status() == status)
                .sorted(Comparator.comparingLong(Row::sequence).reversed())
                .map(Row::progress)
                .toList();
    }

    @Override
    public synchronized boolean delete(String planId) {
        return rows.remove(planId) != null;
    }

    static BigDecimal successRate(int completed, int failed) {
        int finished = completed + failed;
        if (finished == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(completed)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(finished), 2, RoundingMode.HALF_UP);
    }

    private Optional<PlanProgress> modify(String planId, UnaryOperator<PlanProgress> change) {
        Row row = rows.get(planId);
        if (row == null) {
            return Optional.empty();
        }
        PlanProgress changed = change.apply(row.progress());
        var stamped = new PlanProgress(changed.planId(), changed.totalBatches(), changed.completedBatches(),
                changed.failedBatches(), changed.currentBatchIndex(), changed.overallSuccessRate(),
                changed.status(), clock.instant());
        rows.put(planId, new Row(stamped, ++sequence));
        return Optional.of(stamped);
    }

    private static PlanProgress withIndex(PlanProgress p, int index) {
        return new PlanProgress(p.planId(), p.totalBatches(), p.completedBatches(), p.failedBatches(),
                index, p.overallSuccessRate(), p.status(), null);
    }
}
