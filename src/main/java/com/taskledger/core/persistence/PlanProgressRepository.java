package com.taskledger.core.persistence;

import com.taskledger.core.model.PlanProgress;
import com.taskledger.core.model.PlanStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Durable single-row-per-plan progress records. Counter updates are atomic single-row
 * statements so that concurrent workers never lose increments.
 */
public interface PlanProgressRepository {

    /** Upserts the whole record. */
    void save(PlanProgress progress);

    Optional<PlanProgress> get(String planId);

    /**
     * Increments {@code currentBatchIndex}, never past {@code totalBatches}.
     *
     * @return the new index, or empty if the plan has no progress record
     */
    OptionalInt advance(String planId);

    /**
     * Sets {@code currentBatchIndex}, clamped to {@code [0, totalBatches]}.
     */
    boolean setCurrentBatchIndex(String planId, int batchIndex);

    /**
     * Settles batch {@code batchIndex} in one atomic step: bumps the completed or failed
     * counter, refreshes the success rate and moves to the next batch. Applies only while
     * {@code currentBatchIndex == batchIndex}, so repeating the call for a batch that was
     * already settled changes nothing.
     *
     * @return the new index, or empty if the plan is missing or the batch is no longer current
     */
    OptionalInt settleBatch(String planId, int batchIndex, boolean failed);

    boolean incrementCompleted(String planId);

    boolean incrementFailed(String planId);

    /**
     * Recomputes and stores {@code completed / (completed + failed) * 100} rounded half-up to
     * two decimals, or zero when no batch has finished.
     */
    Optional<BigDecimal> recomputeSuccessRate(String planId);

    boolean updateStatus(String planId, PlanStatus status);

    /**
     * @param status optional filter; {@code null} lists every plan
     * @return records most recently updated first
     */
    List<PlanProgress> list(PlanStatus status);

    boolean delete(String planId);
}
