package com.taskledger.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Batch-level progress of a plan. One record per plan.
 *
 * @param planId             plan identifier
 * @param totalBatches       number of batches in the plan
 * @param completedBatches   batches whose tasks all succeeded
 * @param failedBatches      batches with at least one failed task
 * @param currentBatchIndex  batch currently being worked on; equals {@code totalBatches} once finished
 * @param overallSuccessRate percentage of completed batches, two decimals
 * @param status             plan status
 * @param lastUpdated        last write time
 */
public record PlanProgress(
    String planId,
    int totalBatches,
    int completedBatches,
    int failedBatches,
    int currentBatchIndex,
    BigDecimal overallSuccessRate,
    PlanStatus status,
    Instant lastUpdated
) {

    public PlanProgress {
        if (currentBatchIndex > totalBatches) {
            throw new IllegalArgumentException("currentBatchIndex " + currentBatchIndex
                    + " exceeds totalBatches " + totalBatches);
        }
        if (overallSuccessRate == null) {
            overallSuccessRate = BigDecimal.ZERO;
        }
        if (status == null) {
            status = PlanStatus.PLANNING;
        }
    }

    /** No batches remain once the current index reaches the total. */
    public boolean isFinished() {
        return currentBatchIndex >= totalBatches;
    }

    public BatchStats batchStats() {
        return new BatchStats(totalBatches, completedBatches, failedBatches, overallSuccessRate);
    }
}
