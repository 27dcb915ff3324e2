package com.taskledger.core.progress;

import com.taskledger.core.model.BatchStats;
import com.taskledger.core.model.PlanProgress;
import com.taskledger.core.model.PlanStatus;
import com.taskledger.core.persistence.PlanProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Tracks which batch of a plan is active and how many batches succeeded or failed.
 * <p>
 * Status changes follow {@code planning -> running -> completed|failed} with
 * {@code running <-> paused}; anything else raises {@link IllegalStateException}.
 */
@Service
public class BatchProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(BatchProgressTracker.class);

    private final PlanProgressRepository repository;

    public BatchProgressTracker(PlanProgressRepository repository) {
        this.repository = repository;
    }

    /**
     * Creates (or recreates) the progress record at batch 0 in {@code planning}.
     *
     * @throws IllegalArgumentException if {@code toolsPerBatch <= 0} or {@code totalTools < 0}
     */
    public PlanProgress initialize(String planId, int toolsPerBatch, int totalTools) {
        int totalBatches = totalBatches(toolsPerBatch, totalTools);
        var progress = new PlanProgress(planId, totalBatches, 0, 0, 0, BigDecimal.ZERO,
                PlanStatus.PLANNING, null);
        repository.save(progress);
        log.info("Initialised plan '{}': {} tools in {} batches of {}", planId, totalTools,
                totalBatches, toolsPerBatch);
        return get(planId).orElse(progress);
    }

    /**
     * Recomputes the batch count after the tool catalog changed, keeping counters, status
     * and the current index (clamped to the new total).
     */
    public PlanProgress resize(String planId, int toolsPerBatch, int totalTools) {
        PlanProgress current = require(planId);
        int totalBatches = totalBatches(toolsPerBatch, totalTools);
        var resized = new PlanProgress(planId, totalBatches, current.completedBatches(),
                current.failedBatches(), Math.min(current.currentBatchIndex(), totalBatches),
                current.overallSuccessRate(), current.status(), null);
        repository.save(resized);
        log.info("Resized plan '{}' from {} to {} batches", planId, current.totalBatches(), totalBatches);
        return get(planId).orElse(resized);
    }

    /**
     * Moves to the next batch, never past the total. Reaching the total makes the plan
     * {@link PlanProgress#isFinished() finished}; the status stays as it is until a worker
     * transitions it.
     *
     * @return the new current batch index
     * @throws IllegalStateException if the plan has no progress record
     */
    public int advance(String planId) {
        int index = repository.advance(planId)
                .orElseThrow(() -> new IllegalStateException("No progress recorded for plan '" + planId + "'"));
        log.info("Plan '{}' advanced to batch {}", planId, index);
        return index;
    }

    /**
     * Counts batch {@code batchIndex} as completed or failed and moves past it, as one atomic
     * update. Settling a batch that is no longer current is a no-op, so a retried settle never
     * counts the same batch twice.
     *
     * @return the new current batch index, or empty if the batch was already settled
     */
    public OptionalInt settleBatch(String planId, int batchIndex, boolean failed) {
        OptionalInt next = repository.settleBatch(planId, batchIndex, failed);
        if (next.isPresent()) {
            log.info("Plan '{}' settled batch {} as {}, now at batch {}", planId, batchIndex,
                    failed ? "failed" : "completed", next.getAsInt());
        } else {
            log.warn("Batch {} of plan '{}' was already settled", batchIndex, planId);
        }
        return next;
    }

    public boolean incrementCompleted(String planId) {
        return repository.incrementCompleted(planId);
    }

    public boolean incrementFailed(String planId) {
        return repository.incrementFailed(planId);
    }

    public Optional<BigDecimal> recomputeSuccessRate(String planId) {
        return repository.recomputeSuccessRate(planId);
    }

    /**
     * Moves the plan to {@code target}. Re-applying the current status is a no-op.
     *
     * @throws IllegalStateException if the plan is missing or the transition is not allowed
     */
    public PlanProgress transition(String planId, PlanStatus target) {
        PlanProgress current = require(planId);
        if (current.status() == target) {
            return current;
        }
        if (!current.status().canTransitionTo(target)) {
            throw new IllegalStateException("Plan '" + planId + "' cannot move from "
                    + current.status().value() + " to " + target.value());
        }
        repository.updateStatus(planId, target);
        log.info("Plan '{}' status {} -> {}", planId, current.status().value(), target.value());
        return require(planId);
    }

    public PlanProgress pause(String planId) {
        return transition(planId, PlanStatus.PAUSED);
    }

    public PlanProgress resume(String planId) {
        return transition(planId, PlanStatus.RUNNING);
    }

    /**
     * Points the plan back at its first batch. Used once, when the execution worker
     * starts on a plan it has never executed.
     */
    public boolean resetToFirstBatch(String planId) {
        boolean reset = repository.setCurrentBatchIndex(planId, 0);
        if (reset) {
            log.info("Plan '{}' reset to batch 0 for first execution", planId);
        }
        return reset;
    }

    public Optional<PlanProgress> get(String planId) {
        return repository.get(planId);
    }

    public Optional<BatchStats> batchStats(String planId) {
        return repository.get(planId).map(PlanProgress::batchStats);
    }

    public List<PlanProgress> list(PlanStatus status) {
        return repository.list(status);
    }

    public boolean delete(String planId) {
        return repository.delete(planId);
    }

    static int totalBatches(int toolsPerBatch, int totalTools) {
        if (toolsPerBatch <= 0) {
            throw new IllegalArgumentException("toolsPerBatch must be positive, was " + toolsPerBatch);
        }
        if (totalTools < 0) {
            throw new IllegalArgumentException("totalTools must not be negative, was " + totalTools);
        }
        return (totalTools + toolsPerBatch - 1) / toolsPerBatch;
    }

    private PlanProgress require(String planId) {
        return repository.get(planId)
                .orElseThrow(() -> new IllegalStateException("No progress recorded for plan '" + planId + "'"));
    }
}
