package com.taskledger.core.progress;

import com.taskledger.core.MutableClock;
import com.taskledger.core.model.PlanStatus;
import com.taskledger.core.persistence.InMemoryPlanProgressRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class BatchProgressTrackerTest {

    private BatchProgressTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new BatchProgressTracker(new InMemoryPlanProgressRepository(new MutableClock()));
    }

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        @DisplayName("12 tools in batches of 5 make 3 batches")
        void ceilDivision() {
            var progress = tracker.initialize("p1", 5, 12);

            assertEquals(3, progress.totalBatches());
            assertEquals(0, progress.currentBatchIndex());
            assertEquals(PlanStatus.PLANNING, progress.status());
        }

        @Test
        @DisplayName("no tools make zero batches and a finished plan")
        void noTools() {
            assertTrue(tracker.initialize("p1", 5, 0).isFinished());
        }

        @Test
        @DisplayName("non-positive batch size is rejected")
        void rejectsBadBatchSize() {
            assertThrows(IllegalArgumentException.class, () -> tracker.initialize("p1", 0, 3));
            assertThrows(IllegalArgumentException.class, () -> tracker.initialize("p1", 2, -1));
        }

        @Test
        @DisplayName("resize keeps counters and clamps the current batch")
        void resize() {
            tracker.initialize("p1", 2, 10);
            for (int i = 0; i < 4; i++) {
                tracker.advance("p1");
            }
            tracker.incrementCompleted("p1");

            var resized = tracker.resize("p1", 2, 4);

            assertEquals(2, resized.totalBatches());
            assertEquals(2, resized.currentBatchIndex());
            assertEquals(1, resized.completedBatches());
        }
    }

    @Test
    @DisplayName("advance stops at the total")
    void advanceStopsAtTotal() {
        tracker.initialize("p1", 5, 7);

        assertEquals(1, tracker.advance("p1"));
        assertEquals(2, tracker.advance("p1"));
        assertEquals(2, tracker.advance("p1"));
        var progress = tracker.get("p1").orElseThrow();
        assertTrue(progress.isFinished());
        assertEquals(PlanStatus.PLANNING, progress.status());
    }

    @Test
    @DisplayName("advance on an unknown plan fails")
    void advanceUnknownPlan() {
        assertThrows(IllegalStateException.class, () -> tracker.advance("missing"));
    }

    @Nested
    @DisplayName("settleBatch")
    class SettleBatch {

        @Test
        @DisplayName("counts the batch, refreshes the success rate and moves on")
        void settlesOnce() {
            tracker.initialize("p1", 1, 3);

            assertEquals(OptionalInt.of(1), tracker.settleBatch("p1", 0, false));
            assertEquals(OptionalInt.of(2), tracker.settleBatch("p1", 1, true));

            var progress = tracker.get("p1").orElseThrow();
            assertEquals(1, progress.completedBatches());
            assertEquals(1, progress.failedBatches());
            assertEquals(new BigDecimal("50.00"), progress.overallSuccessRate());
        }

        @Test
        @DisplayName("settling the same batch again changes nothing")
        void repeatIsNoOp() {
            tracker.initialize("p1", 1, 3);
            tracker.settleBatch("p1", 0, false);

            assertTrue(tracker.settleBatch("p1", 0, false).isEmpty());
            assertTrue(tracker.settleBatch("p1", 0, true).isEmpty());

            var progress = tracker.get("p1").orElseThrow();
            assertEquals(1, progress.completedBatches());
            assertEquals(0, progress.failedBatches());
            assertEquals(1, progress.currentBatchIndex());
        }

        @Test
        @DisplayName("a finished plan or an unknown plan settles nothing")
        void finishedOrMissing() {
            tracker.initialize("p1", 1, 1);
            tracker.settleBatch("p1", 0, false);

            assertTrue(tracker.settleBatch("p1", 1, false).isEmpty());
            assertTrue(tracker.settleBatch("missing", 0, false).isEmpty());
            assertEquals(1, tracker.get("p1").orElseThrow().completedBatches());
        }
    }

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("runs, pauses, resumes and completes")
        void happyPath() {
            tracker.initialize("p1", 5, 5);

            tracker.transition("p1", PlanStatus.RUNNING);
            assertEquals(PlanStatus.PAUSED, tracker.pause("p1").status());
            assertEquals(PlanStatus.RUNNING, tracker.resume("p1").status());
            assertEquals(PlanStatus.COMPLETED, tracker.transition("p1", PlanStatus.COMPLETED).status());
        }

        @Test
        @DisplayName("illegal moves are rejected and leave the status alone")
        void illegalMove() {
            tracker.initialize("p1", 5, 5);

            assertThrows(IllegalStateException.class, () -> tracker.transition("p1", PlanStatus.COMPLETED));
            assertEquals(PlanStatus.PLANNING, tracker.get("p1").orElseThrow().status());
        }

        @Test
        @DisplayName("re-applying the current status is a no-op")
        void sameStatus() {
            tracker.initialize("p1", 5, 5);

            assertEquals(PlanStatus.PLANNING, tracker.transition("p1", PlanStatus.PLANNING).status());
        }
    }

    @Test
    @DisplayName("batch stats reflect the counters and success rate")
    void batchStats() {
        tracker.initialize("p1", 1, 3);
        tracker.incrementCompleted("p1");
        tracker.incrementCompleted("p1");
        tracker.incrementFailed("p1");
        tracker.recomputeSuccessRate("p1");

        var stats = tracker.batchStats("p1").orElseThrow();
        assertEquals(3, stats.total());
        assertEquals(2, stats.completed());
        assertEquals(1, stats.failed());
        assertEquals(new BigDecimal("66.67"), stats.successRate());
    }

    @Test
    @DisplayName("resetToFirstBatch points back at batch 0")
    void resetToFirstBatch() {
        tracker.initialize("p1", 1, 3);
        tracker.advance("p1");
        tracker.advance("p1");

        assertTrue(tracker.resetToFirstBatch("p1"));
        assertEquals(0, tracker.get("p1").orElseThrow().currentBatchIndex());
        assertFalse(tracker.resetToFirstBatch("missing"));
    }
}
