package com.taskledger.core.nodes;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskledger.core.collaborator.ToolCatalogProvider;
import com.taskledger.core.collaborator.ToolDescriptor;
import com.taskledger.core.collaborator.ToolExecutionResult;
import com.taskledger.core.collaborator.ToolExecutor;
import com.taskledger.core.cursor.ExecutionCursorService;
import com.taskledger.core.logging.MdcContext;
import com.taskledger.core.memory.DualStoreResolver;
import com.taskledger.core.memory.KeyValueStore;
import com.taskledger.core.memory.LedgerNamespaces;
import com.taskledger.core.metrics.LedgerMetrics;
import com.taskledger.core.model.ExecutionCursor;
import com.taskledger.core.model.PlanProgress;
import com.taskledger.core.model.PlanStatus;
import com.taskledger.core.model.TaskPlan;
import com.taskledger.core.model.TaskStatus;
import com.taskledger.core.model.TaskTest;
import com.taskledger.core.persistence.TaskPlanRepository;
import com.taskledger.core.progress.BatchProgressTracker;
import com.taskledger.core.recording.TaskTestRecorder;
import com.taskledger.core.state.LedgerState;
import com.taskledger.core.state.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Executes one planned task per invocation.
 * <p>
 * The cursor only moves after the outcome is durably recorded, so a crash between the tool
 * call and the recording replays the task rather than losing it. When the cursor runs past
 * the last task of a batch the node settles the batch (completed or failed) and moves batch
 * progress past it in one update, then resets the cursor for the next batch.
 */
@Component
public class ExecuteTaskNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteTaskNode.class);

    private final DualStoreResolver storeResolver;
    private final LedgerNamespaces namespaces;
    private final ToolCatalogProvider toolCatalog;
    private final ToolExecutor toolExecutor;
    private final TaskPlanRepository taskPlans;
    private final BatchProgressTracker progressTracker;
    private final ExecutionCursorService cursors;
    private final TaskTestRecorder recorder;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecuteTaskNode(DualStoreResolver storeResolver, LedgerNamespaces namespaces,
                           ToolCatalogProvider toolCatalog, ToolExecutor toolExecutor,
                           TaskPlanRepository taskPlans, BatchProgressTracker progressTracker,
                           ExecutionCursorService cursors, TaskTestRecorder recorder,
                           LedgerMetrics metrics, ObjectMapper objectMapper, Clock clock) {
        this.storeResolver = storeResolver;
        this.namespaces = namespaces;
        this.toolCatalog = toolCatalog;
        this.toolExecutor = toolExecutor;
        this.taskPlans = taskPlans;
        this.progressTracker = progressTracker;
        this.cursors = cursors;
        this.recorder = recorder;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Map<String, Object> apply(LedgerState state, KeyValueStore callerStore) {
        String planId = state.planId();
        String threadId = state.threadId();
        MdcContext.setPlan(planId, threadId);
        try {
            KeyValueStore store = storeResolver.resolve(callerStore);

            Optional<PlanProgress> found = progressTracker.get(planId);
            if (found.isEmpty()) {
                log.debug("No progress for plan '{}' yet, nothing to execute", planId);
                return outcome(StepOutcome.IDLE, 0, 0);
            }

            if (!cursors.exists(store, planId)) {
                progressTracker.resetToFirstBatch(planId);
                cursors.reset(store, planId, 0);
                found = progressTracker.get(planId);
            }
            PlanProgress progress = found.orElseThrow();

            if (progress.status() == PlanStatus.PAUSED) {
                log.info("Plan '{}' is paused", planId);
                return outcome(StepOutcome.PAUSED, progress.currentBatchIndex(), 0);
            }
            if (progress.status().isTerminal()) {
                return finished(progress);
            }
            if (progress.status() == PlanStatus.PLANNING) {
                progress = progressTracker.transition(planId, PlanStatus.RUNNING);
            }
            if (progress.isFinished()) {
                progressTracker.transition(planId, PlanStatus.COMPLETED);
                log.info("Plan '{}' executed all {} batches", planId, progress.totalBatches());
                return finished(progress);
            }

            int batchIndex = progress.currentBatchIndex();
            MdcContext.setBatch(planId, batchIndex);
            List<TaskPlan> tasks = taskPlans.getByBatch(planId, batchIndex);
            if (tasks.isEmpty()) {
                log.debug("Batch {} of plan '{}' has no tasks yet, waiting for the planner", batchIndex, planId);
                return outcome(StepOutcome.WAITING, batchIndex, 0);
            }

            ExecutionCursor cursor = cursors.load(store, planId, batchIndex);
            if (cursor.taskIndex() >= tasks.size()) {
                return settleBatch(store, planId, batchIndex, tasks);
            }

            TaskPlan task = tasks.get(cursor.taskIndex());
            MdcContext.setTask(planId, batchIndex, task.taskId());

            Set<String> known = toolCatalog.listTools().stream()
                    .map(ToolDescriptor::name)
                    .collect(Collectors.toSet());
            if (!known.contains(task.toolName())) {
                taskPlans.updateStatus(task.taskId(), TaskStatus.FAILED, null, "Tool not found: " + task.toolName());
                ExecutionCursor next = cursors.advance(store, planId);
                log.warn("Task '{}' targets unknown tool '{}', marked failed", task.taskId(), task.toolName());
                return taskOutcome(StepOutcome.TOOL_NOT_FOUND, batchIndex, next.taskIndex(), task.taskId());
            }

            return execute(store, planId, threadId, batchIndex, task);
        } finally {
            MdcContext.clear();
        }
    }

    private Map<String, Object> execute(KeyValueStore store, String planId, String threadId,
                                        int batchIndex, TaskPlan task) {
        taskPlans.updateStatus(task.taskId(), TaskStatus.RUNNING, null, null);
        TaskTest running = recorder.openAttempt(task.taskId(), threadId, task.toolName(), task.parameters());
        cursors.bindTestId(store, planId, running.testId());

        long start = clock.millis();
        ToolExecutionResult result;
        try {
            result = toolExecutor.execute(task);
            if (result == null) {
                result = ToolExecutionResult.failure("Tool executor returned no result");
            } else if (result.success()) {
                result = ToolExecutionResult.inferFrom(result.output());
            }
        } catch (RuntimeException e) {
            log.warn("Tool '{}' threw while executing task '{}': {}", task.toolName(), task.taskId(), e.getMessage());
            result = ToolExecutionResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        long elapsed = clock.millis() - start;
        metrics.recordTaskExecution(task.toolName(), elapsed);

        List<TaskTest> recorded = recorder.recordResult(running, result, elapsed);
        boolean failed = !result.success() || TaskTestRecorder.anyFailed(recorded);

        ObjectNode record = objectMapper.createObjectNode();
        record.put("taskId", task.taskId());
        record.put("toolName", task.toolName());
        record.set("toolArgs", task.parameters().toJson());
        record.set("result", result.output());
        record.put("timestamp", clock.instant().toString());
        store.put(namespaces.testResults(planId, batchIndex), task.taskId(), record);

        ObjectNode planResult = objectMapper.createObjectNode();
        planResult.set("args", task.parameters().toJson());
        planResult.set("output", result.output());
        taskPlans.updateStatus(task.taskId(), failed ? TaskStatus.FAILED : TaskStatus.COMPLETED, planResult,
                failed ? errorText(result) : null);

        ExecutionCursor next = cursors.advance(store, planId);
        log.info("Task '{}' {} in {} ms ({} test rows)", task.taskId(), failed ? "failed" : "completed",
                elapsed, recorded.size());
        return taskOutcome(StepOutcome.EXECUTED, batchIndex, next.taskIndex(), task.taskId());
    }

    private Map<String, Object> settleBatch(KeyValueStore store, String planId, int batchIndex,
                                            List<TaskPlan> tasks) {
        boolean anyFailed = tasks.stream().anyMatch(t -> t.status() == TaskStatus.FAILED);
        OptionalInt settled = progressTracker.settleBatch(planId, batchIndex, anyFailed);
        int next;
        if (settled.isPresent()) {
            next = settled.getAsInt();
            metrics.recordBatchOutcome(anyFailed);
            metrics.recordBatchAdvance("executor");
            log.info("Batch {} of plan '{}' settled as {}, moving to batch {}", batchIndex, planId,
                    anyFailed ? "failed" : "completed", next);
        } else {
            next = progressTracker.get(planId).map(PlanProgress::currentBatchIndex).orElse(batchIndex);
        }
        cursors.reset(store, planId, next);
        return outcome(StepOutcome.BATCH_ADVANCED, next, 0);
    }

    private Map<String, Object> finished(PlanProgress progress) {
        return Map.of(
                "batchIndex", progress.currentBatchIndex(),
                "taskIndex", 0,
                "lastOutcome", StepOutcome.FINISHED.name(),
                "planFinished", true);
    }

    private static Map<String, Object> outcome(StepOutcome outcome, int batchIndex, int taskIndex) {
        return Map.of(
                "batchIndex", batchIndex,
                "taskIndex", taskIndex,
                "lastOutcome", outcome.name(),
                "planFinished", false);
    }

    private static Map<String, Object> taskOutcome(StepOutcome outcome, int batchIndex, int taskIndex, String taskId) {
        return Map.of(
                "batchIndex", batchIndex,
                "taskIndex", taskIndex,
                "lastTaskId", taskId,
                "lastOutcome", outcome.name(),
                "planFinished", false);
    }

    private static String errorText(ToolExecutionResult result) {
        if (result.errorMessage() != null) {
            return result.errorMessage();
        }
        return result.output() != null ? result.output().toString() : "Tool call failed";
    }
}
