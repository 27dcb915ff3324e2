package com.taskledger.core.nodes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskledger.core.collaborator.CandidateTask;
import com.taskledger.core.collaborator.PlanGenerator;
import com.taskledger.core.collaborator.PlanningRequest;
import com.taskledger.core.collaborator.ToolCatalogProvider;
import com.taskledger.core.collaborator.ToolDescriptor;
import com.taskledger.core.config.TaskLedgerProperties;
import com.taskledger.core.logging.MdcContext;
import com.taskledger.core.memory.DualStoreResolver;
import com.taskledger.core.memory.KeyValueStore;
import com.taskledger.core.memory.LedgerNamespaces;
import com.taskledger.core.metrics.LedgerMetrics;
import com.taskledger.core.model.JsonPayloads;
import com.taskledger.core.model.MemoryItem;
import com.taskledger.core.model.Namespace;
import com.taskledger.core.model.PlanProgress;
import com.taskledger.core.model.PlanningMeta;
import com.taskledger.core.model.TaskComplexity;
import com.taskledger.core.model.TaskPlan;
import com.taskledger.core.persistence.TaskIds;
import com.taskledger.core.persistence.TaskPlanRepository;
import com.taskledger.core.progress.BatchProgressTracker;
import com.taskledger.core.state.LedgerState;
import com.taskledger.core.state.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plans one batch of tools per invocation.
 * <p>
 * Initialises batch progress on the first run (or resizes it when the tool catalog changed),
 * skips batches that already have tasks, asks the {@link PlanGenerator} for candidate tasks,
 * persists them in one transaction and advances to the next batch.
 */
@Component
public class PlanBatchNode {

    private static final Logger log = LoggerFactory.getLogger(PlanBatchNode.class);

    private final DualStoreResolver storeResolver;
    private final LedgerNamespaces namespaces;
    private final ToolCatalogProvider toolCatalog;
    private final PlanGenerator planGenerator;
    private final TaskPlanRepository taskPlans;
    private final BatchProgressTracker progressTracker;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final int toolsPerBatch;

    public PlanBatchNode(DualStoreResolver storeResolver, LedgerNamespaces namespaces,
                         ToolCatalogProvider toolCatalog, PlanGenerator planGenerator,
                         TaskPlanRepository taskPlans, BatchProgressTracker progressTracker,
                         LedgerMetrics metrics, ObjectMapper objectMapper,
                         TaskLedgerProperties properties) {
        this.storeResolver = storeResolver;
        this.namespaces = namespaces;
        this.toolCatalog = toolCatalog;
        this.planGenerator = planGenerator;
        this.taskPlans = taskPlans;
        this.progressTracker = progressTracker;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.toolsPerBatch = properties.getPlanning().getToolsPerBatch();
    }

    public Map<String, Object> apply(LedgerState state, KeyValueStore callerStore) {
        String planId = state.planId();
        MdcContext.setPlan(planId, state.threadId());
        try {
            KeyValueStore store = storeResolver.resolve(callerStore);
            Namespace ns = namespaces.plans(planId);
            List<ToolDescriptor> tools = toolCatalog.listTools();

            PlanProgress progress = ensureProgress(store, ns, planId, tools.size());
            if (progress.isFinished()) {
                log.info("All {} batches of plan '{}' are planned", progress.totalBatches(), planId);
                return Map.of(
                        "batchIndex", progress.currentBatchIndex(),
                        "lastOutcome", StepOutcome.FINISHED.name(),
                        "planFinished", true);
            }

            int batchIndex = progress.currentBatchIndex();
            MdcContext.setBatch(planId, batchIndex);

            List<TaskPlan> existing = taskPlans.getByBatch(planId, batchIndex);
            if (!existing.isEmpty()) {
                int next = progressTracker.advance(planId);
                metrics.recordBatchAdvance("planner");
                log.info("Batch {} of plan '{}' already has {} tasks, skipping to batch {}",
                        batchIndex, planId, existing.size(), next);
                return Map.of(
                        "batchIndex", next,
                        "plannedTaskIds", taskIds(existing),
                        "lastOutcome", StepOutcome.SKIPPED.name(),
                        "planFinished", next >= progress.totalBatches());
            }

            int from = Math.min(batchIndex * toolsPerBatch, tools.size());
            int to = Math.min(from + toolsPerBatch, tools.size());
            List<ToolDescriptor> slice = List.copyOf(tools.subList(from, to));

            JsonNode priorContext = store.get(ns, LedgerNamespaces.PLANNING_CONTEXT_KEY)
                    .map(MemoryItem::value)
                    .orElse(null);
            store.put(ns, LedgerNamespaces.PLANNING_CONTEXT_KEY, planningContext(batchIndex, slice));

            List<CandidateTask> candidates = planGenerator.generate(
                    new PlanningRequest(planId, batchIndex, slice, priorContext));
            List<TaskPlan> tasks = toTaskPlans(planId, batchIndex, candidates != null ? candidates : List.of(), existing);
            if (tasks.isEmpty()) {
                log.warn("Generator produced no tasks for batch {} of plan '{}'", batchIndex, planId);
            }
            taskPlans.saveBatch(planId, tasks);
            metrics.recordTasksPlanned(tasks.size());

            int next = progressTracker.advance(planId);
            metrics.recordBatchAdvance("planner");
            log.info("Planned {} tasks for batch {} of plan '{}', next batch {}", tasks.size(), batchIndex, planId, next);

            return Map.of(
                    "batchIndex", next,
                    "plannedTaskIds", taskIds(tasks),
                    "lastOutcome", StepOutcome.PLANNED.name(),
                    "planFinished", next >= progress.totalBatches());
        } finally {
            MdcContext.clear();
        }
    }

    private PlanProgress ensureProgress(KeyValueStore store, Namespace ns, String planId, int totalTools) {
        var meta = new PlanningMeta(toolsPerBatch, totalTools);
        Optional<PlanProgress> current = progressTracker.get(planId);
        if (current.isEmpty()) {
            PlanProgress created = progressTracker.initialize(planId, toolsPerBatch, totalTools);
            writeMeta(store, ns, meta);
            return created;
        }
        Optional<PlanningMeta> stored = readMeta(store, ns);
        if (stored.isEmpty() || !stored.get().equals(meta)) {
            log.info("Tool catalog of plan '{}' changed ({} -> {}), resizing batches", planId,
                    stored.map(PlanningMeta::totalTools).orElse(-1), totalTools);
            PlanProgress resized = progressTracker.resize(planId, toolsPerBatch, totalTools);
            writeMeta(store, ns, meta);
            return resized;
        }
        return current.get();
    }

    private Optional<PlanningMeta> readMeta(KeyValueStore store, Namespace ns) {
        Optional<MemoryItem> item = store.get(ns, LedgerNamespaces.TOOL_BATCH_KEY);
        if (item.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.treeToValue(item.get().value(), PlanningMeta.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable planning meta in {}, treating it as missing: {}", ns, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeMeta(KeyValueStore store, Namespace ns, PlanningMeta meta) {
        store.put(ns, LedgerNamespaces.TOOL_BATCH_KEY, objectMapper.valueToTree(meta));
    }

    private ObjectNode planningContext(int batchIndex, List<ToolDescriptor> slice) {
        ObjectNode context = objectMapper.createObjectNode();
        context.put("batchIndex", batchIndex);
        ArrayNode toolNames = context.putArray("tools");
        slice.forEach(tool -> toolNames.add(tool.name()));
        return context;
    }

    List<TaskPlan> toTaskPlans(String planId, int batchIndex, List<CandidateTask> candidates,
                               List<TaskPlan> existing) {
        String prefixBase = TaskIds.sanitize(planId);
        int seq = maxSequence(existing, prefixBase + "-" + batchIndex + "-");
        int lastSeq = seq + candidates.size();
        int suffixLength = ("-" + batchIndex + "-" + lastSeq).length();
        String safePlanId = prefixBase.length() + suffixLength > TaskIds.MAX_LENGTH
                ? prefixBase.substring(0, TaskIds.MAX_LENGTH - suffixLength)
                : prefixBase;

        List<TaskPlan> tasks = new ArrayList<>();
        for (CandidateTask candidate : candidates) {
            String taskId = safePlanId + "-" + batchIndex + "-" + (++seq);
            tasks.add(TaskPlan.planned(planId, batchIndex, taskId,
                    candidate.toolName() != null ? candidate.toolName() : "",
                    candidate.description(),
                    JsonPayloads.normalize(candidate.parameters(), objectMapper),
                    complexityOf(candidate),
                    candidate.requiresValidation()));
        }
        return tasks;
    }

    private static int maxSequence(List<TaskPlan> existing, String prefix) {
        int max = 0;
        for (TaskPlan task : existing) {
            if (task.taskId().startsWith(prefix)) {
                try {
                    max = Math.max(max, Integer.parseInt(task.taskId().substring(prefix.length())));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric task id '{}' when numbering", task.taskId());
                }
            }
        }
        return max;
    }

    private static TaskComplexity complexityOf(CandidateTask candidate) {
        String raw = candidate.complexity();
        if (raw == null || raw.isBlank()) {
            return TaskComplexity.MEDIUM;
        }
        try {
            return TaskComplexity.fromValue(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown complexity '{}' for tool '{}', using medium", raw, candidate.toolName());
            return TaskComplexity.MEDIUM;
        }
    }

    private static List<String> taskIds(List<TaskPlan> tasks) {
        return tasks.stream().map(TaskPlan::taskId).toList();
    }
}
