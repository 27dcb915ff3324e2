package com.taskledger.core.memory;

import com.taskledger.core.config.TaskLedgerProperties;
import com.taskledger.core.model.MemoryNamespace;
import com.taskledger.core.model.Namespace;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives the key-value namespaces used by the planning and execution workers from the
 * configured project, environment and agent type.
 */
@Component
public class LedgerNamespaces {

    public static final String PLANS = "plans";
    public static final String TEST_RESULTS = "test-results";

    /** Execution cursor of a plan. */
    public static final String EXECUTE_PROGRESS_KEY = "executeProgress";
    /** Batch sizing used by the planner. */
    public static final String TOOL_BATCH_KEY = "toolBatch";
    /** Tools and batch index handed to the plan generator. */
    public static final String PLANNING_CONTEXT_KEY = "planningContext";

    private final MemoryNamespace scope;

    @Autowired
    public LedgerNamespaces(TaskLedgerProperties properties) {
        this(new MemoryNamespace(
                properties.getNamespace().getProject(),
                properties.getNamespace().getEnvironment(),
                properties.getNamespace().getAgentType()));
    }

    public LedgerNamespaces(MemoryNamespace scope) {
        this.scope = scope;
    }

    public MemoryNamespace scope() {
        return scope;
    }

    /** {@code [plans, project, environment, agentType, planId]} */
    public Namespace plans(String planId) {
        return Namespace.of(PLANS, scope.project(), scope.environment(), scope.agentType(), planId);
    }

    /** {@code [test-results, project, environment, agentType, planId, batch-<n>]} */
    public Namespace testResults(String planId, int batchIndex) {
        return Namespace.of(TEST_RESULTS, scope.project(), scope.environment(), scope.agentType(),
                planId, "batch-" + batchIndex);
    }

    /**
     * Session-scoped memory namespace for ad-hoc worker memory.
     */
    public Namespace session(String sessionId) {
        return new MemoryNamespace(scope.project(), scope.environment(), scope.agentType(), sessionId)
                .toNamespace();
    }
}
