package com.taskledger.core.config;

import com.taskledger.core.collaborator.ToolExecutor;
import com.taskledger.core.graph.ExecutionGraph;
import com.taskledger.core.graph.PlanningGraph;
import com.taskledger.core.health.HealthCheckService;
import com.taskledger.core.memory.DualStoreResolver;
import com.taskledger.core.memory.StoreDurability;
import com.taskledger.core.model.TaskComplexity;
import com.taskledger.core.model.TaskPlan;
import com.taskledger.core.persistence.InMemoryPlanProgressRepository;
import com.taskledger.core.persistence.InMemoryTaskPlanRepository;
import com.taskledger.core.persistence.InMemoryTaskTestRepository;
import com.taskledger.core.persistence.PlanProgressRepository;
import com.taskledger.core.persistence.TaskPlanRepository;
import com.taskledger.core.persistence.TaskTestRepository;
import com.taskledger.core.state.StepOutcome;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application without a database and checks the in-memory wiring.
 */
@SpringBootTest(properties = "taskledger.planning.tools-per-batch=3")
@ActiveProfiles("memory")
class StoreConfigTest {

    @Autowired
    private DualStoreResolver resolver;

    @Autowired
    private TaskPlanRepository taskPlans;

    @Autowired
    private TaskTestRepository taskTests;

    @Autowired
    private PlanProgressRepository planProgress;

    @Autowired
    private BaseCheckpointSaver checkpointSaver;

    @Autowired
    private TaskLedgerProperties properties;

    @Autowired
    private ExecutionGraph executionGraph;

    @Autowired
    private PlanningGraph planningGraph;

    @Autowired
    private ToolExecutor toolExecutor;

    @Autowired
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("without a DataSource every store is in memory")
    void inMemoryStores() {
        assertEquals(StoreDurability.EPHEMERAL, resolver.durableStore().durability());
        assertFalse(resolver.isForceDurable());
        assertInstanceOf(InMemoryTaskPlanRepository.class, taskPlans);
        assertInstanceOf(InMemoryTaskTestRepository.class, taskTests);
        assertInstanceOf(InMemoryPlanProgressRepository.class, planProgress);
        assertInstanceOf(MemorySaver.class, checkpointSaver);
    }

    @Test
    @DisplayName("properties bind from configuration")
    void propertiesBind() {
        assertEquals(3, properties.getPlanning().getToolsPerBatch());
        assertEquals("tool-tester", properties.getNamespace().getAgentType());
    }

    @Test
    @DisplayName("the default executor fails every task")
    void defaultExecutor() {
        var task = TaskPlan.planned("p", 0, "p-0-1", "list_tables", "", null, TaskComplexity.LOW, false);

        var result = toolExecutor.execute(task);

        assertFalse(result.success());
        assertTrue(result.errorMessage().contains("list_tables"));
    }

    @Test
    @DisplayName("the graphs run against the configured beans")
    void graphsRun() {
        assertEquals(Optional.of(StepOutcome.IDLE), executionGraph.runUntilIdle("unknown-plan", "w", 3));
        assertEquals(1, planningGraph.planAll("empty-plan", "w", 3));
        assertEquals(3, healthCheckService.checkAll().size());
    }
}
