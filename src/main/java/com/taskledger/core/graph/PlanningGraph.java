package com.taskledger.core.graph;

import com.taskledger.core.memory.KeyValueStore;
import com.taskledger.core.nodes.PlanBatchNode;
import com.taskledger.core.state.LedgerState;
import com.taskledger.core.state.StepOutcome;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Compiled LangGraph4j graph that plans one batch per invocation:
 * <pre>
 *   START -> plan_batch -> END
 * </pre>
 * Callers loop over {@link #step} (or use {@link #planAll}) until the plan is finished.
 */
@Component
public class PlanningGraph {

    private static final Logger log = LoggerFactory.getLogger(PlanningGraph.class);

    private final CompiledGraph<LedgerState> compiledGraph;

    public PlanningGraph(PlanBatchNode planBatchNode,
                         @Autowired(required = false) BaseCheckpointSaver checkpointSaver,
                         @Autowired(required = false) @Qualifier("runtimeKeyValueStore") KeyValueStore runtimeStore)
            throws Exception {

        var graph = new StateGraph<>(LedgerState.SCHEMA, LedgerState::new)
                .addNode("plan_batch", node_async(state -> planBatchNode.apply(state, runtimeStore)))
                .addEdge(START, "plan_batch")
                .addEdge("plan_batch", END);

        var configBuilder = CompileConfig.builder();
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Planning graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Planning graph compiled without checkpoint saver");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
    }

    /**
     * Plans the current batch of {@code planId}.
     */
    public Optional<LedgerState> step(String planId, String threadId) {
        var config = RunnableConfig.builder().threadId("planner:" + planId).build();
        return compiledGraph.invoke(Map.of("planId", planId, "threadId", threadId), config);
    }

    /**
     * Plans batches until every batch is planned or {@code maxSteps} steps ran.
     *
     * @return number of steps executed
     */
    public int planAll(String planId, String threadId, int maxSteps) {
        int steps = 0;
        while (steps < maxSteps) {
            Optional<LedgerState> result = step(planId, threadId);
            steps++;
            if (result.isEmpty() || result.get().planFinished()
                    || result.get().lastOutcome() == StepOutcome.FINISHED) {
                break;
            }
        }
        log.info("Planning of plan '{}' ran {} steps", planId, steps);
        return steps;
    }

    public CompiledGraph<LedgerState> getCompiledGraph() {
        return compiledGraph;
    }
}
