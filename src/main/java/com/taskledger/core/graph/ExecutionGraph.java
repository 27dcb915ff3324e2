package com.taskledger.core.graph;

import com.taskledger.core.memory.KeyValueStore;
import com.taskledger.core.nodes.ExecuteTaskNode;
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

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Compiled LangGraph4j graph that executes one task (or settles one batch) per invocation:
 * <pre>
 *   START -> execute_task -> END
 * </pre>
 */
@Component
public class ExecutionGraph {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGraph.class);

    private static final Set<StepOutcome> STOPPING = EnumSet.of(
            StepOutcome.FINISHED, StepOutcome.PAUSED, StepOutcome.IDLE, StepOutcome.WAITING);

    private final CompiledGraph<LedgerState> compiledGraph;

    public ExecutionGraph(ExecuteTaskNode executeTaskNode,
                          @Autowired(required = false) BaseCheckpointSaver checkpointSaver,
                          @Autowired(required = false) @Qualifier("runtimeKeyValueStore") KeyValueStore runtimeStore)
            throws Exception {

        var graph = new StateGraph<>(LedgerState.SCHEMA, LedgerState::new)
                .addNode("execute_task", node_async(state -> executeTaskNode.apply(state, runtimeStore)))
                .addEdge(START, "execute_task")
                .addEdge("execute_task", END);

        var configBuilder = CompileConfig.builder();
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Execution graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Execution graph compiled without checkpoint saver");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
    }

    public Optional<LedgerState> step(String planId, String threadId) {
        var config = RunnableConfig.builder().threadId("executor:" + planId).build();
        return compiledGraph.invoke(Map.of("planId", planId, "threadId", threadId), config);
    }

    /**
     * Executes steps until the plan finishes, pauses, runs out of planned work or
     * {@code maxSteps} steps ran.
     *
     * @return the outcome of the last step, or empty if no step produced a state
     */
    public Optional<StepOutcome> runUntilIdle(String planId, String threadId, int maxSteps) {
        StepOutcome last = null;
        for (int steps = 0; steps < maxSteps; steps++) {
            Optional<LedgerState> result = step(planId, threadId);
            if (result.isEmpty()) {
                break;
            }
            last = result.get().lastOutcome();
            if (last == null || STOPPING.contains(last)) {
                break;
            }
        }
        log.info("Execution of plan '{}' stopped with {}", planId, last);
        return Optional.ofNullable(last);
    }

    public CompiledGraph<LedgerState> getCompiledGraph() {
        return compiledGraph;
    }
}
