package com.taskledger.core.health;

import com.taskledger.core.graph.ExecutionGraph;
import com.taskledger.core.graph.PlanningGraph;
import com.taskledger.core.memory.DualStoreResolver;
import com.taskledger.core.memory.StoreDurability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DualStoreResolver storeResolver;
    private final DataSource dataSource;
    private final PlanningGraph planningGraph;
    private final ExecutionGraph executionGraph;

    public HealthCheckService(
            DualStoreResolver storeResolver,
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) PlanningGraph planningGraph,
            @Autowired(required = false) ExecutionGraph executionGraph) {
        this.storeResolver = storeResolver;
        this.dataSource = dataSource;
        this.planningGraph = planningGraph;
        this.executionGraph = executionGraph;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkDatabase());
        results.add(checkGraphs());
        return results;
    }

    HealthStatus checkStore() {
        var durable = storeResolver.durableStore();
        var metadata = Map.of(
                "implementation", durable.getClass().getSimpleName(),
                "forceDurable", String.valueOf(storeResolver.isForceDurable()));
        if (durable.durability() == StoreDurability.DURABLE) {
            return new HealthStatus("store", HealthStatus.Status.UP,
                    "Durable store available", metadata);
        }
        // Works for a single process, but progress is neither shared nor kept across restarts.
        return new HealthStatus("store", HealthStatus.Status.DEGRADED,
                "Only an in-memory store is configured", metadata);
    }

    HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured; using in-memory stores", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkGraphs() {
        if (planningGraph != null && executionGraph != null) {
            return new HealthStatus("graphs", HealthStatus.Status.UP,
                    "Planning and execution graphs compiled", Map.of());
        }
        if (planningGraph == null && executionGraph == null) {
            return new HealthStatus("graphs", HealthStatus.Status.DOWN,
                    "No graphs available", Map.of());
        }
        String missing = planningGraph == null ? "planning" : "execution";
        return new HealthStatus("graphs", HealthStatus.Status.DEGRADED,
                "The " + missing + " graph is not available", Map.of());
    }
}
