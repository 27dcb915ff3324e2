package com.taskledger.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger configuration bound from {@code taskledger.*}.
 */
@ConfigurationProperties(prefix = "taskledger")
public class TaskLedgerProperties {

    private NamespaceProperties namespace = new NamespaceProperties();
    private Planning planning = new Planning();
    private Store store = new Store();
    private Memory memory = new Memory();

    public NamespaceProperties getNamespace() { return namespace; }
    public void setNamespace(NamespaceProperties namespace) { this.namespace = namespace; }

    public Planning getPlanning() { return planning; }
    public void setPlanning(Planning planning) { this.planning = planning; }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory; }

    /** Scope segments shared by every namespace the workers write to. */
    public static class NamespaceProperties {
        private String project = "default";
        private String environment = "dev";
        private String agentType = "tool-tester";

        public String getProject() { return project; }
        public void setProject(String project) { this.project = project; }

        public String getEnvironment() { return environment; }
        public void setEnvironment(String environment) { this.environment = environment; }

        public String getAgentType() { return agentType; }
        public void setAgentType(String agentType) { this.agentType = agentType; }
    }

    public static class Planning {
        /** Number of tools planned per batch */
        private int toolsPerBatch = 5;

        public int getToolsPerBatch() { return toolsPerBatch; }
        public void setToolsPerBatch(int toolsPerBatch) { this.toolsPerBatch = toolsPerBatch; }
    }

    public static class Store {
        /** Ignore caller-supplied stores and always use the durable one */
        private boolean forceDurable = false;

        public boolean isForceDurable() { return forceDurable; }
        public void setForceDurable(boolean forceDurable) { this.forceDurable = forceDurable; }
    }

    public static class Memory {
        /** Delay between sweeps of expired memory items */
        private Duration cleanupInterval = Duration.ofMinutes(10);

        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    }
}
