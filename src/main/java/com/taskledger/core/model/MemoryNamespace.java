package com.taskledger.core.model;

import java.util.ArrayList;

/**
 * Deployment scope shared by cooperating workers.
 *
 * @param project     project name
 * @param environment deployment environment (e.g. "dev", "prod")
 * @param agentType   kind of worker the memory belongs to
 * @param sessionId   optional session scope; {@code null} for project-wide memory
 */
public record MemoryNamespace(
    String project,
    String environment,
    String agentType,
    String sessionId
) {

    public MemoryNamespace(String project, String environment, String agentType) {
        this(project, environment, agentType, null);
    }

    public Namespace toNamespace() {
        var path = new ArrayList<String>();
        path.add(project);
        path.add(environment);
        path.add(agentType);
        if (sessionId != null && !sessionId.isBlank()) {
            path.add(sessionId);
        }
        return new Namespace(path);
    }
}
