package com.taskledger.core.config;

import com.taskledger.core.collaborator.PlanGenerator;
import com.taskledger.core.collaborator.ToolCatalogProvider;
import com.taskledger.core.collaborator.ToolExecutionResult;
import com.taskledger.core.collaborator.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Placeholder collaborators used until the host application provides real ones.
 * With these in place the workers start but find no tools and plan nothing.
 */
@Configuration
public class CollaboratorDefaults {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorDefaults.class);

    @Bean
    @ConditionalOnMissingBean(ToolCatalogProvider.class)
    public ToolCatalogProvider emptyToolCatalog() {
        log.warn("No ToolCatalogProvider configured; the tool catalog is empty");
        return List::of;
    }

    @Bean
    @ConditionalOnMissingBean(PlanGenerator.class)
    public PlanGenerator emptyPlanGenerator() {
        log.warn("No PlanGenerator configured; planning produces no tasks");
        return request -> List.of();
    }

    @Bean
    @ConditionalOnMissingBean(ToolExecutor.class)
    public ToolExecutor unavailableToolExecutor() {
        return task -> ToolExecutionResult.failure("No tool executor configured for '" + task.toolName() + "'");
    }
}
