package com.taskledger.core.collaborator;

import java.util.List;

/**
 * Produces candidate tasks for one batch of tools, typically by prompting a language model.
 */
@FunctionalInterface
public interface PlanGenerator {

    List<CandidateTask> generate(PlanningRequest request);
}
