package com.taskledger.core.collaborator;

import java.util.List;

/**
 * Source of the tools to plan tasks for. The order of the returned list must be stable
 * between calls so that batch slices stay aligned.
 */
@FunctionalInterface
public interface ToolCatalogProvider {

    List<ToolDescriptor> listTools();
}
