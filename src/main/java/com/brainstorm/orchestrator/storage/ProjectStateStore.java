package com.brainstorm.orchestrator.storage;

import com.brainstorm.orchestrator.model.project.Item;
import com.brainstorm.orchestrator.model.project.ProjectState;

import java.util.List;

/**
 * Durable home of project items.
 *
 * {@link #append} must be idempotent and commutative by item id, so two turns
 * appending to the same snapshot never lose each other's items.
 */
public interface ProjectStateStore {

    /**
     * @return the current state, or an empty state for an unknown project
     */
    ProjectState fetch(String projectId);

    /**
     * @return the state after the append
     */
    ProjectState append(String projectId, List<Item> items);
}
