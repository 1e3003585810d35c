package com.brainstorm.orchestrator.model.dto;

import com.brainstorm.orchestrator.model.activity.ActivityEvent;
import com.brainstorm.orchestrator.model.project.Item;
import com.brainstorm.orchestrator.model.project.ProjectState;
import lombok.Value;

import java.util.List;

@Value
public class Reconciliation {

    ProjectState state;
    List<ActivityEvent> events;

    /**
     * Items appended by this reconciliation, in the order they were added.
     */
    List<Item> addedItems;

    public boolean hasChanges() {
        return !addedItems.isEmpty();
    }
}
