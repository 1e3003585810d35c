package com.brainstorm.orchestrator.model.project;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of a project's items, fetched fresh for every turn.
 */
@Value
@Builder(toBuilder = true)
public class ProjectState {

    String id;

    @Singular
    List<Item> items;

    long revision;

    public static ProjectState empty(String projectId) {
        return ProjectState.builder().id(projectId).revision(0).build();
    }

    public List<Item> activeItems() {
        return items.stream().filter(Item::isActive).toList();
    }

    public List<Item> activeItems(ItemState state) {
        return items.stream()
                .filter(Item::isActive)
                .filter(item -> item.getState() == state)
                .toList();
    }

    /**
     * Returns a new snapshot with the given items appended. The revision only
     * moves when something was actually added.
     */
    public ProjectState withAppended(List<Item> added) {
        if (added == null || added.isEmpty()) {
            return this;
        }
        List<Item> merged = new ArrayList<>(items);
        merged.addAll(added);
        return ProjectState.builder()
                .id(id)
                .items(merged)
                .revision(revision + 1)
                .build();
    }
}
