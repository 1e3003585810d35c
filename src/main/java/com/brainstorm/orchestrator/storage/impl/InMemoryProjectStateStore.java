package com.brainstorm.orchestrator.storage.impl;

import com.brainstorm.orchestrator.model.project.Item;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.storage.ProjectStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Appends merge by item id under the map's per-key lock.
 */
@Slf4j
@Component
public class InMemoryProjectStateStore implements ProjectStateStore {

    private final Map<String, ProjectState> projects = new ConcurrentHashMap<>();

    @Override
    public ProjectState fetch(String projectId) {
        return projects.getOrDefault(projectId, ProjectState.empty(projectId));
    }

    @Override
    public ProjectState append(String projectId, List<Item> items) {
        return projects.compute(projectId, (id, current) -> {
            ProjectState base = current != null ? current : ProjectState.empty(id);
            Set<String> known = new HashSet<>();
            base.getItems().forEach(item -> known.add(item.getId()));

            List<Item> fresh = new ArrayList<>();
            for (Item item : items) {
                if (known.add(item.getId())) {
                    fresh.add(item);
                }
            }
            if (fresh.size() < items.size()) {
                log.debug("Ignored {} already-stored item(s) for {}", items.size() - fresh.size(), id);
            }
            return base.withAppended(fresh);
        });
    }
}
