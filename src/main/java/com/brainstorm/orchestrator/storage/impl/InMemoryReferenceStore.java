package com.brainstorm.orchestrator.storage.impl;

import com.brainstorm.orchestrator.model.context.ReferenceSummary;
import com.brainstorm.orchestrator.storage.ReferenceStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryReferenceStore implements ReferenceStore {

    private final Map<String, List<ReferenceSummary>> references = new ConcurrentHashMap<>();

    @Override
    public List<ReferenceSummary> fetchForProject(String projectId) {
        return List.copyOf(references.getOrDefault(projectId, List.of()));
    }

    public void save(String projectId, ReferenceSummary reference) {
        references.computeIfAbsent(projectId, id -> new CopyOnWriteArrayList<>()).add(reference);
    }
}
