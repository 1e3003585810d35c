package com.brainstorm.orchestrator.storage.impl;

import com.brainstorm.orchestrator.model.context.DocumentSummary;
import com.brainstorm.orchestrator.storage.DocumentStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, List<DocumentSummary>> documents = new ConcurrentHashMap<>();

    @Override
    public List<DocumentSummary> fetchForProject(String projectId) {
        return List.copyOf(documents.getOrDefault(projectId, List.of()));
    }

    public void save(String projectId, DocumentSummary document) {
        documents.computeIfAbsent(projectId, id -> new CopyOnWriteArrayList<>()).add(document);
    }
}
