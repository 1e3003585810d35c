package com.brainstorm.orchestrator.storage;

import com.brainstorm.orchestrator.model.context.DocumentSummary;

import java.util.List;

public interface DocumentStore {

    List<DocumentSummary> fetchForProject(String projectId);
}
