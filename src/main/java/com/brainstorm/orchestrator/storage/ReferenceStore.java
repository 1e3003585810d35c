package com.brainstorm.orchestrator.storage;

import com.brainstorm.orchestrator.model.context.ReferenceSummary;

import java.util.List;

public interface ReferenceStore {

    List<ReferenceSummary> fetchForProject(String projectId);
}
