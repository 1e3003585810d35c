package com.brainstorm.orchestrator.service;

import com.brainstorm.orchestrator.exception.PersistenceException;
import com.brainstorm.orchestrator.model.dto.TurnResult;

/**
 * Entry point for one conversation turn.
 */
public interface CoordinationService {

    /**
     * Classifies the message, runs the matching workflow and merges its
     * effects into the project.
     *
     * @return at least one user-facing message, the generic fallback when
     *         nothing else applies
     * @throws PersistenceException when newly recorded items could not be stored
     */
    TurnResult process(String userMessage, String projectId, String userId);
}
