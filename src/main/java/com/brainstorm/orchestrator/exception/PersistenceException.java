package com.brainstorm.orchestrator.exception;

import lombok.Getter;

/**
 * The synchronous item append for a turn could not be durably recorded.
 */
@Getter
public class PersistenceException extends RuntimeException {

    private final String projectId;

    public PersistenceException(String projectId, String message, Throwable cause) {
        super(message, cause);
        this.projectId = projectId;
    }
}
