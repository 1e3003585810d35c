package com.brainstorm.orchestrator.exception;

import com.brainstorm.orchestrator.workflow.Intent;
import lombok.Getter;

/**
 * Raised when a workflow table entry is invalid, or when a turn resolves to an
 * intent that has no registered workflow.
 */
@Getter
public class ConfigException extends RuntimeException {

    private final Intent intent;

    public ConfigException(String message) {
        this(message, null);
    }

    public ConfigException(String message, Intent intent) {
        super(message);
        this.intent = intent;
    }
}
