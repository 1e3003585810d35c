package com.brainstorm.orchestrator.workflow.state;

import com.brainstorm.orchestrator.exception.CapabilityException;
import lombok.Value;

/**
 * Failure captured for a single step. Never escalated past the orchestrator.
 */
@Value
public class StepError {

    Kind kind;
    String message;

    public enum Kind {
        TIMEOUT,
        INVALID_RESPONSE,
        UPSTREAM_FAILURE,
        MISSING_CAPABILITY,
        UNEXPECTED
    }

    public static StepError of(Kind kind, String message) {
        return new StepError(kind, message);
    }

    public static StepError from(CapabilityException e) {
        Kind kind = switch (e.getKind()) {
            case TIMEOUT -> Kind.TIMEOUT;
            case INVALID_RESPONSE -> Kind.INVALID_RESPONSE;
            case UPSTREAM_FAILURE -> Kind.UPSTREAM_FAILURE;
        };
        return new StepError(kind, e.getMessage());
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
