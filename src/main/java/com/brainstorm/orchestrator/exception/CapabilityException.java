package com.brainstorm.orchestrator.exception;

import lombok.Getter;

/**
 * Failure of a single capability invocation. Captured per step by the
 * Orchestrator and never escalated to the turn.
 */
@Getter
public class CapabilityException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        INVALID_RESPONSE,
        UPSTREAM_FAILURE
    }

    private final Kind kind;

    public CapabilityException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CapabilityException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CapabilityException timeout(String message) {
        return new CapabilityException(Kind.TIMEOUT, message);
    }

    public static CapabilityException invalidResponse(String message, Throwable cause) {
        return new CapabilityException(Kind.INVALID_RESPONSE, message, cause);
    }

    public static CapabilityException upstream(String message, Throwable cause) {
        return new CapabilityException(Kind.UPSTREAM_FAILURE, message, cause);
    }
}
