package com.brainstorm.orchestrator.exception;

import lombok.Getter;

@Getter
public class ClassificationUncertainException extends RuntimeException {

    private final String rawType;

    public ClassificationUncertainException(String message, String rawType) {
        super(message);
        this.rawType = rawType;
    }

    public ClassificationUncertainException(String message, Throwable cause) {
        super(message, cause);
        this.rawType = null;
    }
}
