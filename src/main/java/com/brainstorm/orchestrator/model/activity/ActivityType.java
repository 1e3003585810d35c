package com.brainstorm.orchestrator.model.activity;

/**
 * Outcome recorded in an {@link ActivityEvent}.
 */
public enum ActivityType {
    RECORDED("recorded"),
    DUPLICATE_SUPPRESSED("duplicate-suppressed"),
    RECORD_REJECTED("record-rejected"),
    NOT_RECORDED("not-recorded"),
    STEP_FAILED("step-failed"),
    STEP_SKIPPED("step-skipped");

    private final String value;

    ActivityType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
