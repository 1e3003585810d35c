package com.brainstorm.orchestrator.model.activity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record for one executed or skipped workflow step.
 *
 * Every field except {@code createdAt} is derived from the step alone, so
 * replaying the same results yields the same events.
 */
@Value
@Builder
public class ActivityEvent {

    String projectId;

    String agentName;

    /**
     * One of the {@link ActivityType} values.
     */
    String action;

    @Singular
    Map<String, Object> details;

    Instant createdAt;
}
