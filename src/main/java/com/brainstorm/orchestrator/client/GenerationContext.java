package com.brainstorm.orchestrator.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call settings passed alongside a prompt.
 */
@Value
@Builder
public class GenerationContext {

    String agentName;
    String action;
    String projectId;

    /**
     * When set, the reply is parsed as a JSON object into
     * {@link GenerationResult#getStructuredMetadata()}.
     */
    boolean expectJson;

    /**
     * Null uses the backend's own request timeout.
     */
    Duration timeout;

    public static GenerationContext json(String agentName, String action, String projectId, Duration timeout) {
        return GenerationContext.builder()
                .agentName(agentName)
                .action(action)
                .projectId(projectId)
                .expectJson(true)
                .timeout(timeout)
                .build();
    }

    public static GenerationContext text(String agentName, String action, String projectId, Duration timeout) {
        return GenerationContext.builder()
                .agentName(agentName)
                .action(action)
                .projectId(projectId)
                .expectJson(false)
                .timeout(timeout)
                .build();
    }
}
