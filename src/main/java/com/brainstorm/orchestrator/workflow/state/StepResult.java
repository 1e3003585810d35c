package com.brainstorm.orchestrator.workflow.state;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Output of one capability invocation.
 *
 * Metadata keys are documented per action in
 * {@link com.brainstorm.orchestrator.workflow.MetadataKeys}; consumers must
 * not rely on anything else.
 */
@Value
@Builder(toBuilder = true)
public class StepResult {

    String agent;
    String action;
    String message;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    boolean showToUser;

    /**
     * Set only when the invocation failed.
     */
    StepError error;

    public boolean isFailed() {
        return error != null;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public boolean isTrue(String key) {
        return Boolean.TRUE.equals(metadata.get(key));
    }

    public static StepResult failure(String agent, String action, StepError error) {
        return StepResult.builder()
                .agent(agent)
                .action(action)
                .message("")
                .showToUser(false)
                .error(error)
                .build();
    }
}
