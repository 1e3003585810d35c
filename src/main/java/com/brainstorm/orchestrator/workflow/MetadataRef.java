package com.brainstorm.orchestrator.workflow;

import lombok.NonNull;
import lombok.Value;

/**
 * A metadata key a condition reads, optionally scoped to the agent that must
 * have produced it. A null agent means "any earlier step".
 */
@Value
public class MetadataRef {

    String agentName;

    @NonNull
    String key;

    public static MetadataRef of(String agentName, String key) {
        return new MetadataRef(agentName, key);
    }

    @Override
    public String toString() {
        return agentName == null ? key : agentName + "." + key;
    }
}
