package com.brainstorm.orchestrator.workflow;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IntentClassification {

    Intent intent;

    /**
     * 0 - 100.
     */
    double confidence;

    String reasoning;

    public static IntentClassification unresolved(String reasoning) {
        return IntentClassification.builder()
                .intent(Intent.UNRESOLVED)
                .confidence(0)
                .reasoning(reasoning)
                .build();
    }
}
