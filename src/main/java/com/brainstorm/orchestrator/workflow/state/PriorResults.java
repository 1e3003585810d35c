package com.brainstorm.orchestrator.workflow.state;

import java.util.List;
import java.util.Optional;

/**
 * Reads documented metadata out of the results of earlier phases.
 */
public final class PriorResults {

    private PriorResults() {
    }

    /**
     * Value of {@code key} from the latest successful result that carries it.
     *
     * @param agentName restricts the search to one agent, null for any
     */
    public static Optional<Object> latest(List<StepResult> results, String agentName, String key) {
        for (int i = results.size() - 1; i >= 0; i--) {
            StepResult result = results.get(i);
            if (result.isFailed()) {
                continue;
            }
            if (agentName != null && !agentName.equals(result.getAgent())) {
                continue;
            }
            Object value = result.getMetadata().get(key);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
