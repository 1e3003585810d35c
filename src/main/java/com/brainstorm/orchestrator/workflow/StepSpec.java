package com.brainstorm.orchestrator.workflow;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One declared capability invocation inside a workflow.
 */
@Value
@Builder(toBuilder = true)
public class StepSpec {

    @NonNull
    String agentName;

    @NonNull
    String action;

    /**
     * Null means the step always runs.
     */
    StepCondition condition;

    /**
     * Contiguous steps sharing a tag run concurrently. Null means a phase of
     * its own.
     */
    String parallelGroup;

    public static StepSpec step(String agentName, String action) {
        return StepSpec.builder().agentName(agentName).action(action).build();
    }

    public StepSpec when(StepCondition condition) {
        return toBuilder().condition(condition).build();
    }

    public StepSpec inGroup(String parallelGroup) {
        return toBuilder().parallelGroup(parallelGroup).build();
    }

    public boolean isConditional() {
        return condition != null;
    }

    public String key() {
        return agentName + "." + action;
    }

    @Override
    public String toString() {
        return key() + (condition != null ? " if " + condition.describe() : "");
    }
}
