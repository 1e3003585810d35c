package com.brainstorm.orchestrator.workflow;

import lombok.Value;

import java.util.List;

@Value
public class WorkflowPhase {

    int index;
    List<StepSpec> steps;

    /**
     * Null for a single ungrouped step.
     */
    String parallelGroup;

    public boolean isParallel() {
        return parallelGroup != null;
    }
}
