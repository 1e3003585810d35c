package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.Value;

import java.util.List;

/**
 * Outcome of running one workflow. Outcomes are in declaration order, one per
 * declared step.
 */
@Value
public class ExecutionReport {

    WorkflowDefinition workflow;
    List<StepOutcome> outcomes;

    public List<StepResult> results() {
        return outcomes.stream()
                .filter(outcome -> !outcome.isSkipped())
                .map(StepOutcome::getResult)
                .toList();
    }

    public List<StepSpec> skipped() {
        return outcomes.stream()
                .filter(StepOutcome::isSkipped)
                .map(StepOutcome::getStep)
                .toList();
    }

    public long failedCount() {
        return results().stream().filter(StepResult::isFailed).count();
    }
}
