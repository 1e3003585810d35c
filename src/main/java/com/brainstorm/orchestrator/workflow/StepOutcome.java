package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.Value;

/**
 * A declared step paired with its result, or with no result when its
 * condition skipped it.
 */
@Value
public class StepOutcome {

    StepSpec step;
    StepResult result;

    public static StepOutcome executed(StepSpec step, StepResult result) {
        return new StepOutcome(step, result);
    }

    public static StepOutcome skipped(StepSpec step) {
        return new StepOutcome(step, null);
    }

    public boolean isSkipped() {
        return result == null;
    }
}
