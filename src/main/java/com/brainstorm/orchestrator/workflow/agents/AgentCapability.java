package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.exception.CapabilityException;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Common contract of every specialized behavior a workflow step can invoke.
 *
 * Implementations are Spring beans collected by {@link AgentCapabilityRegistry}.
 * A capability never assumes a sibling in the same phase ran; anything it
 * needs from other steps comes from {@code priorResults} through the keys
 * documented in {@link com.brainstorm.orchestrator.workflow.MetadataKeys}.
 */
public interface AgentCapability {

    String name();

    Set<String> actions();

    /**
     * Metadata keys the given action documents. Workflow conditions may only
     * reference these.
     */
    Set<String> producedKeys(String action);

    /**
     * @param priorResults results of all earlier phases of the current workflow
     * @param timeout      budget for this invocation
     * @throws CapabilityException on timeout, upstream failure, or unusable output
     */
    StepResult invoke(String action, StepInput input, ProjectState projectState,
                      List<StepResult> priorResults, Duration timeout);
}
