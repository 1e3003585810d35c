package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.exception.CapabilityException;
import com.brainstorm.orchestrator.model.project.ItemState;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.PriorResults;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that what is about to be recorded is actually backed by what the
 * user said. The verdict is advisory and never blocks recording.
 */
@Component
public class ClaimVerifierAgent extends AbstractGenerativeCapability {

    private static final Set<String> KEYS = Set.of(
            MetadataKeys.APPROVED, MetadataKeys.CONFIDENCE, MetadataKeys.ISSUES, MetadataKeys.REASONING);

    public ClaimVerifierAgent(GenerationBackend backend, PromptLibraryService promptLibrary) {
        super(backend, promptLibrary);
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.CLAIM_VERIFIER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.VERIFY);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.VERIFY.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.VERIFY.equals(action)) {
            throw unsupported(action);
        }

        Map<String, Object> variables = baseVariables(input, projectState);
        variables.put("decided", formatItems(projectState.activeItems(ItemState.DECIDED)));
        PriorResults.latest(priorResults, MetadataKeys.Agents.DECISION_RECORDER, MetadataKeys.ITEM)
                .ifPresent(candidate -> variables.put("candidate", candidate));

        Map<String, Object> output = generateJson("claim-verifier", variables, action, input, timeout);
        if (!output.containsKey(MetadataKeys.APPROVED)) {
            throw CapabilityException.invalidResponse("Verifier output has no 'approved' verdict", null);
        }

        return StepResult.builder()
                .agent(name())
                .action(action)
                .message("")
                .showToUser(false)
                .metadataEntry(MetadataKeys.APPROVED, MetadataValues.asBoolean(output.get(MetadataKeys.APPROVED), false))
                .metadataEntry(MetadataKeys.CONFIDENCE, MetadataValues.asDouble(output.get(MetadataKeys.CONFIDENCE), 0))
                .metadataEntry(MetadataKeys.ISSUES,
                        MetadataValues.asStringList(output.get(MetadataKeys.ISSUES), "description", "issue"))
                .metadataEntry(MetadataKeys.REASONING, String.valueOf(output.getOrDefault(MetadataKeys.REASONING, "")))
                .build();
    }
}
