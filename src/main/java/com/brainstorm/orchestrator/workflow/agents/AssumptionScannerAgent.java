package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
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
 * Flags details in the turn that the user never stated explicitly.
 */
@Component
public class AssumptionScannerAgent extends AbstractGenerativeCapability {

    private static final Set<String> KEYS = Set.of(
            MetadataKeys.ASSUMPTIONS_DETECTED, MetadataKeys.ASSUMPTIONS, MetadataKeys.APPROVED);

    public AssumptionScannerAgent(GenerationBackend backend, PromptLibraryService promptLibrary) {
        super(backend, promptLibrary);
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.ASSUMPTION_SCANNER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.SCAN);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.SCAN.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.SCAN.equals(action)) {
            throw unsupported(action);
        }

        Map<String, Object> variables = baseVariables(input, projectState);
        PriorResults.latest(priorResults, MetadataKeys.Agents.DECISION_RECORDER, MetadataKeys.ITEM)
                .ifPresent(candidate -> variables.put("candidate", candidate));

        Map<String, Object> output = generateJson("assumption-scanner", variables, action, input, timeout);
        List<String> assumptions = MetadataValues.asStringList(
                output.get(MetadataKeys.ASSUMPTIONS), "assumption", "description");

        return StepResult.builder()
                .agent(name())
                .action(action)
                .message("")
                .showToUser(false)
                .metadataEntry(MetadataKeys.ASSUMPTIONS_DETECTED, !assumptions.isEmpty())
                .metadataEntry(MetadataKeys.ASSUMPTIONS, assumptions)
                .metadataEntry(MetadataKeys.APPROVED, assumptions.isEmpty())
                .build();
    }
}
