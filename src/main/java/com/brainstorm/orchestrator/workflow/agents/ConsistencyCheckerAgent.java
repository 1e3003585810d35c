package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares the turn against what the project already holds.
 */
@Slf4j
@Component
public class ConsistencyCheckerAgent extends AbstractGenerativeCapability {

    private static final Set<String> KEYS = Set.of(
            MetadataKeys.CONFLICT_DETECTED, MetadataKeys.CONFLICTS, MetadataKeys.RECOMMENDATION);

    public ConsistencyCheckerAgent(GenerationBackend backend, PromptLibraryService promptLibrary) {
        super(backend, promptLibrary);
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.CONSISTENCY_CHECKER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.CHECK_CONSISTENCY);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.CHECK_CONSISTENCY.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.CHECK_CONSISTENCY.equals(action)) {
            throw unsupported(action);
        }

        // Nothing recorded yet, nothing to contradict
        if (projectState.activeItems().isEmpty()) {
            log.debug("No active items in {}, skipping consistency call", input.getProjectId());
            return result(action, List.of(), "");
        }

        Map<String, Object> output = generateJson(
                "consistency-checker", baseVariables(input, projectState), action, input, timeout);
        List<String> conflicts = MetadataValues.asStringList(output.get(MetadataKeys.CONFLICTS), "description", "conflict");
        return result(action, conflicts, String.valueOf(output.getOrDefault(MetadataKeys.RECOMMENDATION, "")));
    }

    private StepResult result(String action, List<String> conflicts, String recommendation) {
        return StepResult.builder()
                .agent(name())
                .action(action)
                .message("")
                .showToUser(false)
                .metadataEntry(MetadataKeys.CONFLICT_DETECTED, !conflicts.isEmpty())
                .metadataEntry(MetadataKeys.CONFLICTS, conflicts)
                .metadataEntry(MetadataKeys.RECOMMENDATION, recommendation)
                .build();
    }
}
