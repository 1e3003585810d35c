package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.config.AgentConfig;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.util.TextNormalizer;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads back through the conversation and lists statements that never made
 * it into the project record.
 */
@Slf4j
@Component
public class ReviewerAgent extends AbstractGenerativeCapability {

    private static final Set<String> KEYS = Set.of(MetadataKeys.HAS_FINDINGS, MetadataKeys.FINDINGS, MetadataKeys.SUMMARY);

    private final AgentConfig.ReviewerConfig config;

    public ReviewerAgent(GenerationBackend backend, PromptLibraryService promptLibrary, AgentConfig agentConfig) {
        super(backend, promptLibrary);
        this.config = agentConfig.getReviewer();
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.REVIEWER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.REVIEW);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.REVIEW.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.REVIEW.equals(action)) {
            throw unsupported(action);
        }

        Map<String, Object> variables = baseVariables(input, projectState);
        variables.put("history", formatHistory(input.getHistory(), config.getHistoryWindow()));
        variables.put("maxFindings", config.getMaxFindings());

        Map<String, Object> output = generateJson("reviewer", variables, action, input, timeout);

        Set<String> known = projectState.activeItems().stream()
                .map(item -> TextNormalizer.normalize(item.getText()))
                .collect(Collectors.toCollection(HashSet::new));

        List<Map<String, Object>> findings = MetadataValues.asMapList(output.get(MetadataKeys.FINDINGS)).stream()
                .filter(finding -> finding.get(MetadataKeys.ITEM) != null)
                .filter(finding -> !known.contains(TextNormalizer.normalize(finding.get(MetadataKeys.ITEM).toString())))
                .limit(config.getMaxFindings())
                .<Map<String, Object>>map(LinkedHashMap::new)
                .toList();
        String summary = String.valueOf(output.getOrDefault(MetadataKeys.SUMMARY, "")).trim();

        log.info("🔎 Review of {} found {} unrecorded statements", input.getProjectId(), findings.size());

        return StepResult.builder()
                .agent(name())
                .action(action)
                .message(renderMessage(summary, findings))
                .showToUser(true)
                .metadataEntry(MetadataKeys.HAS_FINDINGS, !findings.isEmpty())
                .metadataEntry(MetadataKeys.FINDINGS, findings)
                .metadataEntry(MetadataKeys.SUMMARY, summary)
                .build();
    }

    private static String renderMessage(String summary, List<Map<String, Object>> findings) {
        StringBuilder message = new StringBuilder();
        if (!summary.isEmpty()) {
            message.append(summary);
        }
        if (findings.isEmpty()) {
            if (message.length() == 0) {
                message.append("Everything you've said is already captured.");
            }
            return message.toString();
        }
        if (message.length() > 0) {
            message.append("\n\n");
        }
        message.append("Not yet recorded:");
        for (Map<String, Object> finding : findings) {
            message.append("\n- ").append(finding.get(MetadataKeys.ITEM));
        }
        return message.toString();
    }
}
