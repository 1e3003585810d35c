package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.config.AgentConfig;
import com.brainstorm.orchestrator.model.project.ItemState;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.workflow.Intent;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.PriorResults;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides what from the turn belongs in the project record.
 *
 * {@code record} looks at the current message; {@code recordFromReview}
 * turns the reviewer's findings into a batch. Neither writes anything: the
 * reconciler does, from the documented metadata.
 */
@Slf4j
@Component
public class DecisionRecorderAgent extends AbstractGenerativeCapability {

    private static final Set<String> RECORD_KEYS = Set.of(
            MetadataKeys.SHOULD_RECORD, MetadataKeys.ITEM, MetadataKeys.STATE, MetadataKeys.CONFIDENCE,
            MetadataKeys.REASONING, MetadataKeys.NEEDS_CONFIRMATION);

    private static final Set<String> REVIEW_KEYS = Set.of(MetadataKeys.ITEMS_TO_RECORD, MetadataKeys.ITEM_COUNT);

    private final AgentConfig.DecisionRecorderConfig config;

    public DecisionRecorderAgent(GenerationBackend backend, PromptLibraryService promptLibrary, AgentConfig agentConfig) {
        super(backend, promptLibrary);
        this.config = agentConfig.getDecisionRecorder();
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.DECISION_RECORDER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.RECORD, MetadataKeys.Actions.RECORD_FROM_REVIEW);
    }

    @Override
    public Set<String> producedKeys(String action) {
        if (MetadataKeys.Actions.RECORD.equals(action)) {
            return RECORD_KEYS;
        }
        if (MetadataKeys.Actions.RECORD_FROM_REVIEW.equals(action)) {
            return REVIEW_KEYS;
        }
        return Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (MetadataKeys.Actions.RECORD.equals(action)) {
            return record(input, projectState, timeout);
        }
        if (MetadataKeys.Actions.RECORD_FROM_REVIEW.equals(action)) {
            return recordFromReview(priorResults);
        }
        throw unsupported(action);
    }

    private StepResult record(StepInput input, ProjectState projectState, Duration timeout) {
        Map<String, Object> variables = baseVariables(input, projectState);
        String suggested = suggestedState(input.getIntent());
        variables.put("suggestedState", suggested);

        Map<String, Object> output = generateJson("decision-recorder", variables, MetadataKeys.Actions.RECORD, input, timeout);

        boolean shouldRecord = MetadataValues.asBoolean(output.get(MetadataKeys.SHOULD_RECORD), false);
        String item = MetadataValues.asString(output.get(MetadataKeys.ITEM));
        // missing or unrecognised state falls back to the one suggested by the intent
        String state = ItemState.fromValue(output.get(MetadataKeys.STATE))
                .map(ItemState::value)
                .orElse(suggested);
        double confidence = MetadataValues.asDouble(output.get(MetadataKeys.CONFIDENCE), config.getDefaultConfidence());
        String reasoning = MetadataValues.asString(output.get(MetadataKeys.REASONING));
        boolean needsConfirmation = shouldRecord && confidence < config.getConfirmationThreshold();

        String message = "";
        if (needsConfirmation) {
            message = "I've noted \"" + item + "\" as " + state + ". Let me know if I got that wrong.";
        }

        log.debug("Recorder: shouldRecord={}, state={}, confidence={}", shouldRecord, state, confidence);

        StepResult.StepResultBuilder result = StepResult.builder()
                .agent(name())
                .action(MetadataKeys.Actions.RECORD)
                .message(message)
                .showToUser(needsConfirmation)
                .metadataEntry(MetadataKeys.SHOULD_RECORD, shouldRecord)
                .metadataEntry(MetadataKeys.CONFIDENCE, confidence)
                .metadataEntry(MetadataKeys.NEEDS_CONFIRMATION, needsConfirmation);
        if (item != null) {
            result.metadataEntry(MetadataKeys.ITEM, item);
        }
        result.metadataEntry(MetadataKeys.STATE, state);
        if (reasoning != null) {
            result.metadataEntry(MetadataKeys.REASONING, reasoning);
        }
        return result.build();
    }

    private StepResult recordFromReview(List<StepResult> priorResults) {
        List<Map<String, Object>> findings = MetadataValues.asMapList(PriorResults.latest(
                priorResults, MetadataKeys.Agents.REVIEWER, MetadataKeys.FINDINGS).orElse(null));

        List<Map<String, Object>> batch = new ArrayList<>();
        for (Map<String, Object> finding : findings) {
            String item = MetadataValues.asString(finding.get(MetadataKeys.ITEM));
            if (item == null || item.isBlank()) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(MetadataKeys.ITEM, item.trim());
            entry.put(MetadataKeys.STATE, ItemState.fromValue(finding.get(MetadataKeys.STATE))
                    .orElse(ItemState.EXPLORING).value());
            entry.put(MetadataKeys.CONFIDENCE,
                    MetadataValues.asDouble(finding.get(MetadataKeys.CONFIDENCE), config.getDefaultConfidence()));
            Object quote = finding.get(MetadataKeys.USER_QUOTE);
            if (quote != null) {
                entry.put(MetadataKeys.USER_QUOTE, quote.toString());
            }
            batch.add(entry);
        }

        String message = batch.isEmpty()
                ? ""
                : "Added " + batch.size() + (batch.size() == 1 ? " item" : " items") + " from the conversation review.";

        return StepResult.builder()
                .agent(name())
                .action(MetadataKeys.Actions.RECORD_FROM_REVIEW)
                .message(message)
                .showToUser(!batch.isEmpty())
                .metadataEntry(MetadataKeys.ITEMS_TO_RECORD, batch)
                .metadataEntry(MetadataKeys.ITEM_COUNT, batch.size())
                .build();
    }

    private static String suggestedState(Intent intent) {
        if (intent == null) {
            return ItemState.EXPLORING.value();
        }
        return switch (intent) {
            case DECIDING, MODIFYING -> ItemState.DECIDED.value();
            case PARKING -> ItemState.PARKED.value();
            default -> ItemState.EXPLORING.value();
        };
    }
}
