package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.model.project.Item;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.util.TextNormalizer;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.PriorResults;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Numbers the versions of a recorded statement. Deterministic: the version is
 * one more than the number of active items with the same normalized text.
 */
@Component
public class VersionTrackerAgent implements AgentCapability {

    public static final String CHANGE_CREATED = "created";
    public static final String CHANGE_MODIFIED = "modified";
    public static final String TRIGGER_RECORDER = "decision_recorder";
    public static final String TRIGGER_MESSAGE = "user_message";

    private static final Set<String> KEYS = Set.of(
            MetadataKeys.VERSION_NUMBER, MetadataKeys.CHANGE_TYPE, MetadataKeys.REASONING, MetadataKeys.TRIGGERED_BY);

    @Override
    public String name() {
        return MetadataKeys.Agents.VERSION_TRACKER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.TRACK_CHANGE);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.TRACK_CHANGE.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.TRACK_CHANGE.equals(action)) {
            throw new IllegalArgumentException(name() + " does not support action '" + action + "'");
        }

        boolean recorded = PriorResults.latest(priorResults, MetadataKeys.Agents.DECISION_RECORDER, MetadataKeys.SHOULD_RECORD)
                .map(value -> MetadataValues.asBoolean(value, false))
                .orElse(false);
        String subject = recorded
                ? PriorResults.latest(priorResults, MetadataKeys.Agents.DECISION_RECORDER, MetadataKeys.ITEM)
                        .map(Object::toString)
                        .orElse(input.getUserMessage())
                : input.getUserMessage();

        String normalized = TextNormalizer.normalize(subject);
        long previous = projectState.activeItems().stream()
                .map(Item::getText)
                .map(TextNormalizer::normalize)
                .filter(normalized::equals)
                .count();
        int version = (int) previous + 1;
        String changeType = version == 1 ? CHANGE_CREATED : CHANGE_MODIFIED;

        return StepResult.builder()
                .agent(name())
                .action(action)
                .message("")
                .showToUser(false)
                .metadataEntry(MetadataKeys.VERSION_NUMBER, version)
                .metadataEntry(MetadataKeys.CHANGE_TYPE, changeType)
                .metadataEntry(MetadataKeys.REASONING, previous == 0
                        ? "No earlier version of this statement"
                        : previous + " earlier version(s) of this statement")
                .metadataEntry(MetadataKeys.TRIGGERED_BY, recorded ? TRIGGER_RECORDER : TRIGGER_MESSAGE)
                .build();
    }
}
