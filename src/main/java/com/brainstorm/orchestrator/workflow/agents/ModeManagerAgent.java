package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.config.AgentConfig;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword detection of the session mode. Decide keywords win over export,
 * export over brainstorm; no match stays in brainstorm.
 */
@Component
public class ModeManagerAgent implements AgentCapability {

    public static final String MODE_BRAINSTORM = "brainstorm";
    public static final String MODE_DECIDE = "decide";
    public static final String MODE_EXPORT = "export";

    private final AgentConfig.ModeManagerConfig config;

    public ModeManagerAgent(AgentConfig agentConfig) {
        this.config = agentConfig.getModeManager();
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.MODE_MANAGER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.DETECT_MODE);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.DETECT_MODE.equals(action) ? Set.of(MetadataKeys.MODE) : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.DETECT_MODE.equals(action)) {
            throw new IllegalArgumentException(name() + " does not support action '" + action + "'");
        }
        return StepResult.builder()
                .agent(name())
                .action(action)
                .message("")
                .showToUser(false)
                .metadataEntry(MetadataKeys.MODE, detectMode(input.getUserMessage()))
                .build();
    }

    public String detectMode(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (containsAny(lower, config.getDecideKeywords())) {
            return MODE_DECIDE;
        }
        if (containsAny(lower, config.getExportKeywords())) {
            return MODE_EXPORT;
        }
        return MODE_BRAINSTORM;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
