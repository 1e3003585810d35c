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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Silent analysis of what the user left unsaid. Never produces a user message.
 */
@Slf4j
@Component
public class GapDetectorAgent extends AbstractGenerativeCapability {

    private static final Set<String> KEYS = Set.of(MetadataKeys.HAS_GAPS, MetadataKeys.CRITICAL_COUNT, MetadataKeys.GAPS);

    public GapDetectorAgent(GenerationBackend backend, PromptLibraryService promptLibrary) {
        super(backend, promptLibrary);
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.GAP_DETECTOR;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.ANALYZE);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.ANALYZE.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.ANALYZE.equals(action)) {
            throw unsupported(action);
        }

        Map<String, Object> output = generateJson("gap-detector", baseVariables(input, projectState), action, input, timeout);

        List<Map<String, Object>> gaps = MetadataValues.asMapList(output.get(MetadataKeys.GAPS)).stream()
                .map(GapDetectorAgent::normalizeGap)
                .filter(gap -> !gap.get("description").toString().isBlank())
                .toList();
        long critical = gaps.stream().filter(gap -> "critical".equals(gap.get("importance"))).count();
        boolean high = gaps.stream().anyMatch(gap -> "high".equals(gap.get("importance")));

        log.debug("Gap analysis: {} gaps, {} critical", gaps.size(), critical);

        return StepResult.builder()
                .agent(name())
                .action(action)
                .message("")
                .showToUser(false)
                .metadataEntry(MetadataKeys.HAS_GAPS, critical > 0 || high)
                .metadataEntry(MetadataKeys.CRITICAL_COUNT, (int) critical)
                .metadataEntry(MetadataKeys.GAPS, gaps)
                .build();
    }

    private static Map<String, Object> normalizeGap(Map<String, Object> raw) {
        Map<String, Object> gap = new LinkedHashMap<>();
        gap.put("category", String.valueOf(raw.getOrDefault("category", "detail")));
        gap.put("description", String.valueOf(raw.getOrDefault("description", "")));
        gap.put("importance", String.valueOf(raw.getOrDefault("importance", "low")).toLowerCase(Locale.ROOT));
        gap.put("question", String.valueOf(raw.getOrDefault("question", "")));
        return gap;
    }
}
