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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Asks one question aimed at the most pressing open point: a detected
 * conflict first, then the most important gap, otherwise an exploratory
 * question.
 */
@Component
public class ClarifierAgent extends AbstractGenerativeCapability {

    public static final String MODE_CONFLICT = "conflict";
    public static final String MODE_GAP = "gap";
    public static final String MODE_EXPLORATION = "exploration";

    private static final Set<String> KEYS = Set.of(MetadataKeys.AGENT_QUESTIONS, MetadataKeys.MODE);

    private static final List<String> IMPORTANCE_ORDER = List.of("critical", "high", "medium", "low");

    public ClarifierAgent(GenerationBackend backend, PromptLibraryService promptLibrary) {
        super(backend, promptLibrary);
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.CLARIFIER;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.GENERATE_QUESTION);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.GENERATE_QUESTION.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.GENERATE_QUESTION.equals(action)) {
            throw unsupported(action);
        }

        Map<String, Object> variables = baseVariables(input, projectState);
        String mode = MODE_EXPLORATION;

        List<String> conflicts = MetadataValues.asStringList(PriorResults.latest(
                priorResults, MetadataKeys.Agents.CONSISTENCY_CHECKER, MetadataKeys.CONFLICTS).orElse(null));
        List<Map<String, Object>> gaps = MetadataValues.asMapList(PriorResults.latest(
                priorResults, MetadataKeys.Agents.GAP_DETECTOR, MetadataKeys.GAPS).orElse(null));

        if (!conflicts.isEmpty()) {
            mode = MODE_CONFLICT;
            variables.put("focus", String.join("\n", conflicts));
        } else if (!gaps.isEmpty()) {
            mode = MODE_GAP;
            Map<String, Object> top = gaps.stream()
                    .min(Comparator.comparingInt(gap -> importanceRank(gap.get("importance"))))
                    .orElseThrow();
            variables.put("focus", top.get("description"));
            variables.put("suggestedQuestion", top.get("question"));
        }
        variables.put("mode", mode);

        String question = generateText("clarifier", variables, action, input, timeout);
        List<String> questions = question.isBlank() ? List.of() : List.of(question);

        return StepResult.builder()
                .agent(name())
                .action(action)
                .message(question)
                .showToUser(!questions.isEmpty())
                .metadataEntry(MetadataKeys.AGENT_QUESTIONS, questions)
                .metadataEntry(MetadataKeys.MODE, mode)
                .build();
    }

    private static int importanceRank(Object importance) {
        int rank = IMPORTANCE_ORDER.indexOf(String.valueOf(importance));
        return rank < 0 ? IMPORTANCE_ORDER.size() : rank;
    }
}
