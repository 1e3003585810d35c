package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.client.GenerationContext;
import com.brainstorm.orchestrator.model.context.ReferenceSummary;
import com.brainstorm.orchestrator.model.conversation.ConversationMessage;
import com.brainstorm.orchestrator.model.project.Item;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.workflow.state.StepInput;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base for capabilities that render a prompt and call the generation backend.
 */
public abstract class AbstractGenerativeCapability implements AgentCapability {

    protected final GenerationBackend backend;
    protected final PromptLibraryService promptLibrary;

    protected AbstractGenerativeCapability(GenerationBackend backend, PromptLibraryService promptLibrary) {
        this.backend = backend;
        this.promptLibrary = promptLibrary;
    }

    protected Map<String, Object> generateJson(String template, Map<String, Object> variables,
                                               String action, StepInput input, Duration timeout) {
        String prompt = promptLibrary.render(template, variables);
        return backend.generate(prompt, GenerationContext.json(name(), action, input.getProjectId(), timeout))
                .getStructuredMetadata();
    }

    protected String generateText(String template, Map<String, Object> variables,
                                  String action, StepInput input, Duration timeout) {
        String prompt = promptLibrary.render(template, variables);
        String text = backend.generate(prompt, GenerationContext.text(name(), action, input.getProjectId(), timeout))
                .getText();
        return text == null ? "" : text.trim();
    }

    /**
     * Variables every prompt can use: the message, the active items, recent
     * history and reference summaries, each pre-rendered as plain text.
     */
    protected Map<String, Object> baseVariables(StepInput input, ProjectState state) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("userMessage", input.getUserMessage());
        variables.put("intent", input.getIntent() != null ? input.getIntent().name() : "");
        variables.put("items", formatItems(state.activeItems()));
        variables.put("history", formatHistory(input.getHistory(), 10));
        variables.put("references", formatReferences(input.getReferences()));
        return variables;
    }

    protected static String formatItems(List<Item> items) {
        if (items.isEmpty()) {
            return "(nothing recorded yet)";
        }
        return items.stream()
                .map(item -> "- [" + item.getState().value() + "] " + item.getText())
                .collect(Collectors.joining("\n"));
    }

    protected static String formatHistory(List<ConversationMessage> history, int window) {
        if (history.isEmpty()) {
            return "(no earlier messages)";
        }
        int from = Math.max(0, history.size() - window);
        return history.subList(from, history.size()).stream()
                .map(message -> message.getRole() + ": " + message.getContent())
                .collect(Collectors.joining("\n"));
    }

    protected static String formatReferences(List<ReferenceSummary> references) {
        if (references.isEmpty()) {
            return "(none)";
        }
        return references.stream()
                .map(reference -> "- " + reference.getFilename()
                        + (reference.getDescription() != null ? ": " + reference.getDescription() : ""))
                .collect(Collectors.joining("\n"));
    }

    protected IllegalArgumentException unsupported(String action) {
        return new IllegalArgumentException(name() + " does not support action '" + action + "'");
    }
}
