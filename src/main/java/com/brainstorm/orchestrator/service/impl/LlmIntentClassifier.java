package com.brainstorm.orchestrator.service.impl;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.client.GenerationContext;
import com.brainstorm.orchestrator.configuration.AppProperties;
import com.brainstorm.orchestrator.configuration.OrchestratorProperties;
import com.brainstorm.orchestrator.exception.CapabilityException;
import com.brainstorm.orchestrator.exception.ClassificationUncertainException;
import com.brainstorm.orchestrator.model.conversation.ConversationMessage;
import com.brainstorm.orchestrator.service.IntentClassifier;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.util.MetadataValues;
import com.brainstorm.orchestrator.workflow.Intent;
import com.brainstorm.orchestrator.workflow.IntentClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class LlmIntentClassifier implements IntentClassifier {

    private static final String AGENT_NAME = "intent_classifier";

    private static final Pattern REVIEW_COMMAND = Pattern.compile("^\\s*\\??\\s*review conversation\\s*$",
            Pattern.CASE_INSENSITIVE);

    private final GenerationBackend backend;
    private final PromptLibraryService promptLibrary;
    private final AppProperties props;

    @Override
    public IntentClassification classify(String userMessage, List<ConversationMessage> recentHistory) {
        if (userMessage != null && REVIEW_COMMAND.matcher(userMessage).matches()) {
            log.info("🧭 Review command detected, classifying as {}", Intent.REVIEWING);
            return IntentClassification.builder()
                    .intent(Intent.REVIEWING)
                    .confidence(100)
                    .reasoning("Explicit review command")
                    .build();
        }

        try {
            IntentClassification classification = askBackend(userMessage, recentHistory);
            log.info("🧭 Intent: {} ({}%)", classification.getIntent(), Math.round(classification.getConfidence()));
            return classification;
        } catch (ClassificationUncertainException e) {
            log.warn("⚠️ Intent unresolved: {}", e.getMessage());
            return IntentClassification.unresolved(e.getMessage());
        }
    }

    private IntentClassification askBackend(String userMessage, List<ConversationMessage> recentHistory) {
        OrchestratorProperties.Classifier config = props.getOrchestrator().getClassifier();

        Map<String, Object> output;
        try {
            Map<String, Object> variables = new HashMap<>();
            variables.put("userMessage", userMessage);
            variables.put("history", formatHistory(recentHistory, config.getHistoryWindow()));
            String prompt = promptLibrary.render("intent-classifier", variables);
            output = backend.generate(prompt, GenerationContext.json(AGENT_NAME, "classify", null, props.getOrchestrator().getStepTimeout()))
                    .getStructuredMetadata();
        } catch (CapabilityException e) {
            throw new ClassificationUncertainException("Classifier call failed: " + e.getKind(), e);
        } catch (RuntimeException e) {
            throw new ClassificationUncertainException("Classifier call failed: " + e.getMessage(), e);
        }

        String rawType = MetadataValues.asString(output.get("type"));
        Intent intent = Intent.fromLabel(rawType)
                .orElseThrow(() -> new ClassificationUncertainException("Unknown intent label '" + rawType + "'", rawType));
        double confidence = MetadataValues.asDouble(output.get("confidence"), -1);
        if (confidence < 0) {
            throw new ClassificationUncertainException("Classifier gave no confidence", rawType);
        }
        if (confidence < config.getMinConfidence()) {
            throw new ClassificationUncertainException(
                    "Confidence " + confidence + " below " + config.getMinConfidence() + " for " + intent, rawType);
        }

        return IntentClassification.builder()
                .intent(intent)
                .confidence(Math.min(confidence, 100))
                .reasoning(MetadataValues.asString(output.get("reasoning")))
                .build();
    }

    private static String formatHistory(List<ConversationMessage> history, int window) {
        if (history == null || history.isEmpty() || window == 0) {
            return "(no earlier messages)";
        }
        int from = Math.max(0, history.size() - window);
        return history.subList(from, history.size()).stream()
                .map(message -> message.getRole() + ": " + message.getContent())
                .collect(Collectors.joining("\n"));
    }
}
