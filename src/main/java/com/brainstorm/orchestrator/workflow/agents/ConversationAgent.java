package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.config.AgentConfig;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.util.TextNormalizer;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversational reply to the user.
 *
 * The reply is shaped by how much concrete detail the user gave: terse input
 * gets a few foundational questions, detailed input gets deeper suggestions
 * built on what was said. A correction gets an acknowledgement and no
 * questions. A reply that breaks these rules is regenerated once with the
 * stricter prompt.
 */
@Slf4j
@Component
public class ConversationAgent extends AbstractGenerativeCapability {

    public static final String DETAIL_TERSE = "terse";
    public static final String DETAIL_DETAILED = "detailed";

    private static final Set<String> KEYS = Set.of(
            MetadataKeys.DETAIL_LEVEL, MetadataKeys.SUGGESTION_COUNT, MetadataKeys.IS_CORRECTION, MetadataKeys.WAS_RETRIED);

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?");
    private static final Pattern WORD = Pattern.compile("[A-Za-z][\\w'-]*");
    private static final Pattern LEADING_NO = Pattern.compile("^\\s*no\\b");
    private static final Pattern SUGGESTION_LINE = Pattern.compile("(?m)^\\s*(?:[-*•]|\\d+[.)])\\s+\\S");

    private final AgentConfig.ConversationConfig config;

    public ConversationAgent(GenerationBackend backend, PromptLibraryService promptLibrary, AgentConfig agentConfig) {
        super(backend, promptLibrary);
        this.config = agentConfig.getConversation();
    }

    @Override
    public String name() {
        return MetadataKeys.Agents.CONVERSATION;
    }

    @Override
    public Set<String> actions() {
        return Set.of(MetadataKeys.Actions.REFLECT);
    }

    @Override
    public Set<String> producedKeys(String action) {
        return MetadataKeys.Actions.REFLECT.equals(action) ? KEYS : Set.of();
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        if (!MetadataKeys.Actions.REFLECT.equals(action)) {
            throw unsupported(action);
        }

        String message = input.getUserMessage();
        boolean correction = isCorrection(message);
        boolean detailed = detailScore(message) >= config.getDetailedScoreThreshold();
        int maxQuestions = correction ? 0 : (detailed ? 1 : config.getTerseMaxQuestions());

        Map<String, Object> variables = baseVariables(input, projectState);
        variables.put("isCorrection", correction);
        variables.put("detailed", detailed && !correction);
        variables.put("terse", !detailed && !correction);
        variables.put("maxQuestions", maxQuestions);
        variables.put("maxSuggestions", config.getDetailedMaxSuggestions());

        String reply = generateText("conversation", variables, action, input, timeout);
        boolean retried = false;

        Optional<String> violation = findViolation(reply, correction, maxQuestions);
        if (violation.isPresent()) {
            log.info("🔁 Conversation reply broke shape ({}), regenerating with strict prompt", violation.get());
            variables.put("violation", violation.get());
            reply = generateText("conversation-strict", variables, action, input, timeout);
            retried = true;
        }

        return StepResult.builder()
                .agent(name())
                .action(action)
                .message(reply)
                .showToUser(true)
                .metadataEntry(MetadataKeys.DETAIL_LEVEL, detailed ? DETAIL_DETAILED : DETAIL_TERSE)
                .metadataEntry(MetadataKeys.SUGGESTION_COUNT, detailed && !correction ? countSuggestions(reply) : 0)
                .metadataEntry(MetadataKeys.IS_CORRECTION, correction)
                .metadataEntry(MetadataKeys.WAS_RETRIED, retried)
                .build();
    }

    boolean isCorrection(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (LEADING_NO.matcher(lower).find()) {
            return true;
        }
        return config.getCorrectionSignals().stream().anyMatch(lower::contains);
    }

    /**
     * Words plus weighted numbers, proper nouns and technical terms.
     */
    int detailScore(String message) {
        if (message == null || message.isBlank()) {
            return 0;
        }
        int score = TextNormalizer.wordCount(message);
        score += 3 * count(NUMBER.matcher(message));
        score += 2 * countProperNouns(message);

        String lower = message.toLowerCase(Locale.ROOT);
        for (String term : config.getTechnicalTerms()) {
            if (Pattern.compile("\\b" + Pattern.quote(term) + "\\b").matcher(lower).find()) {
                score += 3;
            }
        }
        return score;
    }

    Optional<String> findViolation(String reply, boolean correction, int maxQuestions) {
        String lower = reply.toLowerCase(Locale.ROOT);
        for (String phrase : config.getForbiddenPhrases()) {
            if (lower.contains(phrase)) {
                return Optional.of("forbidden phrase '" + phrase + "'");
            }
        }
        long questions = reply.chars().filter(c -> c == '?').count();
        if (correction && questions > 0) {
            return Optional.of("question during correction");
        }
        if (questions > maxQuestions) {
            return Optional.of(questions + " questions, at most " + maxQuestions + " allowed");
        }
        return Optional.empty();
    }

    private int countSuggestions(String reply) {
        int lines = count(SUGGESTION_LINE.matcher(reply));
        return Math.min(lines, config.getDetailedMaxSuggestions());
    }

    private static int countProperNouns(String message) {
        int count = 0;
        boolean sentenceStart = true;
        Matcher matcher = WORD.matcher(message);
        int last = 0;
        while (matcher.find()) {
            String between = message.substring(last, matcher.start());
            if (between.matches("(?s).*[.!?]\\s*")) {
                sentenceStart = true;
            }
            String word = matcher.group();
            if (!sentenceStart && Character.isUpperCase(word.charAt(0)) && !"I".equals(word)) {
                count++;
            }
            sentenceStart = false;
            last = matcher.end();
        }
        return count;
    }

    private static int count(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
