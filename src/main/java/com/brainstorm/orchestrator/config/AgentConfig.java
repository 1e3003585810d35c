package com.brainstorm.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Umbrella configuration for all capability-specific settings.
 *
 * <p>Properties are loaded from the {@code app.agents} namespace in application.yml:
 * <pre>
 * app:
 *   agents:
 *     conversation:
 *       terse-max-questions: 3
 *       detailed-max-suggestions: 3
 *       detailed-score-threshold: 30
 *     decision-recorder:
 *       default-confidence: 100
 *     reviewer:
 *       max-findings: 10
 *     mode-manager:
 *       decide-keywords: ["let's go with", "i've decided"]
 * </pre>
 */
@ConfigurationProperties(prefix = "app.agents")
@Data
public class AgentConfig {

    private ConversationConfig conversation = new ConversationConfig();

    private DecisionRecorderConfig decisionRecorder = new DecisionRecorderConfig();

    private ReviewerConfig reviewer = new ReviewerConfig();

    private ModeManagerConfig modeManager = new ModeManagerConfig();

    /**
     * Shapes the conversational reply to how much the user already said.
     */
    @Data
    public static class ConversationConfig {

        /**
         * Foundational questions allowed when the input is terse.
         */
        private int terseMaxQuestions = 3;

        /**
         * Deep suggestions allowed when the input is detailed.
         */
        private int detailedMaxSuggestions = 3;

        /**
         * Detail score at or above which input counts as detailed. The score
         * adds word count, numbers, proper nouns and technical terms.
         */
        private int detailedScoreThreshold = 30;

        /**
         * Lower-case phrases that mark the user correcting a misunderstanding.
         */
        private List<String> correctionSignals = new ArrayList<>(List.of(
                "no,", "listen", "i just said", "i said", "not what i meant", "you're not listening", "wrong"));

        /**
         * Lower-case phrases a reply may never contain.
         */
        private List<String> forbiddenPhrases = new ArrayList<>(List.of(
                "looking at your documents", "this ties into", "this opens up", "as an ai"));

        /**
         * Lower-case words counted as technical terms when scoring detail.
         */
        private List<String> technicalTerms = new ArrayList<>(List.of(
                "api", "database", "backend", "frontend", "server", "cloud", "mobile", "app", "integration",
                "authentication", "payment", "latency", "budget", "deadline", "platform", "architecture"));
    }

    @Data
    public static class DecisionRecorderConfig {

        /**
         * Citation confidence used when the recorder output carries none.
         */
        private double defaultConfidence = 100;

        /**
         * Below this confidence the recorder asks the user to confirm.
         */
        private double confirmationThreshold = 70;
    }

    @Data
    public static class ReviewerConfig {

        private int maxFindings = 10;

        /**
         * How many recent messages the reviewer reads.
         */
        private int historyWindow = 50;
    }

    @Data
    public static class ModeManagerConfig {

        private List<String> decideKeywords = new ArrayList<>(List.of(
                "/decide", "let's go with", "lets go with", "i've decided", "i have decided", "final decision",
                "we'll use", "decided on"));

        private List<String> exportKeywords = new ArrayList<>(List.of(
                "/export", "export", "generate the document", "download"));
    }
}
