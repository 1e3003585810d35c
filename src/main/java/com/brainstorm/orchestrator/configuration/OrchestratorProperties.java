package com.brainstorm.orchestrator.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Turn-level settings bound from {@code app.orchestrator}.
 */
@Data
public class OrchestratorProperties {

    /**
     * Upper bound for a single capability invocation.
     */
    @NotNull
    private Duration stepTimeout = Duration.ofSeconds(20);

    /**
     * Per-agent overrides of {@link #stepTimeout}, keyed by agent name.
     */
    private Map<String, Duration> agentTimeouts = new HashMap<>();

    @NotNull
    private Duration contextFetchTimeout = Duration.ofSeconds(5);

    /**
     * Number of recent conversation messages fetched for each turn.
     */
    @Min(0)
    private int historyLimit = 50;

    @NotBlank
    private String fallbackMessage = "I'm having trouble with that right now. Could you say it another way?";

    @Valid
    @NotNull
    private Classifier classifier = new Classifier();

    public Duration timeoutFor(String agentName) {
        Duration override = agentTimeouts.get(agentName);
        return override != null ? override : stepTimeout;
    }

    @Data
    public static class Classifier {

        /**
         * Classifications below this confidence (0 - 100) resolve to UNRESOLVED.
         */
        @DecimalMin("0")
        @DecimalMax("100")
        private double minConfidence = 40;

        /**
         * How many of the most recent messages go into the classifier prompt.
         */
        @Min(0)
        private int historyWindow = 5;
    }
}
