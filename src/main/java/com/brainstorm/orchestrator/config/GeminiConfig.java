package com.brainstorm.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Tuning for Gemini generation calls.
 *
 * <p>Properties are loaded from the {@code app.gemini} namespace in application.yml.
 * Connection settings (key, model, base url) live in
 * {@link com.brainstorm.orchestrator.configuration.GeminiProperties}.
 * <pre>
 * app:
 *   gemini:
 *     default-temperature: 0.7
 *     json-temperature: 0.2
 *     agent-temperatures:
 *       conversation: 0.8
 *       claim_verifier: 0.1
 *     retry:
 *       max-attempts: 2
 *       initial-backoff-millis: 500
 * </pre>
 */
@ConfigurationProperties(prefix = "app.gemini")
@Data
public class GeminiConfig {

    /**
     * Range: 0.0 (deterministic) to 1.0 (creative).
     */
    private double defaultTemperature = 0.7;

    /**
     * Used when the caller asks for JSON output.
     */
    private double jsonTemperature = 0.2;

    /**
     * Agent-specific temperature overrides, keyed by agent name.
     */
    private Map<String, Double> agentTemperatures;

    private RetryConfig retry = new RetryConfig();

    /**
     * @param agentName the name of the calling agent
     * @param json whether structured JSON output is requested
     * @return the agent override if configured, otherwise the default for the output kind
     */
    public double getTemperatureForAgent(String agentName, boolean json) {
        double fallback = json ? jsonTemperature : defaultTemperature;
        if (agentTemperatures == null || agentName == null) {
            return fallback;
        }
        return agentTemperatures.getOrDefault(agentName, fallback);
    }

    /**
     * Exponential backoff for transient failures like rate limits and
     * temporary server errors.
     */
    @Data
    public static class RetryConfig {

        private int maxAttempts = 2;

        private long initialBackoffMillis = 500;

        private long maxBackoffMillis = 4000;

        /**
         * HTTP status codes that trigger a retry. Null falls back to 429 and 5xx.
         */
        private List<Integer> retryableStatusCodes;
    }
}
