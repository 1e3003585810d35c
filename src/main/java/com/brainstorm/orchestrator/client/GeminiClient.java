package com.brainstorm.orchestrator.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.brainstorm.orchestrator.config.GeminiConfig;
import com.brainstorm.orchestrator.configuration.AppProperties;
import com.brainstorm.orchestrator.configuration.GeminiProperties;
import com.brainstorm.orchestrator.exception.CapabilityException;
import com.brainstorm.orchestrator.model.CallContext;
import com.brainstorm.orchestrator.model.ServiceType;
import com.brainstorm.orchestrator.util.ExternalCallLogger;
import com.brainstorm.orchestrator.util.JsonExtractor;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link GenerationBackend} backed by the Gemini generateContent REST API.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient implements GenerationBackend {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final AppProperties props;
    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        GeminiProperties gemini = props.getGemini();
        // key travels as a header, never in the URL
        this.geminiWebClient = WebClient.builder()
                .baseUrl(gemini.getBaseUrl())
                .defaultHeader("x-goog-api-key", gemini.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public GenerationResult generate(String prompt, GenerationContext context) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);

        GeminiProperties gemini = props.getGemini();
        String model = gemini.getChatModel();
        Duration timeout = context.getTimeout() != null ? context.getTimeout() : gemini.getRequestTimeout();
        double temperature = geminiConfig.getTemperatureForAgent(context.getAgentName(), context.isExpectJson());

        callCtx.logRequest("Generating " + (context.isExpectJson() ? "JSON" : "text"),
                "Agent", context.getAgentName() + "." + context.getAction(),
                "Project", context.getProjectId() != null ? context.getProjectId() : "N/A",
                "Model", model,
                "Prompt Length", prompt.length() + " chars",
                "Prompt", ExternalCallLogger.truncate(prompt, 500));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature", temperature);
        if (context.isExpectJson()) {
            generationConfig.put("responseMimeType", "application/json");
        }
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", generationConfig);

        String json;
        try {
            json = geminiWebClient.post()
                    .uri(getApiUrl(gemini, model))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw CapabilityException.upstream(
                    "Gemini returned " + e.getStatusCode().value() + " for " + context.getAgentName(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                callCtx.logError("Timed out after " + timeout.toMillis() + "ms", null);
                throw CapabilityException.timeout(
                        "Gemini call for " + context.getAgentName() + " exceeded " + timeout.toMillis() + "ms");
            }
            callCtx.logError("Unexpected error", cause);
            throw CapabilityException.upstream("Gemini call failed for " + context.getAgentName(), cause);
        }

        String text = extractText(json);
        callCtx.logResponse("Generated",
                "Response Length", text.length() + " chars",
                "Response", ExternalCallLogger.truncate(text, 500));

        if (!context.isExpectJson()) {
            return GenerationResult.text(text);
        }
        return GenerationResult.structured(text, parseObject(text, context));
    }

    private String getApiUrl(GeminiProperties gemini, String model) {
        return String.format("/%s/models/%s:generateContent", gemini.getApiVersion(), model);
    }

    private Retry buildRetrySpec() {
        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofMillis(retry.getInitialBackoffMillis()))
                .maxBackoff(Duration.ofMillis(retry.getMaxBackoffMillis()))
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private boolean isRetryable(Throwable ex) {
        if (ex instanceof WebClientRequestException) {
            return true;
        }
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = geminiConfig.getRetry().getRetryableStatusCodes();
        if (codes == null) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return codes.contains(webEx.getStatusCode().value());
    }

    private String extractText(String rawJson) {
        try {
            JsonNode root = objectMapper.readTree(rawJson);
            JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
            if (text.isMissingNode() || text.isNull()) {
                throw CapabilityException.invalidResponse("Gemini response has no candidate text", null);
            }
            return text.asText();
        } catch (CapabilityException e) {
            throw e;
        } catch (Exception e) {
            throw CapabilityException.invalidResponse("Gemini response is not valid JSON", e);
        }
    }

    private Map<String, Object> parseObject(String text, GenerationContext context) {
        try {
            return objectMapper.readValue(JsonExtractor.extract(text), MAP_TYPE);
        } catch (Exception e) {
            log.warn("⚠️ {} returned unparseable JSON: {}", context.getAgentName(), ExternalCallLogger.truncate(text, 200));
            throw CapabilityException.invalidResponse("Could not parse JSON output for " + context.getAgentName(), e);
        }
    }
}
