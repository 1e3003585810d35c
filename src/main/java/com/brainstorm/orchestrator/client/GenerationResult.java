package com.brainstorm.orchestrator.client;

import lombok.Value;

import java.util.Map;

@Value
public class GenerationResult {

    String text;

    /**
     * Parsed JSON object for JSON calls, empty otherwise.
     */
    Map<String, Object> structuredMetadata;

    public static GenerationResult text(String text) {
        return new GenerationResult(text, Map.of());
    }

    public static GenerationResult structured(String text, Map<String, Object> metadata) {
        return new GenerationResult(text, metadata);
    }
}
