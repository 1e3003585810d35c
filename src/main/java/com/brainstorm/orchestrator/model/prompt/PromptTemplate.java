package com.brainstorm.orchestrator.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: gap-detector
 * version: 1.0
 * systemPrompt: |
 *   You find missing information...
 * userPrompt: |
 *   Statement: {{userMessage}}
 * </pre>
 *
 * @see com.brainstorm.orchestrator.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;
}
