package com.brainstorm.orchestrator.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Prompt Library Tests")
class PromptLibraryServiceTest {

    private PromptLibraryService library;

    @BeforeEach
    void setUp() {
        library = new PromptLibraryService();
        library.loadPrompts();
    }

    @Test
    @DisplayName("Every prompt a capability renders is on the classpath")
    void loadPrompts_ShouldLoadAllTemplates() {
        assertThat(library.templateNames()).contains(
                "intent-classifier", "conversation", "conversation-strict", "gap-detector", "clarifier",
                "decision-recorder", "claim-verifier", "assumption-scanner", "consistency-checker", "reviewer");
    }

    @Test
    @DisplayName("User text is inserted verbatim, not HTML-escaped")
    void render_ShouldNotEscapeUserText() {
        String prompt = library.render("conversation", Map.of(
                "userMessage", "Budget < $5k & \"soon\"",
                "terse", true,
                "maxQuestions", 3));

        assertTrue(prompt.contains("User: Budget < $5k & \"soon\""));
        assertTrue(prompt.contains("at most 3 short foundational questions"));
        assertFalse(prompt.contains("The user is correcting you"));
    }

    @Test
    @DisplayName("Unknown template names fail loudly")
    void render_ShouldRejectUnknownTemplate() {
        assertThrows(IllegalArgumentException.class, () -> library.render("nope", Map.of()));
    }
}
