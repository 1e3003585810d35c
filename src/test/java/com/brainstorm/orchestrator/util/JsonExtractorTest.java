package com.brainstorm.orchestrator.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JSON Extractor Tests")
class JsonExtractorTest {

    @Test
    @DisplayName("Strips a markdown fence")
    void extract_ShouldStripFence() {
        String raw = "```json\n{\"approved\": true}\n```";

        assertEquals("{\"approved\": true}", JsonExtractor.extract(raw));
    }

    @Test
    @DisplayName("Finds the object inside surrounding prose")
    void extract_ShouldIgnoreProse() {
        String raw = "Sure! Here you go: {\"type\": \"deciding\", \"meta\": {\"a\": 1}} Hope that helps.";

        assertEquals("{\"type\": \"deciding\", \"meta\": {\"a\": 1}}", JsonExtractor.extract(raw));
    }

    @Test
    @DisplayName("Text without an object is returned trimmed")
    void extract_ShouldPassThroughNonJson() {
        assertEquals("no json here", JsonExtractor.extract("  no json here "));
        assertEquals("", JsonExtractor.extract(null));
    }
}
