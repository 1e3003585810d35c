package com.brainstorm.orchestrator.model.project;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Provenance of a recorded item.
 */
@Value
@Builder
public class Citation {

    public static final String SOURCE_CONVERSATION = "conversation";
    public static final String SOURCE_REVIEW = "review";

    /**
     * The user's original words that triggered the recording.
     */
    String userQuote;

    Instant timestamp;

    /**
     * 0 - 100.
     */
    double confidence;

    String source;
}
