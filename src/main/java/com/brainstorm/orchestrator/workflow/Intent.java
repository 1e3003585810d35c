package com.brainstorm.orchestrator.workflow;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Classified purpose of a user utterance. Produced per turn, never persisted.
 */
public enum Intent {
    BRAINSTORMING,
    DECIDING,
    MODIFYING,
    EXPLORING,
    PARKING,
    ASKING,
    REVIEWING,
    UPLOADING,
    GENERAL,
    UNRESOLVED;

    private static final Map<String, Intent> ALIASES = Map.of(
            "questioning", ASKING,
            "question", ASKING,
            "reference_integration", UPLOADING,
            "upload", UPLOADING,
            "development", GENERAL,
            "decide", DECIDING,
            "explore", EXPLORING,
            "park", PARKING,
            "review", REVIEWING
    );

    /**
     * Maps a classifier label onto the enumeration. Empty for labels that
     * are neither a member name nor a known alias.
     */
    public static Optional<Intent> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        Intent alias = ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        for (Intent intent : values()) {
            if (intent.name().equalsIgnoreCase(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
