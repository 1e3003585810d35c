package com.brainstorm.orchestrator.model;

/**
 * External services called during a turn, for unified call logging.
 *
 * @see com.brainstorm.orchestrator.util.ExternalCallLogger
 */
public enum ServiceType {
    GEMINI("🔴", "Gemini");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
