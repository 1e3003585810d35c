package com.brainstorm.orchestrator.model.project;

import java.util.Locale;
import java.util.Optional;

/**
 * Column an item lives in on the project board.
 */
public enum ItemState {
    DECIDED,
    EXPLORING,
    PARKED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of the state string agents put into metadata.
     */
    public static Optional<ItemState> fromValue(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.toString().trim().toUpperCase(Locale.ROOT);
        for (ItemState state : values()) {
            if (state.name().equals(text)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
