package com.brainstorm.orchestrator.model.project;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One entry of the project's decision trail.
 *
 * Items are immutable. A correction or a state move is recorded as a new
 * item layered on top of the old one.
 */
@Value
@Builder
public class Item {

    @NonNull
    String id;

    @NonNull
    String text;

    @NonNull
    ItemState state;

    Citation citation;

    boolean archived;

    Instant createdAt;

    public boolean isActive() {
        return !archived;
    }
}
