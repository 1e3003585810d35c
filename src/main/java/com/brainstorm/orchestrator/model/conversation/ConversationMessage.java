package com.brainstorm.orchestrator.model.conversation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One chat message of a project conversation.
 */
@Value
@Builder
public class ConversationMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    String projectId;

    String userId;

    /**
     * "user" or "assistant".
     */
    String role;

    String content;

    /**
     * Capability that produced the message, null for user messages.
     */
    String agentName;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    Instant createdAt;

    public boolean isFromUser() {
        return ROLE_USER.equals(role);
    }
}
