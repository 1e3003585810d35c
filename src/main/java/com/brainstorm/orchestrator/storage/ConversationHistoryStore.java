package com.brainstorm.orchestrator.storage;

import com.brainstorm.orchestrator.model.conversation.ConversationMessage;

import java.util.List;

public interface ConversationHistoryStore {

    /**
     * @return at most {@code limit} of the latest messages, oldest first
     */
    List<ConversationMessage> fetchRecent(String projectId, int limit);
}
