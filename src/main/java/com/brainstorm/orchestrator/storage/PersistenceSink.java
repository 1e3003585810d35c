package com.brainstorm.orchestrator.storage;

import com.brainstorm.orchestrator.model.activity.ActivityEvent;
import com.brainstorm.orchestrator.model.conversation.ConversationMessage;

import java.util.List;

/**
 * Write side for conversation messages and the activity log. Called off the
 * request path; implementations may be slow.
 */
public interface PersistenceSink {

    void writeMessages(List<ConversationMessage> messages);

    void writeActivity(List<ActivityEvent> events);
}
