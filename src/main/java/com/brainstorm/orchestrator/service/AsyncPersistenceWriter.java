package com.brainstorm.orchestrator.service;

import com.brainstorm.orchestrator.model.activity.ActivityEvent;
import com.brainstorm.orchestrator.model.conversation.ConversationMessage;
import com.brainstorm.orchestrator.storage.PersistenceSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fire-and-forget writes of a turn's messages and activity. Failures are
 * logged and never reach the turn.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AsyncPersistenceWriter {

    private final PersistenceSink sink;

    @Async("persistenceExecutor")
    public void writeMessages(List<ConversationMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        try {
            sink.writeMessages(messages);
        } catch (RuntimeException e) {
            log.error("❌ Failed to persist {} message(s) for project {}",
                    messages.size(), messages.get(0).getProjectId(), e);
        }
    }

    @Async("persistenceExecutor")
    public void writeActivity(List<ActivityEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        try {
            sink.writeActivity(events);
        } catch (RuntimeException e) {
            log.error("❌ Failed to persist {} activity event(s) for project {}",
                    events.size(), events.get(0).getProjectId(), e);
        }
    }
}
