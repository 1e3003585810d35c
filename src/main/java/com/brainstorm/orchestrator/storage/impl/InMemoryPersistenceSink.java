package com.brainstorm.orchestrator.storage.impl;

import com.brainstorm.orchestrator.model.activity.ActivityEvent;
import com.brainstorm.orchestrator.model.conversation.ConversationMessage;
import com.brainstorm.orchestrator.storage.ConversationHistoryStore;
import com.brainstorm.orchestrator.storage.PersistenceSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps messages and activity in memory and serves the message log back as
 * conversation history.
 */
@Slf4j
@Component
public class InMemoryPersistenceSink implements PersistenceSink, ConversationHistoryStore {

    private final Map<String, List<ConversationMessage>> messages = new ConcurrentHashMap<>();
    private final Map<String, List<ActivityEvent>> activity = new ConcurrentHashMap<>();

    @Override
    public void writeMessages(List<ConversationMessage> batch) {
        for (ConversationMessage message : batch) {
            messages.computeIfAbsent(message.getProjectId(), id -> new CopyOnWriteArrayList<>()).add(message);
        }
        log.debug("Stored {} message(s)", batch.size());
    }

    @Override
    public void writeActivity(List<ActivityEvent> events) {
        for (ActivityEvent event : events) {
            activity.computeIfAbsent(event.getProjectId(), id -> new CopyOnWriteArrayList<>()).add(event);
        }
        log.debug("Stored {} activity event(s)", events.size());
    }

    @Override
    public List<ConversationMessage> fetchRecent(String projectId, int limit) {
        List<ConversationMessage> all = messages.getOrDefault(projectId, List.of());
        List<ConversationMessage> snapshot = List.copyOf(all);
        int from = Math.max(0, snapshot.size() - limit);
        return snapshot.subList(from, snapshot.size());
    }

    public List<ActivityEvent> activityFor(String projectId) {
        return List.copyOf(activity.getOrDefault(projectId, List.of()));
    }
}
