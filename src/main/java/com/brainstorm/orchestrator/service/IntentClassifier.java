package com.brainstorm.orchestrator.service;

import com.brainstorm.orchestrator.model.conversation.ConversationMessage;
import com.brainstorm.orchestrator.workflow.IntentClassification;

import java.util.List;

public interface IntentClassifier {

    /**
     * Never fails: anything the classifier cannot settle resolves to
     * {@link com.brainstorm.orchestrator.workflow.Intent#UNRESOLVED}.
     */
    IntentClassification classify(String userMessage, List<ConversationMessage> recentHistory);
}
