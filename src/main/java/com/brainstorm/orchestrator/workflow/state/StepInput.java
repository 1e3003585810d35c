package com.brainstorm.orchestrator.workflow.state;

import com.brainstorm.orchestrator.model.context.DocumentSummary;
import com.brainstorm.orchestrator.model.context.ReferenceSummary;
import com.brainstorm.orchestrator.model.conversation.ConversationMessage;
import com.brainstorm.orchestrator.workflow.Intent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything a capability sees about the current turn besides the project
 * state and the results of earlier phases.
 */
@Value
@Builder
public class StepInput {

    String userMessage;
    String projectId;
    String userId;
    Intent intent;

    @Singular("historyMessage")
    List<ConversationMessage> history;

    @Singular
    List<ReferenceSummary> references;

    @Singular
    List<DocumentSummary> documents;
}
