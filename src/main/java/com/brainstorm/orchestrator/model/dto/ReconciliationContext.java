package com.brainstorm.orchestrator.model.dto;

import com.brainstorm.orchestrator.workflow.Intent;
import lombok.Builder;
import lombok.Value;

/**
 * Turn facts the reconciler stamps onto items and events.
 */
@Value
@Builder
public class ReconciliationContext {

    String projectId;

    /**
     * Quoted verbatim in the citation of items recorded from this turn.
     */
    String userMessage;

    Intent intent;
}
