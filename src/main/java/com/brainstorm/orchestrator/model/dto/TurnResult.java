package com.brainstorm.orchestrator.model.dto;

import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.workflow.Intent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What one conversation turn hands back to the request layer.
 */
@Value
@Builder
public class TurnResult {

    Intent intent;

    /**
     * User-facing messages in workflow declaration order. Never empty.
     */
    @Singular
    List<String> messages;

    /**
     * Non-blocking notes from verification and consistency checks.
     */
    @Singular
    List<String> advisories;

    ProjectState updatedState;

    /**
     * True when the turn took the generic fallback path.
     */
    boolean fallback;
}
