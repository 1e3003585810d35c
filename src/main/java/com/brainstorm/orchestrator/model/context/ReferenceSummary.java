package com.brainstorm.orchestrator.model.context;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of an uploaded reference (PDF, image, link) produced by the
 * out-of-scope upload analysis pipeline.
 */
@Value
@Builder
public class ReferenceSummary {
    String id;
    String filename;
    String type;
    String description;
    String analysis;
}
