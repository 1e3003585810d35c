package com.brainstorm.orchestrator.model.context;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DocumentSummary {
    String id;
    String filename;
    String type;
    String description;
}
