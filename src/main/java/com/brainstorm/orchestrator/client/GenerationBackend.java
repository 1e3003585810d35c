package com.brainstorm.orchestrator.client;

import com.brainstorm.orchestrator.exception.CapabilityException;

/**
 * Opaque text-generation backend used by every generative capability.
 */
public interface GenerationBackend {

    /**
     * @throws CapabilityException when the call times out, fails upstream, or
     *                             returns output that cannot be parsed as requested
     */
    GenerationResult generate(String prompt, GenerationContext context);
}
