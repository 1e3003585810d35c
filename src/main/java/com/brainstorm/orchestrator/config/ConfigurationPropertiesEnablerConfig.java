package com.brainstorm.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the agent and Gemini tuning classes with Spring's property binding.
 *
 * <ul>
 *   <li>{@link GeminiConfig} - temperatures and retry policy for backend calls
 *   <li>{@link AgentConfig} - per-capability settings
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GeminiConfig.class,
    AgentConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
