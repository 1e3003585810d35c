package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.exception.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name-keyed lookup of every {@link AgentCapability} bean.
 */
@Slf4j
@Component
public class AgentCapabilityRegistry {

    private final Map<String, AgentCapability> capabilities = new LinkedHashMap<>();

    public AgentCapabilityRegistry(List<AgentCapability> beans) {
        for (AgentCapability capability : beans) {
            AgentCapability previous = capabilities.putIfAbsent(capability.name(), capability);
            if (previous != null) {
                throw new ConfigException("Two capabilities named '" + capability.name() + "': "
                        + previous.getClass().getSimpleName() + " and " + capability.getClass().getSimpleName());
            }
        }
        log.info("🧩 Registered {} capabilities: {}", capabilities.size(), capabilities.keySet());
    }

    public Optional<AgentCapability> find(String agentName, String action) {
        AgentCapability capability = capabilities.get(agentName);
        if (capability == null || !capability.actions().contains(action)) {
            return Optional.empty();
        }
        return Optional.of(capability);
    }

    public boolean supports(String agentName, String action) {
        return find(agentName, action).isPresent();
    }

    /**
     * Keys documented by the action, empty when the pair is unknown.
     */
    public Set<String> documentedKeys(String agentName, String action) {
        return find(agentName, action)
                .map(capability -> capability.producedKeys(action))
                .orElse(Set.of());
    }
}
