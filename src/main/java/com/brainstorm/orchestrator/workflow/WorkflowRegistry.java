package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.exception.ConfigException;
import com.brainstorm.orchestrator.workflow.agents.AgentCapabilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated table of intent to workflow.
 *
 * Everything that can be checked without running a workflow is checked in
 * {@link #register}: unknown capabilities, split parallel groups, and
 * conditions reading keys no earlier phase documents.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowRegistry {

    private final AgentCapabilityRegistry capabilities;

    private final Map<Intent, WorkflowDefinition> workflows = new EnumMap<>(Intent.class);

    public synchronized void register(WorkflowDefinition workflow) {
        Intent intent = workflow.getIntent();
        if (workflows.containsKey(intent)) {
            throw new ConfigException("Workflow for " + intent + " is already registered", intent);
        }
        validate(workflow);
        workflows.put(intent, workflow);
        log.debug("Registered workflow {}: {}", intent, workflow.getSteps());
    }

    /**
     * @throws ConfigException when no workflow is registered for the intent
     */
    public synchronized WorkflowDefinition lookup(Intent intent) {
        WorkflowDefinition workflow = workflows.get(intent);
        if (workflow == null) {
            throw new ConfigException("No workflow registered for intent " + intent, intent);
        }
        return workflow;
    }

    public synchronized Set<Intent> registeredIntents() {
        return Set.copyOf(workflows.keySet());
    }

    private void validate(WorkflowDefinition workflow) {
        Intent intent = workflow.getIntent();
        List<WorkflowPhase> phases = workflow.phases();

        // agent name -> keys documented by that agent in phases seen so far
        Map<String, Set<String>> documentedByAgent = new HashMap<>();
        Set<String> documented = new HashSet<>();

        for (WorkflowPhase phase : phases) {
            for (StepSpec step : phase.getSteps()) {
                if (!capabilities.supports(step.getAgentName(), step.getAction())) {
                    throw new ConfigException("Workflow " + intent + " names unknown capability " + step.key(), intent);
                }
                if (step.isConditional()) {
                    for (MetadataRef ref : step.getCondition().references()) {
                        checkReference(intent, step, ref, documented, documentedByAgent);
                    }
                }
            }
            for (StepSpec step : phase.getSteps()) {
                Set<String> keys = capabilities.documentedKeys(step.getAgentName(), step.getAction());
                documented.addAll(keys);
                documentedByAgent.computeIfAbsent(step.getAgentName(), name -> new HashSet<>()).addAll(keys);
            }
        }
    }

    private static void checkReference(Intent intent, StepSpec step, MetadataRef ref,
                                       Set<String> documented, Map<String, Set<String>> documentedByAgent) {
        boolean satisfied = ref.getAgentName() == null
                ? documented.contains(ref.getKey())
                : documentedByAgent.getOrDefault(ref.getAgentName(), Set.of()).contains(ref.getKey());
        if (!satisfied) {
            throw new ConfigException("Condition on " + step.key() + " in workflow " + intent
                    + " reads '" + ref + "', which no step in an earlier phase documents", intent);
        }
    }
}
