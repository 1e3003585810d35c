package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.workflow.agents.AgentCapability;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configurable capability for engine tests.
 */
public class StubCapability implements AgentCapability {

    @FunctionalInterface
    public interface Behavior {
        StepResult invoke(String action, StepInput input, ProjectState state, List<StepResult> prior, Duration timeout);
    }

    private final String name;
    private final Map<String, Set<String>> keysByAction;
    private final Behavior behavior;
    private final AtomicInteger invocations = new AtomicInteger();

    public StubCapability(String name, Map<String, Set<String>> keysByAction, Behavior behavior) {
        this.name = name;
        this.keysByAction = keysByAction;
        this.behavior = behavior;
    }

    public static StubCapability of(String name, String action, Set<String> keys, Behavior behavior) {
        return new StubCapability(name, Map.of(action, keys), behavior);
    }

    /**
     * Returns a shown message and the given metadata.
     */
    public static StubCapability replying(String name, String action, String message, Map<String, Object> metadata) {
        return of(name, action, metadata.keySet(), (a, input, state, prior, timeout) -> StepResult.builder()
                .agent(name)
                .action(a)
                .message(message)
                .showToUser(message != null && !message.isEmpty())
                .metadata(metadata)
                .build());
    }

    public int invocations() {
        return invocations.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> actions() {
        return keysByAction.keySet();
    }

    @Override
    public Set<String> producedKeys(String action) {
        return keysByAction.getOrDefault(action, Set.of());
    }

    @Override
    public StepResult invoke(String action, StepInput input, ProjectState projectState,
                             List<StepResult> priorResults, Duration timeout) {
        invocations.incrementAndGet();
        return behavior.invoke(action, input, projectState, priorResults, timeout);
    }
}
