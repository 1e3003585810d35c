package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.exception.ConfigException;
import com.brainstorm.orchestrator.workflow.agents.AgentCapabilityRegistry;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.brainstorm.orchestrator.workflow.StepSpec.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Workflow Registry Tests")
class WorkflowRegistryTest {

    private WorkflowRegistry registry;

    @BeforeEach
    void setUp() {
        StubCapability verifier = StubCapability.of("verifier", "verify", Set.of("approved", "issues"),
                (action, input, state, prior, timeout) -> StepResult.builder().agent("verifier").build());
        StubCapability recorder = StubCapability.of("recorder", "record", Set.of("shouldRecord", "item"),
                (action, input, state, prior, timeout) -> StepResult.builder().agent("recorder").build());
        StubCapability chat = StubCapability.of("chat", "reply", Set.of(),
                (action, input, state, prior, timeout) -> StepResult.builder().agent("chat").build());

        registry = new WorkflowRegistry(new AgentCapabilityRegistry(List.of(verifier, recorder, chat)));
    }

    @Test
    @DisplayName("Condition on a key no earlier step documents fails at registration")
    void register_ShouldRejectUndocumentedConditionKey() {
        // Given: recording gated on a verifier field that is never produced
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.DECIDING)
                .then(step("verifier", "verify"))
                .then(step("recorder", "record").when(StepCondition.isTrue("verifier", "verified")))
                .build();

        // When/Then
        assertThatThrownBy(() -> registry.register(workflow))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("verifier.verified");
        assertThat(registry.registeredIntents()).doesNotContain(Intent.DECIDING);
    }

    @Test
    @DisplayName("Condition may not read a key produced in the same phase")
    void register_ShouldRejectSamePhaseReference() {
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.DECIDING)
                .parallel(step("verifier", "verify"),
                        step("recorder", "record").when(StepCondition.isTrue("verifier", "approved")))
                .build();

        assertThatThrownBy(() -> registry.register(workflow)).isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("Agent-scoped reference must name the agent that documents the key")
    void register_ShouldRejectWrongAgentForKey() {
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.DECIDING)
                .then(step("recorder", "record"))
                .then(step("chat", "reply").when(StepCondition.isTrue("verifier", "shouldRecord")))
                .build();

        assertThatThrownBy(() -> registry.register(workflow)).isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("Composite conditions are validated on every reference")
    void register_ShouldValidateCompositeConditions() {
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.MODIFYING)
                .then(step("verifier", "verify"))
                .then(step("chat", "reply").when(StepCondition.anyOf(
                        StepCondition.isFalse("verifier", "approved"),
                        StepCondition.isNotEmpty(null, "conflicts"))))
                .build();

        assertThatThrownBy(() -> registry.register(workflow))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("conflicts");
    }

    @Test
    @DisplayName("Unknown agent or action fails at registration")
    void register_ShouldRejectUnknownCapability() {
        assertThatThrownBy(() -> registry.register(WorkflowDefinition.forIntent(Intent.ASKING)
                .then(step("nobody", "reply")).build()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("nobody.reply");

        assertThatThrownBy(() -> registry.register(WorkflowDefinition.forIntent(Intent.ASKING)
                .then(step("chat", "shout")).build()))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("Valid workflow registers and can be looked up")
    void register_ShouldAcceptValidWorkflow() {
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.DECIDING)
                .then(step("recorder", "record"))
                .parallel(step("verifier", "verify"), step("chat", "reply"))
                .then(step("chat", "reply").when(StepCondition.isFalse("verifier", "approved")))
                .build();

        registry.register(workflow);

        assertThat(registry.lookup(Intent.DECIDING)).isSameAs(workflow);
        assertThat(registry.registeredIntents()).containsExactly(Intent.DECIDING);
    }

    @Test
    @DisplayName("Registering the same intent twice fails")
    void register_ShouldRejectDuplicateIntent() {
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.ASKING).then(step("chat", "reply")).build();
        registry.register(workflow);

        assertThatThrownBy(() -> registry.register(workflow))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    @DisplayName("Lookup of an unregistered intent fails with the intent attached")
    void lookup_ShouldFailForUnregisteredIntent() {
        assertThatThrownBy(() -> registry.lookup(Intent.UPLOADING))
                .isInstanceOf(ConfigException.class)
                .extracting(e -> ((ConfigException) e).getIntent())
                .isEqualTo(Intent.UPLOADING);
    }

    @Test
    @DisplayName("Two capabilities with the same name fail fast")
    void capabilityRegistry_ShouldRejectDuplicateNames() {
        StubCapability first = StubCapability.replying("chat", "reply", "hi", Map.of());
        StubCapability second = StubCapability.replying("chat", "reply", "hello", Map.of());

        assertThatThrownBy(() -> new AgentCapabilityRegistry(List.of(first, second)))
                .isInstanceOf(ConfigException.class);
    }
}
