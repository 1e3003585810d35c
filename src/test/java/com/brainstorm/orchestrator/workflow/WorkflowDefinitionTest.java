package com.brainstorm.orchestrator.workflow;

import com.brainstorm.orchestrator.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.brainstorm.orchestrator.workflow.StepSpec.step;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Workflow Definition Tests")
class WorkflowDefinitionTest {

    @Test
    @DisplayName("Ungrouped steps become singleton phases, contiguous groups one phase")
    void phases_ShouldFollowDeclaration() {
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.DECIDING)
                .parallel(step("a", "x"), step("b", "x"))
                .then(step("c", "x"))
                .parallel(step("d", "x"), step("e", "x"), step("f", "x"))
                .then(step("g", "x"))
                .build();

        List<WorkflowPhase> phases = workflow.phases();

        assertEquals(4, phases.size());
        assertEquals(2, phases.get(0).getSteps().size());
        assertTrue(phases.get(0).isParallel());
        assertFalse(phases.get(1).isParallel());
        assertEquals("c", phases.get(1).getSteps().get(0).getAgentName());
        assertEquals(List.of("d", "e", "f"),
                phases.get(2).getSteps().stream().map(StepSpec::getAgentName).toList());
        assertEquals(3, phases.get(3).getIndex());
    }

    @Test
    @DisplayName("A group tag that reappears after another phase is rejected")
    void phases_ShouldRejectNonContiguousGroup() {
        WorkflowDefinition workflow = new WorkflowDefinition(Intent.GENERAL, List.of(
                step("a", "x").inGroup("g1"),
                step("b", "x"),
                step("c", "x").inGroup("g1")));

        ConfigException error = assertThrows(ConfigException.class, workflow::phases);
        assertEquals(Intent.GENERAL, error.getIntent());
        assertTrue(error.getMessage().contains("g1"));
    }

    @Test
    @DisplayName("Two different adjacent groups are two phases")
    void phases_ShouldSplitAdjacentGroups() {
        WorkflowDefinition workflow = new WorkflowDefinition(Intent.GENERAL, List.of(
                step("a", "x").inGroup("g1"),
                step("b", "x").inGroup("g1"),
                step("c", "x").inGroup("g2")));

        List<WorkflowPhase> phases = workflow.phases();

        assertEquals(2, phases.size());
        assertEquals("g2", phases.get(1).getParallelGroup());
    }

    @Test
    @DisplayName("Steps are copied, the definition is immutable")
    void steps_ShouldBeImmutable() {
        WorkflowDefinition workflow = WorkflowDefinition.forIntent(Intent.ASKING).then(step("a", "x")).build();

        assertThrows(UnsupportedOperationException.class, () -> workflow.getSteps().add(step("b", "x")));
    }
}
