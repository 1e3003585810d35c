package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.client.GenerationContext;
import com.brainstorm.orchestrator.client.GenerationResult;
import com.brainstorm.orchestrator.config.AgentConfig;
import com.brainstorm.orchestrator.model.project.Item;
import com.brainstorm.orchestrator.model.project.ItemState;
import com.brainstorm.orchestrator.model.dto.Reconciliation;
import com.brainstorm.orchestrator.model.dto.ReconciliationContext;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
import com.brainstorm.orchestrator.service.StateReconciler;
import com.brainstorm.orchestrator.workflow.Intent;
import com.brainstorm.orchestrator.workflow.MetadataKeys;
import com.brainstorm.orchestrator.workflow.state.StepInput;
import com.brainstorm.orchestrator.workflow.state.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Decision Recorder and Reviewer Tests")
class DecisionRecorderAgentTest {

    @Mock
    private GenerationBackend backend;

    @Mock
    private PromptLibraryService promptLibrary;

    private DecisionRecorderAgent recorder;
    private ReviewerAgent reviewer;

    @BeforeEach
    void setUp() {
        AgentConfig config = new AgentConfig();
        recorder = new DecisionRecorderAgent(backend, promptLibrary, config);
        reviewer = new ReviewerAgent(backend, promptLibrary, config);
    }

    private static StepInput input(String message, Intent intent) {
        return StepInput.builder().userMessage(message).projectId("p-1").intent(intent).build();
    }

    @Test
    @DisplayName("Record suggests a state from the intent and asks for confirmation when unsure")
    void record_ShouldAskForConfirmationBelowThreshold() {
        // Given
        when(promptLibrary.render(eq("decision-recorder"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any())).thenReturn(GenerationResult.structured("{}", Map.of(
                "shouldRecord", true, "item", "Park the loyalty program", "state", "parked", "confidence", 55)));

        // When
        StepResult result = recorder.invoke(MetadataKeys.Actions.RECORD, input("let's park loyalty", Intent.PARKING),
                ProjectState.empty("p-1"), List.of(), Duration.ofSeconds(5));

        // Then
        assertTrue(result.isTrue(MetadataKeys.SHOULD_RECORD));
        assertTrue(result.isTrue(MetadataKeys.NEEDS_CONFIRMATION));
        assertTrue(result.isShowToUser());
        assertThat(result.getMessage()).contains("Park the loyalty program");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(promptLibrary).render(eq("decision-recorder"), variables.capture());
        assertEquals("parked", variables.getValue().get("suggestedState"));
    }

    @Test
    @DisplayName("Missing confidence falls back to the configured default and stays silent")
    void record_ShouldDefaultConfidence() {
        when(promptLibrary.render(eq("decision-recorder"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any(GenerationContext.class))).thenReturn(GenerationResult.structured("{}",
                Map.of("shouldRecord", true, "item", "Use Postgres", "state", "decided")));

        StepResult result = recorder.invoke(MetadataKeys.Actions.RECORD, input("Use Postgres", Intent.DECIDING),
                ProjectState.empty("p-1"), List.of(), Duration.ofSeconds(5));

        assertEquals(100.0, result.getMetadata().get(MetadataKeys.CONFIDENCE));
        assertFalse(result.isShowToUser());
    }

    @Test
    @DisplayName("A decision without a state is recorded under the state the intent suggests")
    void record_ShouldFallBackToSuggestedStateWhenMissing() {
        // Given
        when(promptLibrary.render(eq("decision-recorder"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any())).thenReturn(GenerationResult.structured("{}", Map.of(
                "shouldRecord", true, "item", "Use JWT for auth", "confidence", 95)));
        StateReconciler reconciler = new StateReconciler(Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));

        // When
        StepResult result = recorder.invoke(MetadataKeys.Actions.RECORD, input("Let's use JWT for auth", Intent.DECIDING),
                ProjectState.empty("p-1"), List.of(), Duration.ofSeconds(5));
        Reconciliation reconciliation = reconciler.apply(ProjectState.empty("p-1"), List.of(result),
                ReconciliationContext.builder()
                        .projectId("p-1")
                        .userMessage("Let's use JWT for auth")
                        .intent(Intent.DECIDING)
                        .build());

        // Then
        assertEquals("decided", result.getMetadata().get(MetadataKeys.STATE));
        assertEquals(1, reconciliation.getState().getItems().size());
        Item item = reconciliation.getState().getItems().get(0);
        assertEquals("Use JWT for auth", item.getText());
        assertEquals(ItemState.DECIDED, item.getState());
    }

    @Test
    @DisplayName("An unrecognised state is replaced by the suggested one")
    void record_ShouldReplaceUnknownState() {
        when(promptLibrary.render(eq("decision-recorder"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any())).thenReturn(GenerationResult.structured("{}", Map.of(
                "shouldRecord", true, "item", "Park the loyalty program", "state", "decision")));

        StepResult result = recorder.invoke(MetadataKeys.Actions.RECORD, input("park loyalty for now", Intent.PARKING),
                ProjectState.empty("p-1"), List.of(), Duration.ofSeconds(5));

        assertEquals("parked", result.getMetadata().get(MetadataKeys.STATE));
    }

    @Test
    @DisplayName("Known states are passed through in canonical form")
    void record_ShouldCanonicaliseKnownState() {
        when(promptLibrary.render(eq("decision-recorder"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any())).thenReturn(GenerationResult.structured("{}", Map.of(
                "shouldRecord", true, "item", "Explore a mobile app", "state", " Exploring ")));

        StepResult result = recorder.invoke(MetadataKeys.Actions.RECORD, input("maybe a mobile app", Intent.DECIDING),
                ProjectState.empty("p-1"), List.of(), Duration.ofSeconds(5));

        assertEquals("exploring", result.getMetadata().get(MetadataKeys.STATE));
    }

    @Test
    @DisplayName("Review findings become a batch without calling the model")
    void recordFromReview_ShouldBuildBatchFromFindings() {
        // Given
        StepResult review = StepResult.builder()
                .agent(MetadataKeys.Agents.REVIEWER)
                .action(MetadataKeys.Actions.REVIEW)
                .metadataEntry(MetadataKeys.HAS_FINDINGS, true)
                .metadataEntry(MetadataKeys.FINDINGS, List.of(
                        Map.of("item", "Launch in Q3", "state", "decided", "userQuote", "we launch in Q3"),
                        Map.of("item", " "),
                        Map.of("item", "Dark mode")))
                .build();

        // When
        StepResult result = recorder.invoke(MetadataKeys.Actions.RECORD_FROM_REVIEW, input("review conversation", Intent.REVIEWING),
                ProjectState.empty("p-1"), List.of(review), Duration.ofSeconds(5));

        // Then
        assertEquals(2, result.getMetadata().get(MetadataKeys.ITEM_COUNT));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> batch = (List<Map<String, Object>>) result.getMetadata().get(MetadataKeys.ITEMS_TO_RECORD);
        assertEquals("we launch in Q3", batch.get(0).get(MetadataKeys.USER_QUOTE));
        assertEquals("exploring", batch.get(1).get(MetadataKeys.STATE));
        assertEquals("Added 2 items from the conversation review.", result.getMessage());
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("Reviewer drops findings already on the board")
    void review_ShouldFilterKnownItems() {
        // Given
        when(promptLibrary.render(eq("reviewer"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any())).thenReturn(GenerationResult.structured("{}", Map.of(
                "summary", "Two things came up.",
                "findings", List.of(Map.of("item", "Use Postgres", "state", "decided"),
                        Map.of("item", "Weekly releases", "state", "decided")))));
        ProjectState state = ProjectState.builder()
                .id("p-1")
                .item(Item.builder()
                        .id("i-1").text("use postgres").state(ItemState.DECIDED).build())
                .build();

        // When
        StepResult result = reviewer.invoke(MetadataKeys.Actions.REVIEW, input("review conversation", Intent.REVIEWING),
                state, List.of(), Duration.ofSeconds(5));

        // Then
        assertTrue(result.isTrue(MetadataKeys.HAS_FINDINGS));
        assertThat((List<?>) result.getMetadata().get(MetadataKeys.FINDINGS)).hasSize(1);
        assertEquals("Two things came up.\n\nNot yet recorded:\n- Weekly releases", result.getMessage());
    }
}
