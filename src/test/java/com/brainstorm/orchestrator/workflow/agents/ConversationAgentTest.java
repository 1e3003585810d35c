package com.brainstorm.orchestrator.workflow.agents;

import com.brainstorm.orchestrator.client.GenerationBackend;
import com.brainstorm.orchestrator.client.GenerationContext;
import com.brainstorm.orchestrator.client.GenerationResult;
import com.brainstorm.orchestrator.config.AgentConfig;
import com.brainstorm.orchestrator.model.project.ProjectState;
import com.brainstorm.orchestrator.service.PromptLibraryService;
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

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Conversation Agent Tests")
class ConversationAgentTest {

    private static final String DETAILED_MESSAGE = "We are building a payment API for 1200 restaurants in Chicago "
            + "using Stripe, with a budget of 50000 dollars and a deadline in March, so the backend has to be "
            + "ready by week 6 and the mobile app by week 10.";

    @Mock
    private GenerationBackend backend;

    @Mock
    private PromptLibraryService promptLibrary;

    private ConversationAgent agent;

    @BeforeEach
    void setUp() {
        agent = new ConversationAgent(backend, promptLibrary, new AgentConfig());
    }

    private StepResult reply(String userMessage) {
        StepInput input = StepInput.builder()
                .userMessage(userMessage)
                .projectId("p-1")
                .intent(Intent.BRAINSTORMING)
                .build();
        return agent.invoke(MetadataKeys.Actions.REFLECT, input, ProjectState.empty("p-1"), List.of(), Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Terse input is scored terse and allows a few foundational questions")
    void invoke_ShouldTreatShortInputAsTerse() {
        // Given
        when(promptLibrary.render(eq("conversation"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any())).thenReturn(
                GenerationResult.text("A dog walking app. Who is it for? What city first?"));

        // When
        StepResult result = reply("An app for dog walkers");

        // Then
        assertTrue(result.isShowToUser());
        assertEquals(ConversationAgent.DETAIL_TERSE, result.getMetadata().get(MetadataKeys.DETAIL_LEVEL));
        assertEquals(false, result.getMetadata().get(MetadataKeys.WAS_RETRIED));
        assertEquals(0, result.getMetadata().get(MetadataKeys.SUGGESTION_COUNT));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(promptLibrary).render(eq("conversation"), variables.capture());
        assertEquals(true, variables.getValue().get("terse"));
        assertEquals(3, variables.getValue().get("maxQuestions"));
    }

    @Test
    @DisplayName("Detailed input is scored detailed and suggestions are counted")
    void invoke_ShouldTreatRichInputAsDetailed() {
        when(promptLibrary.render(eq("conversation"), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any())).thenReturn(GenerationResult.text(
                "So a Stripe-based payment API for 1200 Chicago restaurants.\n"
                        + "- Start with card-present payments\n"
                        + "- Add tipping in week 8\n"
                        + "- Pilot with 20 restaurants\n"
                        + "- Offer a dashboard\n"
                        + "Which POS systems matter most?"));

        StepResult result = reply(DETAILED_MESSAGE);

        assertEquals(ConversationAgent.DETAIL_DETAILED, result.getMetadata().get(MetadataKeys.DETAIL_LEVEL));
        assertEquals(3, result.getMetadata().get(MetadataKeys.SUGGESTION_COUNT));
        assertEquals(false, result.getMetadata().get(MetadataKeys.WAS_RETRIED));
    }

    @Test
    @DisplayName("A correction that gets a question back is regenerated once with the strict prompt")
    void invoke_ShouldRetryOnceWhenCorrectionGetsQuestion() {
        // Given
        when(promptLibrary.render(anyString(), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any()))
                .thenReturn(GenerationResult.text("Got it, cats. Which breed?"))
                .thenReturn(GenerationResult.text("Understood, the app is for cat owners."));

        // When
        StepResult result = reply("No, I said it's for cats");

        // Then
        assertEquals("Understood, the app is for cat owners.", result.getMessage());
        assertEquals(true, result.getMetadata().get(MetadataKeys.IS_CORRECTION));
        assertEquals(true, result.getMetadata().get(MetadataKeys.WAS_RETRIED));
        verify(promptLibrary).render(eq("conversation-strict"), anyMap());
        verify(backend, times(2)).generate(anyString(), any(GenerationContext.class));
    }

    @Test
    @DisplayName("The strict reply is used even if it still breaks the rules")
    void invoke_ShouldNotRetryTwice() {
        when(promptLibrary.render(anyString(), anyMap())).thenReturn("prompt");
        when(backend.generate(anyString(), any()))
                .thenReturn(GenerationResult.text("Looking at your documents, this opens up a lot."))
                .thenReturn(GenerationResult.text("This opens up options."));

        StepResult result = reply("A recipe sharing site");

        assertEquals("This opens up options.", result.getMessage());
        verify(backend, times(2)).generate(anyString(), any());
    }

    @Test
    @DisplayName("Leading 'no' and configured phrases count as corrections")
    void isCorrection_ShouldDetectSignals() {
        assertTrue(agent.isCorrection("no that's not it"));
        assertTrue(agent.isCorrection("You're not listening to me"));
        assertTrue(agent.isCorrection("I just said it was weekly"));
        assertFalse(agent.isCorrection("Nobody uses fax anymore"));
        assertFalse(agent.isCorrection("Let's add a calendar view"));
    }

    @Test
    @DisplayName("Detail score weighs numbers, proper nouns and technical terms")
    void detailScore_ShouldWeighConcreteDetail() {
        int plain = agent.detailScore("we want something for people");
        int concrete = agent.detailScore("we want an API for 300 clinics in Boston");

        assertEquals(5, plain);
        assertTrue(concrete > plain + 10, "concrete score was " + concrete);
        assertEquals(0, agent.detailScore("   "));
    }

    @Test
    @DisplayName("Too many questions for a terse reply is a violation")
    void findViolation_ShouldCountQuestions() {
        assertTrue(agent.findViolation("A? B? C? D?", false, 3).isPresent());
        assertTrue(agent.findViolation("A? B? C?", false, 3).isEmpty());
        assertTrue(agent.findViolation("Sure?", true, 0).isPresent());
    }
}
