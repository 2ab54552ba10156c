package me.golemcore.cognition.domain.service;

import me.golemcore.cognition.domain.model.AgentMode;
import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.ContactDecision;
import me.golemcore.cognition.domain.model.SelfQuestion;
import me.golemcore.cognition.domain.model.Urgency;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class ContactGateTest {

    private SelfQuestionService selfQuestionService;
    private ContactGate gate;

    @BeforeEach
    void setUp() {
        selfQuestionService = mock(SelfQuestionService.class);
        gate = new ContactGate(selfQuestionService, new BotProperties());
    }

    private static AgentState stateWithIntensity(int intensity) {
        return AgentState.builder()
                .mode(AgentMode.THINKING)
                .motivation("curiosity")
                .motivationIntensity(intensity)
                .autonomyLevel(8)
                .build();
    }

    private void givenTopQuestion(int priority) {
        SelfQuestion question = SelfQuestion.builder()
                .id("q-1")
                .question("Why do tides lag the moon?")
                .priority(priority)
                .build();
        when(selfQuestionService.findTopPending(anyInt())).thenAnswer(invocation -> {
            int min = invocation.getArgument(0);
            return priority >= min ? Optional.of(question) : Optional.empty();
        });
    }

    @Test
    void shouldContactWhenQuestionAndMotivationBothQualify() {
        givenTopQuestion(8);

        ContactDecision decision = gate.evaluate(stateWithIntensity(7));

        assertTrue(decision.isShouldContact());
        assertEquals("q-1", decision.getQuestionId());
        assertEquals(Urgency.MEDIUM, decision.getUrgency());
        assertTrue(decision.getMessage().contains("Why do tides lag the moon?"));
    }

    @Test
    void shouldNotContactWithLowMotivationEvenForUrgentQuestion() {
        givenTopQuestion(10);

        assertFalse(gate.evaluate(stateWithIntensity(6)).isShouldContact());
    }

    @Test
    void shouldNotContactWithHighMotivationButMinorQuestion() {
        givenTopQuestion(7);

        assertFalse(gate.evaluate(stateWithIntensity(10)).isShouldContact());
    }

    @Test
    void shouldNotContactWithoutPendingQuestions() {
        when(selfQuestionService.findTopPending(anyInt())).thenReturn(Optional.empty());

        ContactDecision decision = gate.evaluate(stateWithIntensity(10));

        assertFalse(decision.isShouldContact());
        assertNotNull(decision.getReason());
    }

    @Test
    void shouldHonorConfiguredThresholds() {
        BotProperties properties = new BotProperties();
        properties.getContact().setMinQuestionPriority(5);
        properties.getContact().setMinMotivationIntensity(3);
        gate = new ContactGate(selfQuestionService, properties);
        givenTopQuestion(5);

        assertTrue(gate.evaluate(stateWithIntensity(3)).isShouldContact());
    }
}
