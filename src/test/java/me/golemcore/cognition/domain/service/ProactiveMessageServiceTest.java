package me.golemcore.cognition.domain.service;

import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.model.ContactDecision;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.ProactiveMessage;
import me.golemcore.cognition.domain.model.ProactiveMessage.MessageStatus;
import me.golemcore.cognition.domain.model.SelfQuestion;
import me.golemcore.cognition.domain.model.SelfQuestion.QuestionStatus;
import me.golemcore.cognition.domain.model.Urgency;
import me.golemcore.cognition.infrastructure.config.AutoConfiguration;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.NotificationPort;
import me.golemcore.cognition.testsupport.InMemoryStoragePort;
import me.golemcore.cognition.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProactiveMessageServiceTest {

    private NotificationPort notificationPort;
    private SelfQuestionService selfQuestionService;
    private ProactiveMessageService service;
    private SelfQuestion question;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
        BotProperties properties = new BotProperties();
        properties.getContact().setSendTimeout(Duration.ofMillis(50));
        JsonFileStore store = new JsonFileStore(new InMemoryStoragePort(), AutoConfiguration.objectMapper(),
                properties);
        notificationPort = mock(NotificationPort.class);
        when(notificationPort.getChannelType()).thenReturn("log");
        selfQuestionService = new SelfQuestionService(store, clock);
        question = selfQuestionService.ask("Why do tides lag the moon?", 9).getValue();
        service = new ProactiveMessageService(store, notificationPort, selfQuestionService, properties, clock);
    }

    private ContactDecision contact() {
        return ContactDecision.builder()
                .shouldContact(true)
                .message("Can we talk about tides?")
                .reason("test")
                .urgency(Urgency.MEDIUM)
                .questionId(question.getId())
                .build();
    }

    @Test
    void shouldMarkSentAndQuestionExploringOnConfirmedDelivery() {
        when(notificationPort.send(any())).thenReturn(CompletableFuture.completedFuture(true));

        OperationResult<ProactiveMessage> result = service.deliver(contact());

        assertEquals(MessageStatus.SENT, result.getValue().getStatus());
        assertNotNull(result.getValue().getSentAt());
        assertEquals(QuestionStatus.EXPLORING, selfQuestionService.findById(question.getId()).orElseThrow()
                .getStatus());
    }

    @Test
    void shouldStayPendingWhenDeliveryNotConfirmed() {
        when(notificationPort.send(any())).thenReturn(CompletableFuture.completedFuture(false));

        OperationResult<ProactiveMessage> result = service.deliver(contact());

        assertEquals(MessageStatus.PENDING, result.getValue().getStatus());
        assertEquals(QuestionStatus.PENDING, selfQuestionService.findById(question.getId()).orElseThrow()
                .getStatus());
    }

    @Test
    void shouldStayPendingWhenDeliveryTimesOut() {
        when(notificationPort.send(any())).thenReturn(new CompletableFuture<>());

        OperationResult<ProactiveMessage> result = service.deliver(contact());

        assertEquals(MessageStatus.PENDING, result.getValue().getStatus());
    }

    @Test
    void shouldReuseSamePendingMessageOnRetry() {
        when(notificationPort.send(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")))
                .thenReturn(CompletableFuture.completedFuture(true));

        service.deliver(contact());
        OperationResult<ProactiveMessage> second = service.deliver(contact());

        assertEquals(1, service.getMessages().size());
        assertEquals(2, second.getValue().getAttempts());
        assertEquals(MessageStatus.SENT, second.getValue().getStatus());
    }

    @Test
    void shouldRefuseNegativeContactDecision() {
        assertFalse(service.deliver(ContactDecision.none("nothing to say")).isSuccess());
        verify(notificationPort, never()).send(any());
    }

    @Test
    void shouldCancelMessage() {
        when(notificationPort.send(any())).thenReturn(CompletableFuture.completedFuture(false));
        ProactiveMessage pending = service.deliver(contact()).getValue();

        OperationResult<ProactiveMessage> cancelled = service.cancel(pending.getId());

        assertEquals(MessageStatus.CANCELLED, cancelled.getValue().getStatus());
        assertEquals(0, service.countPending());
    }
}
