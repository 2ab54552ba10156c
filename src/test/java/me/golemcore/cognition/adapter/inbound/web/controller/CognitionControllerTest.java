package me.golemcore.cognition.adapter.inbound.web.controller;

import me.golemcore.cognition.auto.CognitionScheduler;
import me.golemcore.cognition.domain.model.AgentMode;
import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.AgentStateUpdate;
import me.golemcore.cognition.domain.model.CognitiveTask;
import me.golemcore.cognition.domain.model.CycleOutcome;
import me.golemcore.cognition.domain.model.DecisionRecord;
import me.golemcore.cognition.domain.model.RateLimitWindow;
import me.golemcore.cognition.domain.model.SchedulerStatus;
import me.golemcore.cognition.domain.service.AgentStateService;
import me.golemcore.cognition.domain.service.DecisionAuditService;
import me.golemcore.cognition.domain.service.MemoryConsolidationService;
import me.golemcore.cognition.domain.service.TaskQueueService;
import me.golemcore.cognition.ratelimit.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CognitionControllerTest {

    private CognitionScheduler scheduler;
    private AgentStateService agentStateService;
    private TaskQueueService taskQueueService;
    private DecisionAuditService decisionAuditService;
    private RateLimiter rateLimiter;
    private CognitionController controller;

    @BeforeEach
    void setUp() {
        scheduler = mock(CognitionScheduler.class);
        agentStateService = mock(AgentStateService.class);
        taskQueueService = mock(TaskQueueService.class);
        decisionAuditService = mock(DecisionAuditService.class);
        rateLimiter = mock(RateLimiter.class);
        controller = new CognitionController(scheduler, agentStateService, mock(MemoryConsolidationService.class),
                taskQueueService, decisionAuditService, rateLimiter);
    }

    @Test
    void rateLimitResetShouldClearWindowBeforeReportingIt() {
        when(rateLimiter.getWindow()).thenReturn(RateLimitWindow.builder()
                .callCount(0)
                .maxCallsPerMinute(20)
                .build());

        StepVerifier.create(controller.resetRateLimit())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(0, response.getBody().getCallCount());
                    assertNull(response.getBody().getCooldownUntil());
                })
                .verifyComplete();

        InOrder order = inOrder(rateLimiter);
        order.verify(rateLimiter).reset();
        order.verify(rateLimiter).getWindow();
    }

    @Test
    void startShouldReportWhetherStateChanged() {
        when(scheduler.start()).thenReturn(false);
        when(scheduler.isRunning()).thenReturn(true);

        StepVerifier.create(controller.start())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().running());
                    assertFalse(response.getBody().changed());
                })
                .verifyComplete();
    }

    @Test
    void cycleShouldReturnOutcome() {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        when(scheduler.tick()).thenReturn(CycleOutcome.SKIPPED_BUSY);
        when(scheduler.getStatus()).thenReturn(SchedulerStatus.builder().lastCycleAt(at).build());

        StepVerifier.create(controller.runCycle())
                .assertNext(response -> {
                    assertEquals("SKIPPED_BUSY", response.getBody().outcome());
                    assertEquals(at, response.getBody().completedAt());
                })
                .verifyComplete();
    }

    @Test
    void updateStateShouldParseModeCaseInsensitively() {
        AgentState updated = AgentState.builder().mode(AgentMode.SLEEPING).build();
        when(agentStateService.update(any())).thenReturn(updated);

        StepVerifier.create(controller.updateState(
                new CognitionController.StateUpdateRequest("sleeping", null, 4, null)))
                .assertNext(response -> assertEquals(AgentMode.SLEEPING, response.getBody().getMode()))
                .verifyComplete();

        ArgumentCaptor<AgentStateUpdate> captor = ArgumentCaptor.forClass(AgentStateUpdate.class);
        verify(agentStateService).update(captor.capture());
        assertEquals(AgentMode.SLEEPING, captor.getValue().getMode());
        assertEquals(4, captor.getValue().getMotivationIntensity());
        assertNull(captor.getValue().getAutonomyLevel());
    }

    @Test
    void updateStateShouldRejectUnknownMode() {
        CognitionController.StateUpdateRequest request = new CognitionController.StateUpdateRequest("dreaming",
                null, null, null);

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> controller.updateState(request));

        assertEquals(HttpStatus.BAD_REQUEST, exception.getStatusCode());
        verify(agentStateService, never()).update(any());
    }

    @Test
    void tasksShouldBeListedNewestFirst() {
        CognitiveTask older = CognitiveTask.builder().id("a").createdAt(Instant.parse("2026-03-01T09:00:00Z"))
                .build();
        CognitiveTask newer = CognitiveTask.builder().id("b").createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
        when(taskQueueService.getTasks()).thenReturn(List.of(older, newer));

        StepVerifier.create(controller.getTasks())
                .assertNext(response -> assertEquals("b", response.getBody().get(0).getId()))
                .verifyComplete();
    }

    @Test
    void decisionsShouldValidateLimit() {
        assertThrows(ResponseStatusException.class, () -> controller.getDecisions(0));
        assertThrows(ResponseStatusException.class, () -> controller.getDecisions(201));
        verify(decisionAuditService, never()).getRecent(anyInt());
    }

    @Test
    void decisionsShouldReturnRecentRecords() {
        when(decisionAuditService.getRecent(20)).thenReturn(List.of(DecisionRecord.builder().build()));

        StepVerifier.create(controller.getDecisions(20))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
    }
}
