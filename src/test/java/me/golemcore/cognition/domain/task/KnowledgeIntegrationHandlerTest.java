package me.golemcore.cognition.domain.task;

import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.model.CognitiveTask;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.service.JournalService;
import me.golemcore.cognition.domain.service.KnowledgeGraphService;
import me.golemcore.cognition.infrastructure.config.AutoConfiguration;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.testsupport.InMemoryStoragePort;
import me.golemcore.cognition.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class KnowledgeIntegrationHandlerTest {

    private MutableClock clock;
    private TaskTextGenerator generator;
    private KnowledgeGraphService knowledgeGraphService;
    private JournalService journalService;
    private KnowledgeIntegrationHandler handler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        JsonFileStore store = new JsonFileStore(new InMemoryStoragePort(), AutoConfiguration.objectMapper(),
                new BotProperties());
        knowledgeGraphService = new KnowledgeGraphService(store, clock);
        journalService = new JournalService(store, clock);
        generator = mock(TaskTextGenerator.class);
        handler = new KnowledgeIntegrationHandler(knowledgeGraphService, journalService, generator);
    }

    private static CognitiveTask task() {
        return CognitiveTask.builder()
                .kind(CognitiveTask.KIND_INTEGRATE_KNOWLEDGE)
                .description("connect")
                .priority(5)
                .build();
    }

    @Test
    void shouldLinkConceptsAndLogModelIntegration() {
        knowledgeGraphService.reinforceConcept("tides", "water");
        clock.advance(Duration.ofSeconds(1));
        knowledgeGraphService.reinforceConcept("moon", "satellite");
        when(generator.generate(eq(CognitiveTask.KIND_INTEGRATE_KNOWLEDGE), anyString(), contains("moon")))
                .thenReturn(OperationResult.success("The moon pulls the tides."));

        OperationResult<String> result = handler.execute(task());

        assertEquals("The moon pulls the tides.", result.getValue());
        assertEquals(1, knowledgeGraphService.countRelations());
        assertEquals("The moon pulls the tides.", journalService.getRecentLogs(1).get(0).getContent());
    }

    @Test
    void shouldSkipModelWhenGraphIsEmpty() {
        OperationResult<String> result = handler.execute(task());

        assertEquals("Integrated knowledge: connect", result.getValue());
        verifyNoInteractions(generator);
    }

    @Test
    void shouldLogSummaryWhenModelGivesNothing() {
        knowledgeGraphService.reinforceConcept("tides", "water");
        when(generator.generate(anyString(), anyString(), anyString()))
                .thenReturn(OperationResult.failure(ErrorKind.PARSE, "Empty model response"));

        OperationResult<String> result = handler.execute(task());

        assertEquals("Integrated knowledge: connect", result.getValue());
        assertEquals(1, journalService.countLogs());
    }
}
