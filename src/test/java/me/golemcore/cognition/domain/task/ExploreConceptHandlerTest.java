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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ExploreConceptHandlerTest {

    private TaskTextGenerator generator;
    private KnowledgeGraphService knowledgeGraphService;
    private JournalService journalService;
    private ExploreConceptHandler handler;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
        JsonFileStore store = new JsonFileStore(new InMemoryStoragePort(), AutoConfiguration.objectMapper(),
                new BotProperties());
        knowledgeGraphService = new KnowledgeGraphService(store, clock);
        journalService = new JournalService(store, clock);
        generator = mock(TaskTextGenerator.class);
        handler = new ExploreConceptHandler(knowledgeGraphService, journalService, generator);
    }

    private static CognitiveTask task(String concept) {
        return CognitiveTask.builder()
                .kind(CognitiveTask.KIND_EXPLORE_CONCEPT)
                .description(concept)
                .motivation("curious")
                .priority(7)
                .build();
    }

    @Test
    void shouldStoreModelExplorationAsEpisodeAndResult() {
        when(generator.generate(eq(CognitiveTask.KIND_EXPLORE_CONCEPT), anyString(), contains("tides")))
                .thenReturn(OperationResult.success("Tides are the ocean answering the moon."));

        OperationResult<String> result = handler.execute(task("tides"));

        assertEquals("Tides are the ocean answering the moon.", result.getValue());
        assertEquals("Tides are the ocean answering the moon.",
                journalService.getRecentEpisodes(1).get(0).getSummary());
        assertEquals(1, knowledgeGraphService.countConcepts());
    }

    @Test
    void shouldFallBackToBookkeepingWithoutModelText() {
        when(generator.generate(anyString(), anyString(), anyString()))
                .thenReturn(OperationResult.failure(ErrorKind.RATE_LIMITED, "window full"));

        OperationResult<String> result = handler.execute(task("tides"));

        assertTrue(result.getValue().startsWith("Explored 'tides'"));
        assertEquals(1, journalService.countEpisodes());
    }
}
