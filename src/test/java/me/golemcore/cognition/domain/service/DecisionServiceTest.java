package me.golemcore.cognition.domain.service;

import me.golemcore.cognition.cache.ResponseCache;
import me.golemcore.cognition.domain.component.DecisionParser;
import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.DecisionContext;
import me.golemcore.cognition.domain.model.DecisionKind;
import me.golemcore.cognition.domain.model.DecisionRecord;
import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.LlmResponse;
import me.golemcore.cognition.infrastructure.config.AutoConfiguration;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.LlmPort;
import me.golemcore.cognition.ratelimit.WindowedRateLimiter;
import me.golemcore.cognition.testsupport.InMemoryStoragePort;
import me.golemcore.cognition.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DecisionServiceTest {

    private LlmPort llmPort;
    private MutableClock clock;
    private KnowledgeGraphService knowledgeGraphService;
    private SelfQuestionService selfQuestionService;
    private JournalService journalService;
    private DecisionAuditService auditService;
    private AgentStateService agentStateService;
    private DecisionService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        clock = MutableClock.at("2026-03-01T10:00:00Z");

        BotProperties properties = new BotProperties();
        properties.getInvocation().setTimeout(Duration.ofMillis(50));
        properties.getInvocation().setMaxRetries(1);
        properties.getInvocation().setRetryBackoff(Duration.ZERO);
        properties.getRateLimit().setMinInterval(Duration.ZERO);

        JsonFileStore store = new JsonFileStore(new InMemoryStoragePort(), AutoConfiguration.objectMapper(),
                properties);
        LlmInvocationService invoker = new LlmInvocationService(llmPort, new ResponseCache(properties, clock),
                new WindowedRateLimiter(properties, clock), properties);
        knowledgeGraphService = new KnowledgeGraphService(store, clock);
        selfQuestionService = new SelfQuestionService(store, clock);
        journalService = new JournalService(store, clock);
        auditService = new DecisionAuditService(store, clock);
        agentStateService = new AgentStateService(store, clock);
        service = new DecisionService(invoker, new DecisionParser(AutoConfiguration.objectMapper()), auditService,
                knowledgeGraphService, selfQuestionService, journalService, properties, clock);
    }

    private static CompletableFuture<LlmResponse> reply(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }

    @Test
    void shouldReturnParsedDecision() {
        when(llmPort.chat(any())).thenReturn(reply("""
                {"decision":"ask_question","reasoning":"Something puzzles me","action":"Why do tides lag the moon?",
                 "shouldContactUser":true,"urgency":"high"}"""));

        Decision decision = service.decide(agentStateService.getState());

        assertEquals(DecisionKind.ASK_QUESTION, decision.getKind());
        assertTrue(decision.isShouldContactUser());
        assertFalse(decision.isFallback());
    }

    @Test
    void shouldFallBackWhenModelTimesOutOnEveryAttempt() {
        when(llmPort.chat(any())).thenAnswer(invocation -> new CompletableFuture<LlmResponse>());

        Decision decision = assertDoesNotThrow(() -> service.decide(agentStateService.getState()));

        assertEquals(DecisionKind.INTEGRATE_KNOWLEDGE, decision.getKind());
        assertEquals(DecisionService.FALLBACK_ACTION, decision.getAction());
        assertTrue(decision.getReasoning().startsWith("fallback"));
        assertTrue(decision.isFallback());
        verify(llmPort, times(2)).chat(any());
    }

    @Test
    void shouldFallBackOnMalformedPayload() {
        when(llmPort.chat(any())).thenReturn(reply("I would like to rest now."));

        Decision decision = service.decide(agentStateService.getState());

        assertTrue(decision.isFallback());
        assertTrue(decision.getReasoning().startsWith("fallback: parse"));
    }

    @Test
    void shouldNotServeMalformedPayloadFromCache() {
        when(llmPort.chat(any())).thenReturn(reply("I would like to rest now."));
        AgentState state = agentStateService.getState();

        Decision first = service.decide(state);
        Decision second = service.decide(state);

        assertTrue(first.isFallback());
        assertTrue(second.isFallback());
        verify(llmPort, times(2)).chat(any());
    }

    @Test
    void shouldFallBackWhenPortThrows() {
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("adapter not available"));

        Decision decision = service.decide(agentStateService.getState());

        assertTrue(decision.isFallback());
    }

    @Test
    void shouldAuditFreshAndFallbackDecisions() {
        when(llmPort.chat(any()))
                .thenReturn(reply("""
                        {"decision":"reflect","reasoning":"r","action":"a","shouldContactUser":false,"urgency":"low"}"""))
                .thenReturn(reply("not json"));

        AgentState state = agentStateService.getState();
        service.decide(state);
        clock.advance(Duration.ofHours(2));
        service.decide(state);

        List<DecisionRecord> records = auditService.getRecent(10);
        assertEquals(2, records.size());
        assertTrue(records.get(0).isFallback());
        assertNotNull(records.get(0).getErrorKind());
        assertEquals(DecisionKind.REFLECT, records.get(1).getKind());
    }

    @Test
    void shouldIncludeConceptsQuestionsAndReflectionsInContext() {
        knowledgeGraphService.reinforceConcept("tides", "Ocean movement");
        selfQuestionService.ask("Why do tides lag the moon?", 9);
        journalService.addReflection("patience", "Learning takes time");
        when(llmPort.chat(any())).thenReturn(reply("""
                {"decision":"rest","reasoning":"r","action":"a","shouldContactUser":false,"urgency":"low"}"""));

        AgentState state = agentStateService.getState();
        DecisionContext context = service.buildContext(state);
        service.decide(state);

        assertEquals(1, context.getConcepts().size());
        assertEquals(1, context.getQuestions().size());
        assertEquals(1, context.getReflections().size());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String prompt = captor.getValue().getUserPrompt();
        assertTrue(prompt.contains("tides"));
        assertTrue(prompt.contains("Why do tides lag the moon?"));
        assertTrue(prompt.contains("patience"));
        assertEquals(DecisionService.SCHEMA_NAME, captor.getValue().getSchemaName());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRequireAllFieldsInSchema() {
        Map<String, Object> schema = DecisionService.decisionSchema();

        List<String> required = (List<String>) schema.get("required");
        assertEquals(List.of("decision", "reasoning", "action", "shouldContactUser", "urgency"), required);
    }
}
