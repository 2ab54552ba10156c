package me.golemcore.cognition.domain.service;

import me.golemcore.cognition.cache.ResponseCache;
import me.golemcore.cognition.domain.model.CallClass;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.LlmResponse;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.LlmPort;
import me.golemcore.cognition.ratelimit.WindowedRateLimiter;
import me.golemcore.cognition.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmInvocationServiceTest {

    private static final int CAP = 3;

    private LlmPort llmPort;
    private MutableClock clock;
    private ResponseCache cache;
    private WindowedRateLimiter rateLimiter;
    private LlmInvocationService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        clock = MutableClock.at("2026-03-01T10:00:00Z");

        BotProperties properties = new BotProperties();
        properties.getRateLimit().setMaxCallsPerMinute(CAP);
        properties.getRateLimit().setMinInterval(Duration.ZERO);
        properties.getInvocation().setTimeout(Duration.ofMillis(50));
        properties.getInvocation().setMaxRetries(1);
        properties.getInvocation().setRetryBackoff(Duration.ZERO);

        cache = new ResponseCache(properties, clock);
        rateLimiter = new WindowedRateLimiter(properties, clock);
        service = new LlmInvocationService(llmPort, cache, rateLimiter, properties);
    }

    private static LlmRequest request(String prompt) {
        return LlmRequest.builder()
                .systemPrompt("system")
                .userPrompt(prompt)
                .schemaName("test")
                .temperature(0.5)
                .build();
    }

    private static CompletableFuture<LlmResponse> reply(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }

    @Test
    void shouldReturnModelContent() {
        when(llmPort.chat(any())).thenReturn(reply("{\"ok\":true}"));

        OperationResult<String> result = service.invoke(request("hello"), CallClass.EPHEMERAL);

        assertTrue(result.isSuccess());
        assertEquals("{\"ok\":true}", result.getValue());
    }

    @Test
    void shouldServeRepeatedRequestFromCache() {
        when(llmPort.chat(any())).thenReturn(reply("cached"));

        service.invoke(request("same"), CallClass.CREATIVE);
        OperationResult<String> second = service.invoke(request("same"), CallClass.CREATIVE);

        assertEquals("cached", second.getValue());
        verify(llmPort, times(1)).chat(any());
        assertEquals(1, service.getMetrics().getCacheHits());
    }

    @Test
    void shouldCacheOnlyRepliesTheValidatorAccepts() {
        when(llmPort.chat(any())).thenReturn(reply("bad"), reply("good"));

        OperationResult<Integer> rejected = service.invoke(request("same"), CallClass.EPHEMERAL, this::lengthIfGood);
        assertEquals(ErrorKind.PARSE, rejected.getErrorKind());
        assertEquals(0, cache.size());

        OperationResult<Integer> accepted = service.invoke(request("same"), CallClass.EPHEMERAL, this::lengthIfGood);
        OperationResult<Integer> cached = service.invoke(request("same"), CallClass.EPHEMERAL, this::lengthIfGood);

        assertEquals(4, accepted.getValue());
        assertEquals(4, cached.getValue());
        verify(llmPort, times(2)).chat(any());
    }

    private OperationResult<Integer> lengthIfGood(String raw) {
        return "good".equals(raw)
                ? OperationResult.success(raw.length())
                : OperationResult.failure(ErrorKind.PARSE, "rejected: " + raw);
    }

    @Test
    void shouldBypassCacheForUncachedCalls() {
        when(llmPort.chat(any())).thenReturn(reply("fresh"));

        service.invoke(request("same"), CallClass.UNCACHED);
        service.invoke(request("same"), CallClass.UNCACHED);

        verify(llmPort, times(2)).chat(any());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldDenyCapPlusOneCallWithoutInvokingModel() {
        when(llmPort.chat(any())).thenReturn(reply("r"));
        for (int i = 0; i < CAP; i++) {
            assertTrue(service.invoke(request("p" + i), CallClass.UNCACHED).isSuccess());
        }

        OperationResult<String> denied = service.invoke(request("one more"), CallClass.UNCACHED);

        assertFalse(denied.isSuccess());
        assertEquals(ErrorKind.RATE_LIMITED, denied.getErrorKind());
        verify(llmPort, times(CAP)).chat(any());
    }

    @Test
    void shouldRetryAfterTimeoutAndGiveUpAfterBound() {
        when(llmPort.chat(any())).thenAnswer(invocation -> new CompletableFuture<LlmResponse>());

        OperationResult<String> result = service.invoke(request("slow"), CallClass.EPHEMERAL);

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.TRANSIENT_IO, result.getErrorKind());
        verify(llmPort, times(2)).chat(any());
        assertEquals(1, service.getMetrics().getRetries());
    }

    @Test
    void shouldStartCooldownOnProviderRateLimit() {
        when(llmPort.chat(any())).thenReturn(
                CompletableFuture.failedFuture(new RuntimeException("HTTP 429 Too Many Requests")));

        OperationResult<String> result = service.invoke(request("x"), CallClass.UNCACHED);

        assertEquals(ErrorKind.RATE_LIMITED, result.getErrorKind());
        assertNotNull(rateLimiter.getWindow().getCooldownUntil());
        verify(llmPort, times(1)).chat(any());
        assertFalse(service.invoke(request("y"), CallClass.UNCACHED).isSuccess());
        verify(llmPort, times(1)).chat(any());
    }

    @Test
    void shouldTreatBlankContentAsParseFailure() {
        when(llmPort.chat(any())).thenReturn(reply("  "));

        OperationResult<String> result = service.invoke(request("x"), CallClass.EPHEMERAL);

        assertEquals(ErrorKind.PARSE, result.getErrorKind());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldRecognizeRateLimitErrorsInCauseChain() {
        assertTrue(LlmInvocationService.isRateLimitError(
                new IllegalStateException("wrapper", new RuntimeException("rate_limit_exceeded"))));
        assertFalse(LlmInvocationService.isRateLimitError(new RuntimeException("connection reset")));
    }
}
