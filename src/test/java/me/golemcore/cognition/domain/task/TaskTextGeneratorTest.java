package me.golemcore.cognition.domain.task;

import me.golemcore.cognition.cache.ResponseCache;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.LlmResponse;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.service.LlmInvocationService;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.LlmPort;
import me.golemcore.cognition.ratelimit.WindowedRateLimiter;
import me.golemcore.cognition.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TaskTextGeneratorTest {

    private LlmPort llmPort;
    private TaskTextGenerator generator;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
        BotProperties properties = new BotProperties();
        properties.getRateLimit().setMinInterval(Duration.ZERO);
        properties.getInvocation().setTimeout(Duration.ofMillis(50));
        properties.getInvocation().setMaxRetries(0);
        LlmInvocationService invoker = new LlmInvocationService(llmPort, new ResponseCache(properties, clock),
                new WindowedRateLimiter(properties, clock), properties);
        generator = new TaskTextGenerator(invoker, properties);
    }

    @Test
    void shouldSendPlainTextRequestAndTrimReply() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("  Tides follow the moon.\n").build()));

        OperationResult<String> text = generator.generate("reflect", "system", "user");

        assertEquals("Tides follow the moon.", text.getValue());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertNull(captor.getValue().getResponseSchema());
        assertEquals("task_reflect", captor.getValue().getSchemaName());
    }

    @Test
    void shouldClipLongReplies() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("x".repeat(TaskTextGenerator.MAX_TEXT_LENGTH + 10)).build()));

        OperationResult<String> text = generator.generate("explore_concept", "system", "user");

        assertEquals(TaskTextGenerator.MAX_TEXT_LENGTH, text.getValue().length());
    }

    @Test
    void shouldReturnFailureWhenPortThrows() {
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("adapter not available"));

        OperationResult<String> text = assertDoesNotThrow(() -> generator.generate("reflect", "system", "user"));

        assertFalse(text.isSuccess());
        assertEquals(ErrorKind.TRANSIENT_IO, text.getErrorKind());
    }
}
