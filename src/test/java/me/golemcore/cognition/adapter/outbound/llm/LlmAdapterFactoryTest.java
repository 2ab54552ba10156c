package me.golemcore.cognition.adapter.outbound.llm;

import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.LlmResponse;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private BotProperties properties;
    private LlmProviderAdapter langchain;
    private NoOpLlmAdapter noOp;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        langchain = mock(LlmProviderAdapter.class);
        when(langchain.getProviderId()).thenReturn("langchain4j");
        when(langchain.getCurrentModel()).thenReturn("gpt-4o-mini");
        noOp = new NoOpLlmAdapter();
    }

    private LlmAdapterFactory factory(List<LlmProviderAdapter> adapters) {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, adapters);
        factory.init();
        return factory;
    }

    @Test
    void shouldSelectAndInitializeConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        when(langchain.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("{}").build()));

        LlmAdapterFactory factory = factory(List.of(noOp, langchain));
        factory.chat(LlmRequest.builder().userPrompt("hi").build()).join();

        assertEquals("langchain4j", factory.getProviderId());
        assertEquals("gpt-4o-mini", factory.getCurrentModel());
        verify(langchain).initialize();
        verify(langchain).chat(any());
    }

    @Test
    void shouldFallBackToNoOpForUnknownProvider() throws Exception {
        properties.getLlm().setProvider("mystery");

        LlmAdapterFactory factory = factory(List.of(langchain, noOp));

        assertEquals("none", factory.getProviderId());
        assertEquals("[No LLM configured]", factory.chat(LlmRequest.builder().build()).get().getContent());
        verify(langchain, never()).initialize();
    }

    @Test
    void shouldFailChatWithoutAdapters() {
        LlmAdapterFactory factory = factory(List.of());

        assertFalse(factory.isAvailable());
        assertThrows(ExecutionException.class, () -> factory.chat(LlmRequest.builder().build()).get());
    }
}
