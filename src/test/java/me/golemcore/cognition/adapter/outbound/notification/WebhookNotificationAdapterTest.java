package me.golemcore.cognition.adapter.outbound.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.cognition.domain.model.ProactiveMessage;
import me.golemcore.cognition.domain.model.Urgency;
import me.golemcore.cognition.infrastructure.config.AutoConfiguration;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookNotificationAdapterTest {

    private MockWebServer server;
    private BotProperties properties;
    private WebhookNotificationAdapter adapter;
    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new BotProperties();
        properties.getNotification().setWebhookUrl(server.url("/notify").toString());
        adapter = new WebhookNotificationAdapter(properties, new OkHttpClient(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static ProactiveMessage message() {
        return ProactiveMessage.builder()
                .id("m-1")
                .content("Can we talk about tides?")
                .reason("question priority 9")
                .urgency(Urgency.MEDIUM)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }

    @Test
    void shouldPostJsonAndConfirmOn2xx() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        assertTrue(adapter.send(message()).get(5, TimeUnit.SECONDS));

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("POST", request.getMethod());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("m-1", body.get("id").asText());
        assertEquals("Can we talk about tides?", body.get("content").asText());
        assertEquals("medium", body.get("urgency").asText());
    }

    @Test
    void shouldNotConfirmOnServerError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        assertFalse(adapter.send(message()).get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldFailWhenServerUnreachable() throws Exception {
        server.shutdown();

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> adapter.send(message()).get(5, TimeUnit.SECONDS));

        assertNotNull(exception.getCause());
    }

    @Test
    void shouldNotSendWithoutUrl() throws Exception {
        properties.getNotification().setWebhookUrl(" ");

        assertFalse(adapter.isAvailable());
        assertFalse(adapter.send(message()).get(1, TimeUnit.SECONDS));
        assertEquals(0, server.getRequestCount());
    }
}
