package me.golemcore.cognition.infrastructure.http;

import me.golemcore.cognition.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldBoundWholeCallBySendTimeout() {
        BotProperties properties = new BotProperties();
        properties.getContact().setSendTimeout(Duration.ofSeconds(7));

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(7000, client.callTimeoutMillis());
        assertEquals(3000, client.connectTimeoutMillis());
        assertEquals(5000, client.readTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
        assertFalse(client.followRedirects());
    }

    @Test
    void shouldAbortSlowWebhookAtSendTimeout() throws IOException {
        BotProperties properties = new BotProperties();
        properties.getContact().setSendTimeout(Duration.ofMillis(300));
        properties.getHttp().setReadTimeout(Duration.ofSeconds(5));
        OkHttpClient client = OkHttpConfig.buildWebhookClient(properties);

        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(200).setBodyDelay(2, TimeUnit.SECONDS)
                    .setBody("ok"));
            server.start();

            Request request = new Request.Builder().url(server.url("/hook")).build();

            assertThrows(InterruptedIOException.class, () -> {
                try (Response response = client.newCall(request).execute()) {
                    response.body().string();
                }
            });
        }
    }
}
