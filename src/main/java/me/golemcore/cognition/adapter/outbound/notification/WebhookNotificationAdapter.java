package me.golemcore.cognition.adapter.outbound.notification;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.cognition.domain.model.ProactiveMessage;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts proactive messages as JSON to {@code bot.notification.webhook-url}.
 * Only a 2xx response counts as delivered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookNotificationAdapter implements NotificationChannelAdapter {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final BotProperties properties;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Boolean> send(ProactiveMessage message) {
        String url = properties.getNotification().getWebhookUrl();
        if (url == null || url.isBlank()) {
            return CompletableFuture.completedFuture(false);
        }

        return CompletableFuture.supplyAsync(() -> {
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(toJson(message), JSON))
                    .build();

            try (Response response = okHttpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("[Notify] Webhook returned HTTP {} for message {}", response.code(), message.getId());
                    return false;
                }
                return true;
            } catch (IOException e) {
                throw new UncheckedIOException("Webhook delivery failed: " + e.getMessage(), e);
            }
        });
    }

    private String toJson(ProactiveMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", message.getId());
        payload.put("content", message.getContent());
        payload.put("reason", message.getReason());
        payload.put("urgency", message.getUrgency() != null ? message.getUrgency().getWireName() : null);
        payload.put("createdAt", message.getCreatedAt() != null ? message.getCreatedAt().toString() : null);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize proactive message", e);
        }
    }

    @Override
    public String getChannelType() {
        return "webhook";
    }

    @Override
    public boolean isAvailable() {
        String url = properties.getNotification().getWebhookUrl();
        return url != null && !url.isBlank();
    }
}
