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
import me.golemcore.cognition.port.outbound.NotificationPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the notification transport from {@code bot.notification.channel}.
 * Falls back to the log channel when the configured one is missing or not
 * usable.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class NotificationAdapterFactory implements NotificationPort {

    private static final String CHANNEL_LOG = "log";

    private final BotProperties properties;
    private final List<NotificationChannelAdapter> adapters;

    private NotificationChannelAdapter activeAdapter;

    @PostConstruct
    public void init() {
        String channel = properties.getNotification().getChannel();
        activeAdapter = find(channel);
        if (activeAdapter == null || !activeAdapter.isAvailable()) {
            NotificationChannelAdapter fallback = find(CHANNEL_LOG);
            log.warn("[Notify] Channel '{}' not usable, using: {}", channel,
                    fallback != null ? fallback.getChannelType() : "none");
            activeAdapter = fallback;
        } else {
            log.info("[Notify] Active notification channel: {}", channel);
        }
    }

    private NotificationChannelAdapter find(String channelType) {
        return adapters.stream()
                .filter(adapter -> adapter.getChannelType().equals(channelType))
                .findFirst()
                .orElse(null);
    }

    @Override
    public CompletableFuture<Boolean> send(ProactiveMessage message) {
        if (activeAdapter == null) {
            return CompletableFuture.completedFuture(false);
        }
        return activeAdapter.send(message);
    }

    @Override
    public String getChannelType() {
        return activeAdapter != null ? activeAdapter.getChannelType() : "none";
    }
}
