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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Writes proactive messages to the application log. Delivery always counts as
 * confirmed.
 */
@Component
@Slf4j
public class LogNotificationAdapter implements NotificationChannelAdapter {

    @Override
    public CompletableFuture<Boolean> send(ProactiveMessage message) {
        log.info("[Notify] Proactive message ({}): {}", message.getUrgency(), message.getContent());
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public String getChannelType() {
        return "log";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
