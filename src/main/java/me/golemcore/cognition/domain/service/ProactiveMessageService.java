package me.golemcore.cognition.domain.service;

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

import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.component.JsonRecordList;
import me.golemcore.cognition.domain.model.ContactDecision;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.ProactiveMessage;
import me.golemcore.cognition.domain.model.ProactiveMessage.MessageStatus;
import me.golemcore.cognition.domain.model.SelfQuestion.QuestionStatus;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.NotificationPort;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivery bookkeeping for proactive messages.
 *
 * <p>
 * A message is marked {@code SENT} only after the notification channel
 * confirmed delivery. Failed or timed-out deliveries leave it {@code PENDING}
 * so the next qualifying cycle retries the same record instead of creating a
 * new one.
 */
@Service
@Slf4j
public class ProactiveMessageService {

    private final JsonRecordList<ProactiveMessage> messages;
    private final NotificationPort notificationPort;
    private final SelfQuestionService selfQuestionService;
    private final BotProperties properties;
    private final Clock clock;

    public ProactiveMessageService(JsonFileStore store, NotificationPort notificationPort,
            SelfQuestionService selfQuestionService, BotProperties properties, Clock clock) {
        this.messages = new JsonRecordList<>(store, "cognition", "proactive-messages.json", new TypeReference<>() {
        });
        this.notificationPort = notificationPort;
        this.selfQuestionService = selfQuestionService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Send the message a positive contact decision asks for.
     *
     * @return the message record after the attempt
     */
    public OperationResult<ProactiveMessage> deliver(ContactDecision decision) {
        if (decision == null || !decision.isShouldContact()) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Contact was not requested");
        }

        OperationResult<ProactiveMessage> prepared = messages.mutate(list -> {
            Optional<ProactiveMessage> existing = list.stream()
                    .filter(m -> m.getStatus() == MessageStatus.PENDING)
                    .filter(m -> decision.getQuestionId() != null
                            && decision.getQuestionId().equals(m.getQuestionId()))
                    .findFirst();
            ProactiveMessage message = existing.orElseGet(() -> {
                ProactiveMessage created = ProactiveMessage.builder()
                        .id(UUID.randomUUID().toString())
                        .questionId(decision.getQuestionId())
                        .content(decision.getMessage())
                        .reason(decision.getReason())
                        .urgency(decision.getUrgency())
                        .status(MessageStatus.PENDING)
                        .createdAt(clock.instant())
                        .build();
                list.add(created);
                return created;
            });
            message.setAttempts(message.getAttempts() + 1);
            return copy(message);
        });
        if (!prepared.isSuccess()) {
            log.warn("[Contact] Could not record proactive message: {}", prepared.getError());
            return prepared;
        }

        ProactiveMessage message = prepared.getValue();
        if (!send(message)) {
            log.warn("[Contact] Delivery of message {} not confirmed (attempt {}), left pending",
                    message.getId(), message.getAttempts());
            return OperationResult.success(message);
        }

        OperationResult<ProactiveMessage> sent = updateStatus(message.getId(), MessageStatus.SENT);
        if (message.getQuestionId() != null) {
            OperationResult<?> marked = selfQuestionService.markStatus(message.getQuestionId(),
                    QuestionStatus.EXPLORING);
            if (!marked.isSuccess()) {
                log.warn("[Contact] Could not mark question {} exploring: {}", message.getQuestionId(),
                        marked.getError());
            }
        }
        log.info("[Contact] Proactive message {} sent via {}", message.getId(), notificationPort.getChannelType());
        return sent;
    }

    public OperationResult<ProactiveMessage> cancel(String id) {
        return updateStatus(id, MessageStatus.CANCELLED);
    }

    public List<ProactiveMessage> getMessages() {
        return messages.snapshotOrEmpty();
    }

    public long countPending() {
        return messages.snapshotOrEmpty().stream().filter(m -> m.getStatus() == MessageStatus.PENDING).count();
    }

    private boolean send(ProactiveMessage message) {
        long timeoutMs = properties.getContact().getSendTimeout().toMillis();
        CompletableFuture<Boolean> future;
        try {
            future = notificationPort.send(message);
        } catch (RuntimeException e) {
            log.warn("[Contact] Notification channel rejected message: {}", e.getMessage());
            return false;
        }
        try {
            return Boolean.TRUE.equals(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Contact] Notification timed out after {}ms", timeoutMs);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Contact] Notification failed: {}", cause.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private OperationResult<ProactiveMessage> updateStatus(String id, MessageStatus status) {
        OperationResult<Optional<ProactiveMessage>> updated = messages.mutate(list -> {
            Optional<ProactiveMessage> match = list.stream().filter(m -> m.getId().equals(id)).findFirst();
            match.ifPresent(m -> {
                m.setStatus(status);
                if (status == MessageStatus.SENT) {
                    m.setSentAt(clock.instant());
                }
            });
            return match.map(this::copy);
        });
        if (!updated.isSuccess()) {
            return OperationResult.failure(updated.getErrorKind(), updated.getError());
        }
        return updated.getValue()
                .map(OperationResult::success)
                .orElseGet(() -> OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Unknown message: " + id));
    }

    private ProactiveMessage copy(ProactiveMessage m) {
        return ProactiveMessage.builder()
                .id(m.getId())
                .questionId(m.getQuestionId())
                .content(m.getContent())
                .reason(m.getReason())
                .urgency(m.getUrgency())
                .status(m.getStatus())
                .attempts(m.getAttempts())
                .createdAt(m.getCreatedAt())
                .sentAt(m.getSentAt())
                .build();
    }
}
