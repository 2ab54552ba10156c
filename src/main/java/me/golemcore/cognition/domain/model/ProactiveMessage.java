package me.golemcore.cognition.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outbound message the agent decided to send on its own. Stays
 * {@link MessageStatus#PENDING} until delivery is confirmed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProactiveMessage {

    private String id;
    private String questionId;
    private String content;
    private String reason;
    private Urgency urgency;

    @Builder.Default
    private MessageStatus status = MessageStatus.PENDING;

    private int attempts;
    private Instant createdAt;
    private Instant sentAt;

    public enum MessageStatus {
        PENDING, SENT, CANCELLED
    }
}
