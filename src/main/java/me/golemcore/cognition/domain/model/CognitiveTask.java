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
 * Unit of background work created from a decision. Dispatch is by
 * {@link #kind}; unknown kinds end up {@link TaskStatus#ABANDONED}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CognitiveTask {

    public static final String KIND_EXPLORE_CONCEPT = "explore_concept";
    public static final String KIND_REFLECT = "reflect";
    public static final String KIND_INTEGRATE_KNOWLEDGE = "integrate_knowledge";
    public static final String KIND_ASK_QUESTION = "ask_question";

    private String id;
    private String kind;
    private String description;
    private int priority;
    private String motivation;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private String result;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public boolean isFinished() {
        return status == TaskStatus.COMPLETED || status == TaskStatus.ABANDONED;
    }

    public enum TaskStatus {
        PENDING, IN_PROGRESS, COMPLETED, ABANDONED
    }
}
