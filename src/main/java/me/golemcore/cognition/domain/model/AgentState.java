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
 * Singleton internal state of the agent. Persisted as
 * {@code cognition/state.json}; owned exclusively by
 * {@link me.golemcore.cognition.domain.service.AgentStateService}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentState {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 10;

    @Builder.Default
    private AgentMode mode = AgentMode.AWAKE;
    private String motivation;
    private int motivationIntensity;
    private String lastThought;
    private int autonomyLevel;
    private Instant updatedAt;

    /**
     * Copy used when handing state to callers so they cannot mutate the owned
     * instance.
     */
    public AgentState copy() {
        return AgentState.builder()
                .mode(mode)
                .motivation(motivation)
                .motivationIntensity(motivationIntensity)
                .lastThought(lastThought)
                .autonomyLevel(autonomyLevel)
                .updatedAt(updatedAt)
                .build();
    }
}
