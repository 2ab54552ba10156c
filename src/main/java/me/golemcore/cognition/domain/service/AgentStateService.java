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
import me.golemcore.cognition.domain.model.AgentMode;
import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.AgentStateUpdate;
import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.OperationResult;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Owner of the singleton {@link AgentState}.
 *
 * <p>
 * All reads and writes of the state go through this service. First boot
 * creates the initial state (awake, curious); a read failure yields a degraded
 * default that is returned but never persisted, so a transient storage problem
 * cannot overwrite the real state.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AgentStateService {

    static final String DIRECTORY = "cognition";
    static final String FILE = "state.json";
    static final int MAX_THOUGHT_LENGTH = 200;
    static final int MAX_MOTIVATION_LENGTH = 100;

    private static final TypeReference<AgentState> STATE_TYPE = new TypeReference<>() {
    };

    // First match wins. CJK keywords have no word boundaries to anchor on.
    private static final List<Map.Entry<Pattern, AgentMode>> MODE_KEYWORDS = List.of(
            Map.entry(Pattern.compile("思考|\\bthink"), AgentMode.THINKING),
            Map.entry(Pattern.compile("反思|\\breflect"), AgentMode.REFLECTING),
            Map.entry(Pattern.compile("探索|\\bexplor"), AgentMode.EXPLORING),
            Map.entry(Pattern.compile("休息|\\b(sleep|rest)"), AgentMode.SLEEPING),
            Map.entry(Pattern.compile("清醒|\\b(awake|wake)"), AgentMode.AWAKE));

    private final JsonFileStore store;
    private final Clock clock;

    private AgentState current;

    public AgentStateService(JsonFileStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Current state, initializing it on first boot.
     */
    public synchronized AgentState getState() {
        OperationResult<AgentState> loaded = loadState();
        if (!loaded.isSuccess()) {
            log.warn("[State] Failed to read agent state ({}), using degraded default", loaded.getError());
            return degradedState();
        }
        return loaded.getValue().copy();
    }

    /**
     * Merge a partial update into the state. Numeric fields are clamped to
     * {@code [1, 10]} and text fields truncated.
     */
    public synchronized AgentState update(AgentStateUpdate update) {
        OperationResult<AgentState> loaded = loadState();
        boolean degraded = !loaded.isSuccess();
        AgentState state = degraded ? degradedState() : loaded.getValue().copy();
        if (update.getMode() != null) {
            state.setMode(update.getMode());
        }
        if (update.getMotivation() != null && !update.getMotivation().isBlank()) {
            state.setMotivation(truncate(update.getMotivation().trim(), MAX_MOTIVATION_LENGTH));
        }
        if (update.getMotivationIntensity() != null) {
            state.setMotivationIntensity(clampLevel(update.getMotivationIntensity()));
        }
        if (update.getLastThought() != null) {
            state.setLastThought(truncate(update.getLastThought(), MAX_THOUGHT_LENGTH));
        }
        if (update.getAutonomyLevel() != null) {
            state.setAutonomyLevel(clampLevel(update.getAutonomyLevel()));
        }
        state.setUpdatedAt(clock.instant());

        if (degraded) {
            log.warn("[State] State unreadable, update applied to degraded default only");
            return state;
        }
        persist(state);
        current = state;
        return state.copy();
    }

    /**
     * Apply the side effects a decision has on the state: a mode change for
     * {@code change_state} and {@code rest}, and the reasoning as the latest
     * thought for every decision.
     */
    public synchronized AgentState applyDecision(Decision decision) {
        AgentStateUpdate.AgentStateUpdateBuilder update = AgentStateUpdate.builder()
                .lastThought(decision.getReasoning());

        switch (decision.getKind()) {
        case CHANGE_STATE -> {
            Optional<AgentMode> target = parseTargetMode(decision.getAction());
            if (target.isPresent()) {
                update.mode(target.get());
            } else {
                log.debug("[State] No mode keyword in '{}', mode unchanged", decision.getAction());
            }
        }
        case REST -> update.mode(AgentMode.SLEEPING);
        default -> {
            // Thought only
        }
        }

        AgentState updated = update(update.build());
        log.debug("[State] Applied {} -> mode={}", decision.getKind(), updated.getMode());
        return updated;
    }

    /**
     * Extract a target mode from free text by keyword. Returns empty when no
     * keyword is found.
     */
    public static Optional<AgentMode> parseTargetMode(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, AgentMode> entry : MODE_KEYWORDS) {
            if (entry.getKey().matcher(normalized).find()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Drop the cached state so the next read goes to storage.
     */
    public synchronized void reload() {
        current = null;
    }

    private OperationResult<AgentState> loadState() {
        if (current != null) {
            return OperationResult.success(current);
        }

        OperationResult<Optional<AgentState>> read = store.read(DIRECTORY, FILE, STATE_TYPE);
        if (!read.isSuccess()) {
            return OperationResult.failure(read.getErrorKind(), read.getError());
        }

        Optional<AgentState> stored = read.getValue();
        if (stored.isEmpty()) {
            AgentState initial = initialState();
            persist(initial);
            current = initial;
            log.info("[State] Initialized agent state: {} / {}", initial.getMode(), initial.getMotivation());
        } else {
            current = normalize(stored.get());
        }
        return OperationResult.success(current);
    }

    AgentState initialState() {
        return AgentState.builder()
                .mode(AgentMode.AWAKE)
                .motivation("curiosity")
                .motivationIntensity(7)
                .lastThought("Just woke up. Curious about what I might learn.")
                .autonomyLevel(8)
                .updatedAt(clock.instant())
                .build();
    }

    AgentState degradedState() {
        return AgentState.builder()
                .mode(AgentMode.THINKING)
                .motivation("curiosity")
                .motivationIntensity(5)
                .lastThought("State unavailable, continuing with defaults.")
                .autonomyLevel(5)
                .updatedAt(clock.instant())
                .build();
    }

    private AgentState normalize(AgentState state) {
        if (state.getMode() == null) {
            state.setMode(AgentMode.AWAKE);
        }
        if (state.getMotivation() == null || state.getMotivation().isBlank()) {
            state.setMotivation("curiosity");
        }
        state.setMotivationIntensity(clampLevel(state.getMotivationIntensity()));
        state.setAutonomyLevel(clampLevel(state.getAutonomyLevel()));
        return state;
    }

    private void persist(AgentState state) {
        OperationResult<Void> saved = store.write(DIRECTORY, FILE, state);
        if (!saved.isSuccess()) {
            log.error("[State] Failed to save agent state: {}", saved.getError());
        }
    }

    static int clampLevel(int value) {
        return Math.max(AgentState.MIN_LEVEL, Math.min(AgentState.MAX_LEVEL, value));
    }

    static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
