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

import me.golemcore.cognition.domain.component.DecisionParser;
import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.component.JsonRecordList;
import me.golemcore.cognition.domain.model.CallClass;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.RelationshipEvent;
import me.golemcore.cognition.domain.model.RelationshipEvent.EventType;
import me.golemcore.cognition.domain.model.RelationshipPattern;
import me.golemcore.cognition.domain.model.TrustHistoryEntry;
import me.golemcore.cognition.domain.model.TrustMetric;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Trust bookkeeping per relationship.
 *
 * <p>
 * Each recorded event moves trust by {@code impact * bot.trust.impact-weight}
 * with the impact clamped to {@code [-10, 10]} and the resulting level clamped
 * to {@code [1, 10]}. Every change is appended to
 * {@code relationships/trust-history.jsonl}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class TrustScoringService {

    static final double MIN_TRUST = 1.0;
    static final double MAX_TRUST = 10.0;
    static final double DEFAULT_LEVEL = 5.0;
    static final int PATTERN_EVENT_WINDOW = 10;
    static final int DEFAULT_CONFIDENCE = 5;

    private static final String DIRECTORY = "relationships";
    private static final String HISTORY_FILE = "trust-history.jsonl";
    private static final String PATTERN_SCHEMA = "relationship_patterns";

    private static final String PATTERN_PROMPT = """
            You analyse the history of a relationship between an agent and a person.
            Identify recurring behavioural patterns in the events you are given.
            Each pattern gets a confidence from 1 to 10. Answer with JSON only.""";

    private final JsonRecordList<TrustMetric> metrics;
    private final JsonRecordList<RelationshipEvent> events;
    private final JsonRecordList<RelationshipPattern> patterns;
    private final JsonFileStore store;
    private final LlmInvocationService invoker;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;
    private final Clock clock;

    public TrustScoringService(JsonFileStore store, LlmInvocationService invoker, ObjectMapper objectMapper,
            BotProperties properties, Clock clock) {
        this.metrics = new JsonRecordList<>(store, DIRECTORY, "trust-metrics.json", new TypeReference<>() {
        });
        this.events = new JsonRecordList<>(store, DIRECTORY, "events.json", new TypeReference<>() {
        });
        this.patterns = new JsonRecordList<>(store, DIRECTORY, "patterns.json", new TypeReference<>() {
        });
        this.store = store;
        this.invoker = invoker;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Record an event and apply its trust impact.
     *
     * @return the new trust level
     */
    public synchronized OperationResult<Double> recordEvent(String relationshipId, EventType type, int impact,
            String description, String emotionalResponse) {
        if (relationshipId == null || relationshipId.isBlank()) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Relationship id is required");
        }
        if (type == null) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Event type is required");
        }

        int clampedImpact = Math.max(RelationshipEvent.MIN_IMPACT, Math.min(RelationshipEvent.MAX_IMPACT, impact));
        Instant now = clock.instant();
        RelationshipEvent event = RelationshipEvent.builder()
                .id(UUID.randomUUID().toString())
                .relationshipId(relationshipId)
                .type(type)
                .trustImpact(clampedImpact)
                .description(description)
                .emotionalResponse(emotionalResponse)
                .resolved(false)
                .createdAt(now)
                .build();

        OperationResult<Boolean> eventSaved = events.mutate(list -> list.add(event));
        if (!eventSaved.isSuccess()) {
            return OperationResult.failure(eventSaved.getErrorKind(), eventSaved.getError());
        }

        double weight = properties.getTrust().getImpactWeight();
        OperationResult<double[]> updated = metrics.mutate(list -> {
            TrustMetric metric = list.stream()
                    .filter(m -> relationshipId.equals(m.getRelationshipId()))
                    .findFirst()
                    .orElseGet(() -> {
                        TrustMetric created = TrustMetric.builder()
                                .relationshipId(relationshipId)
                                .trustLevel(DEFAULT_LEVEL)
                                .intimacyLevel(DEFAULT_LEVEL)
                                .totalSharedEvents(0)
                                .updatedAt(now)
                                .build();
                        list.add(created);
                        return created;
                    });
            double before = metric.getTrustLevel();
            double after = clampTrust(before + clampedImpact * weight);
            metric.setTrustLevel(after);
            metric.setTotalSharedEvents(metric.getTotalSharedEvents() + 1);
            metric.setUpdatedAt(now);
            return new double[] { before, after };
        });
        if (!updated.isSuccess()) {
            return OperationResult.failure(updated.getErrorKind(), updated.getError());
        }

        double before = updated.getValue()[0];
        double after = updated.getValue()[1];
        OperationResult<Void> history = store.append(DIRECTORY, HISTORY_FILE, TrustHistoryEntry.builder()
                .relationshipId(relationshipId)
                .trustLevel(after)
                .change(after - before)
                .reason(type.name().toLowerCase(Locale.ROOT) + (description != null ? ": " + description : ""))
                .eventId(event.getId())
                .createdAt(now)
                .build());
        if (!history.isSuccess()) {
            log.warn("[Trust] History append failed for {}: {}", relationshipId, history.getError());
        }

        log.info("[Trust] {} {} impact {}: trust {} -> {}", relationshipId, type, clampedImpact, before, after);
        return OperationResult.success(after);
    }

    /**
     * Mine behavioural patterns from recent events. Relationships with fewer
     * than {@code bot.trust.pattern-min-events} events are left alone.
     *
     * @return patterns that were created or reinforced
     */
    public OperationResult<List<RelationshipPattern>> learnPatterns(String relationshipId) {
        List<RelationshipEvent> recent = getEvents(relationshipId).stream()
                .sorted(Comparator.comparing(RelationshipEvent::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(PATTERN_EVENT_WINDOW)
                .toList();
        if (recent.size() < properties.getTrust().getPatternMinEvents()) {
            log.debug("[Trust] {} has {} event(s), not enough to learn patterns", relationshipId, recent.size());
            return OperationResult.success(List.of());
        }

        String eventsJson;
        try {
            eventsJson = objectMapper.writeValueAsString(recent);
        } catch (JsonProcessingException e) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Cannot serialize events");
        }

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(PATTERN_PROMPT)
                .userPrompt("Events:\n" + eventsJson)
                .schemaName(PATTERN_SCHEMA)
                .responseSchema(patternSchema())
                .temperature(properties.getLlm().getTemperature())
                .build();

        OperationResult<List<MinedPattern>> mined = invoker.invoke(request, CallClass.CREATIVE,
                this::parsePatterns);
        if (!mined.isSuccess()) {
            log.warn("[Trust] Pattern learning for {} failed: {} {}", relationshipId, mined.getErrorKind(),
                    mined.getError());
            return OperationResult.failure(mined.getErrorKind(), mined.getError());
        }

        Instant now = clock.instant();
        OperationResult<List<RelationshipPattern>> stored = patterns.mutate(list -> {
            List<RelationshipPattern> touched = new ArrayList<>();
            for (MinedPattern p : mined.getValue()) {
                Optional<RelationshipPattern> existing = list.stream()
                        .filter(e -> relationshipId.equals(e.getRelationshipId())
                                && p.pattern().equalsIgnoreCase(e.getPattern()))
                        .findFirst();
                RelationshipPattern pattern = existing.orElseGet(() -> {
                    RelationshipPattern created = RelationshipPattern.builder()
                            .relationshipId(relationshipId)
                            .pattern(p.pattern())
                            .evidenceCount(0)
                            .build();
                    list.add(created);
                    return created;
                });
                pattern.setConfidence(p.confidence());
                pattern.setEvidenceCount(pattern.getEvidenceCount() + 1);
                pattern.setLastObserved(now);
                touched.add(pattern);
            }
            return touched;
        });
        if (stored.isSuccess()) {
            log.info("[Trust] Learned {} pattern(s) for {}", stored.getValue().size(), relationshipId);
        }
        return stored;
    }

    /**
     * Mark an event as resolved. Resolving twice keeps the first resolution
     * time.
     */
    public OperationResult<RelationshipEvent> resolveEvent(String relationshipId, String eventId) {
        Instant now = clock.instant();
        OperationResult<Optional<RelationshipEvent>> resolved = events.mutate(list -> {
            Optional<RelationshipEvent> match = list.stream()
                    .filter(e -> e.getId().equals(eventId) && e.getRelationshipId().equals(relationshipId))
                    .findFirst();
            match.filter(e -> !e.isResolved()).ifPresent(e -> {
                e.setResolved(true);
                e.setResolvedAt(now);
            });
            return match;
        });
        if (!resolved.isSuccess()) {
            return OperationResult.failure(resolved.getErrorKind(), resolved.getError());
        }
        return resolved.getValue()
                .map(OperationResult::success)
                .orElseGet(() -> OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Unknown event: " + eventId));
    }

    /**
     * True when a negative event has stayed unresolved longer than
     * {@code bot.trust.healing-threshold}.
     */
    public boolean needsHealing(String relationshipId) {
        Instant cutoff = clock.instant().minus(properties.getTrust().getHealingThreshold());
        return getEvents(relationshipId).stream()
                .anyMatch(e -> !e.isResolved()
                        && e.getTrustImpact() < 0
                        && e.getCreatedAt() != null
                        && e.getCreatedAt().isBefore(cutoff));
    }

    public Optional<TrustMetric> getTrustMetric(String relationshipId) {
        return metrics.snapshotOrEmpty().stream()
                .filter(m -> relationshipId.equals(m.getRelationshipId()))
                .findFirst();
    }

    public List<RelationshipEvent> getEvents(String relationshipId) {
        return events.snapshotOrEmpty().stream()
                .filter(e -> relationshipId.equals(e.getRelationshipId()))
                .toList();
    }

    public List<RelationshipPattern> getPatterns(String relationshipId) {
        return patterns.snapshotOrEmpty().stream()
                .filter(p -> relationshipId.equals(p.getRelationshipId()))
                .toList();
    }

    public OperationResult<List<TrustHistoryEntry>> getHistory(String relationshipId) {
        return store.readLines(DIRECTORY, HISTORY_FILE, TrustHistoryEntry.class)
                .map(rows -> rows.stream()
                        .filter(r -> relationshipId.equals(r.getRelationshipId()))
                        .toList());
    }

    static double clampTrust(double value) {
        return Math.max(MIN_TRUST, Math.min(MAX_TRUST, value));
    }

    static Map<String, Object> patternSchema() {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("type", "object");
        item.put("properties", Map.of(
                "pattern", Map.of("type", "string", "description", "Short description of the pattern"),
                "confidence", Map.of("type", "integer", "description", "1 to 10")));
        item.put("required", List.of("pattern", "confidence"));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.of("patterns", Map.of("type", "array", "items", item)));
        schema.put("required", List.of("patterns"));
        return schema;
    }

    private OperationResult<List<MinedPattern>> parsePatterns(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(DecisionParser.extractJson(raw));
        } catch (JsonProcessingException e) {
            return OperationResult.failure(ErrorKind.PARSE, "Invalid patterns: not valid JSON");
        }
        JsonNode array = root != null && root.isObject() ? root.get("patterns") : root;
        if (array == null || !array.isArray()) {
            return OperationResult.failure(ErrorKind.PARSE, "Invalid patterns: expected an array");
        }
        List<MinedPattern> result = new ArrayList<>();
        for (JsonNode node : array) {
            JsonNode text = node.get("pattern");
            if (text == null || !text.isTextual() || text.asText().isBlank()) {
                continue;
            }
            int confidence = AgentStateService.clampLevel(node.path("confidence").asInt(DEFAULT_CONFIDENCE));
            result.add(new MinedPattern(text.asText().trim(), confidence));
        }
        return OperationResult.success(result);
    }

    private record MinedPattern(String pattern, int confidence) {
    }
}
