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
import me.golemcore.cognition.domain.model.ConceptNode;
import me.golemcore.cognition.domain.model.ConceptRelation;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Knowledge graph of concepts and typed relations between them.
 *
 * <p>
 * Concepts are matched by exact name when reinforced; case variants created
 * along the way are merged later by {@link #mergeDuplicateConcepts()}. Removing
 * a concept always removes the relations that point to or from it.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class KnowledgeGraphService {

    static final int NEW_CONCEPT_CONFIDENCE = 5;
    static final int NEW_RELATION_STRENGTH = 5;
    static final int MAX_NAME_LENGTH = 120;

    private final JsonRecordList<ConceptNode> concepts;
    private final JsonRecordList<ConceptRelation> relations;
    private final Clock clock;

    public KnowledgeGraphService(JsonFileStore store, Clock clock) {
        this.concepts = new JsonRecordList<>(store, "knowledge", "concepts.json", new TypeReference<>() {
        });
        this.relations = new JsonRecordList<>(store, "knowledge", "relations.json", new TypeReference<>() {
        });
        this.clock = clock;
    }

    /**
     * Create the concept or strengthen it: confidence +1 (max 10), one more
     * encounter, reinforced now.
     */
    public OperationResult<ConceptNode> reinforceConcept(String name, String description) {
        if (name == null || name.isBlank()) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Concept name is required");
        }
        String normalizedName = AgentStateService.truncate(name.trim(), MAX_NAME_LENGTH);
        Instant now = clock.instant();

        return concepts.mutate(list -> {
            Optional<ConceptNode> existing = list.stream()
                    .filter(concept -> normalizedName.equals(concept.getName()))
                    .findFirst();
            if (existing.isPresent()) {
                ConceptNode concept = existing.get();
                concept.setConfidence(AgentStateService.clampLevel(concept.getConfidence() + 1));
                concept.setEncounterCount(concept.getEncounterCount() + 1);
                concept.setLastReinforced(now);
                if (concept.getDescription() == null && description != null) {
                    concept.setDescription(description);
                }
                return concept;
            }
            ConceptNode created = ConceptNode.builder()
                    .id(UUID.randomUUID().toString())
                    .name(normalizedName)
                    .description(description)
                    .confidence(NEW_CONCEPT_CONFIDENCE)
                    .encounterCount(1)
                    .firstEncountered(now)
                    .lastReinforced(now)
                    .build();
            list.add(created);
            return created;
        });
    }

    /**
     * Link two concepts. An existing relation of the same type is strengthened
     * by one instead.
     */
    public OperationResult<ConceptRelation> relate(String fromId, String toId, String relationType) {
        if (fromId == null || toId == null || fromId.equals(toId)) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Relation needs two distinct concepts");
        }
        Set<String> knownIds = new HashSet<>();
        concepts.snapshotOrEmpty().forEach(concept -> knownIds.add(concept.getId()));
        if (!knownIds.contains(fromId) || !knownIds.contains(toId)) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Unknown concept in relation");
        }

        return relations.mutate(list -> {
            Optional<ConceptRelation> existing = list.stream()
                    .filter(relation -> fromId.equals(relation.getFromId())
                            && toId.equals(relation.getToId())
                            && relationType.equals(relation.getRelationType()))
                    .findFirst();
            if (existing.isPresent()) {
                ConceptRelation relation = existing.get();
                relation.setStrength(AgentStateService.clampLevel(relation.getStrength() + 1));
                return relation;
            }
            ConceptRelation created = ConceptRelation.builder()
                    .id(UUID.randomUUID().toString())
                    .fromId(fromId)
                    .toId(toId)
                    .relationType(relationType)
                    .strength(NEW_RELATION_STRENGTH)
                    .createdAt(clock.instant())
                    .build();
            list.add(created);
            return created;
        });
    }

    public List<ConceptNode> getConcepts() {
        return concepts.snapshotOrEmpty();
    }

    public List<ConceptRelation> getRelations() {
        return relations.snapshotOrEmpty();
    }

    /**
     * Most recently reinforced concepts first.
     */
    public List<ConceptNode> getRecentConcepts(int limit) {
        return JournalService.newestFirst(concepts.snapshotOrEmpty(), ConceptNode::getLastReinforced, limit);
    }

    public OperationResult<Integer> removeWeakRelations(int minStrength) {
        return relations.mutate(list -> {
            int before = list.size();
            list.removeIf(relation -> relation.getStrength() < minStrength);
            return before - list.size();
        });
    }

    /**
     * Merge concepts whose names differ only by case. The keeper is the one
     * with the highest confidence (then most encounters, then oldest); its
     * encounter count absorbs the others and their relations are re-pointed to
     * it.
     *
     * @return number of concepts removed
     */
    public OperationResult<Integer> mergeDuplicateConcepts() {
        Map<String, String> replacedBy = new HashMap<>();
        OperationResult<Integer> merged = concepts.mutate(list -> {
            Map<String, List<ConceptNode>> groups = new LinkedHashMap<>();
            for (ConceptNode concept : list) {
                String key = concept.getName() == null ? "" : concept.getName().trim().toLowerCase(Locale.ROOT);
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(concept);
            }
            int removed = 0;
            for (List<ConceptNode> group : groups.values()) {
                if (group.size() < 2) {
                    continue;
                }
                ConceptNode keeper = group.stream()
                        .sorted(Comparator.comparingInt(ConceptNode::getConfidence).reversed()
                                .thenComparing(Comparator.comparingInt(ConceptNode::getEncounterCount).reversed())
                                .thenComparing(ConceptNode::getFirstEncountered,
                                        Comparator.nullsLast(Comparator.naturalOrder())))
                        .findFirst()
                        .orElseThrow();
                for (ConceptNode duplicate : group) {
                    if (duplicate == keeper) {
                        continue;
                    }
                    keeper.setEncounterCount(keeper.getEncounterCount() + duplicate.getEncounterCount());
                    if (duplicate.getLastReinforced() != null && (keeper.getLastReinforced() == null
                            || duplicate.getLastReinforced().isAfter(keeper.getLastReinforced()))) {
                        keeper.setLastReinforced(duplicate.getLastReinforced());
                    }
                    replacedBy.put(duplicate.getId(), keeper.getId());
                    list.remove(duplicate);
                    removed++;
                }
            }
            return removed;
        });

        if (!merged.isSuccess() || replacedBy.isEmpty()) {
            return merged;
        }

        OperationResult<Integer> repointed = relations.mutate(list -> {
            for (ConceptRelation relation : list) {
                relation.setFromId(replacedBy.getOrDefault(relation.getFromId(), relation.getFromId()));
                relation.setToId(replacedBy.getOrDefault(relation.getToId(), relation.getToId()));
            }
            int before = list.size();
            list.removeIf(relation -> relation.getFromId().equals(relation.getToId()));
            return before - list.size();
        });
        if (!repointed.isSuccess()) {
            log.warn("[Knowledge] Merged concepts but failed to re-point relations: {}", repointed.getError());
        }
        return merged;
    }

    /**
     * Keep at most {@code max} concepts, removing the least recently
     * reinforced ones together with their relations.
     *
     * @return number of concepts removed
     */
    public OperationResult<Integer> enforceConceptCeiling(int max) {
        Set<String> removedIds = new HashSet<>();
        OperationResult<Integer> trimmed = concepts.mutate(list -> {
            int excess = list.size() - Math.max(0, max);
            if (excess <= 0) {
                return 0;
            }
            List<ConceptNode> oldest = list.stream()
                    .sorted(Comparator.comparing(ConceptNode::getLastReinforced,
                            Comparator.nullsFirst(Comparator.naturalOrder())))
                    .limit(excess)
                    .toList();
            oldest.forEach(concept -> removedIds.add(concept.getId()));
            list.removeAll(oldest);
            return excess;
        });
        if (trimmed.isSuccess() && !removedIds.isEmpty()) {
            OperationResult<Integer> dangling = relations.mutate(list -> {
                int before = list.size();
                list.removeIf(relation -> removedIds.contains(relation.getFromId())
                        || removedIds.contains(relation.getToId()));
                return before - list.size();
            });
            if (!dangling.isSuccess()) {
                log.warn("[Knowledge] Failed to remove relations of trimmed concepts: {}", dangling.getError());
            }
        }
        return trimmed;
    }

    public OperationResult<Integer> enforceRelationCeiling(int max) {
        return relations.mutate(list -> JournalService.keepNewest(list, ConceptRelation::getCreatedAt, max));
    }

    public int countConcepts() {
        return concepts.snapshotOrEmpty().size();
    }

    public int countRelations() {
        return relations.snapshotOrEmpty().size();
    }
}
