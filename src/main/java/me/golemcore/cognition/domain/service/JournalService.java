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
import me.golemcore.cognition.domain.model.CognitiveLogEntry;
import me.golemcore.cognition.domain.model.EpisodicMemory;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.Reflection;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Journal of the agent's inner life: cognitive log lines, episodic memories
 * and reflections.
 */
@Service
@Slf4j
public class JournalService {

    static final int MAX_CONTENT_LENGTH = 2000;

    private final JsonRecordList<CognitiveLogEntry> logs;
    private final JsonRecordList<EpisodicMemory> episodes;
    private final JsonRecordList<Reflection> reflections;
    private final Clock clock;

    public JournalService(JsonFileStore store, Clock clock) {
        this.logs = new JsonRecordList<>(store, "knowledge", "cognitive-log.json", new TypeReference<>() {
        });
        this.episodes = new JsonRecordList<>(store, "knowledge", "episodes.json", new TypeReference<>() {
        });
        this.reflections = new JsonRecordList<>(store, "cognition", "reflections.json", new TypeReference<>() {
        });
        this.clock = clock;
    }

    public OperationResult<CognitiveLogEntry> log(String category, String content) {
        CognitiveLogEntry entry = CognitiveLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .category(category)
                .content(AgentStateService.truncate(content, MAX_CONTENT_LENGTH))
                .createdAt(clock.instant())
                .build();
        OperationResult<CognitiveLogEntry> result = logs.mutate(list -> {
            list.add(entry);
            return entry;
        });
        if (!result.isSuccess()) {
            log.warn("[Journal] Failed to write cognitive log: {}", result.getError());
        }
        return result;
    }

    public OperationResult<EpisodicMemory> recordEpisode(String summary, String concept, int significance) {
        EpisodicMemory episode = EpisodicMemory.builder()
                .id(UUID.randomUUID().toString())
                .summary(AgentStateService.truncate(summary, MAX_CONTENT_LENGTH))
                .concept(concept)
                .significance(AgentStateService.clampLevel(significance))
                .createdAt(clock.instant())
                .build();
        return episodes.mutate(list -> {
            list.add(episode);
            return episode;
        });
    }

    public OperationResult<Reflection> addReflection(String topic, String content) {
        Reflection reflection = Reflection.builder()
                .id(UUID.randomUUID().toString())
                .topic(topic)
                .content(AgentStateService.truncate(content, MAX_CONTENT_LENGTH))
                .createdAt(clock.instant())
                .build();
        return reflections.mutate(list -> {
            list.add(reflection);
            return reflection;
        });
    }

    public List<Reflection> getRecentReflections(int limit) {
        return newestFirst(reflections.snapshotOrEmpty(), Reflection::getCreatedAt, limit);
    }

    public List<CognitiveLogEntry> getRecentLogs(int limit) {
        return newestFirst(logs.snapshotOrEmpty(), CognitiveLogEntry::getCreatedAt, limit);
    }

    public List<EpisodicMemory> getRecentEpisodes(int limit) {
        return newestFirst(episodes.snapshotOrEmpty(), EpisodicMemory::getCreatedAt, limit);
    }

    public OperationResult<Integer> pruneLogsOlderThan(Instant cutoff) {
        return logs.mutate(list -> removeOlderThan(list, CognitiveLogEntry::getCreatedAt, cutoff));
    }

    public OperationResult<Integer> pruneEpisodesOlderThan(Instant cutoff) {
        return episodes.mutate(list -> removeOlderThan(list, EpisodicMemory::getCreatedAt, cutoff));
    }

    public OperationResult<Integer> trimLogs(int max) {
        return logs.mutate(list -> keepNewest(list, CognitiveLogEntry::getCreatedAt, max));
    }

    public OperationResult<Integer> trimEpisodes(int max) {
        return episodes.mutate(list -> keepNewest(list, EpisodicMemory::getCreatedAt, max));
    }

    public OperationResult<Integer> trimReflections(int max) {
        return reflections.mutate(list -> keepNewest(list, Reflection::getCreatedAt, max));
    }

    public int countLogs() {
        return logs.snapshotOrEmpty().size();
    }

    public int countEpisodes() {
        return episodes.snapshotOrEmpty().size();
    }

    public int countReflections() {
        return reflections.snapshotOrEmpty().size();
    }

    static <T> List<T> newestFirst(List<T> records, Function<T, Instant> timestamp, int limit) {
        return records.stream()
                .sorted(Comparator.comparing(timestamp, Comparator.nullsFirst(Comparator.naturalOrder())).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    static <T> int removeOlderThan(List<T> records, Function<T, Instant> timestamp, Instant cutoff) {
        int before = records.size();
        records.removeIf(record -> timestamp.apply(record) == null || timestamp.apply(record).isBefore(cutoff));
        return before - records.size();
    }

    /**
     * Remove the oldest records until at most {@code max} remain.
     *
     * @return number of records removed
     */
    static <T> int keepNewest(List<T> records, Function<T, Instant> timestamp, int max) {
        int excess = records.size() - Math.max(0, max);
        if (excess <= 0) {
            return 0;
        }
        List<T> oldest = records.stream()
                .sorted(Comparator.comparing(timestamp, Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(excess)
                .toList();
        oldest.forEach(records::remove);
        return excess;
    }
}
