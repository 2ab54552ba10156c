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

import me.golemcore.cognition.domain.model.ConsolidationReport;
import me.golemcore.cognition.domain.model.MemoryStats;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.RuntimeResourcePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Keeps long-running memory bounded.
 *
 * <p>
 * A full pass first consolidates (age-based pruning of the cognitive log and
 * episodic memories, removal of weak relations, merge of duplicate concepts)
 * and then enforces the per-category ceilings. Each step runs on its own: a
 * failing step is recorded in the report and the next one still runs.
 * Running a pass twice on unchanged data removes nothing the second time.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MemoryConsolidationService {

    static final String CONCEPTS = "concepts";
    static final String RELATIONS = "relations";
    static final String LOGS = "logs";
    static final String EPISODES = "episodes";
    static final String REFLECTIONS = "reflections";
    static final String QUESTIONS = "questions";
    static final String TASKS = "tasks";

    private final KnowledgeGraphService knowledgeGraphService;
    private final JournalService journalService;
    private final SelfQuestionService selfQuestionService;
    private final TaskQueueService taskQueueService;
    private final RuntimeResourcePort runtimeResourcePort;
    private final BotProperties properties;
    private final Clock clock;

    public MemoryConsolidationService(KnowledgeGraphService knowledgeGraphService, JournalService journalService,
            SelfQuestionService selfQuestionService, TaskQueueService taskQueueService,
            RuntimeResourcePort runtimeResourcePort, BotProperties properties, Clock clock) {
        this.knowledgeGraphService = knowledgeGraphService;
        this.journalService = journalService;
        this.selfQuestionService = selfQuestionService;
        this.taskQueueService = taskQueueService;
        this.runtimeResourcePort = runtimeResourcePort;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Age and quality based cleanup.
     */
    public ConsolidationReport consolidate() {
        ConsolidationReport report = ConsolidationReport.builder().startedAt(clock.instant()).build();
        consolidateInto(report);
        report.setFinishedAt(clock.instant());
        return report;
    }

    /**
     * Trim every category down to its ceiling.
     */
    public ConsolidationReport enforceLimits() {
        ConsolidationReport report = ConsolidationReport.builder().startedAt(clock.instant()).build();
        enforceLimitsInto(report);
        report.setFinishedAt(clock.instant());
        return report;
    }

    public ConsolidationReport runFullConsolidation() {
        ConsolidationReport report = ConsolidationReport.builder().startedAt(clock.instant()).build();
        consolidateInto(report);
        enforceLimitsInto(report);
        report.setFinishedAt(clock.instant());

        if (report.getErrors().isEmpty()) {
            log.info("[Consolidation] Removed {} record(s): logs={}, episodes={}, weakRelations={}, merged={}, "
                    + "trimmed={}", report.totalRemoved(), report.getLogsRemoved(), report.getEpisodesRemoved(),
                    report.getWeakRelationsRemoved(), report.getDuplicateConceptsMerged(),
                    report.getTrimmedByLimit());
        } else {
            log.warn("[Consolidation] Finished with {} failed step(s): {}", report.getErrors().size(),
                    report.getErrors());
        }
        return report;
    }

    public MemoryStats getStats() {
        BotProperties.MemoryProperties config = properties.getMemory();
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(CONCEPTS, knowledgeGraphService.countConcepts());
        counts.put(RELATIONS, knowledgeGraphService.countRelations());
        counts.put(LOGS, journalService.countLogs());
        counts.put(EPISODES, journalService.countEpisodes());
        counts.put(REFLECTIONS, journalService.countReflections());
        counts.put(QUESTIONS, selfQuestionService.count());
        counts.put(TASKS, taskQueueService.count());

        Map<String, Integer> ceilings = new LinkedHashMap<>();
        ceilings.put(CONCEPTS, config.getMaxConcepts());
        ceilings.put(RELATIONS, config.getMaxRelations());
        ceilings.put(LOGS, config.getMaxLogs());
        ceilings.put(EPISODES, config.getMaxEpisodes());
        ceilings.put(REFLECTIONS, config.getMaxReflections());
        ceilings.put(QUESTIONS, config.getMaxQuestions());
        ceilings.put(TASKS, config.getMaxFinishedTasks());

        return MemoryStats.builder()
                .counts(counts)
                .ceilings(ceilings)
                .heapUtilization(runtimeResourcePort.heapUtilization())
                .build();
    }

    private void consolidateInto(ConsolidationReport report) {
        BotProperties.MemoryProperties config = properties.getMemory();
        Instant now = clock.instant();

        step(report, "prune cognitive log",
                () -> journalService.pruneLogsOlderThan(now.minus(config.getLogRetention())),
                report::setLogsRemoved);
        step(report, "prune episodic memories",
                () -> journalService.pruneEpisodesOlderThan(now.minus(config.getEpisodeRetention())),
                report::setEpisodesRemoved);
        step(report, "remove weak relations",
                () -> knowledgeGraphService.removeWeakRelations(config.getMinRelationStrength()),
                report::setWeakRelationsRemoved);
        step(report, "merge duplicate concepts",
                knowledgeGraphService::mergeDuplicateConcepts,
                report::setDuplicateConceptsMerged);
    }

    private void enforceLimitsInto(ConsolidationReport report) {
        BotProperties.MemoryProperties config = properties.getMemory();
        trim(report, CONCEPTS, () -> knowledgeGraphService.enforceConceptCeiling(config.getMaxConcepts()));
        trim(report, RELATIONS, () -> knowledgeGraphService.enforceRelationCeiling(config.getMaxRelations()));
        trim(report, LOGS, () -> journalService.trimLogs(config.getMaxLogs()));
        trim(report, EPISODES, () -> journalService.trimEpisodes(config.getMaxEpisodes()));
        trim(report, REFLECTIONS, () -> journalService.trimReflections(config.getMaxReflections()));
        trim(report, QUESTIONS, () -> selfQuestionService.trimToCeiling(config.getMaxQuestions()));
        trim(report, TASKS, () -> taskQueueService.pruneFinished(config.getMaxFinishedTasks()));
    }

    private void trim(ConsolidationReport report, String category, Supplier<OperationResult<Integer>> action) {
        step(report, "limit " + category, action,
                removed -> report.getTrimmedByLimit().merge(category, removed, Integer::sum));
    }

    private void step(ConsolidationReport report, String name, Supplier<OperationResult<Integer>> action,
            IntConsumer onSuccess) {
        try {
            OperationResult<Integer> result = action.get();
            if (result.isSuccess()) {
                onSuccess.accept(result.getValue());
            } else {
                report.getErrors().add(name + ": " + result.getErrorKind() + " " + result.getError());
                log.warn("[Consolidation] Step '{}' failed: {}", name, result.getError());
            }
        } catch (RuntimeException e) {
            report.getErrors().add(name + ": " + e.getMessage());
            log.error("[Consolidation] Step '{}' threw", name, e);
        }
    }
}
