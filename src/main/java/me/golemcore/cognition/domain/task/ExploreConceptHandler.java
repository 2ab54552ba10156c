package me.golemcore.cognition.domain.task;

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

import me.golemcore.cognition.domain.model.CognitiveTask;
import me.golemcore.cognition.domain.model.ConceptNode;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.service.JournalService;
import me.golemcore.cognition.domain.service.KnowledgeGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ExploreConceptHandler implements CognitiveTaskHandler {

    static final String SYSTEM_PROMPT = "You are exploring a concept on your own. Think about what it means, "
            + "what it relates to and what remains unclear about it.";

    private final KnowledgeGraphService knowledgeGraphService;
    private final JournalService journalService;
    private final TaskTextGenerator generator;

    @Override
    public String getKind() {
        return CognitiveTask.KIND_EXPLORE_CONCEPT;
    }

    @Override
    public OperationResult<String> execute(CognitiveTask task) {
        OperationResult<ConceptNode> reinforced = knowledgeGraphService.reinforceConcept(task.getDescription(),
                task.getMotivation());
        if (!reinforced.isSuccess()) {
            return OperationResult.failure(reinforced.getErrorKind(), reinforced.getError());
        }

        ConceptNode concept = reinforced.getValue();
        String bookkeeping = "Explored '" + concept.getName() + "' (confidence "
                + concept.getConfidence() + ", encounters " + concept.getEncounterCount() + ")";
        String result = generator.generate(getKind(), SYSTEM_PROMPT, "Explore the concept: " + concept.getName())
                .orElse(bookkeeping);

        OperationResult<?> episode = journalService.recordEpisode(result, concept.getName(), task.getPriority());
        if (!episode.isSuccess()) {
            log.warn("[Task] Explored '{}' but could not record the episode: {}", concept.getName(),
                    episode.getError());
        }
        return OperationResult.success(result);
    }
}
