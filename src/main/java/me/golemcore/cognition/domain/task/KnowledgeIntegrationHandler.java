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
import me.golemcore.cognition.domain.model.ConceptRelation;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.service.JournalService;
import me.golemcore.cognition.domain.service.KnowledgeGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeIntegrationHandler implements CognitiveTaskHandler {

    static final String RELATION_TYPE = "related_to";
    static final int MAX_CONCEPTS = 20;
    static final String SYSTEM_PROMPT = "You are integrating what you already know. Look for connections "
            + "between the concepts and build a more complete understanding.";

    private final KnowledgeGraphService knowledgeGraphService;
    private final JournalService journalService;
    private final TaskTextGenerator generator;

    @Override
    public String getKind() {
        return CognitiveTask.KIND_INTEGRATE_KNOWLEDGE;
    }

    @Override
    public OperationResult<String> execute(CognitiveTask task) {
        String summary = "Integrated knowledge: " + task.getDescription();

        List<ConceptNode> recent = knowledgeGraphService.getRecentConcepts(MAX_CONCEPTS);
        if (recent.size() >= 2) {
            OperationResult<ConceptRelation> linked = knowledgeGraphService.relate(
                    recent.get(0).getId(), recent.get(1).getId(), RELATION_TYPE);
            if (linked.isSuccess()) {
                summary += " (linked " + recent.get(0).getName() + " -> " + recent.get(1).getName()
                        + ", strength " + linked.getValue().getStrength() + ")";
            } else {
                log.debug("[Task] Could not link recent concepts: {}", linked.getError());
            }
        }

        String result = summary;
        if (!recent.isEmpty()) {
            String names = recent.stream().map(ConceptNode::getName).collect(Collectors.joining(", "));
            result = generator.generate(getKind(), SYSTEM_PROMPT, "Integrate these concepts: " + names)
                    .orElse(summary);
        }

        String logged = result;
        return journalService.log("integration", logged).map(entry -> logged);
    }
}
