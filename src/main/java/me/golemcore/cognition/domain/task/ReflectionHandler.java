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
import me.golemcore.cognition.domain.model.Reflection;
import me.golemcore.cognition.domain.service.JournalService;
import me.golemcore.cognition.domain.service.KnowledgeGraphService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Reflects over the most recently touched concepts. Without a model reply the
 * decision's own motivation is stored as the reflection.
 */
@Component
@RequiredArgsConstructor
public class ReflectionHandler implements CognitiveTaskHandler {

    static final int RECENT_CONCEPTS = 10;
    static final String SYSTEM_PROMPT = "You are reflecting on your own. Review what you learned recently "
            + "and describe your understanding and your open questions.";

    private final KnowledgeGraphService knowledgeGraphService;
    private final JournalService journalService;
    private final TaskTextGenerator generator;

    @Override
    public String getKind() {
        return CognitiveTask.KIND_REFLECT;
    }

    @Override
    public OperationResult<String> execute(CognitiveTask task) {
        String recent = knowledgeGraphService.getRecentConcepts(RECENT_CONCEPTS).stream()
                .map(ConceptNode::getName)
                .collect(Collectors.joining(", "));
        String prompt = "Recently learned concepts: " + (recent.isEmpty() ? "none yet" : recent)
                + "\n\nFocus: " + task.getDescription() + "\n\nReflect deeply:";

        String content = generator.generate(getKind(), SYSTEM_PROMPT, prompt)
                .orElse(task.getMotivation() != null ? task.getMotivation() : task.getDescription());
        return journalService.addReflection(task.getDescription(), content)
                .map(Reflection::getContent);
    }
}
