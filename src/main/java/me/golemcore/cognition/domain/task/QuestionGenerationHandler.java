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
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.service.SelfQuestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns the decision's context into one sincere question for the user. The
 * context itself is queued when the model gives nothing back.
 */
@Component
@RequiredArgsConstructor
public class QuestionGenerationHandler implements CognitiveTaskHandler {

    static final String SYSTEM_PROMPT = "You want to ask the user one sincere question that comes from your "
            + "own confusion or curiosity. Reply with the question only.";

    private final SelfQuestionService selfQuestionService;
    private final TaskTextGenerator generator;

    @Override
    public String getKind() {
        return CognitiveTask.KIND_ASK_QUESTION;
    }

    @Override
    public OperationResult<String> execute(CognitiveTask task) {
        String question = generator.generate(getKind(), SYSTEM_PROMPT,
                "Write a question based on this context: " + task.getDescription())
                .orElse(task.getDescription());
        return selfQuestionService.ask(question, task.getPriority())
                .map(asked -> "Asked: " + asked.getQuestion());
    }
}
