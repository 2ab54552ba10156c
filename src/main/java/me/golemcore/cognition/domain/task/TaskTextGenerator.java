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

import me.golemcore.cognition.domain.model.CallClass;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.service.LlmInvocationService;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Free-text model calls made by task handlers.
 *
 * <p>
 * Calls go through the invoker as {@link CallClass#CREATIVE} without a
 * response schema, so any non-blank reply is accepted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskTextGenerator {

    static final int MAX_TEXT_LENGTH = 2000;

    private final LlmInvocationService invoker;
    private final BotProperties properties;

    public OperationResult<String> generate(String kind, String systemPrompt, String userPrompt) {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .schemaName("task_" + kind)
                .temperature(properties.getLlm().getTemperature())
                .build();
        OperationResult<String> text;
        try {
            text = invoker.invoke(request, CallClass.CREATIVE)
                    .map(String::trim)
                    .map(TaskTextGenerator::clip);
        } catch (RuntimeException e) {
            log.warn("[Task] Model call for {} failed unexpectedly", kind, e);
            text = OperationResult.failure(ErrorKind.TRANSIENT_IO, e.getMessage());
        }
        if (!text.isSuccess()) {
            log.debug("[Task] No model text for {}: {} {}", kind, text.getErrorKind(), text.getError());
        }
        return text;
    }

    static String clip(String text) {
        return text.length() <= MAX_TEXT_LENGTH ? text : text.substring(0, MAX_TEXT_LENGTH);
    }
}
