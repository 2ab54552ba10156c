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

/**
 * Executes one kind of {@link CognitiveTask}. Handlers are discovered as Spring
 * beans and indexed by {@link #getKind()}.
 */
public interface CognitiveTaskHandler {

    String getKind();

    /**
     * Run the task.
     *
     * @return short human-readable result on success
     */
    OperationResult<String> execute(CognitiveTask task);
}
