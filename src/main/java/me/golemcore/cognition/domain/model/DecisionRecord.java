package me.golemcore.cognition.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit row appended for every decision, fresh or fallback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRecord {

    private String id;
    private DecisionKind kind;
    private String reasoning;
    private String action;
    private boolean shouldContactUser;
    private Urgency urgency;
    private boolean fallback;
    private ErrorKind errorKind;
    private String error;
    private AgentMode mode;
    private int conceptsInContext;
    private int questionsInContext;
    private int reflectionsInContext;
    private Instant timestamp;
}
