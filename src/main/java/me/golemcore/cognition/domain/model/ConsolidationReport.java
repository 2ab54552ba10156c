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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts of records removed by one consolidation pass. Steps that failed are
 * listed in {@link #errors}; the remaining steps still ran.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationReport {

    private int logsRemoved;
    private int episodesRemoved;
    private int weakRelationsRemoved;
    private int duplicateConceptsMerged;

    @Builder.Default
    private Map<String, Integer> trimmedByLimit = new LinkedHashMap<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private Instant startedAt;
    private Instant finishedAt;

    public int totalRemoved() {
        int trimmed = trimmedByLimit.values().stream().mapToInt(Integer::intValue).sum();
        return logsRemoved + episodesRemoved + weakRelationsRemoved + duplicateConceptsMerged + trimmed;
    }
}
