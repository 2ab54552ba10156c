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
 * Operational snapshot of the cognition scheduler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatus {

    private boolean running;
    private boolean cycleInProgress;
    private Instant lastCycleAt;
    private CycleOutcome lastOutcome;
    private DecisionKind lastDecision;
    private Instant lastConsolidationAt;
    private long cyclesCompleted;
    private long cyclesSkippedBusy;
    private long cyclesSkippedPressure;
    private long cyclesFailed;
    private long consolidations;
    private InvocationMetrics invocation;
    private RateLimitWindow rateLimit;
}
