package me.golemcore.cognition.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.cognition.auto.CognitionScheduler;
import me.golemcore.cognition.domain.model.AgentMode;
import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.AgentStateUpdate;
import me.golemcore.cognition.domain.model.CognitiveTask;
import me.golemcore.cognition.domain.model.ConsolidationReport;
import me.golemcore.cognition.domain.model.CycleOutcome;
import me.golemcore.cognition.domain.model.DecisionRecord;
import me.golemcore.cognition.domain.model.MemoryStats;
import me.golemcore.cognition.domain.model.RateLimitWindow;
import me.golemcore.cognition.domain.model.ReclaimResult;
import me.golemcore.cognition.domain.model.SchedulerStatus;
import me.golemcore.cognition.domain.service.AgentStateService;
import me.golemcore.cognition.domain.service.DecisionAuditService;
import me.golemcore.cognition.domain.service.MemoryConsolidationService;
import me.golemcore.cognition.domain.service.TaskQueueService;
import me.golemcore.cognition.ratelimit.RateLimiter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Operational endpoints for the background cognition loop.
 */
@RestController
@RequestMapping("/api/cognition")
@RequiredArgsConstructor
public class CognitionController {

    private static final int MAX_DECISION_LIMIT = 200;

    private final CognitionScheduler scheduler;
    private final AgentStateService agentStateService;
    private final MemoryConsolidationService consolidationService;
    private final TaskQueueService taskQueueService;
    private final DecisionAuditService decisionAuditService;
    private final RateLimiter rateLimiter;

    @GetMapping("/status")
    public Mono<ResponseEntity<SchedulerStatus>> getStatus() {
        return Mono.just(ResponseEntity.ok(scheduler.getStatus()));
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<RunningResponse>> start() {
        boolean changed = scheduler.start();
        return Mono.just(ResponseEntity.ok(new RunningResponse(scheduler.isRunning(), changed)));
    }

    @PostMapping("/stop")
    public Mono<ResponseEntity<RunningResponse>> stop() {
        boolean changed = scheduler.stop();
        return Mono.just(ResponseEntity.ok(new RunningResponse(scheduler.isRunning(), changed)));
    }

    @PostMapping("/cycle")
    public Mono<ResponseEntity<CycleResponse>> runCycle() {
        CycleOutcome outcome = scheduler.tick();
        return Mono.just(ResponseEntity.ok(new CycleResponse(outcome.name(), scheduler.getStatus().getLastCycleAt())));
    }

    @PostMapping("/reclaim")
    public Mono<ResponseEntity<ReclaimResult>> reclaim() {
        return Mono.just(ResponseEntity.ok(scheduler.forceReclaim()));
    }

    @PostMapping("/consolidate")
    public Mono<ResponseEntity<ConsolidationReport>> consolidate() {
        return Mono.just(ResponseEntity.ok(scheduler.runConsolidationNow()));
    }

    @GetMapping("/rate-limit")
    public Mono<ResponseEntity<RateLimitWindow>> getRateLimit() {
        return Mono.just(ResponseEntity.ok(rateLimiter.getWindow()));
    }

    @PostMapping("/rate-limit/reset")
    public Mono<ResponseEntity<RateLimitWindow>> resetRateLimit() {
        rateLimiter.reset();
        return Mono.just(ResponseEntity.ok(rateLimiter.getWindow()));
    }

    @GetMapping("/memory")
    public Mono<ResponseEntity<MemoryStats>> getMemory() {
        return Mono.just(ResponseEntity.ok(consolidationService.getStats()));
    }

    @GetMapping("/state")
    public Mono<ResponseEntity<AgentState>> getState() {
        return Mono.just(ResponseEntity.ok(agentStateService.getState()));
    }

    @PutMapping("/state")
    public Mono<ResponseEntity<AgentState>> updateState(@RequestBody StateUpdateRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        AgentStateUpdate update = AgentStateUpdate.builder()
                .mode(parseMode(request.mode()))
                .motivation(request.motivation())
                .motivationIntensity(request.motivationIntensity())
                .autonomyLevel(request.autonomyLevel())
                .build();
        return Mono.just(ResponseEntity.ok(agentStateService.update(update)));
    }

    @GetMapping("/tasks")
    public Mono<ResponseEntity<List<CognitiveTask>>> getTasks() {
        List<CognitiveTask> tasks = taskQueueService.getTasks().stream()
                .sorted(Comparator.comparing(CognitiveTask::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .toList();
        return Mono.just(ResponseEntity.ok(tasks));
    }

    @GetMapping("/decisions")
    public Mono<ResponseEntity<List<DecisionRecord>>> getDecisions(
            @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_DECISION_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + MAX_DECISION_LIMIT);
        }
        return Mono.just(ResponseEntity.ok(decisionAuditService.getRecent(limit)));
    }

    private static AgentMode parseMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return null;
        }
        try {
            return AgentMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown mode: " + mode);
        }
    }

    record RunningResponse(boolean running, boolean changed) {
    }

    record CycleResponse(String outcome, Instant completedAt) {
    }

    record StateUpdateRequest(String mode, String motivation, Integer motivationIntensity, Integer autonomyLevel) {
    }
}
