package me.golemcore.cognition.auto;

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

import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.CognitiveTask;
import me.golemcore.cognition.domain.model.ConsolidationReport;
import me.golemcore.cognition.domain.model.ContactDecision;
import me.golemcore.cognition.domain.model.CycleOutcome;
import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.DecisionKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.ProactiveMessage;
import me.golemcore.cognition.domain.model.ReclaimResult;
import me.golemcore.cognition.domain.model.SchedulerStatus;
import me.golemcore.cognition.domain.service.AgentStateService;
import me.golemcore.cognition.domain.service.ContactGate;
import me.golemcore.cognition.domain.service.DecisionService;
import me.golemcore.cognition.domain.service.JournalService;
import me.golemcore.cognition.domain.service.LlmInvocationService;
import me.golemcore.cognition.domain.service.MemoryConsolidationService;
import me.golemcore.cognition.domain.service.ProactiveMessageService;
import me.golemcore.cognition.domain.service.TaskQueueService;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.RuntimeResourcePort;
import me.golemcore.cognition.ratelimit.RateLimiter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background control loop of the agent.
 *
 * <p>
 * One cycle runs strictly in sequence:
 * <ol>
 * <li>read the agent state</li>
 * <li>ask the decision engine what to do</li>
 * <li>enqueue the task the decision calls for and execute at most one
 * pending task</li>
 * <li>evaluate the contact gate and deliver a proactive message if it
 * opens</li>
 * <li>apply the decision to the state</li>
 * </ol>
 * Memory consolidation runs on its own timer on the same thread.
 *
 * <p>
 * Execution is non-interruptible: a tick that arrives while a cycle is still
 * running is skipped. Under memory pressure the cycle is skipped and the
 * runtime is asked to reclaim memory. Nothing thrown by a cycle cancels the
 * timer.
 *
 * @since 1.0
 * @see DecisionService
 * @see TaskQueueService
 * @see MemoryConsolidationService
 */
@Component
@Slf4j
public class CognitionScheduler {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final AgentStateService agentStateService;
    private final DecisionService decisionService;
    private final TaskQueueService taskQueueService;
    private final ContactGate contactGate;
    private final ProactiveMessageService proactiveMessageService;
    private final JournalService journalService;
    private final MemoryConsolidationService consolidationService;
    private final LlmInvocationService invocationService;
    private final RateLimiter rateLimiter;
    private final RuntimeResourcePort runtimeResourcePort;
    private final BotProperties properties;
    private final Clock clock;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicLong cyclesSkippedBusy = new AtomicLong();
    private final AtomicLong cyclesSkippedPressure = new AtomicLong();
    private final AtomicLong cyclesFailed = new AtomicLong();
    private final AtomicLong consolidations = new AtomicLong();

    private volatile Instant lastCycleAt;
    private volatile CycleOutcome lastOutcome;
    private volatile DecisionKind lastDecision;
    private volatile Instant lastConsolidationAt;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> cycleTask;
    private ScheduledFuture<?> consolidationTask;

    public CognitionScheduler(AgentStateService agentStateService, DecisionService decisionService,
            TaskQueueService taskQueueService, ContactGate contactGate,
            ProactiveMessageService proactiveMessageService, JournalService journalService,
            MemoryConsolidationService consolidationService, LlmInvocationService invocationService,
            RateLimiter rateLimiter, RuntimeResourcePort runtimeResourcePort, BotProperties properties,
            Clock clock) {
        this.agentStateService = agentStateService;
        this.decisionService = decisionService;
        this.taskQueueService = taskQueueService;
        this.contactGate = contactGate;
        this.proactiveMessageService = proactiveMessageService;
        this.journalService = journalService;
        this.consolidationService = consolidationService;
        this.invocationService = invocationService;
        this.rateLimiter = rateLimiter;
        this.runtimeResourcePort = runtimeResourcePort;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        BotProperties.CognitionProperties config = properties.getCognition();
        if (!config.isEnabled()) {
            log.info("[Cognition] Background cognition disabled");
            return;
        }
        if (config.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        log.info("[Cognition] Shut down");
    }

    /**
     * Start the cycle and consolidation timers.
     *
     * @return {@code false} if already running
     */
    public synchronized boolean start() {
        if (isRunning()) {
            return false;
        }
        taskQueueService.recoverInterrupted();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cognition-scheduler");
            t.setDaemon(true);
            return t;
        });

        BotProperties.CognitionProperties config = properties.getCognition();
        long intervalMs = config.getInterval().toMillis();
        long consolidationMs = properties.getMemory().getConsolidationInterval().toMillis();
        cycleTask = scheduler.scheduleAtFixedRate(this::tick,
                config.getInitialDelay().toMillis(), intervalMs, TimeUnit.MILLISECONDS);
        consolidationTask = scheduler.scheduleAtFixedRate(this::runScheduledConsolidation,
                consolidationMs, consolidationMs, TimeUnit.MILLISECONDS);

        log.info("[Cognition] Started: interval={}, initial delay={}, consolidation every {}",
                config.getInterval(), config.getInitialDelay(), properties.getMemory().getConsolidationInterval());
        return true;
    }

    /**
     * Stop the timers. A cycle already running is allowed to finish.
     *
     * @return {@code false} if not running
     */
    public synchronized boolean stop() {
        if (scheduler == null) {
            return false;
        }
        if (cycleTask != null) {
            cycleTask.cancel(false);
        }
        if (consolidationTask != null) {
            consolidationTask.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[Cognition] Cycle still running after {}s, leaving it to finish",
                        SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        cycleTask = null;
        consolidationTask = null;
        executing.set(false);
        log.info("[Cognition] Stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    /**
     * Run one cycle unless another one is in progress or memory is under
     * pressure.
     */
    public CycleOutcome tick() {
        if (!executing.compareAndSet(false, true)) {
            cyclesSkippedBusy.incrementAndGet();
            log.debug("[Cognition] Previous cycle still running, skipping tick");
            return record(CycleOutcome.SKIPPED_BUSY);
        }
        try {
            double utilization = runtimeResourcePort.heapUtilization();
            double highWaterMark = properties.getCognition().getMemoryHighWaterMark();
            if (utilization > highWaterMark) {
                cyclesSkippedPressure.incrementAndGet();
                log.warn("[Cognition] Heap at {}% (limit {}%), skipping cycle and requesting reclaim",
                        percent(utilization), percent(highWaterMark));
                runtimeResourcePort.requestReclaim();
                return record(CycleOutcome.SKIPPED_PRESSURE);
            }
            runCycle();
            cyclesCompleted.incrementAndGet();
            return record(CycleOutcome.COMPLETED);
        } catch (Exception e) { // NOSONAR - nothing may cancel the timer
            cyclesFailed.incrementAndGet();
            log.error("[Cognition] Cycle failed", e);
            return record(CycleOutcome.FAILED);
        } finally {
            executing.set(false);
        }
    }

    public ConsolidationReport runConsolidationNow() {
        ConsolidationReport report = consolidationService.runFullConsolidation();
        consolidations.incrementAndGet();
        lastConsolidationAt = clock.instant();
        return report;
    }

    /**
     * Ask the runtime to reclaim memory and report the heap before and after.
     */
    public ReclaimResult forceReclaim() {
        double before = runtimeResourcePort.heapUtilization();
        long usedBefore = runtimeResourcePort.usedHeapBytes();
        runtimeResourcePort.requestReclaim();
        ReclaimResult result = ReclaimResult.builder()
                .utilizationBefore(before)
                .utilizationAfter(runtimeResourcePort.heapUtilization())
                .usedBytesBefore(usedBefore)
                .usedBytesAfter(runtimeResourcePort.usedHeapBytes())
                .requestedAt(clock.instant())
                .build();
        log.info("[Cognition] Reclaim requested: heap {}% -> {}%", percent(result.getUtilizationBefore()),
                percent(result.getUtilizationAfter()));
        return result;
    }

    public SchedulerStatus getStatus() {
        return SchedulerStatus.builder()
                .running(isRunning())
                .cycleInProgress(executing.get())
                .lastCycleAt(lastCycleAt)
                .lastOutcome(lastOutcome)
                .lastDecision(lastDecision)
                .lastConsolidationAt(lastConsolidationAt)
                .cyclesCompleted(cyclesCompleted.get())
                .cyclesSkippedBusy(cyclesSkippedBusy.get())
                .cyclesSkippedPressure(cyclesSkippedPressure.get())
                .cyclesFailed(cyclesFailed.get())
                .consolidations(consolidations.get())
                .invocation(invocationService.getMetrics())
                .rateLimit(rateLimiter.getWindow())
                .build();
    }

    private void runCycle() {
        AgentState state = agentStateService.getState();
        Decision decision = decisionService.decide(state);
        lastDecision = decision.getKind();

        taskQueueService.enqueueFor(decision);
        Optional<CognitiveTask> executed = taskQueueService.executeOne();

        ContactDecision contact = contactGate.evaluate(state);
        String contactOutcome = "none";
        if (contact.isShouldContact()) {
            OperationResult<ProactiveMessage> delivered = proactiveMessageService.deliver(contact);
            contactOutcome = delivered.isSuccess()
                    ? delivered.getValue().getStatus().name().toLowerCase(Locale.ROOT)
                    : "failed";
        }

        AgentState updated = agentStateService.applyDecision(decision);

        String taskSummary = executed
                .map(task -> task.getKind() + "=" + task.getStatus().name().toLowerCase(Locale.ROOT))
                .orElse("none");
        OperationResult<?> logged = journalService.log("cycle", decision.getKind().getWireName() + ": "
                + decision.getAction() + " (task " + taskSummary + ", contact " + contactOutcome + ")");
        if (!logged.isSuccess()) {
            log.debug("[Cognition] Cognitive log append failed: {}", logged.getError());
        }

        log.info("[Cognition] Cycle done: mode={}, decision={}{}, task={}, contact={}",
                updated.getMode().name().toLowerCase(Locale.ROOT), decision.getKind().getWireName(),
                decision.isFallback() ? " (fallback)" : "", taskSummary, contactOutcome);
    }

    private void runScheduledConsolidation() {
        try {
            runConsolidationNow();
        } catch (Exception e) { // NOSONAR - nothing may cancel the timer
            log.error("[Consolidation] Scheduled consolidation failed", e);
        }
    }

    private CycleOutcome record(CycleOutcome outcome) {
        lastOutcome = outcome;
        lastCycleAt = clock.instant();
        return outcome;
    }

    private static long percent(double ratio) {
        return Math.round(ratio * 100);
    }
}
