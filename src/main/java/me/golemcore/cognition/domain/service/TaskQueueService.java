package me.golemcore.cognition.domain.service;

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

import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.component.JsonRecordList;
import me.golemcore.cognition.domain.model.CognitiveTask;
import me.golemcore.cognition.domain.model.CognitiveTask.TaskStatus;
import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.task.CognitiveTaskHandler;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue of background tasks created from decisions.
 *
 * <p>
 * {@link #executeOne()} runs at most one task per call: the oldest pending
 * task is promoted to {@code IN_PROGRESS}, dispatched by kind to its
 * {@link CognitiveTaskHandler}, and finished as {@code COMPLETED} with the
 * handler's result or {@code ABANDONED} with the error. Handler failures and
 * unknown kinds never escape this method.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class TaskQueueService {

    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final JsonRecordList<CognitiveTask> tasks;
    private final Map<String, CognitiveTaskHandler> handlers = new HashMap<>();
    private final BotProperties properties;
    private final Clock clock;

    public TaskQueueService(JsonFileStore store, List<CognitiveTaskHandler> handlers,
            BotProperties properties, Clock clock) {
        this.tasks = new JsonRecordList<>(store, "cognition", "tasks.json", new TypeReference<>() {
        });
        for (CognitiveTaskHandler handler : handlers) {
            this.handlers.put(handler.getKind(), handler);
        }
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Create the task a decision calls for, if any. Only explore, reflect,
     * integrate and ask decisions produce tasks.
     */
    public Optional<CognitiveTask> enqueueFor(Decision decision) {
        String kind;
        int priority;
        switch (decision.getKind()) {
        case EXPLORE_CONCEPT -> {
            kind = CognitiveTask.KIND_EXPLORE_CONCEPT;
            priority = 7;
        }
        case REFLECT -> {
            kind = CognitiveTask.KIND_REFLECT;
            priority = 6;
        }
        case INTEGRATE_KNOWLEDGE -> {
            kind = CognitiveTask.KIND_INTEGRATE_KNOWLEDGE;
            priority = 5;
        }
        case ASK_QUESTION -> {
            kind = CognitiveTask.KIND_ASK_QUESTION;
            priority = 8;
        }
        default -> {
            return Optional.empty();
        }
        }

        CognitiveTask task = CognitiveTask.builder()
                .kind(kind)
                .description(decision.getAction())
                .priority(priority)
                .motivation(decision.getReasoning())
                .build();
        OperationResult<CognitiveTask> enqueued = enqueue(task);
        if (!enqueued.isSuccess()) {
            log.warn("[TaskQueue] Task for {} not enqueued: {}", decision.getKind(), enqueued.getError());
            return Optional.empty();
        }
        return Optional.of(enqueued.getValue());
    }

    /**
     * Add a pending task. Refused when the pending backlog is at
     * {@code bot.tasks.max-pending}.
     */
    public OperationResult<CognitiveTask> enqueue(CognitiveTask task) {
        if (task.getKind() == null || task.getKind().isBlank()) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Task kind is required");
        }
        int maxPending = properties.getTasks().getMaxPending();
        CognitiveTask toAdd = CognitiveTask.builder()
                .id(task.getId() != null ? task.getId() : UUID.randomUUID().toString())
                .kind(task.getKind())
                .description(AgentStateService.truncate(task.getDescription(), MAX_DESCRIPTION_LENGTH))
                .priority(AgentStateService.clampLevel(task.getPriority()))
                .motivation(AgentStateService.truncate(task.getMotivation(), MAX_DESCRIPTION_LENGTH))
                .status(TaskStatus.PENDING)
                .createdAt(clock.instant())
                .build();

        OperationResult<Boolean> added = tasks.mutate(list -> {
            long pending = list.stream().filter(t -> t.getStatus() == TaskStatus.PENDING).count();
            if (pending >= maxPending) {
                return false;
            }
            list.add(toAdd);
            return true;
        });
        if (!added.isSuccess()) {
            return OperationResult.failure(added.getErrorKind(), added.getError());
        }
        if (!Boolean.TRUE.equals(added.getValue())) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION,
                    "Pending task backlog is full (" + maxPending + ")");
        }
        log.debug("[TaskQueue] Enqueued {} (priority {}): {}", toAdd.getKind(), toAdd.getPriority(),
                toAdd.getDescription());
        return OperationResult.success(toAdd);
    }

    /**
     * Execute the oldest pending task.
     *
     * @return the finished task, or empty when nothing was pending or the queue
     *         could not be read
     */
    public Optional<CognitiveTask> executeOne() {
        Instant startedAt = clock.instant();
        OperationResult<Optional<CognitiveTask>> claimed = tasks.mutate(list -> {
            Optional<CognitiveTask> next = list.stream()
                    .filter(t -> t.getStatus() == TaskStatus.PENDING)
                    .min(Comparator.comparing(CognitiveTask::getCreatedAt,
                            Comparator.nullsFirst(Comparator.naturalOrder())));
            next.ifPresent(task -> {
                task.setStatus(TaskStatus.IN_PROGRESS);
                task.setStartedAt(startedAt);
            });
            return next.map(this::copy);
        });
        if (!claimed.isSuccess()) {
            log.warn("[TaskQueue] Could not claim a task: {}", claimed.getError());
            return Optional.empty();
        }
        if (claimed.getValue().isEmpty()) {
            return Optional.empty();
        }

        CognitiveTask task = claimed.getValue().get();
        OperationResult<String> outcome = run(task);
        TaskStatus status = outcome.isSuccess() ? TaskStatus.COMPLETED : TaskStatus.ABANDONED;
        String result = outcome.isSuccess()
                ? outcome.getValue()
                : outcome.getErrorKind() + ": " + outcome.getError();

        task.setStatus(status);
        task.setResult(AgentStateService.truncate(result, MAX_DESCRIPTION_LENGTH));
        task.setCompletedAt(clock.instant());
        finish(task);

        if (outcome.isSuccess()) {
            log.info("[TaskQueue] Completed {}: {}", task.getKind(), task.getResult());
        } else {
            log.warn("[TaskQueue] Abandoned {}: {}", task.getKind(), task.getResult());
        }
        return Optional.of(task);
    }

    /**
     * Abandon tasks left {@code IN_PROGRESS} by a previous run.
     *
     * @return number of tasks abandoned
     */
    public int recoverInterrupted() {
        Instant now = clock.instant();
        OperationResult<Integer> recovered = tasks.mutate(list -> {
            int count = 0;
            for (CognitiveTask task : list) {
                if (task.getStatus() == TaskStatus.IN_PROGRESS) {
                    task.setStatus(TaskStatus.ABANDONED);
                    task.setResult("Interrupted before completion");
                    task.setCompletedAt(now);
                    count++;
                }
            }
            return count;
        });
        int count = recovered.orElse(0);
        if (count > 0) {
            log.info("[TaskQueue] Abandoned {} interrupted task(s)", count);
        }
        return count;
    }

    /**
     * Keep at most {@code max} finished tasks, dropping the oldest completions.
     *
     * @return number of tasks removed
     */
    public OperationResult<Integer> pruneFinished(int max) {
        return tasks.mutate(list -> {
            List<CognitiveTask> finished = list.stream()
                    .filter(CognitiveTask::isFinished)
                    .sorted(Comparator.comparing(CognitiveTask::getCompletedAt,
                            Comparator.nullsFirst(Comparator.naturalOrder())))
                    .toList();
            int excess = finished.size() - Math.max(0, max);
            if (excess <= 0) {
                return 0;
            }
            list.removeAll(finished.subList(0, excess));
            return excess;
        });
    }

    public List<CognitiveTask> getTasks() {
        return tasks.snapshotOrEmpty();
    }

    public long countPending() {
        return tasks.snapshotOrEmpty().stream().filter(t -> t.getStatus() == TaskStatus.PENDING).count();
    }

    public int count() {
        return tasks.snapshotOrEmpty().size();
    }

    private OperationResult<String> run(CognitiveTask task) {
        CognitiveTaskHandler handler = handlers.get(task.getKind());
        if (handler == null) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Unknown task kind: " + task.getKind());
        }
        try {
            OperationResult<String> result = handler.execute(task);
            return result != null
                    ? result
                    : OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Handler returned no result");
        } catch (RuntimeException e) {
            log.error("[TaskQueue] Handler for {} failed", task.getKind(), e);
            return OperationResult.failure(ErrorKind.TRANSIENT_IO,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void finish(CognitiveTask finished) {
        OperationResult<Boolean> saved = tasks.mutate(list -> {
            for (CognitiveTask task : list) {
                if (task.getId().equals(finished.getId())) {
                    task.setStatus(finished.getStatus());
                    task.setResult(finished.getResult());
                    task.setCompletedAt(finished.getCompletedAt());
                    return true;
                }
            }
            return false;
        });
        if (!saved.isSuccess()) {
            log.error("[TaskQueue] Failed to persist outcome of task {}: {}", finished.getId(), saved.getError());
        }
    }

    private CognitiveTask copy(CognitiveTask task) {
        return CognitiveTask.builder()
                .id(task.getId())
                .kind(task.getKind())
                .description(task.getDescription())
                .priority(task.getPriority())
                .motivation(task.getMotivation())
                .status(task.getStatus())
                .result(task.getResult())
                .createdAt(task.getCreatedAt())
                .startedAt(task.getStartedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }
}
