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
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.SelfQuestion;
import me.golemcore.cognition.domain.model.SelfQuestion.QuestionStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Questions the agent asks itself while thinking. Pending questions feed the
 * decision context and the contact gate.
 */
@Service
@Slf4j
public class SelfQuestionService {

    static final int MAX_QUESTION_LENGTH = 500;

    private static final Comparator<SelfQuestion> BY_PRIORITY_THEN_AGE = Comparator
            .comparingInt(SelfQuestion::getPriority).reversed()
            .thenComparing(SelfQuestion::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final JsonRecordList<SelfQuestion> questions;
    private final Clock clock;

    public SelfQuestionService(JsonFileStore store, Clock clock) {
        this.questions = new JsonRecordList<>(store, "cognition", "questions.json", new TypeReference<>() {
        });
        this.clock = clock;
    }

    /**
     * Add a pending question. A pending question with the same text is reused
     * and its priority raised if the new one is higher.
     */
    public OperationResult<SelfQuestion> ask(String question, int priority) {
        if (question == null || question.isBlank()) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Question text is required");
        }
        String text = AgentStateService.truncate(question.trim(), MAX_QUESTION_LENGTH);
        int clampedPriority = AgentStateService.clampLevel(priority);

        return questions.mutate(list -> {
            Optional<SelfQuestion> existing = list.stream()
                    .filter(q -> q.getStatus() == QuestionStatus.PENDING && text.equalsIgnoreCase(q.getQuestion()))
                    .findFirst();
            if (existing.isPresent()) {
                SelfQuestion q = existing.get();
                q.setPriority(Math.max(q.getPriority(), clampedPriority));
                return q;
            }
            SelfQuestion created = SelfQuestion.builder()
                    .id(UUID.randomUUID().toString())
                    .question(text)
                    .priority(clampedPriority)
                    .status(QuestionStatus.PENDING)
                    .createdAt(clock.instant())
                    .build();
            list.add(created);
            log.debug("[Questions] New question (priority {}): {}", clampedPriority, text);
            return created;
        });
    }

    /**
     * Pending questions, highest priority first, oldest first on ties.
     */
    public List<SelfQuestion> getPendingByPriority(int limit) {
        return questions.snapshotOrEmpty().stream()
                .filter(q -> q.getStatus() == QuestionStatus.PENDING)
                .sorted(BY_PRIORITY_THEN_AGE)
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * The highest-priority pending question at or above {@code minPriority}.
     */
    public Optional<SelfQuestion> findTopPending(int minPriority) {
        return getPendingByPriority(1).stream()
                .filter(q -> q.getPriority() >= minPriority)
                .findFirst();
    }

    public Optional<SelfQuestion> findById(String id) {
        return questions.snapshotOrEmpty().stream()
                .filter(q -> q.getId().equals(id))
                .findFirst();
    }

    public OperationResult<SelfQuestion> markStatus(String id, QuestionStatus status) {
        OperationResult<Optional<SelfQuestion>> updated = questions.mutate(list -> {
            Optional<SelfQuestion> match = list.stream()
                    .filter(q -> q.getId().equals(id))
                    .findFirst();
            match.ifPresent(q -> q.setStatus(status));
            return match;
        });
        if (!updated.isSuccess()) {
            return OperationResult.failure(updated.getErrorKind(), updated.getError());
        }
        return updated.getValue()
                .map(OperationResult::success)
                .orElseGet(() -> OperationResult.failure(ErrorKind.INVARIANT_VIOLATION, "Unknown question: " + id));
    }

    public List<SelfQuestion> getAll() {
        return questions.snapshotOrEmpty();
    }

    public int count() {
        return questions.snapshotOrEmpty().size();
    }

    /**
     * Keep at most {@code max} questions. Answered and abandoned questions go
     * first, oldest first; pending ones are removed only if still over the
     * ceiling.
     *
     * @return number of questions removed
     */
    public OperationResult<Integer> trimToCeiling(int max) {
        return questions.mutate(list -> {
            int excess = list.size() - Math.max(0, max);
            if (excess <= 0) {
                return 0;
            }
            List<SelfQuestion> victims = list.stream()
                    .sorted(Comparator
                            .comparing((SelfQuestion q) -> q.getStatus() == QuestionStatus.PENDING
                                    || q.getStatus() == QuestionStatus.EXPLORING)
                            .thenComparing(SelfQuestion::getCreatedAt,
                                    Comparator.nullsFirst(Comparator.naturalOrder())))
                    .limit(excess)
                    .toList();
            list.removeAll(victims);
            return victims.size();
        });
    }
}
