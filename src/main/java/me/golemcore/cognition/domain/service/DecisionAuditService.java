package me.golemcore.cognition.domain.service;

import me.golemcore.cognition.domain.component.JsonFileStore;
import me.golemcore.cognition.domain.model.DecisionRecord;
import me.golemcore.cognition.domain.model.OperationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only audit trail of decisions, one JSONL file per UTC day under
 * {@code cognition/decisions/}.
 */
@Service
@Slf4j
public class DecisionAuditService {

    static final String DIRECTORY = "cognition";
    static final String PREFIX = "decisions";

    private final JsonFileStore store;
    private final Clock clock;

    public DecisionAuditService(JsonFileStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void record(DecisionRecord decisionRecord) {
        OperationResult<Void> appended = store.append(DIRECTORY, pathFor(LocalDate.now(clock.withZone(ZoneOffset.UTC))),
                decisionRecord);
        if (!appended.isSuccess()) {
            log.warn("[Decision] Failed to write audit record: {}", appended.getError());
        }
    }

    /**
     * Most recent audit records, newest first.
     */
    public List<DecisionRecord> getRecent(int limit) {
        OperationResult<List<String>> files = store.list(DIRECTORY, PREFIX);
        if (!files.isSuccess()) {
            log.warn("[Decision] Failed to list audit files: {}", files.getError());
            return List.of();
        }

        List<String> newestFirst = files.getValue().stream()
                .filter(path -> path.endsWith(".jsonl"))
                .sorted(Comparator.reverseOrder())
                .toList();

        List<DecisionRecord> records = new ArrayList<>();
        for (String path : newestFirst) {
            if (records.size() >= limit) {
                break;
            }
            List<DecisionRecord> day = new ArrayList<>(
                    store.readLines(DIRECTORY, path, DecisionRecord.class).orElse(List.of()));
            day.sort(Comparator.comparing(DecisionRecord::getTimestamp,
                    Comparator.nullsLast(Comparator.naturalOrder())).reversed());
            for (DecisionRecord decisionRecord : day) {
                if (records.size() >= limit) {
                    break;
                }
                records.add(decisionRecord);
            }
        }
        return records;
    }

    static String pathFor(LocalDate date) {
        return PREFIX + "/" + date + ".jsonl";
    }
}
