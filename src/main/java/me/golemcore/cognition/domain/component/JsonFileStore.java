package me.golemcore.cognition.domain.component;

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

import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Typed JSON access on top of {@link StoragePort}. Every storage call is
 * awaited with {@code bot.storage.timeout}; failures come back as
 * {@link OperationResult} instead of exceptions.
 */
@Component
@Slf4j
public class JsonFileStore {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public JsonFileStore(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.timeout = properties.getStorage().getTimeout();
    }

    public <T> OperationResult<Optional<T>> read(String directory, String path, TypeReference<T> type) {
        OperationResult<String> text = await(storagePort.getText(directory, path), directory, path);
        if (!text.isSuccess()) {
            return OperationResult.failure(text.getErrorKind(), text.getError());
        }
        String json = text.getValue();
        if (json == null || json.isBlank()) {
            return OperationResult.success(Optional.empty());
        }
        try {
            return OperationResult.success(Optional.ofNullable(objectMapper.readValue(json, type)));
        } catch (JsonProcessingException e) {
            log.warn("[Store] Corrupt JSON in {}/{}: {}", directory, path, e.getOriginalMessage());
            return OperationResult.failure(ErrorKind.PARSE, "Corrupt JSON in " + directory + "/" + path);
        }
    }

    public OperationResult<Void> write(String directory, String path, Object value) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION,
                    "Failed to serialize " + directory + "/" + path + ": " + e.getOriginalMessage());
        }
        return await(storagePort.putTextAtomic(directory, path, json, false), directory, path);
    }

    /**
     * Append one JSON line.
     */
    public OperationResult<Void> append(String directory, String path, Object value) {
        String line;
        try {
            line = objectMapper.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            return OperationResult.failure(ErrorKind.INVARIANT_VIOLATION,
                    "Failed to serialize " + directory + "/" + path + ": " + e.getOriginalMessage());
        }
        return await(storagePort.appendText(directory, path, line), directory, path);
    }

    /**
     * Read a JSONL file. Malformed lines are skipped.
     */
    public <T> OperationResult<List<T>> readLines(String directory, String path, Class<T> type) {
        OperationResult<String> text = await(storagePort.getText(directory, path), directory, path);
        if (!text.isSuccess()) {
            return OperationResult.failure(text.getErrorKind(), text.getError());
        }
        List<T> records = new ArrayList<>();
        String content = text.getValue();
        if (content == null || content.isBlank()) {
            return OperationResult.success(records);
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                log.debug("[Store] Skipping malformed line in {}/{}", directory, path);
            }
        }
        return OperationResult.success(records);
    }

    public OperationResult<List<String>> list(String directory, String prefix) {
        return await(storagePort.listObjects(directory, prefix), directory, prefix);
    }

    private <T> OperationResult<T> await(CompletableFuture<T> future, String directory, String path) {
        try {
            return OperationResult.success(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return OperationResult.failure(ErrorKind.TRANSIENT_IO,
                    "Storage timeout after " + timeout.toMillis() + "ms: " + directory + "/" + path);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return OperationResult.failure(ErrorKind.TRANSIENT_IO,
                    "Storage failure on " + directory + "/" + path + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(ErrorKind.TRANSIENT_IO, "Interrupted: " + directory + "/" + path);
        }
    }
}
