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
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Cached list of records persisted as one JSON array file.
 *
 * <p>
 * Reads are served from memory after the first successful load. Mutations run
 * on a working copy and replace the cache only after the file was written, so a
 * failed read never leads to an empty list overwriting stored data. A file
 * that no longer parses is replaced on the next write.
 *
 * @param <T>
 *            record type
 */
@Slf4j
public class JsonRecordList<T> {

    private final JsonFileStore store;
    private final String directory;
    private final String path;
    private final TypeReference<List<T>> type;

    private List<T> cache;

    public JsonRecordList(JsonFileStore store, String directory, String path, TypeReference<List<T>> type) {
        this.store = store;
        this.directory = directory;
        this.path = path;
        this.type = type;
    }

    /**
     * Current records. The returned list is a copy.
     */
    public synchronized OperationResult<List<T>> snapshot() {
        return ensureLoaded().map(records -> new ArrayList<T>(records));
    }

    /**
     * Current records, or an empty list when they cannot be read.
     */
    public List<T> snapshotOrEmpty() {
        return snapshot().orElse(new ArrayList<>());
    }

    /**
     * Apply a mutation and persist the result.
     */
    public synchronized <R> OperationResult<R> mutate(Function<List<T>, R> mutation) {
        OperationResult<List<T>> loaded = ensureLoaded();
        if (!loaded.isSuccess()) {
            return OperationResult.failure(loaded.getErrorKind(), loaded.getError());
        }
        List<T> working = new ArrayList<>(loaded.getValue());
        R result = mutation.apply(working);
        OperationResult<Void> saved = store.write(directory, path, working);
        if (!saved.isSuccess()) {
            cache = null;
            return OperationResult.failure(saved.getErrorKind(), saved.getError());
        }
        cache = working;
        return OperationResult.success(result);
    }

    public synchronized void invalidate() {
        cache = null;
    }

    public String getPath() {
        return directory + "/" + path;
    }

    private OperationResult<List<T>> ensureLoaded() {
        if (cache != null) {
            return OperationResult.success(cache);
        }
        OperationResult<Optional<List<T>>> read = store.read(directory, path, type);
        if (!read.isSuccess() && read.getErrorKind() == ErrorKind.PARSE) {
            log.warn("[Store] {} is unreadable, starting from an empty list", getPath());
            cache = new ArrayList<>();
            return OperationResult.success(cache);
        }
        if (!read.isSuccess()) {
            return OperationResult.failure(read.getErrorKind(), read.getError());
        }
        cache = new ArrayList<>(read.getValue().orElse(List.of()));
        return OperationResult.success(cache);
    }
}
