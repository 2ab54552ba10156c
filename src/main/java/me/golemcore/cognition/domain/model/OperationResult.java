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

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a fallible operation: either a value or an {@link ErrorKind} with
 * a message.
 *
 * @param <T>
 *            value type
 */
public final class OperationResult<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String error;

    private OperationResult(T value, ErrorKind errorKind, String error) {
        this.value = value;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind errorKind, String error) {
        Objects.requireNonNull(errorKind, "errorKind");
        return new OperationResult<>(null, errorKind, error);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + errorKind + " " + error);
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getError() {
        return error;
    }

    public T orElse(T other) {
        return isSuccess() ? value : other;
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return failure(errorKind, error);
        }
        return success(mapper.apply(value));
    }

    public <R> OperationResult<R> flatMap(Function<? super T, OperationResult<R>> mapper) {
        if (!isSuccess()) {
            return failure(errorKind, error);
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return isSuccess() ? "OperationResult[ok]" : "OperationResult[" + errorKind + ": " + error + "]";
    }
}
