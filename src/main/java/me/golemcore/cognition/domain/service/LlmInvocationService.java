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

import me.golemcore.cognition.cache.ResponseCache;
import me.golemcore.cognition.domain.model.CallClass;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.InvocationMetrics;
import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.LlmResponse;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.RateLimitResult;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import me.golemcore.cognition.port.outbound.LlmPort;
import me.golemcore.cognition.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Single entry point for model calls.
 *
 * <p>
 * Order of operations for one logical call:
 * <ol>
 * <li>response cache lookup by request fingerprint (skipped for
 * {@link CallClass#UNCACHED})</li>
 * <li>one rate limiter permit; a denial is returned as
 * {@link ErrorKind#RATE_LIMITED} without touching the model</li>
 * <li>model call awaited with {@code bot.invocation.timeout}, retried up to
 * {@code bot.invocation.max-retries} times after
 * {@code bot.invocation.retry-backoff}</li>
 * <li>content that passes the caller's validator stored in the cache with
 * the TTL of the call class</li>
 * </ol>
 * A throttling error from the provider starts the limiter cooldown and ends the
 * call immediately.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class LlmInvocationService {

    private final LlmPort llmPort;
    private final ResponseCache cache;
    private final RateLimiter rateLimiter;
    private final BotProperties properties;

    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public LlmInvocationService(LlmPort llmPort, ResponseCache cache, RateLimiter rateLimiter,
            BotProperties properties) {
        this.llmPort = llmPort;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    public OperationResult<String> invoke(LlmRequest request, CallClass callClass) {
        return invoke(request, callClass, OperationResult::success);
    }

    /**
     * Invoke the model and convert its reply with {@code validator}. Only a reply
     * the validator accepts is cached; a cached reply it rejects is dropped and
     * the model is asked again.
     */
    public <T> OperationResult<T> invoke(LlmRequest request, CallClass callClass,
            Function<String, OperationResult<T>> validator) {
        calls.incrementAndGet();

        String key = null;
        if (callClass != CallClass.UNCACHED) {
            key = fingerprint(request);
            Optional<String> cached = cache.get(key);
            if (cached.isPresent()) {
                OperationResult<T> validated = validator.apply(cached.get());
                if (validated.isSuccess()) {
                    cacheHits.incrementAndGet();
                    log.debug("[LLM] Cache hit for {} ({})", request.getSchemaName(), callClass);
                    return validated;
                }
                log.debug("[LLM] Dropping cached reply for {}: {}", request.getSchemaName(), validated.getError());
                cache.invalidate(key);
            }
        }

        RateLimitResult permit = rateLimiter.tryAcquire();
        if (!permit.isAllowed()) {
            rateLimited.incrementAndGet();
            log.debug("[LLM] Call skipped: {} (retry in {}ms)", permit.getReason(), permit.getWaitTime().toMillis());
            return OperationResult.failure(ErrorKind.RATE_LIMITED, permit.getReason());
        }

        OperationResult<String> content = callModel(request);
        if (!content.isSuccess()) {
            if (content.getErrorKind() != ErrorKind.RATE_LIMITED) {
                failures.incrementAndGet();
            }
            return OperationResult.failure(content.getErrorKind(), content.getError());
        }

        OperationResult<T> validated = validator.apply(content.getValue());
        if (!validated.isSuccess()) {
            failures.incrementAndGet();
            return validated;
        }
        if (key != null) {
            cache.put(key, content.getValue(), ttlFor(callClass));
        }
        return validated;
    }

    private OperationResult<String> callModel(LlmRequest request) {
        BotProperties.InvocationProperties config = properties.getInvocation();
        long timeoutMs = config.getTimeout().toMillis();
        String lastError = null;

        for (int attempt = 0; attempt <= config.getMaxRetries(); attempt++) {
            if (attempt > 0) {
                retries.incrementAndGet();
                if (!backoff(config.getRetryBackoff())) {
                    return OperationResult.failure(ErrorKind.TRANSIENT_IO, "Interrupted during retry backoff");
                }
            }

            CompletableFuture<LlmResponse> future = llmPort.chat(request);
            try {
                LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                String content = response != null ? response.getContent() : null;
                if (content == null || content.isBlank()) {
                    return OperationResult.failure(ErrorKind.PARSE, "Empty model response");
                }
                return OperationResult.success(content);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = "Model call timed out after " + timeoutMs + "ms";
                log.warn("[LLM] {} (attempt {}/{})", lastError, attempt + 1, config.getMaxRetries() + 1);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (isRateLimitError(cause)) {
                    rateLimiter.recordThrottleSignal();
                    rateLimited.incrementAndGet();
                    return OperationResult.failure(ErrorKind.RATE_LIMITED,
                            "Provider rate limit: " + cause.getMessage());
                }
                lastError = "Model call failed: " + cause.getMessage();
                log.warn("[LLM] {} (attempt {}/{})", lastError, attempt + 1, config.getMaxRetries() + 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OperationResult.failure(ErrorKind.TRANSIENT_IO, "Interrupted while waiting for model");
            }
        }
        return OperationResult.failure(ErrorKind.TRANSIENT_IO, lastError);
    }

    public InvocationMetrics getMetrics() {
        return InvocationMetrics.builder()
                .calls(calls.get())
                .cacheHits(cacheHits.get())
                .cacheMisses(calls.get() - cacheHits.get())
                .rateLimited(rateLimited.get())
                .retries(retries.get())
                .failures(failures.get())
                .cacheSize(cache.size())
                .build();
    }

    Duration ttlFor(CallClass callClass) {
        BotProperties.CacheProperties config = properties.getCache();
        return switch (callClass) {
        case CREATIVE -> config.getCreativeTtl();
        case EPHEMERAL -> config.getEphemeralTtl();
        case UNCACHED -> Duration.ZERO;
        };
    }

    private String fingerprint(LlmRequest request) {
        return ResponseCache.fingerprint(
                request.getSchemaName(),
                request.getSystemPrompt(),
                request.getUserPrompt(),
                String.valueOf(request.getTemperature()));
    }

    private boolean backoff(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("rate limit"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
