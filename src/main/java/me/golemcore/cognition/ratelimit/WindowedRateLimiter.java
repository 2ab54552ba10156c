package me.golemcore.cognition.ratelimit;

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

import me.golemcore.cognition.domain.model.RateLimitResult;
import me.golemcore.cognition.domain.model.RateLimitWindow;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window limiter with minimum spacing and a throttle cooldown.
 *
 * <p>
 * A permit is granted only when all of the following hold:
 * <ul>
 * <li>no cooldown is active ({@code bot.rate-limit.cooldown}, started by
 * {@link #recordThrottleSignal()})</li>
 * <li>at least {@code bot.rate-limit.min-interval} passed since the last
 * granted call</li>
 * <li>fewer than {@code bot.rate-limit.max-calls-per-minute} calls were granted
 * in the current one-minute window</li>
 * </ul>
 * The window starts at the first call after the previous one expired. Calls are
 * counted when the permit is granted, whether or not the model call succeeds.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class WindowedRateLimiter implements RateLimiter {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Clock clock;
    private final Duration minInterval;
    private final int maxCallsPerMinute;
    private final Duration cooldown;

    private Instant windowStart;
    private int callCount;
    private Instant cooldownUntil;
    private Instant lastCallAt;

    public WindowedRateLimiter(BotProperties properties, Clock clock) {
        BotProperties.RateLimitProperties config = properties.getRateLimit();
        this.clock = clock;
        this.minInterval = config.getMinInterval();
        this.maxCallsPerMinute = config.getMaxCallsPerMinute();
        this.cooldown = config.getCooldown();
    }

    @Override
    public synchronized RateLimitResult tryAcquire() {
        Instant now = clock.instant();

        if (cooldownUntil != null && now.isBefore(cooldownUntil)) {
            return RateLimitResult.denied(Duration.between(now, cooldownUntil).toMillis(),
                    "Cooling down after provider rate limit");
        }

        if (lastCallAt != null) {
            Duration sinceLast = Duration.between(lastCallAt, now);
            if (sinceLast.compareTo(minInterval) < 0) {
                return RateLimitResult.denied(minInterval.minus(sinceLast).toMillis(),
                        "Minimum spacing between calls not reached");
            }
        }

        if (windowStart == null || !now.isBefore(windowStart.plus(WINDOW))) {
            windowStart = now;
            callCount = 0;
        }

        if (callCount >= maxCallsPerMinute) {
            long waitMs = Duration.between(now, windowStart.plus(WINDOW)).toMillis();
            log.debug("[RateLimiter] Per-minute cap of {} reached, {}ms until window rollover",
                    maxCallsPerMinute, waitMs);
            return RateLimitResult.denied(waitMs, "Per-minute call cap reached");
        }

        callCount++;
        lastCallAt = now;
        return RateLimitResult.allowed(maxCallsPerMinute - callCount);
    }

    @Override
    public synchronized void recordThrottleSignal() {
        cooldownUntil = clock.instant().plus(cooldown);
        log.warn("[RateLimiter] Provider throttling detected, cooling down until {}", cooldownUntil);
    }

    @Override
    public synchronized RateLimitWindow getWindow() {
        return RateLimitWindow.builder()
                .windowStart(windowStart)
                .callCount(callCount)
                .maxCallsPerMinute(maxCallsPerMinute)
                .cooldownUntil(cooldownUntil)
                .lastCallAt(lastCallAt)
                .build();
    }

    @Override
    public synchronized void reset() {
        log.info("[RateLimiter] Reset ({} calls in window, cooldown until {})", callCount, cooldownUntil);
        windowStart = null;
        callCount = 0;
        cooldownUntil = null;
        lastCallAt = null;
    }
}
