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

/**
 * Rate limiter for calls to the external language model.
 *
 * <p>
 * Denials are ordinary results: callers treat them as "no result" and degrade
 * instead of failing.
 *
 * @since 1.0
 * @see WindowedRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and consume one call permit.
     */
    RateLimitResult tryAcquire();

    /**
     * Report that the provider signalled throttling. Starts the cooldown.
     */
    void recordThrottleSignal();

    /**
     * Get the current window state.
     */
    RateLimitWindow getWindow();

    /**
     * Clear the window and any cooldown. Operator action after a provider
     * quota change.
     */
    void reset();
}
