package me.golemcore.cognition.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of a rate limit check operation.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the call was permitted</li>
 * <li>{@code remainingCalls} - calls left in the current minute window</li>
 * <li>{@code waitTime} - if denied, how long until the next permit</li>
 * <li>{@code reason} - explanation for denial</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private long remainingCalls;
    private Duration waitTime;
    private String reason;

    public static RateLimitResult allowed(long remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .remainingCalls(remaining)
                .waitTime(Duration.ZERO)
                .build();
    }

    public static RateLimitResult denied(long waitMs, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .waitTime(Duration.ofMillis(Math.max(0, waitMs)))
                .reason(reason)
                .build();
    }
}
