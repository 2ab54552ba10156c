package me.golemcore.cognition.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Snapshot of the model call limiter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitWindow {

    private Instant windowStart;
    private int callCount;
    private int maxCallsPerMinute;
    private Instant cooldownUntil;
    private Instant lastCallAt;
}
