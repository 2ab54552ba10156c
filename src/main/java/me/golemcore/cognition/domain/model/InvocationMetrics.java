package me.golemcore.cognition.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvocationMetrics {

    private long calls;
    private long cacheHits;
    private long cacheMisses;
    private long rateLimited;
    private long retries;
    private long failures;
    private int cacheSize;
}
