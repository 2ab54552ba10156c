package me.golemcore.cognition.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Heap reading before and after a reclaim request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReclaimResult {

    private double utilizationBefore;
    private double utilizationAfter;
    private long usedBytesBefore;
    private long usedBytesAfter;
    private Instant requestedAt;
}
