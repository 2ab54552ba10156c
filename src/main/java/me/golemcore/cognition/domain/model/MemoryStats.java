package me.golemcore.cognition.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record counts per memory category next to the configured ceilings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryStats {

    @Builder.Default
    private Map<String, Integer> counts = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> ceilings = new LinkedHashMap<>();

    private double heapUtilization;

    public int totalRecords() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
