package com.rankfusion.memory.model;

import java.util.Map;

/**
 * Per-subject short and long memory scores for one ranking pass. Subjects absent from either
 * map score 0.0.
 */
public record MemorySnapshot(Map<String, Double> shortTerm, Map<String, Double> longTerm) {

    public static final MemorySnapshot EMPTY = new MemorySnapshot(Map.of(), Map.of());

    public MemorySnapshot {
        shortTerm = shortTerm == null ? Map.of() : Map.copyOf(shortTerm);
        longTerm = longTerm == null ? Map.of() : Map.copyOf(longTerm);
    }

    public double shortScore(String appId) {
        return appId == null ? 0.0 : shortTerm.getOrDefault(appId, 0.0);
    }

    public double longScore(String appId) {
        return appId == null ? 0.0 : longTerm.getOrDefault(appId, 0.0);
    }
}
