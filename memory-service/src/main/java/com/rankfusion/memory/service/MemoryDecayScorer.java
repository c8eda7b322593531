package com.rankfusion.memory.service;

import com.rankfusion.memory.model.EpisodicEntry;
import com.rankfusion.memory.model.MemorySnapshot;
import com.rankfusion.memory.model.SemanticEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns memory logs into per-subject scores. Episodic entries decay exponentially with age;
 * semantic entries contribute their clamped priority. Both keep the maximum per subject.
 */
public class MemoryDecayScorer {

    public static final double DEFAULT_HALF_LIFE_DAYS = 14.0;
    static final double MIN_HALF_LIFE_DAYS = 0.1;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double halfLifeDays;

    public MemoryDecayScorer() {
        this(DEFAULT_HALF_LIFE_DAYS);
    }

    public MemoryDecayScorer(double halfLifeDays) {
        this.halfLifeDays = halfLifeDays;
    }

    public double halfLifeDays() {
        return halfLifeDays;
    }

    public static double decay(double ageDays, double halfLifeDays) {
        return Math.exp(-Math.log(2.0) * Math.max(0.0, ageDays) / Math.max(MIN_HALF_LIFE_DAYS, halfLifeDays));
    }

    public Map<String, Double> recencyScores(List<EpisodicEntry> entries, Instant now) {
        Map<String, Double> byApp = new HashMap<>();
        for (EpisodicEntry entry : entries) {
            if (entry.appId() == null || entry.appId().isEmpty()) {
                continue;
            }
            Optional<Instant> ts = Timestamps.parse(entry.ts());
            if (ts.isEmpty()) {
                continue;
            }
            Duration age = Duration.between(ts.get(), now);
            double ageDays = Math.max(0.0, (age.getSeconds() + age.getNano() / 1e9) / SECONDS_PER_DAY);
            double score = clamp(decay(ageDays, halfLifeDays) * entry.scoreHintOrDefault());
            byApp.merge(entry.appId(), score, Math::max);
        }
        return byApp;
    }

    public Map<String, Double> priorityScores(List<SemanticEntry> entries) {
        Map<String, Double> byApp = new HashMap<>();
        for (SemanticEntry entry : entries) {
            if (entry.appId() == null || entry.appId().isEmpty()) {
                continue;
            }
            byApp.merge(entry.appId(), clamp(entry.priorityOrDefault()), Math::max);
        }
        return byApp;
    }

    public MemorySnapshot snapshot(List<EpisodicEntry> episodic, List<SemanticEntry> semantic, Instant now) {
        return new MemorySnapshot(recencyScores(episodic, now), priorityScores(semantic));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
