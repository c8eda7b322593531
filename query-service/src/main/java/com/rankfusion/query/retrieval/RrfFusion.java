package com.rankfusion.query.retrieval;

import com.rankfusion.ranking.model.Candidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion of a dense and a lexical result list.
 */
public final class RrfFusion {

    public static final int DEFAULT_RRF_K = 60;

    private RrfFusion() {
    }

    /**
     * Each list contributes {@code 1 / (rrfK + rank)} per candidate, ranks 1-indexed.
     * Candidates seen in both lists get both contributions and the lexical copy's fields
     * overwrite the dense copy's. Hits without an id are dropped but still occupy their rank.
     * Inputs are not modified. Ties keep first-seen order.
     */
    public static List<Candidate> fuse(List<Candidate> dense, List<Candidate> lexical, int rrfK) {
        Map<String, Candidate> merged = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();

        int rank = 0;
        for (Candidate hit : dense) {
            rank++;
            if (isBlank(hit.getId())) {
                continue;
            }
            Candidate target = absorb(merged, hit);
            target.setRankDense(rank);
            scores.merge(hit.getId(), 1.0 / (rrfK + rank), Double::sum);
        }
        rank = 0;
        for (Candidate hit : lexical) {
            rank++;
            if (isBlank(hit.getId())) {
                continue;
            }
            Candidate target = absorb(merged, hit);
            target.setRankLexical(rank);
            scores.merge(hit.getId(), 1.0 / (rrfK + rank), Double::sum);
        }

        List<Candidate> fused = new ArrayList<>(merged.size());
        for (Map.Entry<String, Candidate> entry : merged.entrySet()) {
            Candidate candidate = entry.getValue();
            candidate.setHybridScore(scores.get(entry.getKey()));
            fused.add(candidate);
        }
        fused.sort(Comparator.comparingDouble(Candidate::getHybridScore).reversed());
        return fused;
    }

    private static boolean isBlank(String id) {
        return id == null || id.isBlank();
    }

    private static Candidate absorb(Map<String, Candidate> merged, Candidate hit) {
        Candidate existing = merged.get(hit.getId());
        if (existing == null) {
            Candidate copy = hit.copy();
            merged.put(hit.getId(), copy);
            return copy;
        }
        existing.mergeFrom(hit);
        return existing;
    }
}
