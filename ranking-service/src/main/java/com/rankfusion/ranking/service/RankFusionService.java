package com.rankfusion.ranking.service;

import com.rankfusion.bandit.service.ThompsonModel;
import com.rankfusion.memory.model.MemorySnapshot;
import com.rankfusion.ranking.model.Candidate;
import com.rankfusion.ranking.model.FusionWeights;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Final ranking: retrieval relevance, query-term overlap, bandit prior and the two memory
 * scores combined linearly. Input candidates are not modified.
 */
@Service
public class RankFusionService {

    private final FeatureExtractor extractor = new FeatureExtractor();
    private final FusionWeights weights;

    public RankFusionService() {
        this(FusionWeights.DEFAULTS);
    }

    public RankFusionService(FusionWeights weights) {
        this.weights = weights;
    }

    @Autowired
    public RankFusionService(
            @Value("${rankfusion.fusion.weight.base:0.48}") double base,
            @Value("${rankfusion.fusion.weight.lexical:0.22}") double lexical,
            @Value("${rankfusion.fusion.weight.bandit:0.20}") double bandit,
            @Value("${rankfusion.fusion.weight.memory-short:0.06}") double memoryShort,
            @Value("${rankfusion.fusion.weight.memory-long:0.04}") double memoryLong
    ) {
        this(new FusionWeights(base, lexical, bandit, memoryShort, memoryLong));
    }

    public FusionWeights weights() {
        return weights;
    }

    public List<Candidate> fuse(List<Candidate> candidates, String query, ThompsonModel model, MemorySnapshot memory) {
        List<Candidate> ranked = new ArrayList<>();
        if (candidates == null) {
            return ranked;
        }
        MemorySnapshot snapshot = memory == null ? MemorySnapshot.EMPTY : memory;

        for (Candidate source : candidates) {
            if (source == null) {
                continue;
            }
            Candidate candidate = source.copy();
            double base = extractor.baseScore(candidate);
            double lexical = extractor.lexicalOverlap(query, candidate);
            double prior = extractor.banditPrior(candidate, model);
            double memoryShort = snapshot.shortScore(candidate.getId());
            double memoryLong = snapshot.longScore(candidate.getId());

            candidate.setBaseScore(base);
            candidate.setLexicalOverlap(lexical);
            candidate.setBanditPrior(prior);
            candidate.setMemoryShort(memoryShort);
            candidate.setMemoryLong(memoryLong);
            candidate.setFinalScore(weights.combine(base, lexical, prior, memoryShort, memoryLong));
            ranked.add(candidate);
        }

        // List.sort is stable, so equal scores keep retrieval order.
        ranked.sort(Comparator.comparingDouble(Candidate::getFinalScore).reversed());
        return ranked;
    }
}
