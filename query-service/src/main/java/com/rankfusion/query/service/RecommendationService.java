package com.rankfusion.query.service;

import com.rankfusion.bandit.model.ArmSample;
import com.rankfusion.bandit.model.ArmStats;
import com.rankfusion.bandit.store.ArmRepository;
import com.rankfusion.query.contract.ContractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only views over the persisted arm set.
 */
@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private static final int MAX_RECOMMENDATIONS = 200;

    private final ArmRepository armRepository;

    public RecommendationService(ArmRepository armRepository) {
        this.armRepository = armRepository;
    }

    public List<ArmSample> recommend(int k) {
        if (k < 1 || k > MAX_RECOMMENDATIONS) {
            throw new ContractException("k must be in [1, " + MAX_RECOMMENDATIONS + "]");
        }
        List<ArmSample> samples = armRepository.load().model().recommend(k);
        log.debug("event=bandit_recommend k={} returned={}", k, samples.size());
        return samples;
    }

    public List<ArmStats> stats() {
        return armRepository.load().model().stats();
    }
}
