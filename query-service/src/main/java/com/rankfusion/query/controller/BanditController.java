package com.rankfusion.query.controller;

import com.rankfusion.bandit.model.ArmSample;
import com.rankfusion.bandit.model.ArmStats;
import com.rankfusion.query.service.RecommendationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/bandit")
public class BanditController {

    private final RecommendationService recommendationService;

    public BanditController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/recommend")
    public List<ArmSample> recommend(@RequestParam(value = "k", defaultValue = "8") int k) {
        return recommendationService.recommend(k);
    }

    @GetMapping("/stats")
    public List<ArmStats> stats() {
        return recommendationService.stats();
    }
}
