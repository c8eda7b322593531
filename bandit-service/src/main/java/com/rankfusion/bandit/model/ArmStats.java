package com.rankfusion.bandit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ArmStats(
        String arm,
        int pulls,
        @JsonProperty("mean_reward") double meanReward,
        double alpha,
        double beta,
        @JsonProperty("total_reward") double totalReward
) {
    public static ArmStats of(Arm arm) {
        return new ArmStats(
                arm.getName(),
                arm.getPulls(),
                arm.getMeanReward(),
                arm.getAlpha(),
                arm.getBeta(),
                arm.getTotalReward()
        );
    }
}
