package com.rankfusion.bandit.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rankfusion.bandit.model.Arm;

/**
 * Accumulated change to one arm, computed away from the model so batches can be merged
 * before a single apply-and-save.
 */
public class ArmDelta {

    private double alpha;
    private double beta;
    private double pulls;
    private double totalReward;

    public void bump(double reward) {
        double r = Math.max(0.0, Math.min(1.0, reward));
        alpha += r;
        beta += 1.0 - r;
        pulls += 1.0;
        totalReward += r;
    }

    public void merge(ArmDelta other) {
        alpha += other.alpha;
        beta += other.beta;
        pulls += other.pulls;
        totalReward += other.totalReward;
    }

    public void applyTo(Arm arm) {
        arm.setAlpha(arm.getAlpha() + alpha);
        arm.setBeta(arm.getBeta() + beta);
        arm.setPulls(arm.getPulls() + (int) Math.round(pulls));
        arm.setTotalReward(arm.getTotalReward() + totalReward);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    public double getPulls() {
        return pulls;
    }

    @JsonProperty("total_reward")
    public double getTotalReward() {
        return totalReward;
    }
}
