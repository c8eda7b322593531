package com.rankfusion.bandit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Beta-Bernoulli posterior for one targeting dimension value, e.g. {@code cat:ai} or
 * {@code method:ashby}. Starts from the uniform prior Beta(1, 1).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Arm {

    private String name;
    private double alpha = 1.0;
    private double beta = 1.0;
    private int pulls;
    private double totalReward;

    public Arm() {
    }

    public Arm(String name) {
        this.name = name;
    }

    public Arm(String name, double alpha, double beta, int pulls, double totalReward) {
        this.name = name;
        this.alpha = alpha;
        this.beta = beta;
        this.pulls = pulls;
        this.totalReward = totalReward;
    }

    public void update(double reward) {
        double r = Math.max(0.0, Math.min(1.0, reward));
        alpha += r;
        beta += 1.0 - r;
        pulls += 1;
        totalReward += r;
    }

    @JsonIgnore
    public double getMeanReward() {
        return alpha / (alpha + beta);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public double getBeta() {
        return beta;
    }

    public void setBeta(double beta) {
        this.beta = beta;
    }

    public int getPulls() {
        return pulls;
    }

    public void setPulls(int pulls) {
        this.pulls = pulls;
    }

    @JsonProperty("total_reward")
    public double getTotalReward() {
        return totalReward;
    }

    @JsonProperty("total_reward")
    public void setTotalReward(double totalReward) {
        this.totalReward = totalReward;
    }
}
