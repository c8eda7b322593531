package com.rankfusion.bandit.service;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

public class BetaSampler {

    private final RandomGenerator random;

    public BetaSampler() {
        this(new Well19937c());
    }

    public BetaSampler(long seed) {
        this(new Well19937c(seed));
    }

    public BetaSampler(RandomGenerator random) {
        this.random = random;
    }

    public double sample(double alpha, double beta) {
        double value = new BetaDistribution(
                random,
                alpha,
                beta,
                BetaDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY
        ).sample();
        return Math.max(0.0, Math.min(1.0, value));
    }
}
