package com.rankfusion.ranking.model;

/**
 * Linear weights of the final score. The defaults sum to 1.0.
 */
public record FusionWeights(double base, double lexical, double bandit, double memoryShort, double memoryLong) {

    public static final FusionWeights DEFAULTS = new FusionWeights(0.48, 0.22, 0.20, 0.06, 0.04);

    public FusionWeights {
        if (base < 0 || lexical < 0 || bandit < 0 || memoryShort < 0 || memoryLong < 0) {
            throw new IllegalArgumentException("fusion weights must be non-negative");
        }
    }

    public double sum() {
        return base + lexical + bandit + memoryShort + memoryLong;
    }

    public double combine(double baseScore, double lexicalScore, double banditScore, double shortScore, double longScore) {
        return base * baseScore
                + lexical * lexicalScore
                + bandit * banditScore
                + memoryShort * shortScore
                + memoryLong * longScore;
    }
}
