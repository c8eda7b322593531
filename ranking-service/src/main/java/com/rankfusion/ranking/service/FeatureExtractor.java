package com.rankfusion.ranking.service;

import com.rankfusion.bandit.service.ThompsonModel;
import com.rankfusion.ranking.model.Candidate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public class FeatureExtractor {

    static final double NEUTRAL_PRIOR = 0.5;

    public double baseScore(Candidate candidate) {
        return normalizeBase(candidate.displayScore());
    }

    /**
     * Squashes unbounded relevance scores into [0, 1). Scores already in [0, 1] pass through.
     */
    public static double normalizeBase(double raw) {
        if (raw <= 0.0) {
            return 0.0;
        }
        if (raw <= 1.0) {
            return raw;
        }
        return raw / (1.0 + raw);
    }

    public double lexicalOverlap(String query, Candidate candidate) {
        Set<String> terms = queryTerms(query);
        if (terms.isEmpty()) {
            return 0.0;
        }
        String haystack = searchableText(candidate);
        int hits = 0;
        for (String term : terms) {
            if (haystack.contains(term)) {
                hits++;
            }
        }
        return Math.min(1.0, hits / (double) terms.size());
    }

    /**
     * Mean posterior reward over the candidate's method arm and category arms that exist in
     * {@code model}. Candidates with no known arm get a neutral 0.5.
     */
    public double banditPrior(Candidate candidate, ThompsonModel model) {
        if (model == null) {
            return NEUTRAL_PRIOR;
        }
        List<Double> priors = new ArrayList<>();
        for (String armName : ThompsonModel.armNamesFor(candidate.getTags(), candidate.getMethod())) {
            Optional<Double> mean = model.meanReward(armName);
            mean.ifPresent(priors::add);
        }
        if (priors.isEmpty()) {
            return NEUTRAL_PRIOR;
        }
        double sum = 0.0;
        for (double prior : priors) {
            sum += prior;
        }
        return sum / priors.size();
    }

    static Set<String> queryTerms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        if (query == null) {
            return terms;
        }
        for (String term : query.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    private static String searchableText(Candidate candidate) {
        List<String> parts = new ArrayList<>();
        parts.add(nullToEmpty(candidate.getCompany()));
        parts.add(nullToEmpty(candidate.getRole()));
        parts.add(nullToEmpty(candidate.getMethod()));
        parts.add(candidate.getTags() == null ? "" : String.join(" ", candidate.getTags()));
        parts.add(nullToEmpty(candidate.getContextBundleText()));
        parts.add(nullToEmpty(candidate.getNotes()));
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
