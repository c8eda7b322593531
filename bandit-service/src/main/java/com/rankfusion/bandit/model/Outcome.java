package com.rankfusion.bandit.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Observed result of a submitted record, ordered by engagement depth. Rewards stay in [0, 1] so
 * Beta updates remain bounded.
 */
public enum Outcome {
    BLOCKED("blocked", 0.0),
    NO_RESPONSE("no_response", 0.05),
    REJECTED("rejected", 0.2),
    RESPONSE("response", 0.5),
    INTERVIEW("interview", 0.8),
    OFFER("offer", 1.0);

    private final String label;
    private final double reward;

    Outcome(String label, double reward) {
        this.label = label;
        this.reward = reward;
    }

    public String label() {
        return label;
    }

    public double reward() {
        return reward;
    }

    public static Optional<Outcome> parse(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Outcome outcome : values()) {
            if (outcome.label.equals(normalized)) {
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }

    public static Outcome fromLabel(String label) {
        return parse(label).orElseThrow(() -> new IllegalArgumentException(
                "Unknown outcome '" + label + "'. Valid: " + validLabels()));
    }

    public static List<String> validLabels() {
        return Arrays.stream(values())
                .map(Outcome::label)
                .sorted()
                .collect(Collectors.toList());
    }
}
