package com.rankfusion.bandit.feedback;

import com.rankfusion.bandit.model.Outcome;

import java.util.Locale;
import java.util.Map;

public final class ThumbVote {

    private static final Map<String, Outcome> VOTES = Map.of(
            "up", Outcome.RESPONSE,
            "thumbs_up", Outcome.RESPONSE,
            "+1", Outcome.RESPONSE,
            "👍", Outcome.RESPONSE,
            "down", Outcome.NO_RESPONSE,
            "thumbs_down", Outcome.NO_RESPONSE,
            "-1", Outcome.NO_RESPONSE,
            "👎", Outcome.NO_RESPONSE
    );

    private ThumbVote() {
    }

    public static Outcome toOutcome(String vote) {
        String key = vote == null ? "" : vote.trim().toLowerCase(Locale.ROOT);
        Outcome outcome = VOTES.get(key);
        if (outcome == null) {
            throw new IllegalArgumentException(
                    "Unknown thumb vote '" + vote + "'. Use one of: up, down, thumbs_up, thumbs_down, +1, -1.");
        }
        return outcome;
    }
}
