package com.rankfusion.bandit.feedback;

import com.rankfusion.bandit.model.Outcome;

public record OutcomeEvent(String appId, Outcome outcome, String ts) {

    public String dedupeKey() {
        return appId + "|" + outcome.label() + "|" + (ts == null ? "" : ts);
    }
}
