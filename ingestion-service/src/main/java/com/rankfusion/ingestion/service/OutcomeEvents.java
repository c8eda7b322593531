package com.rankfusion.ingestion.service;

import com.rankfusion.bandit.feedback.OutcomeEvent;
import com.rankfusion.bandit.model.Outcome;
import com.rankfusion.ingestion.model.EventRecord;
import com.rankfusion.memory.model.EpisodicEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts outcome events from logged rows. An explicit outcome field wins; otherwise an
 * {@code outcome} event's message is scanned for an {@code outcome=<label>} token.
 */
final class OutcomeEvents {

    static final String OUTCOME_TYPE = "outcome";
    private static final String TOKEN_PREFIX = "outcome=";

    private OutcomeEvents() {
    }

    static List<OutcomeEvent> fromEpisodic(List<EpisodicEntry> entries) {
        List<OutcomeEvent> events = new ArrayList<>(entries.size());
        for (EpisodicEntry entry : entries) {
            Outcome outcome = resolve(entry.outcome(), entry.eventType(), entry.text()).orElse(null);
            events.add(new OutcomeEvent(entry.appId(), outcome, nullToEmpty(entry.ts())));
        }
        return events;
    }

    static List<OutcomeEvent> fromEvents(List<EventRecord> records) {
        List<OutcomeEvent> events = new ArrayList<>(records.size());
        for (EventRecord record : records) {
            Outcome outcome = resolve(null, record.getType(), record.getMsg()).orElse(null);
            events.add(new OutcomeEvent(record.getAppId(), outcome, nullToEmpty(record.getTs())));
        }
        return events;
    }

    static Optional<Outcome> resolve(String outcomeField, String type, String msg) {
        Optional<Outcome> explicit = Outcome.parse(outcomeField);
        if (explicit.isPresent()) {
            return explicit;
        }
        if (type == null || !OUTCOME_TYPE.equals(type.trim()) || msg == null) {
            return Optional.empty();
        }
        for (String token : msg.trim().split("\\s+")) {
            if (token.startsWith(TOKEN_PREFIX)) {
                Optional<Outcome> parsed = Outcome.parse(token.substring(TOKEN_PREFIX.length()));
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        return Optional.empty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
