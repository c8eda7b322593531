package com.rankfusion.memory.service;

import com.rankfusion.memory.model.EpisodicEntry;
import com.rankfusion.memory.model.SemanticEntry;
import com.rankfusion.memory.model.SubjectSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds memory log entries. Episodic entries carry a score hint derived from the outcome
 * label; semantic entries carry a priority derived from the record status.
 */
public final class MemoryEntryFactory {

    static final int SUMMARY_NOTES_LIMIT = 240;

    private static final Map<String, Double> OUTCOME_SCORE_HINTS = Map.of(
            "blocked", 0.2,
            "no_response", 0.3,
            "rejected", 0.4,
            "response", 0.7,
            "interview", 0.9,
            "offer", 1.0
    );

    private static final Map<String, Double> STATUS_PRIORITIES = Map.of(
            "Offer", 1.0,
            "Applied", 0.8,
            "Rejected", 0.5,
            "Blocked", 0.3,
            "Draft", 0.2,
            "Closed", 0.1
    );

    private MemoryEntryFactory() {
    }

    public static double scoreHintFor(String outcome) {
        String key = outcome == null ? "" : outcome.trim();
        return OUTCOME_SCORE_HINTS.getOrDefault(key, EpisodicEntry.DEFAULT_SCORE_HINT);
    }

    public static double priorityFor(String status) {
        return STATUS_PRIORITIES.getOrDefault(status == null ? "" : status, SemanticEntry.DEFAULT_PRIORITY);
    }

    public static EpisodicEntry episodic(String appId, String eventType, String text, String ts, String outcome) {
        return new EpisodicEntry(EpisodicEntry.KIND, ts, appId, eventType, outcome, scoreHintFor(outcome), text);
    }

    public static SemanticEntry semantic(SubjectSnapshot subject, String ts) {
        String status = subject.status() == null ? "" : subject.status();
        return new SemanticEntry(
                SemanticEntry.KIND,
                ts,
                subject.appId(),
                subject.company(),
                subject.role(),
                status,
                subject.applicationMethod(),
                subject.tags(),
                priorityFor(status),
                summary(subject)
        );
    }

    static String summary(SubjectSnapshot subject) {
        String notes = nullToEmpty(subject.notes());
        if (notes.length() > SUMMARY_NOTES_LIMIT) {
            notes = notes.substring(0, SUMMARY_NOTES_LIMIT);
        }
        List<String> parts = new ArrayList<>();
        parts.add(nullToEmpty(subject.company()));
        parts.add(nullToEmpty(subject.role()));
        parts.add(String.join(" ", subject.tags()));
        parts.add(nullToEmpty(subject.applicationMethod()));
        parts.add(notes);
        return String.join(" ", parts).trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
