package com.rankfusion.bandit.model;

import java.util.List;

/**
 * Status snapshot of a tracked record, replayed to seed arms before live feedback exists.
 */
public record HistoricalRecord(String status, List<String> tags, String method) {

    public HistoricalRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
