package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BatchReport(
        String source,
        int processed,
        int skipped,
        @JsonProperty("arms_touched") int armsTouched,
        @JsonProperty("new_seen") int newSeen
) {
}
