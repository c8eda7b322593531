package com.rankfusion.memory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the append-only short-term log. {@code scoreHint} may be absent in older
 * files; readers fall back to {@link #DEFAULT_SCORE_HINT}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EpisodicEntry(
        String kind,
        String ts,
        @JsonProperty("app_id") String appId,
        @JsonProperty("event_type") String eventType,
        String outcome,
        @JsonProperty("score_hint") Double scoreHint,
        String text
) {
    public static final String KIND = "episodic";
    public static final double DEFAULT_SCORE_HINT = 0.35;

    public double scoreHintOrDefault() {
        return scoreHint == null ? DEFAULT_SCORE_HINT : scoreHint;
    }
}
