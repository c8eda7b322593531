package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FeedbackReceipt(
        @JsonProperty("app_id") String appId,
        String company,
        String role,
        String outcome,
        @JsonProperty("arms_touched") List<String> armsTouched
) {
}
