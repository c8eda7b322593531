package com.rankfusion.query.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RetrieveItem(
        @JsonProperty("app_id") String appId,
        String company,
        String role,
        String status,
        String method,
        List<String> tags,
        double score,
        String context,
        List<String> evidence
) {

    public RetrieveItem {
        tags = List.copyOf(tags);
        evidence = List.copyOf(evidence);
    }
}
