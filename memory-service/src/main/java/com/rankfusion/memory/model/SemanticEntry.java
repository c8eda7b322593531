package com.rankfusion.memory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SemanticEntry(
        String kind,
        String ts,
        @JsonProperty("app_id") String appId,
        String company,
        String role,
        String status,
        @JsonProperty("application_method") String applicationMethod,
        List<String> tags,
        Double priority,
        String summary
) {
    public static final String KIND = "semantic";
    public static final double DEFAULT_PRIORITY = 0.4;

    public SemanticEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public double priorityOrDefault() {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }
}
