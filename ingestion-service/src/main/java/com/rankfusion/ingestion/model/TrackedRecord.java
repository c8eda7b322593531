package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A normalized record as stored in {@code applications.jsonl}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TrackedRecord {
    private String appId;
    private String company;
    private String role;
    private String status;
    private String dateApplied;
    private String followUpDate;
    private String url;
    private String applicationMethod;
    private List<String> tags = new ArrayList<>();
    private String notes;
    private List<String> evidence = new ArrayList<>();
    private String contextBundleText;
    private String ragText;
    private String updatedAt;
}
