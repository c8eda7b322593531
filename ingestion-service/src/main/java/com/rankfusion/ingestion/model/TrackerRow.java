package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * One row of the application tracker as submitted for a build. Property names follow the
 * tracker's column headers.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackerRow {
    @JsonProperty("Company")
    private String company;
    @JsonProperty("Role")
    private String role;
    @JsonProperty("Status")
    private String status;
    @JsonProperty("Career Page URL")
    private String url;
    @JsonProperty("Tags")
    private String tags;
    @JsonProperty("Notes")
    private String notes;
    @JsonProperty("Location")
    private String location;
    @JsonProperty("Salary Range")
    private String salaryRange;
    @JsonProperty("What Worked")
    private String whatWorked;
    @JsonProperty("Date Applied")
    private String dateApplied;
    @JsonProperty("Follow Up Date")
    private String followUpDate;
    @JsonProperty("Cover Letter Used")
    private String coverLetterUsed;
    @JsonProperty("Evidence")
    private String evidence;
}
