package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BuildReport(
        int records,
        List<String> errors,
        @JsonProperty("bootstrapped_records") int bootstrappedRecords
) {
    public BuildReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
