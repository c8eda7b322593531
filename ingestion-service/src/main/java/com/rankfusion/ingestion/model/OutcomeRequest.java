package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class OutcomeRequest {
    @JsonProperty("app_id")
    private String appId;
    private String outcome;
}
