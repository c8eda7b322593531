package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class ThumbRequest {
    @JsonProperty("app_id")
    private String appId;
    private String vote;
}
