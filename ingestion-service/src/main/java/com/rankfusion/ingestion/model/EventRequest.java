package com.rankfusion.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class EventRequest {
    @JsonProperty("app_id")
    private String appId;
    private String type;
    private String msg;
}
