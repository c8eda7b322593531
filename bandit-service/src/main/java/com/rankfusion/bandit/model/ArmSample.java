package com.rankfusion.bandit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ArmSample(String arm, @JsonProperty("sampled_value") double sampledValue) {
}
