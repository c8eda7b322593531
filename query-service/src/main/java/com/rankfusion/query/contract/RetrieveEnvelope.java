package com.rankfusion.query.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RetrieveEnvelope(
        String contract,
        @JsonProperty("contract_version") String contractVersion,
        String provider,
        @JsonProperty("generated_at") String generatedAt,
        RetrieveRequest request,
        List<RetrieveItem> results
) {
}
