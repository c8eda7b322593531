package com.rankfusion.query.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class QueryRequest {
    private String query;
    @JsonProperty("top_k")
    private Integer topK;

    public QueryRequest() {
    }

    public QueryRequest(String query, Integer topK) {
        this.query = query;
        this.topK = topK;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getTopK() {
        return topK;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }
}
