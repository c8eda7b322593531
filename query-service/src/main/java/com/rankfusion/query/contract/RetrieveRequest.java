package com.rankfusion.query.contract;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of {@code POST /retrieve}. Also echoed, normalized, inside the envelope.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class RetrieveRequest {
    private String query;
    private Integer k;
    private String status;
    private String method;

    public RetrieveRequest() {
    }

    public RetrieveRequest(String query, Integer k, String status, String method) {
        this.query = query;
        this.k = k;
        this.status = status;
        this.method = method;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getK() {
        return k;
    }

    public void setK(Integer k) {
        this.k = k;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }
}
