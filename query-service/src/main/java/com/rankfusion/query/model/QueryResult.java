package com.rankfusion.query.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryResult {
    private String query;
    private int topK;
    private String retrievalPath;
    private String lexicalStatus;
    private int candidateCount;
    private List<RankedResult> rankedResults = new ArrayList<>();

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public String getRetrievalPath() {
        return retrievalPath;
    }

    public void setRetrievalPath(String retrievalPath) {
        this.retrievalPath = retrievalPath;
    }

    public String getLexicalStatus() {
        return lexicalStatus;
    }

    public void setLexicalStatus(String lexicalStatus) {
        this.lexicalStatus = lexicalStatus;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public void setCandidateCount(int candidateCount) {
        this.candidateCount = candidateCount;
    }

    public List<RankedResult> getRankedResults() {
        return rankedResults;
    }

    public void setRankedResults(List<RankedResult> rankedResults) {
        this.rankedResults = rankedResults;
    }
}
