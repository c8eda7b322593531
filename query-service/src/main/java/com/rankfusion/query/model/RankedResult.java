package com.rankfusion.query.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.rankfusion.ranking.model.Candidate;

import java.util.ArrayList;
import java.util.List;

/**
 * One fused result with its score breakdown.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RankedResult {
    private String appId;
    private String company;
    private String role;
    private String status;
    private String method;
    private List<String> tags = new ArrayList<>();
    private double finalScore;
    private double baseScore;
    private double lexicalOverlap;
    private double banditPrior;
    private double memoryShort;
    private double memoryLong;
    private Integer rankDense;
    private Integer rankLexical;

    public RankedResult() {
    }

    public static RankedResult from(Candidate candidate) {
        RankedResult result = new RankedResult();
        result.appId = candidate.getId();
        result.company = candidate.getCompany();
        result.role = candidate.getRole();
        result.status = candidate.getStatus();
        result.method = candidate.getMethod();
        if (candidate.getTags() != null) {
            result.tags = new ArrayList<>(candidate.getTags());
        }
        result.finalScore = candidate.getFinalScore();
        result.baseScore = candidate.getBaseScore();
        result.lexicalOverlap = candidate.getLexicalOverlap();
        result.banditPrior = candidate.getBanditPrior();
        result.memoryShort = candidate.getMemoryShort();
        result.memoryLong = candidate.getMemoryLong();
        result.rankDense = candidate.getRankDense();
        result.rankLexical = candidate.getRankLexical();
        return result;
    }

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    public String getCompany() {
        return company;
    }

    public void setCompany(String company) {
        this.company = company;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
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

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public double getFinalScore() {
        return finalScore;
    }

    public void setFinalScore(double finalScore) {
        this.finalScore = finalScore;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public void setBaseScore(double baseScore) {
        this.baseScore = baseScore;
    }

    public double getLexicalOverlap() {
        return lexicalOverlap;
    }

    public void setLexicalOverlap(double lexicalOverlap) {
        this.lexicalOverlap = lexicalOverlap;
    }

    public double getBanditPrior() {
        return banditPrior;
    }

    public void setBanditPrior(double banditPrior) {
        this.banditPrior = banditPrior;
    }

    public double getMemoryShort() {
        return memoryShort;
    }

    public void setMemoryShort(double memoryShort) {
        this.memoryShort = memoryShort;
    }

    public double getMemoryLong() {
        return memoryLong;
    }

    public void setMemoryLong(double memoryLong) {
        this.memoryLong = memoryLong;
    }

    public Integer getRankDense() {
        return rankDense;
    }

    public void setRankDense(Integer rankDense) {
        this.rankDense = rankDense;
    }

    public Integer getRankLexical() {
        return rankLexical;
    }

    public void setRankLexical(Integer rankLexical) {
        this.rankLexical = rankLexical;
    }
}
