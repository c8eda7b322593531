package com.rankfusion.ranking.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * A retrieved record plus the scores attached to it while it moves through retrieval and
 * fusion. Payload fields use the on-disk record names; score fields are transient and never
 * written back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Candidate {

    @JsonProperty("app_id")
    private String id;
    private String company;
    private String role;
    private String status;
    @JsonProperty("application_method")
    private String method;
    private List<String> tags = new ArrayList<>();
    private String notes;
    @JsonProperty("context_bundle_text")
    private String contextBundleText;
    private String text;
    private String url;
    @JsonProperty("date_applied")
    private String dateApplied;
    private List<String> evidence = new ArrayList<>();

    private Integer rankDense;
    private Integer rankLexical;
    private Double hybridScore;
    private Double score;
    private Double distance;
    private double baseScore;
    private double lexicalOverlap;
    private double banditPrior;
    private double memoryShort;
    private double memoryLong;
    private double finalScore;

    public Candidate() {
    }

    public Candidate(String id) {
        this.id = id;
    }

    /**
     * Overwrites this candidate's payload and score fields with every non-null field of
     * {@code other}. Ranks are kept when {@code other} does not carry them.
     */
    public void mergeFrom(Candidate other) {
        if (other.id != null) {
            id = other.id;
        }
        if (other.company != null) {
            company = other.company;
        }
        if (other.role != null) {
            role = other.role;
        }
        if (other.status != null) {
            status = other.status;
        }
        if (other.method != null) {
            method = other.method;
        }
        if (other.tags != null && !other.tags.isEmpty()) {
            tags = new ArrayList<>(other.tags);
        }
        if (other.notes != null) {
            notes = other.notes;
        }
        if (other.contextBundleText != null) {
            contextBundleText = other.contextBundleText;
        }
        if (other.text != null) {
            text = other.text;
        }
        if (other.url != null) {
            url = other.url;
        }
        if (other.dateApplied != null) {
            dateApplied = other.dateApplied;
        }
        if (other.evidence != null && !other.evidence.isEmpty()) {
            evidence = new ArrayList<>(other.evidence);
        }
        if (other.rankDense != null) {
            rankDense = other.rankDense;
        }
        if (other.rankLexical != null) {
            rankLexical = other.rankLexical;
        }
        if (other.hybridScore != null) {
            hybridScore = other.hybridScore;
        }
        if (other.score != null) {
            score = other.score;
        }
        if (other.distance != null) {
            distance = other.distance;
        }
    }

    public Candidate copy() {
        Candidate c = new Candidate(id);
        c.mergeFrom(this);
        c.baseScore = baseScore;
        c.lexicalOverlap = lexicalOverlap;
        c.banditPrior = banditPrior;
        c.memoryShort = memoryShort;
        c.memoryLong = memoryLong;
        c.finalScore = finalScore;
        return c;
    }

    /**
     * Retrieval-side relevance: the fused hybrid score when present, else the native score,
     * else a similarity derived from the vector distance, else zero.
     */
    public double displayScore() {
        if (hybridScore != null) {
            return hybridScore;
        }
        if (score != null) {
            return score;
        }
        if (distance != null) {
            return 1.0 / (1.0 + Math.max(0.0, distance));
        }
        return 0.0;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getContextBundleText() {
        return contextBundleText;
    }

    public void setContextBundleText(String contextBundleText) {
        this.contextBundleText = contextBundleText;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getDateApplied() {
        return dateApplied;
    }

    public void setDateApplied(String dateApplied) {
        this.dateApplied = dateApplied;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    public void setEvidence(List<String> evidence) {
        this.evidence = evidence == null ? new ArrayList<>() : new ArrayList<>(evidence);
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

    public Double getHybridScore() {
        return hybridScore;
    }

    public void setHybridScore(Double hybridScore) {
        this.hybridScore = hybridScore;
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }

    public Double getDistance() {
        return distance;
    }

    public void setDistance(Double distance) {
        this.distance = distance;
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

    public double getFinalScore() {
        return finalScore;
    }

    public void setFinalScore(double finalScore) {
        this.finalScore = finalScore;
    }
}
