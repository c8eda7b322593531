package com.rankfusion.query.contract;

import com.rankfusion.memory.service.Timestamps;
import com.rankfusion.ranking.model.Candidate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The {@code rag.retrieve.v1} contract: request normalization and validation, result item
 * canonicalization and the optional envelope.
 */
public final class RetrieveContract {

    public static final String CONTRACT = "rag.retrieve.v1";
    public static final String CONTRACT_VERSION = "2026-02-19";
    public static final String PROVIDER = "local_fusion_v1";

    public static final int DEFAULT_K = 5;
    public static final int MAX_QUERY_LENGTH = 512;
    public static final int MAX_K = 200;
    public static final int MAX_FILTER_LENGTH = 120;
    public static final int MAX_RESULTS = 200;
    public static final int MAX_CONTEXT_LENGTH = 320;

    private RetrieveContract() {
    }

    /**
     * Trims the query and filters, turns blank filters into null and applies the default k.
     * Out-of-range values are rejected, never clamped.
     *
     * @throws ContractException when the request does not satisfy the contract
     */
    public static RetrieveRequest normalize(RetrieveRequest raw) {
        if (raw == null) {
            throw new ContractException("retrieve request must be an object");
        }
        String query = normalizeQuery(raw.getQuery());
        int k = raw.getK() == null ? DEFAULT_K : raw.getK();
        if (k < 1 || k > MAX_K) {
            throw new ContractException("retrieve request k must be in [1, " + MAX_K + "]");
        }
        return new RetrieveRequest(query, k, filter("status", raw.getStatus()), filter("method", raw.getMethod()));
    }

    /**
     * Trims {@code raw} and checks it is 1..{@value #MAX_QUERY_LENGTH} characters. Shared by
     * {@code /retrieve} and {@code /search}.
     */
    public static String normalizeQuery(String raw) {
        String query = raw == null ? "" : raw.trim();
        if (query.isEmpty()) {
            throw new ContractException("query must be a non-empty string");
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new ContractException("query exceeds " + MAX_QUERY_LENGTH + " characters");
        }
        return query;
    }

    /**
     * Converts ranked candidates into contract items. The caller has already validated the
     * request, so an oversized list or a bad score here is a server fault.
     *
     * @throws IllegalStateException when the ranked output breaks the item constraints
     */
    public static List<RetrieveItem> toItems(List<Candidate> ranked) {
        if (ranked.size() > MAX_RESULTS) {
            throw new IllegalStateException("retrieve payload cannot exceed " + MAX_RESULTS + " results");
        }
        List<RetrieveItem> items = new ArrayList<>(ranked.size());
        for (Candidate candidate : ranked) {
            items.add(toItem(candidate));
        }
        return items;
    }

    static RetrieveItem toItem(Candidate candidate) {
        double score = candidate.getFinalScore();
        if (Double.isNaN(score) || Double.isInfinite(score) || score < 0) {
            throw new IllegalStateException("ranked score for " + candidate.getId() + " is not a non-negative number: " + score);
        }
        String context = Objects.toString(candidate.getContextBundleText(), "");
        if (context.length() > MAX_CONTEXT_LENGTH) {
            context = context.substring(0, MAX_CONTEXT_LENGTH);
        }
        return new RetrieveItem(
                Objects.toString(candidate.getId(), ""),
                Objects.toString(candidate.getCompany(), ""),
                Objects.toString(candidate.getRole(), ""),
                Objects.toString(candidate.getStatus(), ""),
                Objects.toString(candidate.getMethod(), ""),
                strings(candidate.getTags()),
                round4(score),
                context,
                strings(candidate.getEvidence())
        );
    }

    public static RetrieveEnvelope envelope(RetrieveRequest request, List<RetrieveItem> results, Instant now) {
        return new RetrieveEnvelope(CONTRACT, CONTRACT_VERSION, PROVIDER, Timestamps.format(now), request, results);
    }

    static double round4(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static String filter(String name, String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_FILTER_LENGTH) {
            throw new ContractException("retrieve request " + name + " exceeds " + MAX_FILTER_LENGTH + " characters");
        }
        return trimmed;
    }

    private static List<String> strings(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        for (String value : values) {
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }
}
