package com.rankfusion.query.index;

import com.rankfusion.ingestion.model.TrackedRecord;
import com.rankfusion.ranking.model.Candidate;
import com.rankfusion.vector.model.FieldBoostedDocument;
import com.rankfusion.vector.service.HashingEmbedder;
import com.rankfusion.vector.service.VectorMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Brute-force index over built records: exact cosine scan for dense search and a term-count
 * scorer for full-text search. No native hybrid mode.
 */
public class InMemoryRecordIndex implements SearchIndex {

    private final List<Entry> entries;

    public InMemoryRecordIndex(List<TrackedRecord> records, HashingEmbedder embedder) {
        this.entries = new ArrayList<>(records.size());
        for (TrackedRecord record : records) {
            entries.add(new Entry(record, embedder.embed(recordText(record))));
        }
    }

    public int size() {
        return entries.size();
    }

    @Override
    public List<Candidate> vectorSearch(float[] vector, int limit) {
        List<Candidate> hits = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            Candidate candidate = toCandidate(entry.record());
            candidate.setDistance(VectorMath.cosineDistance(vector, entry.vector()));
            hits.add(candidate);
        }
        hits.sort(Comparator.comparingDouble(Candidate::getDistance));
        return truncate(hits, limit);
    }

    @Override
    public Optional<List<Candidate>> lexicalSearch(String text, List<String> fields, int limit) {
        Set<String> terms = terms(text);
        List<Candidate> hits = new ArrayList<>();
        if (terms.isEmpty()) {
            return Optional.of(hits);
        }
        for (Entry entry : entries) {
            String haystack = fieldText(entry.record(), fields);
            double score = 0.0;
            for (String term : terms) {
                score += occurrences(haystack, term);
            }
            if (score > 0.0) {
                Candidate candidate = toCandidate(entry.record());
                candidate.setScore(score);
                hits.add(candidate);
            }
        }
        hits.sort(Comparator.comparingDouble(Candidate::getScore).reversed());
        return Optional.of(truncate(hits, limit));
    }

    static String recordText(TrackedRecord record) {
        return FieldBoostedDocument.builder()
                .identity(record.getCompany())
                .label(record.getRole())
                .tags(record.getTags())
                .channel(record.getApplicationMethod())
                .status(record.getStatus())
                .freeText(record.getNotes())
                .context(record.getContextBundleText())
                .freeText(record.getRagText())
                .build()
                .text();
    }

    public static Candidate toCandidate(TrackedRecord record) {
        Candidate candidate = new Candidate(record.getAppId());
        candidate.setCompany(record.getCompany());
        candidate.setRole(record.getRole());
        candidate.setStatus(record.getStatus());
        candidate.setMethod(record.getApplicationMethod());
        candidate.setTags(record.getTags());
        candidate.setNotes(record.getNotes());
        candidate.setContextBundleText(record.getContextBundleText());
        candidate.setText(record.getRagText());
        candidate.setUrl(record.getUrl());
        candidate.setDateApplied(record.getDateApplied());
        candidate.setEvidence(record.getEvidence());
        return candidate;
    }

    private static String fieldText(TrackedRecord record, List<String> fields) {
        List<String> parts = new ArrayList<>();
        for (String field : fields) {
            String value = fieldValue(record, field);
            if (value != null) {
                parts.add(value);
            }
        }
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    // Unknown columns contribute nothing.
    private static String fieldValue(TrackedRecord record, String field) {
        switch (field) {
            case "text":
                return record.getRagText();
            case "context_bundle_text":
                return record.getContextBundleText();
            case "company":
                return record.getCompany();
            case "role":
                return record.getRole();
            case "notes":
                return record.getNotes();
            case "tags":
                return record.getTags() == null ? null : String.join(" ", record.getTags());
            default:
                return null;
        }
    }

    private static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                terms.add(token);
            }
        }
        return terms;
    }

    private static int occurrences(String haystack, String term) {
        int count = 0;
        int from = haystack.indexOf(term);
        while (from >= 0) {
            count++;
            from = haystack.indexOf(term, from + term.length());
        }
        return count;
    }

    private static List<Candidate> truncate(List<Candidate> hits, int limit) {
        return hits.size() <= limit ? hits : new ArrayList<>(hits.subList(0, Math.max(0, limit)));
    }

    private record Entry(TrackedRecord record, float[] vector) {
    }
}
