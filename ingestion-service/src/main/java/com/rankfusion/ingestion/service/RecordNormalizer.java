package com.rankfusion.ingestion.service;

import com.rankfusion.bandit.model.HistoricalRecord;
import com.rankfusion.ingestion.model.TrackedRecord;
import com.rankfusion.ingestion.model.TrackerRow;
import com.rankfusion.memory.model.SubjectSnapshot;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw tracker rows into {@link TrackedRecord}s: stable ids, canonical statuses, parsed
 * tags, the application channel inferred from the posting URL, and the two text views used
 * for retrieval.
 */
public final class RecordNormalizer {

    public static final String DEFAULT_METHOD = "direct";
    static final int SIGNALS_LIMIT = 160;

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private static final Map<String, String> STATUSES = Map.of(
            "applied", "Applied",
            "draft", "Draft",
            "in progress", "Draft",
            "closed", "Closed",
            "blocked", "Blocked",
            "rejected", "Rejected",
            "offer", "Offer"
    );

    // Most specific first; first match wins.
    private static final Map<String, Pattern> METHOD_PATTERNS = new LinkedHashMap<>();

    static {
        METHOD_PATTERNS.put("mercor", Pattern.compile("work\\.mercor\\.com"));
        METHOD_PATTERNS.put("ashby", Pattern.compile("ashbyhq\\.com"));
        METHOD_PATTERNS.put("greenhouse", Pattern.compile("greenhouse\\.io"));
        METHOD_PATTERNS.put("lever", Pattern.compile("jobs\\.lever\\.co"));
        METHOD_PATTERNS.put("wellfound", Pattern.compile("wellfound\\.com|angel\\.co"));
        METHOD_PATTERNS.put("workday", Pattern.compile("myworkdayjobs\\.com|workday\\.com"));
        METHOD_PATTERNS.put("linkedin", Pattern.compile("linkedin\\.com/jobs"));
    }

    private RecordNormalizer() {
    }

    public static String slug(String value) {
        String lowered = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        String slug = trimDashes(NON_ALNUM.matcher(lowered).replaceAll("-"));
        return slug.isEmpty() ? "unknown" : slug;
    }

    public static String stableId(String company, String role, String url) {
        String prefix = slug(company) + "__" + slug(role);
        String base = prefix + "__" + (url == null ? "" : url.trim());
        return prefix + "__" + DigestUtils.sha256Hex(base).substring(0, 10);
    }

    public static String normalizeStatus(String status) {
        String raw = status == null ? "" : status.trim();
        String mapped = STATUSES.get(raw.toLowerCase(Locale.ROOT));
        if (mapped != null) {
            return mapped;
        }
        return raw.isEmpty() ? "Draft" : raw;
    }

    public static List<String> parseTags(String tags) {
        List<String> out = new ArrayList<>();
        if (tags == null || tags.isEmpty()) {
            return out;
        }
        for (String part : tags.split(";")) {
            String tag = part.trim();
            if (!tag.isEmpty()) {
                out.add(tag);
            }
        }
        return out;
    }

    public static String inferMethod(String url) {
        String lowered = url == null ? "" : url.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> entry : METHOD_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(lowered).find()) {
                return entry.getKey();
            }
        }
        return DEFAULT_METHOD;
    }

    /**
     * @throws IllegalArgumentException when the row names neither a company nor a role
     */
    public static TrackedRecord toRecord(TrackerRow row, String updatedAt) {
        String company = trim(row.getCompany());
        String role = trim(row.getRole());
        if (company.isEmpty() && role.isEmpty()) {
            throw new IllegalArgumentException("row has neither company nor role");
        }
        String url = trim(row.getUrl());

        TrackedRecord record = new TrackedRecord();
        record.setAppId(stableId(company, role, url));
        record.setCompany(company);
        record.setRole(role);
        record.setStatus(normalizeStatus(row.getStatus()));
        record.setDateApplied(trim(row.getDateApplied()));
        record.setFollowUpDate(trim(row.getFollowUpDate()));
        record.setUrl(url);
        record.setApplicationMethod(inferMethod(url));
        record.setTags(parseTags(row.getTags()));
        record.setNotes(row.getNotes() == null ? "" : row.getNotes());
        record.setEvidence(parseTags(row.getEvidence()));
        record.setContextBundleText(contextBundle(record, row));
        record.setRagText(ragText(record, row));
        record.setUpdatedAt(updatedAt);
        return record;
    }

    static String contextBundle(TrackedRecord record, TrackerRow row) {
        String signals = row.getWhatWorked() == null ? "" : row.getWhatWorked();
        if (signals.length() > SIGNALS_LIMIT) {
            signals = signals.substring(0, SIGNALS_LIMIT);
        }
        List<String> parts = List.of(
                "company=" + record.getCompany(),
                "role=" + record.getRole(),
                "status=" + record.getStatus(),
                "method=" + record.getApplicationMethod(),
                "tags=" + String.join(" ", record.getTags()),
                "location=" + nullToEmpty(row.getLocation()),
                "salary=" + nullToEmpty(row.getSalaryRange()),
                "signals=" + signals
        );
        return String.join(" | ", parts).trim();
    }

    static String ragText(TrackedRecord record, TrackerRow row) {
        List<String> lines = List.of(
                "Company: " + record.getCompany(),
                "Role: " + record.getRole(),
                "Status: " + record.getStatus(),
                "Application Method: " + record.getApplicationMethod(),
                "Career Page URL: " + record.getUrl(),
                "Tags: " + String.join(";", record.getTags()),
                "Notes: " + record.getNotes(),
                "Cover Letter Used: " + nullToEmpty(row.getCoverLetterUsed())
        );
        return String.join("\n", lines);
    }

    public static SubjectSnapshot toSubject(TrackedRecord record) {
        return new SubjectSnapshot(
                record.getAppId(),
                record.getCompany(),
                record.getRole(),
                record.getStatus(),
                record.getApplicationMethod(),
                record.getTags(),
                record.getNotes()
        );
    }

    public static HistoricalRecord toHistorical(TrackedRecord record) {
        return new HistoricalRecord(record.getStatus(), record.getTags(), record.getApplicationMethod());
    }

    private static String trimDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
