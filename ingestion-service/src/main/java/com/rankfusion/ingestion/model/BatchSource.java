package com.rankfusion.ingestion.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Stream an outcome batch is replayed from.
 */
public enum BatchSource {
    MEMORY_SHORT("memory_short"),
    EVENTS("events");

    private final String label;

    BatchSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<BatchSource> parse(String raw) {
        String key = raw == null || raw.isBlank() ? MEMORY_SHORT.label : raw.trim().toLowerCase(Locale.ROOT);
        for (BatchSource source : values()) {
            if (source.label.equals(key)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
