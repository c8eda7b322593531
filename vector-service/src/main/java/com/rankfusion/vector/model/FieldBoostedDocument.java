package com.rankfusion.vector.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the text fed to the embedder for an indexed record. High-signal fields are repeated
 * so they claim more hash-bucket weight than free text. The repeat counts are fixed.
 */
public final class FieldBoostedDocument {

    public static final int IDENTITY_REPEAT = 5;
    public static final int LABEL_REPEAT = 4;
    public static final int TAGS_REPEAT = 3;
    public static final int CHANNEL_REPEAT = 2;
    public static final int STATUS_REPEAT = 2;
    public static final int CONTEXT_REPEAT = 2;
    public static final int FREE_TEXT_REPEAT = 1;

    private final List<String> parts;

    private FieldBoostedDocument(List<String> parts) {
        this.parts = Collections.unmodifiableList(parts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> parts() {
        return parts;
    }

    public String text() {
        return String.join(" ", parts);
    }

    public static final class Builder {
        private final List<String> parts = new ArrayList<>();

        private Builder() {
        }

        public Builder identity(String value) {
            return repeat(value, IDENTITY_REPEAT);
        }

        public Builder label(String value) {
            return repeat(value, LABEL_REPEAT);
        }

        // Whole list repeated, not each tag in place: [a, b] -> a b a b a b.
        public Builder tags(List<String> tags) {
            List<String> safe = tags == null ? List.of() : tags;
            for (int i = 0; i < TAGS_REPEAT; i++) {
                for (String tag : safe) {
                    parts.add(tag == null ? "" : tag);
                }
            }
            return this;
        }

        public Builder channel(String value) {
            return repeat(value, CHANNEL_REPEAT);
        }

        public Builder status(String value) {
            return repeat(value, STATUS_REPEAT);
        }

        public Builder context(String value) {
            return repeat(value, CONTEXT_REPEAT);
        }

        public Builder freeText(String value) {
            return repeat(value, FREE_TEXT_REPEAT);
        }

        public FieldBoostedDocument build() {
            return new FieldBoostedDocument(new ArrayList<>(parts));
        }

        private Builder repeat(String value, int times) {
            String safe = value == null ? "" : value;
            for (int i = 0; i < times; i++) {
                parts.add(safe);
            }
            return this;
        }
    }
}
