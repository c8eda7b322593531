package com.rankfusion.ingestion.config;

import java.nio.file.Path;

/**
 * File layout under the data directory.
 */
public class DataPaths {

    private final Path root;

    public DataPaths(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public Path applications() {
        return root.resolve("applications.jsonl");
    }

    public Path arms() {
        return root.resolve("arms.json");
    }

    public Path events() {
        return root.resolve("logs").resolve("events.jsonl");
    }

    public Path feedbackLedger() {
        return root.resolve("feedback_batch_seen.json");
    }
}
