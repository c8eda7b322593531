package com.rankfusion.ingestion.store;

import com.rankfusion.ingestion.exception.IndexNotBuiltException;
import com.rankfusion.ingestion.model.TrackedRecord;
import com.rankfusion.memory.store.JsonlFiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code applications.jsonl}: the built record set, rewritten whole on every build.
 */
public class RecordStore {

    private final Path path;
    private final JsonlFiles files;

    public RecordStore(Path path, JsonlFiles files) {
        this.path = path;
        this.files = files;
    }

    public Path path() {
        return path;
    }

    public boolean isBuilt() {
        return Files.exists(path);
    }

    /**
     * @throws IndexNotBuiltException when no build has been written yet
     */
    public List<TrackedRecord> loadAll() {
        if (!isBuilt()) {
            throw new IndexNotBuiltException();
        }
        return files.read(path, TrackedRecord.class).rows();
    }

    public Optional<TrackedRecord> findById(String appId) {
        return loadAll().stream()
                .filter(record -> appId != null && appId.equals(record.getAppId()))
                .findFirst();
    }

    public Map<String, TrackedRecord> lookup() {
        Map<String, TrackedRecord> byId = new LinkedHashMap<>();
        for (TrackedRecord record : loadAll()) {
            if (record.getAppId() != null && !record.getAppId().isEmpty()) {
                byId.putIfAbsent(record.getAppId(), record);
            }
        }
        return byId;
    }

    public void writeAll(List<TrackedRecord> records) {
        files.rewrite(path, records);
    }
}
