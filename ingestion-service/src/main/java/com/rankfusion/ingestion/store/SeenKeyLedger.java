package com.rankfusion.ingestion.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dedupe keys of outcome events already folded into the arms by a batch replay, stored as a
 * sorted JSON array.
 */
public class SeenKeyLedger {

    private static final Logger log = LoggerFactory.getLogger(SeenKeyLedger.class);
    private static final TypeReference<List<Object>> RAW_LIST = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;

    public SeenKeyLedger(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Set<String> load() {
        Set<String> keys = new LinkedHashSet<>();
        if (!Files.exists(path)) {
            return keys;
        }
        try {
            List<Object> raw = objectMapper.readValue(path.toFile(), RAW_LIST);
            if (raw != null) {
                for (Object item : raw) {
                    if (item instanceof String key) {
                        keys.add(key);
                    }
                }
            }
        } catch (IOException ex) {
            log.warn("feedback ledger unreadable, treating as empty path={} cause={}", path, ex.getMessage());
        }
        return keys;
    }

    public void save(Collection<String> keys) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            List<String> sorted = new ArrayList<>(new TreeSet<>(keys));
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(path.toFile(), sorted);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write feedback ledger " + path, ex);
        }
    }
}
