package com.rankfusion.memory.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON-lines helpers shared by the memory logs and the record and event stores. Reads are
 * tolerant: a missing file is empty and lines that do not map to {@code T} are skipped.
 */
public class JsonlFiles {

    private static final Logger log = LoggerFactory.getLogger(JsonlFiles.class);

    private final ObjectMapper objectMapper;
    private final ObjectWriter lineWriter;

    public JsonlFiles() {
        this(new ObjectMapper());
    }

    public JsonlFiles(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public <T> JsonlReadResult<T> read(Path path, Class<T> type) {
        if (!Files.exists(path)) {
            return new JsonlReadResult<>(List.of(), 0);
        }
        List<T> rows = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (!trimmed.startsWith("{")) {
                    skipped++;
                    continue;
                }
                try {
                    rows.add(objectMapper.readValue(trimmed, type));
                } catch (IOException ex) {
                    skipped++;
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read " + path, ex);
        }
        if (skipped > 0) {
            log.warn("jsonl_skipped_lines path={} skipped={} kept={}", path, skipped, rows.size());
        }
        return new JsonlReadResult<>(rows, skipped);
    }

    public void append(Path path, Object row) {
        try {
            createParent(path);
            Files.writeString(path, lineWriter.writeValueAsString(row) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to append to " + path, ex);
        }
    }

    /**
     * Replaces the file with {@code rows}, one per line, through a temp file and a rename.
     */
    public void rewrite(Path path, List<?> rows) {
        try {
            Path parent = createParent(path);
            Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                    for (Object row : rows) {
                        writer.write(lineWriter.writeValueAsString(row));
                        writer.write('\n');
                    }
                }
                try {
                    Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException ex) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to rewrite " + path, ex);
        }
    }

    public void touch(Path path) {
        try {
            createParent(path);
            if (!Files.exists(path)) {
                Files.createFile(path);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to create " + path, ex);
        }
    }

    private static Path createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        return parent;
    }
}
