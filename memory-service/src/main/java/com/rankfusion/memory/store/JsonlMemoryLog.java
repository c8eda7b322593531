package com.rankfusion.memory.store;

import com.rankfusion.memory.model.EpisodicEntry;
import com.rankfusion.memory.model.SemanticEntry;

import java.nio.file.Path;
import java.util.List;

/**
 * The two memory logs under a data directory: {@code memory_short.jsonl} (episodic, append
 * only) and {@code memory_long.jsonl} (semantic, rewritten on every build).
 */
public class JsonlMemoryLog {

    public static final String SHORT_FILE = "memory_short.jsonl";
    public static final String LONG_FILE = "memory_long.jsonl";

    private final Path shortPath;
    private final Path longPath;
    private final JsonlFiles files;

    public JsonlMemoryLog(Path dataDir) {
        this(dataDir.resolve(SHORT_FILE), dataDir.resolve(LONG_FILE), new JsonlFiles());
    }

    public JsonlMemoryLog(Path dataDir, JsonlFiles files) {
        this(dataDir.resolve(SHORT_FILE), dataDir.resolve(LONG_FILE), files);
    }

    public JsonlMemoryLog(Path shortPath, Path longPath, JsonlFiles files) {
        this.shortPath = shortPath;
        this.longPath = longPath;
        this.files = files;
    }

    public Path shortPath() {
        return shortPath;
    }

    public Path longPath() {
        return longPath;
    }

    public List<EpisodicEntry> loadEpisodic() {
        return files.read(shortPath, EpisodicEntry.class).rows();
    }

    public List<SemanticEntry> loadSemantic() {
        return files.read(longPath, SemanticEntry.class).rows();
    }

    public void appendEpisodic(EpisodicEntry entry) {
        files.append(shortPath, entry);
    }

    public void rewriteSemantic(List<SemanticEntry> entries) {
        files.rewrite(longPath, entries);
    }

    public void ensureEpisodicExists() {
        files.touch(shortPath);
    }
}
