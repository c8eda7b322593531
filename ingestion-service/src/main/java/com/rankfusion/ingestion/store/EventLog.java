package com.rankfusion.ingestion.store;

import com.rankfusion.ingestion.model.EventRecord;
import com.rankfusion.memory.model.EpisodicEntry;
import com.rankfusion.memory.service.MemoryEntryFactory;
import com.rankfusion.memory.service.Timestamps;
import com.rankfusion.memory.store.JsonlFiles;
import com.rankfusion.memory.store.JsonlMemoryLog;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Every event goes to two places: {@code events.jsonl} and the episodic memory log, where it
 * carries a score hint for recency ranking.
 */
public class EventLog {

    private final Path path;
    private final JsonlFiles files;
    private final JsonlMemoryLog memoryLog;
    private final Clock clock;

    public EventLog(Path path, JsonlFiles files, JsonlMemoryLog memoryLog, Clock clock) {
        this.path = path;
        this.files = files;
        this.memoryLog = memoryLog;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    public EventRecord append(String appId, String type, String msg) {
        return append(appId, type, msg, null);
    }

    public EventRecord append(String appId, String type, String msg, String outcome) {
        String ts = Timestamps.format(clock.instant());
        EventRecord event = new EventRecord(ts, appId, type, msg);
        files.append(path, event);
        EpisodicEntry entry = MemoryEntryFactory.episodic(appId, type, msg, ts, outcome);
        memoryLog.appendEpisodic(entry);
        return event;
    }

    public List<EventRecord> loadAll() {
        return files.read(path, EventRecord.class).rows();
    }
}
