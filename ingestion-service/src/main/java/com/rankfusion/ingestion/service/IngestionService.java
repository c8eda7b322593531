package com.rankfusion.ingestion.service;

import com.rankfusion.bandit.model.HistoricalRecord;
import com.rankfusion.bandit.service.ThompsonModel;
import com.rankfusion.bandit.store.ArmLoadResult;
import com.rankfusion.bandit.store.ArmRepository;
import com.rankfusion.ingestion.model.BuildReport;
import com.rankfusion.ingestion.model.TrackedRecord;
import com.rankfusion.ingestion.model.TrackerRow;
import com.rankfusion.ingestion.store.EventLog;
import com.rankfusion.ingestion.store.RecordStore;
import com.rankfusion.memory.model.SemanticEntry;
import com.rankfusion.memory.service.MemoryEntryFactory;
import com.rankfusion.memory.service.Timestamps;
import com.rankfusion.memory.store.JsonlMemoryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds the record set from tracker rows. Writes {@code applications.jsonl}, rewrites
 * semantic memory, and seeds the bandit from record statuses when it has no arms yet.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final RecordStore recordStore;
    private final JsonlMemoryLog memoryLog;
    private final EventLog eventLog;
    private final ArmRepository armRepository;
    private final Clock clock;

    @Autowired
    public IngestionService(
            RecordStore recordStore,
            JsonlMemoryLog memoryLog,
            EventLog eventLog,
            ArmRepository armRepository
    ) {
        this(recordStore, memoryLog, eventLog, armRepository, Clock.systemUTC());
    }

    public IngestionService(
            RecordStore recordStore,
            JsonlMemoryLog memoryLog,
            EventLog eventLog,
            ArmRepository armRepository,
            Clock clock
    ) {
        this.recordStore = recordStore;
        this.memoryLog = memoryLog;
        this.eventLog = eventLog;
        this.armRepository = armRepository;
        this.clock = clock;
    }

    public BuildReport build(List<TrackerRow> rows) {
        long start = System.nanoTime();
        String now = Timestamps.format(clock.instant());
        List<TrackedRecord> records = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (TrackerRow row : rows == null ? List.<TrackerRow>of() : rows) {
            if (row == null) {
                continue;
            }
            TrackedRecord record;
            try {
                record = RecordNormalizer.toRecord(row, now);
            } catch (IllegalArgumentException ex) {
                errors.add("Failed to ingest " + nullToEmpty(row.getCompany()) + " / "
                        + nullToEmpty(row.getRole()) + ": " + ex.getMessage());
                continue;
            }
            if (seenIds.add(record.getAppId())) {
                records.add(record);
            }
        }

        for (String error : errors) {
            log.warn("event=ingest_error detail=\"{}\"", error);
            eventLog.append(null, "ingest_error", error);
        }

        recordStore.writeAll(records);
        List<SemanticEntry> semantic = new ArrayList<>(records.size());
        for (TrackedRecord record : records) {
            semantic.add(MemoryEntryFactory.semantic(RecordNormalizer.toSubject(record), now));
        }
        memoryLog.rewriteSemantic(semantic);
        memoryLog.ensureEpisodicExists();

        int bootstrapped = bootstrapIfEmpty(records);
        eventLog.append(null, "build_ok", "Indexed " + records.size() + " applications");
        log.info(
                "event=build_ok records={} errors={} bootstrapped={} duration_ms={}",
                records.size(),
                errors.size(),
                bootstrapped,
                (System.nanoTime() - start) / 1_000_000.0
        );
        return new BuildReport(records.size(), errors, bootstrapped);
    }

    private int bootstrapIfEmpty(List<TrackedRecord> records) {
        ArmLoadResult loaded = armRepository.load();
        ThompsonModel model = loaded.model();
        if (!model.isEmpty()) {
            return 0;
        }
        List<HistoricalRecord> history = new ArrayList<>(records.size());
        for (TrackedRecord record : records) {
            history.add(RecordNormalizer.toHistorical(record));
        }
        int replayed = model.bootstrap(history);
        armRepository.save(model);
        log.info("event=bandit_bootstrap arm_state={} replayed={} arms={}", loaded.status(), replayed, model.size());
        return replayed;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
