package com.rankfusion.query.index;

import com.rankfusion.ingestion.store.RecordStore;
import com.rankfusion.vector.service.HashingEmbedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens an {@link InMemoryRecordIndex} over {@code applications.jsonl}, re-read on every call
 * so a fresh build is visible to the next query.
 */
@Component
public class LocalSearchIndexProvider implements SearchIndexProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalSearchIndexProvider.class);

    private final RecordStore recordStore;
    private final HashingEmbedder embedder;

    public LocalSearchIndexProvider(RecordStore recordStore, HashingEmbedder embedder) {
        this.recordStore = recordStore;
        this.embedder = embedder;
    }

    @Override
    public SearchIndex open() {
        long start = System.nanoTime();
        InMemoryRecordIndex index = new InMemoryRecordIndex(recordStore.loadAll(), embedder);
        log.debug("event=index_open records={} duration_ms={}", index.size(), (System.nanoTime() - start) / 1_000_000.0);
        return index;
    }
}
