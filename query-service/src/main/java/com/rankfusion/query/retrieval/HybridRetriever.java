package com.rankfusion.query.retrieval;

import com.rankfusion.query.index.SearchIndex;
import com.rankfusion.ranking.model.Candidate;
import com.rankfusion.vector.service.HashingEmbedder;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dense + lexical candidate retrieval. Tries the index's native hybrid mode first, then
 * falls back to running both channels and fusing them with RRF. The lexical channel runs
 * under a time budget and degrades to dense-only on failure; the dense channel must succeed.
 */
public class HybridRetriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    public static final List<String> DEFAULT_FTS_COLUMNS =
            List.of("text", "context_bundle_text", "company", "role", "notes");
    public static final long DEFAULT_LEXICAL_TIMEOUT_MS = 750L;
    private static final long MIN_STAGE_BUDGET_MS = 25L;

    private final HashingEmbedder embedder;
    private final int rrfK;
    private final long lexicalTimeoutMs;
    private final List<String> ftsColumns;
    private final MeterRegistry meterRegistry;

    public HybridRetriever(HashingEmbedder embedder) {
        this(embedder, RrfFusion.DEFAULT_RRF_K, DEFAULT_LEXICAL_TIMEOUT_MS, DEFAULT_FTS_COLUMNS, null);
    }

    public HybridRetriever(
            HashingEmbedder embedder,
            int rrfK,
            long lexicalTimeoutMs,
            List<String> ftsColumns,
            MeterRegistry meterRegistry
    ) {
        if (rrfK < 0) {
            throw new IllegalArgumentException("rrf k must be non-negative: " + rrfK);
        }
        this.embedder = embedder;
        this.rrfK = rrfK;
        this.lexicalTimeoutMs = Math.max(MIN_STAGE_BUDGET_MS, lexicalTimeoutMs);
        this.ftsColumns = (ftsColumns == null || ftsColumns.isEmpty()) ? DEFAULT_FTS_COLUMNS : List.copyOf(ftsColumns);
        this.meterRegistry = meterRegistry;
    }

    public List<String> ftsColumns() {
        return ftsColumns;
    }

    public HybridRetrieval retrieve(SearchIndex index, String query, int candidateK) {
        String text = query == null ? "" : query.trim();

        ChannelStatus nativeStatus = ChannelStatus.UNSUPPORTED;
        try {
            Optional<List<Candidate>> nativeHits = index.hybridSearch(text, ftsColumns, candidateK);
            if (nativeHits.isPresent()) {
                if (!nativeHits.get().isEmpty()) {
                    incrementCounter("retrieval_native_hybrid_total");
                    return new HybridRetrieval(nativeHits.get(), RetrievalPath.NATIVE_HYBRID,
                            ChannelStatus.OK, ChannelStatus.NOT_ATTEMPTED, ChannelStatus.NOT_ATTEMPTED);
                }
                nativeStatus = ChannelStatus.EMPTY;
            }
        } catch (RuntimeException ex) {
            nativeStatus = ChannelStatus.ERROR;
            log.info("stage=native_hybrid outcome=ERROR cause={}", ex.toString());
        }

        long denseStart = System.nanoTime();
        List<Candidate> dense;
        try {
            dense = index.vectorSearch(embedder.embed(text), candidateK);
        } catch (RuntimeException ex) {
            incrementCounter("retrieval_dense_error_total");
            throw new RetrievalException("dense search failed", ex);
        } finally {
            recordTimer("retrieval_dense_latency_ms", denseStart);
        }
        ChannelStatus denseStatus = dense.isEmpty() ? ChannelStatus.EMPTY : ChannelStatus.OK;

        LexicalOutcome lexical = timedLexicalSearch(index, text, candidateK);
        if (lexical.status() != ChannelStatus.OK) {
            if (lexical.status().degraded()) {
                incrementCounter("retrieval_lexical_degraded_total");
            }
            log.debug("stage=lexical_search outcome={} fallback=dense_only dense_hits={}", lexical.status(), dense.size());
            return new HybridRetrieval(dense, RetrievalPath.DENSE_ONLY, nativeStatus, denseStatus, lexical.status());
        }

        List<Candidate> fused = RrfFusion.fuse(dense, lexical.hits(), rrfK);
        return new HybridRetrieval(fused, RetrievalPath.MANUAL_RRF, nativeStatus, denseStatus, ChannelStatus.OK);
    }

    private LexicalOutcome timedLexicalSearch(SearchIndex index, String text, int candidateK) {
        long start = System.nanoTime();
        ChannelStatus status;
        List<Candidate> hits = List.of();
        CompletableFuture<Optional<List<Candidate>>> future =
                CompletableFuture.supplyAsync(() -> index.lexicalSearch(text, ftsColumns, candidateK));
        try {
            Optional<List<Candidate>> result = future.get(lexicalTimeoutMs, TimeUnit.MILLISECONDS);
            if (result == null || result.isEmpty()) {
                status = ChannelStatus.UNSUPPORTED;
            } else if (result.get().isEmpty()) {
                status = ChannelStatus.EMPTY;
            } else {
                status = ChannelStatus.OK;
                hits = result.get();
            }
        } catch (TimeoutException ex) {
            future.cancel(true);
            status = ChannelStatus.TIMEOUT;
            incrementCounter("query_stage_timeout_total");
            log.warn("stage=lexical_search outcome=TIMEOUT budget_ms={}", lexicalTimeoutMs);
        } catch (ExecutionException ex) {
            status = ChannelStatus.ERROR;
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("stage=lexical_search outcome=ERROR cause={}", cause.toString());
            incrementCounter("query_stage_error_total");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            status = ChannelStatus.ERROR;
            log.warn("stage=lexical_search outcome=ERROR cause={}", ex.toString());
            incrementCounter("query_stage_error_total");
        } finally {
            recordTimer("retrieval_lexical_latency_ms", start);
        }
        log.debug("stage=lexical_search duration_ms={} outcome={} hits={}", elapsedMillis(start), status, hits.size());
        return new LexicalOutcome(status, hits);
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record LexicalOutcome(ChannelStatus status, List<Candidate> hits) {
    }
}
