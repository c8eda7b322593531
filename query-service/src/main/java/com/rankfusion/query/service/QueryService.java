package com.rankfusion.query.service;

import com.rankfusion.bandit.store.ArmLoadResult;
import com.rankfusion.bandit.store.ArmRepository;
import com.rankfusion.bandit.store.LoadStatus;
import com.rankfusion.memory.model.MemorySnapshot;
import com.rankfusion.memory.service.MemoryDecayScorer;
import com.rankfusion.memory.store.JsonlMemoryLog;
import com.rankfusion.query.contract.ContractException;
import com.rankfusion.query.contract.RetrieveContract;
import com.rankfusion.query.contract.RetrieveEnvelope;
import com.rankfusion.query.contract.RetrieveItem;
import com.rankfusion.query.contract.RetrieveRequest;
import com.rankfusion.query.index.SearchIndex;
import com.rankfusion.query.index.SearchIndexProvider;
import com.rankfusion.query.model.QueryRequest;
import com.rankfusion.query.model.QueryResult;
import com.rankfusion.query.model.RankedResult;
import com.rankfusion.query.retrieval.HybridRetrieval;
import com.rankfusion.query.retrieval.HybridRetriever;
import com.rankfusion.ranking.model.Candidate;
import com.rankfusion.ranking.service.RankFusionService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Runs a query end to end: open the index, retrieve and fuse dense and lexical candidates,
 * load the arm set and memory logs fresh, rank, filter and truncate.
 */
@Service
public class QueryService {
    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private static final int DEFAULT_TOP_K = 8;

    private final SearchIndexProvider indexProvider;
    private final HybridRetriever retriever;
    private final RankFusionService fusionService;
    private final ArmRepository armRepository;
    private final JsonlMemoryLog memoryLog;
    private final MemoryDecayScorer decayScorer;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public QueryService(
            SearchIndexProvider indexProvider,
            HybridRetriever retriever,
            RankFusionService fusionService,
            ArmRepository armRepository,
            JsonlMemoryLog memoryLog,
            MemoryDecayScorer decayScorer,
            Clock clock
    ) {
        this(indexProvider, retriever, fusionService, armRepository, memoryLog, decayScorer, clock, null);
    }

    @Autowired
    public QueryService(
            SearchIndexProvider indexProvider,
            HybridRetriever retriever,
            RankFusionService fusionService,
            ArmRepository armRepository,
            JsonlMemoryLog memoryLog,
            MemoryDecayScorer decayScorer,
            MeterRegistry meterRegistry
    ) {
        this(indexProvider, retriever, fusionService, armRepository, memoryLog, decayScorer, Clock.systemUTC(), meterRegistry);
    }

    public QueryService(
            SearchIndexProvider indexProvider,
            HybridRetriever retriever,
            RankFusionService fusionService,
            ArmRepository armRepository,
            JsonlMemoryLog memoryLog,
            MemoryDecayScorer decayScorer,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.indexProvider = indexProvider;
        this.retriever = retriever;
        this.fusionService = fusionService;
        this.armRepository = armRepository;
        this.memoryLog = memoryLog;
        this.decayScorer = decayScorer;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public static int queryCandidateK(int k) {
        return Math.max(k * 8, 40);
    }

    public static int retrieveCandidateK(int k) {
        return Math.max(k * 12, 60);
    }

    public QueryResult query(QueryRequest request, String traceId) {
        String effectiveTraceId = effectiveTraceId(traceId);
        long totalStart = System.nanoTime();
        String rawQuery = request == null ? null : request.getQuery();
        int topK = resolveTopK(request);
        log.info("trace_id={} event=query_start query=\"{}\" top_k={}", effectiveTraceId, sanitizeForLog(rawQuery), topK);
        String query = RetrieveContract.normalizeQuery(rawQuery);

        Ranked ranked = rank(query, queryCandidateK(topK), effectiveTraceId);
        List<Candidate> top = truncate(ranked.candidates(), topK);

        QueryResult result = new QueryResult();
        result.setQuery(query);
        result.setTopK(topK);
        result.setRetrievalPath(ranked.retrieval().path().name());
        result.setLexicalStatus(ranked.retrieval().lexicalStatus().name());
        result.setCandidateCount(ranked.candidates().size());
        List<RankedResult> rankedResults = new ArrayList<>(top.size());
        for (Candidate candidate : top) {
            rankedResults.add(RankedResult.from(candidate));
        }
        result.setRankedResults(rankedResults);

        incrementCounter("query_count_total");
        recordTimer("retrieval_query_latency_ms", totalStart);
        log.info(
                "trace_id={} event=query_complete total_ms={} top_k={} results={} path={}",
                effectiveTraceId,
                elapsedMillis(totalStart),
                topK,
                rankedResults.size(),
                ranked.retrieval().path()
        );
        return result;
    }

    public List<RetrieveItem> retrieve(RetrieveRequest raw, String traceId) {
        RetrieveRequest request = RetrieveContract.normalize(raw);
        return retrieveNormalized(request, effectiveTraceId(traceId));
    }

    public RetrieveEnvelope retrieveEnvelope(RetrieveRequest raw, String traceId) {
        RetrieveRequest request = RetrieveContract.normalize(raw);
        List<RetrieveItem> items = retrieveNormalized(request, effectiveTraceId(traceId));
        return RetrieveContract.envelope(request, items, clock.instant());
    }

    private List<RetrieveItem> retrieveNormalized(RetrieveRequest request, String traceId) {
        long totalStart = System.nanoTime();
        int k = request.getK();
        log.info(
                "trace_id={} event=retrieve_start query=\"{}\" k={} status={} method={}",
                traceId,
                sanitizeForLog(request.getQuery()),
                k,
                request.getStatus(),
                request.getMethod()
        );

        Ranked ranked = rank(request.getQuery(), retrieveCandidateK(k), traceId);
        List<Candidate> filtered = new ArrayList<>();
        for (Candidate candidate : ranked.candidates()) {
            if (matches(candidate.getStatus(), request.getStatus()) && matches(candidate.getMethod(), request.getMethod())) {
                filtered.add(candidate);
            }
        }
        List<RetrieveItem> items = RetrieveContract.toItems(truncate(filtered, k));

        incrementCounter("retrieve_count_total");
        recordTimer("retrieval_query_latency_ms", totalStart);
        log.info(
                "trace_id={} event=retrieve_complete total_ms={} k={} filtered={} results={}",
                traceId,
                elapsedMillis(totalStart),
                k,
                filtered.size(),
                items.size()
        );
        return items;
    }

    private Ranked rank(String query, int candidateK, String traceId) {
        long retrievalStart = System.nanoTime();
        SearchIndex index = indexProvider.open();
        HybridRetrieval retrieval = retriever.retrieve(index, query, candidateK);
        log.info(
                "trace_id={} stage=hybrid_retrieval duration_ms={} path={} lexical={} candidates={}",
                traceId,
                elapsedMillis(retrievalStart),
                retrieval.path(),
                retrieval.lexicalStatus(),
                retrieval.candidates().size()
        );
        if (retrieval.degraded()) {
            log.warn("trace_id={} event=retrieval_degraded lexical={}", traceId, retrieval.lexicalStatus());
        }

        long fusionStart = System.nanoTime();
        ArmLoadResult arms = armRepository.load();
        if (arms.status() == LoadStatus.CORRUPT) {
            incrementCounter("bandit_state_corrupt_total");
        }
        MemorySnapshot memory = decayScorer.snapshot(memoryLog.loadEpisodic(), memoryLog.loadSemantic(), clock.instant());
        List<Candidate> fused = fusionService.fuse(retrieval.candidates(), query, arms.model(), memory);
        recordTimer("ranking_fusion_duration_ms", fusionStart);
        log.info(
                "trace_id={} stage=fusion_rerank duration_ms={} ranked_docs={} arms={} arm_state={}",
                traceId,
                elapsedMillis(fusionStart),
                fused.size(),
                arms.model().size(),
                arms.status()
        );
        return new Ranked(retrieval, fused);
    }

    private static boolean matches(String value, String wanted) {
        if (wanted == null) {
            return true;
        }
        String actual = value == null ? "" : value;
        return actual.toLowerCase(Locale.ROOT).equals(wanted.trim().toLowerCase(Locale.ROOT));
    }

    private static List<Candidate> truncate(List<Candidate> candidates, int k) {
        return candidates.size() <= k ? candidates : new ArrayList<>(candidates.subList(0, k));
    }

    private static int resolveTopK(QueryRequest request) {
        if (request == null || request.getTopK() == null) {
            return DEFAULT_TOP_K;
        }
        int topK = request.getTopK();
        if (topK < 1 || topK > RetrieveContract.MAX_K) {
            throw new ContractException("top_k must be in [1, " + RetrieveContract.MAX_K + "]");
        }
        return topK;
    }

    private static String effectiveTraceId(String traceId) {
        return (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
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

    private static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record Ranked(HybridRetrieval retrieval, List<Candidate> candidates) {
    }
}
