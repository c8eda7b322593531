package com.rankfusion.query.config;

import com.rankfusion.memory.service.MemoryDecayScorer;
import com.rankfusion.query.retrieval.HybridRetriever;
import com.rankfusion.vector.service.HashingEmbedder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class RetrievalConfig {

    @Bean
    public HashingEmbedder hashingEmbedder(@Value("${rankfusion.embedding.dims:1536}") int dims) {
        return new HashingEmbedder(dims);
    }

    @Bean
    public HybridRetriever hybridRetriever(
            HashingEmbedder hashingEmbedder,
            @Value("${rankfusion.retrieval.rrf-k:60}") int rrfK,
            @Value("${rankfusion.retrieval.lexical-timeout-ms:750}") long lexicalTimeoutMs,
            @Value("${rankfusion.retrieval.fts-columns:text,context_bundle_text,company,role,notes}") List<String> ftsColumns,
            MeterRegistry meterRegistry
    ) {
        return new HybridRetriever(hashingEmbedder, rrfK, lexicalTimeoutMs, ftsColumns, meterRegistry);
    }

    @Bean
    public MemoryDecayScorer memoryDecayScorer(@Value("${rankfusion.memory.half-life-days:14.0}") double halfLifeDays) {
        return new MemoryDecayScorer(halfLifeDays);
    }
}
