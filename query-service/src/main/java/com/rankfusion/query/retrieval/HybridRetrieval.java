package com.rankfusion.query.retrieval;

import com.rankfusion.ranking.model.Candidate;

import java.util.List;

/**
 * Candidates from one retrieval call plus how each channel behaved.
 */
public record HybridRetrieval(
        List<Candidate> candidates,
        RetrievalPath path,
        ChannelStatus nativeStatus,
        ChannelStatus denseStatus,
        ChannelStatus lexicalStatus
) {

    public HybridRetrieval {
        candidates = List.copyOf(candidates);
    }

    public boolean degraded() {
        return lexicalStatus.degraded();
    }
}
