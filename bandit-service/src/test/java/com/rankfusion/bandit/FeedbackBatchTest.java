package com.rankfusion.bandit;

import com.rankfusion.bandit.feedback.ArmDelta;
import com.rankfusion.bandit.feedback.FeedbackBatch;
import com.rankfusion.bandit.feedback.OutcomeEvent;
import com.rankfusion.bandit.feedback.ThumbVote;
import com.rankfusion.bandit.model.HistoricalRecord;
import com.rankfusion.bandit.model.Outcome;
import com.rankfusion.bandit.service.ThompsonModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FeedbackBatchTest {

    private final Map<String, HistoricalRecord> records = Map.of(
            "acme__ml", new HistoricalRecord("Applied", List.of("ai"), "ashby")
    );

    @Test
    void testComputeSkipsDuplicatesUnknownAndSeen() {
        List<OutcomeEvent> events = List.of(
                new OutcomeEvent("acme__ml", Outcome.INTERVIEW, "2026-01-01T00:00:00Z"),
                new OutcomeEvent("acme__ml", Outcome.INTERVIEW, "2026-01-01T00:00:00Z"),
                new OutcomeEvent("acme__ml", Outcome.OFFER, "2026-01-02T00:00:00Z"),
                new OutcomeEvent("ghost", Outcome.OFFER, "2026-01-03T00:00:00Z"),
                new OutcomeEvent("acme__ml", Outcome.REJECTED, "2026-01-04T00:00:00Z")
        );
        Set<String> ledger = Set.of("acme__ml|rejected|2026-01-04T00:00:00Z");

        FeedbackBatch.Result result = FeedbackBatch.compute(events, records::get, ledger);

        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(3);
        assertThat(result.deltas()).containsOnlyKeys("cat:ai", "method:ashby");
        assertThat(result.deltas().get("cat:ai").getAlpha()).isEqualTo(1.8);
        assertThat(result.newSeenKeys()).contains("ghost|offer|2026-01-03T00:00:00Z");
    }

    @Test
    void testMergedDeltasApplyLikeSequentialUpdates() {
        ArmDelta first = new ArmDelta();
        first.bump(0.8);
        ArmDelta second = new ArmDelta();
        second.bump(0.2);

        Map<String, ArmDelta> merged = FeedbackBatch.merge(List.of(Map.of("cat:ai", first), Map.of("cat:ai", second)));
        ThompsonModel batched = new ThompsonModel();
        batched.applyDeltas(merged);

        ThompsonModel sequential = new ThompsonModel();
        sequential.recordReward(List.of("cat:ai"), 0.8);
        sequential.recordReward(List.of("cat:ai"), 0.2);

        assertThat(batched.arm("cat:ai").orElseThrow().getAlpha())
                .isCloseTo(sequential.arm("cat:ai").orElseThrow().getAlpha(), org.assertj.core.api.Assertions.within(1e-12));
        assertThat(batched.arm("cat:ai").orElseThrow().getPulls()).isEqualTo(2);
    }

    @Test
    void testThumbVotesMapToOutcomes() {
        assertThat(ThumbVote.toOutcome("UP")).isEqualTo(Outcome.RESPONSE);
        assertThat(ThumbVote.toOutcome("👎")).isEqualTo(Outcome.NO_RESPONSE);
        assertThat(ThumbVote.toOutcome("-1")).isEqualTo(Outcome.NO_RESPONSE);
        assertThrows(IllegalArgumentException.class, () -> ThumbVote.toOutcome("meh"));
    }

    @Test
    void testOutcomeLabelsParse() {
        assertThat(Outcome.fromLabel(" Interview ")).isEqualTo(Outcome.INTERVIEW);
        assertThat(Outcome.parse("ghosted")).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> Outcome.fromLabel("ghosted"));
        assertThat(Outcome.validLabels()).hasSize(6).contains("no_response");
    }
}
