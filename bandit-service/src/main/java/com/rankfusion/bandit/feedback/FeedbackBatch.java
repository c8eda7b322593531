package com.rankfusion.bandit.feedback;

import com.rankfusion.bandit.model.HistoricalRecord;
import com.rankfusion.bandit.service.ThompsonModel;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns a replayed stream of outcome events into per-arm deltas. Events already present in the
 * seen-key ledger, repeated within the batch, or pointing at unknown records are skipped.
 */
public final class FeedbackBatch {

    private FeedbackBatch() {
    }

    public static Result compute(
            List<OutcomeEvent> events,
            Function<String, HistoricalRecord> recordLookup,
            Set<String> alreadySeen
    ) {
        Map<String, ArmDelta> deltas = new LinkedHashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        Set<String> ledger = alreadySeen == null ? Set.of() : alreadySeen;
        int processed = 0;
        int skipped = 0;

        for (OutcomeEvent event : events) {
            if (event.appId() == null || event.appId().isBlank() || event.outcome() == null) {
                skipped++;
                continue;
            }
            String key = event.dedupeKey();
            if (seen.contains(key) || ledger.contains(key)) {
                skipped++;
                continue;
            }
            seen.add(key);

            HistoricalRecord record = recordLookup.apply(event.appId());
            if (record == null) {
                skipped++;
                continue;
            }
            double reward = event.outcome().reward();
            for (String armName : ThompsonModel.armNamesFor(record.tags(), record.method())) {
                deltas.computeIfAbsent(armName, ignored -> new ArmDelta()).bump(reward);
            }
            processed++;
        }
        return new Result(deltas, processed, skipped, seen);
    }

    public static Map<String, ArmDelta> merge(List<Map<String, ArmDelta>> chunks) {
        Map<String, ArmDelta> merged = new LinkedHashMap<>();
        for (Map<String, ArmDelta> chunk : chunks) {
            chunk.forEach((name, delta) -> merged.computeIfAbsent(name, ignored -> new ArmDelta()).merge(delta));
        }
        return merged;
    }

    public record Result(Map<String, ArmDelta> deltas, int processed, int skipped, Set<String> newSeenKeys) {
    }
}
