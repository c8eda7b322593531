package com.rankfusion.ingestion.service;

import com.rankfusion.bandit.feedback.FeedbackBatch;
import com.rankfusion.bandit.feedback.OutcomeEvent;
import com.rankfusion.bandit.feedback.ThumbVote;
import com.rankfusion.bandit.model.Outcome;
import com.rankfusion.bandit.service.ThompsonModel;
import com.rankfusion.bandit.store.ArmRepository;
import com.rankfusion.ingestion.exception.IndexNotBuiltException;
import com.rankfusion.ingestion.exception.InvalidFeedbackException;
import com.rankfusion.ingestion.exception.RecordNotFoundException;
import com.rankfusion.ingestion.model.BatchReport;
import com.rankfusion.ingestion.model.BatchSource;
import com.rankfusion.ingestion.model.EventRecord;
import com.rankfusion.ingestion.model.FeedbackReceipt;
import com.rankfusion.ingestion.model.TrackedRecord;
import com.rankfusion.ingestion.store.EventLog;
import com.rankfusion.ingestion.store.RecordStore;
import com.rankfusion.ingestion.store.SeenKeyLedger;
import com.rankfusion.memory.store.JsonlMemoryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome feedback into the bandit: single outcomes, thumb votes and batch replays of logged
 * outcome events. Every change is also logged as an event.
 */
@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final RecordStore recordStore;
    private final ArmRepository armRepository;
    private final EventLog eventLog;
    private final JsonlMemoryLog memoryLog;
    private final SeenKeyLedger seenKeyLedger;

    public FeedbackService(
            RecordStore recordStore,
            ArmRepository armRepository,
            EventLog eventLog,
            JsonlMemoryLog memoryLog,
            SeenKeyLedger seenKeyLedger
    ) {
        this.recordStore = recordStore;
        this.armRepository = armRepository;
        this.eventLog = eventLog;
        this.memoryLog = memoryLog;
        this.seenKeyLedger = seenKeyLedger;
    }

    public FeedbackReceipt recordOutcome(String appId, String outcomeLabel) {
        Outcome outcome = Outcome.parse(outcomeLabel).orElseThrow(() -> new InvalidFeedbackException(
                "Unknown outcome '" + outcomeLabel + "'. Valid: " + Outcome.validLabels()));
        TrackedRecord record = recordStore.findById(appId)
                .orElseThrow(() -> new RecordNotFoundException(appId));

        List<String> arms = ThompsonModel.armNamesFor(record.getTags(), record.getApplicationMethod());
        armRepository.update(model -> model.recordOutcome(arms, outcome));
        eventLog.append(
                appId,
                OutcomeEvents.OUTCOME_TYPE,
                "outcome=" + outcome.label() + " tags=" + record.getTags() + " method=" + record.getApplicationMethod(),
                outcome.label()
        );
        log.info("event=feedback_recorded app_id={} outcome={} arms={}", appId, outcome.label(), arms.size());
        return new FeedbackReceipt(appId, record.getCompany(), record.getRole(), outcome.label(), arms);
    }

    public FeedbackReceipt thumb(String appId, String vote) {
        if (appId == null || appId.isBlank()) {
            throw new InvalidFeedbackException("app_id is required for a thumb vote");
        }
        Outcome outcome;
        try {
            outcome = ThumbVote.toOutcome(vote);
        } catch (IllegalArgumentException ex) {
            throw new InvalidFeedbackException(ex.getMessage(), ex);
        }
        return recordOutcome(appId, outcome.label());
    }

    public BatchReport replayBatch(String sourceLabel) {
        BatchSource source = BatchSource.parse(sourceLabel).orElseThrow(() -> new InvalidFeedbackException(
                "Unknown batch source '" + sourceLabel + "'. Valid: [events, memory_short]"));
        Map<String, TrackedRecord> lookup = recordStore.lookup();
        if (lookup.isEmpty()) {
            throw new IndexNotBuiltException();
        }

        List<OutcomeEvent> events = source == BatchSource.EVENTS
                ? OutcomeEvents.fromEvents(eventLog.loadAll())
                : OutcomeEvents.fromEpisodic(memoryLog.loadEpisodic());
        Set<String> seenKeys = seenKeyLedger.load();

        FeedbackBatch.Result result = FeedbackBatch.compute(
                events,
                appId -> {
                    TrackedRecord record = lookup.get(appId);
                    return record == null ? null : RecordNormalizer.toHistorical(record);
                },
                seenKeys
        );

        armRepository.update(model -> model.applyDeltas(result.deltas()));
        if (!result.newSeenKeys().isEmpty()) {
            Set<String> union = new LinkedHashSet<>(seenKeys);
            union.addAll(result.newSeenKeys());
            seenKeyLedger.save(union);
        }

        BatchReport report = new BatchReport(
                source.label(),
                result.processed(),
                result.skipped(),
                result.deltas().size(),
                result.newSeenKeys().size()
        );
        eventLog.append(null, "feedback_batch", "source=" + report.source()
                + " processed=" + report.processed()
                + " skipped=" + report.skipped()
                + " arms_touched=" + report.armsTouched()
                + " new_seen=" + report.newSeen());
        log.info(
                "event=feedback_batch source={} processed={} skipped={} arms_touched={} new_seen={}",
                report.source(),
                report.processed(),
                report.skipped(),
                report.armsTouched(),
                report.newSeen()
        );
        return report;
    }

    public EventRecord logEvent(String appId, String type, String msg) {
        if (type == null || type.isBlank()) {
            throw new InvalidFeedbackException("event type is required");
        }
        return eventLog.append(appId, type.trim(), msg == null ? "" : msg);
    }
}
