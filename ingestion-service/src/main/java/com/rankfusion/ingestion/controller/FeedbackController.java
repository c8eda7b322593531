package com.rankfusion.ingestion.controller;

import com.rankfusion.ingestion.model.BatchReport;
import com.rankfusion.ingestion.model.BatchRequest;
import com.rankfusion.ingestion.model.EventRecord;
import com.rankfusion.ingestion.model.EventRequest;
import com.rankfusion.ingestion.model.FeedbackReceipt;
import com.rankfusion.ingestion.model.OutcomeRequest;
import com.rankfusion.ingestion.model.ThumbRequest;
import com.rankfusion.ingestion.service.FeedbackService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class FeedbackController {

    private final FeedbackService feedbackService;

    public FeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @PostMapping("/feedback")
    public ResponseEntity<FeedbackReceipt> recordOutcome(@RequestBody OutcomeRequest request) {
        return ResponseEntity.ok(feedbackService.recordOutcome(request.getAppId(), request.getOutcome()));
    }

    @PostMapping("/feedback/thumb")
    public ResponseEntity<FeedbackReceipt> thumb(@RequestBody ThumbRequest request) {
        return ResponseEntity.ok(feedbackService.thumb(request.getAppId(), request.getVote()));
    }

    @PostMapping("/feedback/batch")
    public ResponseEntity<BatchReport> replayBatch(@RequestBody(required = false) BatchRequest request) {
        String source = request == null ? null : request.getSource();
        return ResponseEntity.ok(feedbackService.replayBatch(source));
    }

    @PostMapping("/events")
    public ResponseEntity<EventRecord> logEvent(@RequestBody EventRequest request) {
        return ResponseEntity.ok(feedbackService.logEvent(request.getAppId(), request.getType(), request.getMsg()));
    }
}
