package com.rankfusion.ingestion.controller;

import com.rankfusion.ingestion.model.BuildReport;
import com.rankfusion.ingestion.model.TrackerRow;
import com.rankfusion.ingestion.service.IngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ingest")
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping
    public ResponseEntity<BuildReport> ingestRows(@RequestBody List<TrackerRow> rows) {
        return ResponseEntity.ok(ingestionService.build(rows));
    }
}
