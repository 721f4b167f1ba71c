package com.adlanda.ethicsassistant.controller;

import com.adlanda.ethicsassistant.exception.StorageException;
import com.adlanda.ethicsassistant.health.IngestionHealthIndicator;
import com.adlanda.ethicsassistant.model.FileIngestionResult;
import com.adlanda.ethicsassistant.model.IngestionResult;
import com.adlanda.ethicsassistant.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for triggering document ingestion.
 */
@RestController
@RequestMapping("/api/v1/ingest")
public class IngestionController {

    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionService ingestionService;
    private final IngestionHealthIndicator healthIndicator;

    public IngestionController(IngestionService ingestionService, IngestionHealthIndicator healthIndicator) {
        this.ingestionService = ingestionService;
        this.healthIndicator = healthIndicator;
    }

    /**
     * Ingests every eligible document. Per-document failures are reported in the body.
     */
    @PostMapping
    public ResponseEntity<IngestionResult> ingestAll() {
        IngestionResult result = ingestionService.ingestAll();
        healthIndicator.markCompleted(result);
        return ResponseEntity.ok(result);
    }

    /**
     * Ingests (or re-ingests) a single document by logical key.
     */
    @PostMapping("/document")
    public ResponseEntity<FileIngestionResult> ingestDocument(@RequestParam("key") String key) {
        return ResponseEntity.ok(ingestionService.ingestDocument(key));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, String>> storageUnavailable(StorageException e) {
        log.error("Document storage unavailable: {}", e.getMessage(), e);
        healthIndicator.markFailed(e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", e.getMessage(), "kind", e.kind().name()));
    }
}
