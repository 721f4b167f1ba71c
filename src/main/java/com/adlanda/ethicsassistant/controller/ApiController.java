package com.adlanda.ethicsassistant.controller;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery and a configuration summary.
 *
 * Dependency health is reported by /api/v1/rag/health and Spring Actuator.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    private final AssistantProperties properties;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    public ApiController(AssistantProperties properties) {
        this.properties = properties;
    }

    /**
     * Root endpoint with API documentation links.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "AI Ethics Assistant",
                "version", appVersion,
                "endpoints", Map.of(
                        "chat", "POST /api/v1/chat - Ask a question (set stream=true for SSE)",
                        "ingest", "POST /api/v1/ingest - Ingest all documents",
                        "ingestDocument", "POST /api/v1/ingest/document?key= - Ingest one document",
                        "ragHealth", "GET /api/v1/rag/health - Dependency health",
                        "status", "GET /api/v1/status - Configured services",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }

    /**
     * API liveness; does not contact any dependency.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "message", "AI Ethics Assistant API is running"
        ));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        AssistantProperties.Index index = properties.getIndex();
        return ResponseEntity.ok(Map.of(
                "version", appVersion,
                "services", Map.of(
                        "storage", Map.of(
                                "root", properties.getStorage().getRoot(),
                                "suffix", properties.getStorage().getSuffix()),
                        "vectorIndex", Map.of(
                                "type", index.getType(),
                                "collection", index.getCollection(),
                                "metric", index.getMetric().name()),
                        "chunking", Map.of(
                                "size", properties.getChunking().getSize(),
                                "overlap", properties.getChunking().getOverlap()),
                        "retrieval", Map.of(
                                "defaultTopK", properties.getRetrieval().getDefaultTopK(),
                                "maxTopK", properties.getRetrieval().getMaxTopK())
                )
        ));
    }
}
