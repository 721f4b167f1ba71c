package com.adlanda.ethicsassistant;

import com.adlanda.ethicsassistant.exception.AssistantException;
import com.adlanda.ethicsassistant.health.IngestionHealthIndicator;
import com.adlanda.ethicsassistant.model.FileIngestionResult;
import com.adlanda.ethicsassistant.model.IngestionResult;
import com.adlanda.ethicsassistant.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs batch ingestion on application startup when
 * assistant.ingestion.run-on-startup is true.
 *
 * A failed run is reported through the ingestion health indicator and does not
 * stop the application; questions are still answered from whatever is indexed.
 */
@Component
@Order(1) // Run after StartupVerifier, before StartupInfoLogger
@ConditionalOnProperty(prefix = "assistant.ingestion", name = "run-on-startup", havingValue = "true")
public class IngestionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    private final IngestionService ingestionService;
    private final IngestionHealthIndicator healthIndicator;

    public IngestionRunner(IngestionService ingestionService,
                           IngestionHealthIndicator healthIndicator) {
        this.ingestionService = ingestionService;
        this.healthIndicator = healthIndicator;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Starting document ingestion...");

        try {
            IngestionResult result = ingestionService.ingestAll();

            for (FileIngestionResult file : result.files()) {
                if (file.succeeded()) {
                    log.info("  {} - {} chunks", file.file(), file.chunks());
                } else {
                    log.warn("  {} - FAILED ({}): {}", file.file(), file.errorKind(), file.error());
                }
            }
            log.info("Ingestion complete: {} processed, {} failed, {} chunks indexed",
                    result.processed(), result.failed(), result.totalChunks());

            healthIndicator.markCompleted(result);

        } catch (AssistantException e) {
            log.error("Failed to ingest documents: {}", e.getMessage(), e);
            healthIndicator.markFailed(e.getMessage());
        }
    }
}
