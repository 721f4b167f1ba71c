package com.adlanda.ethicsassistant;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.ConnectivityException;
import com.adlanda.ethicsassistant.repository.VectorIndex;
import com.adlanda.ethicsassistant.service.DocumentStorage;
import com.adlanda.ethicsassistant.service.EmbeddingBackend;
import com.adlanda.ethicsassistant.service.GenerationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Verifies collaborators before anything is served or ingested.
 *
 * Storage and the vector index must be reachable or startup fails. The index
 * collection is created if absent, using the configured dimension or, when none
 * is configured, the one the embedding backend reports. An unreachable generation
 * backend is only logged.
 */
@Component
@Order(0) // Run before IngestionRunner
@ConditionalOnProperty(prefix = "assistant.startup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StartupVerifier implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupVerifier.class);

    private final DocumentStorage documentStorage;
    private final VectorIndex vectorIndex;
    private final EmbeddingBackend embeddingBackend;
    private final GenerationBackend generationBackend;
    private final AssistantProperties properties;

    public StartupVerifier(DocumentStorage documentStorage,
                           VectorIndex vectorIndex,
                           EmbeddingBackend embeddingBackend,
                           GenerationBackend generationBackend,
                           AssistantProperties properties) {
        this.documentStorage = documentStorage;
        this.vectorIndex = vectorIndex;
        this.embeddingBackend = embeddingBackend;
        this.generationBackend = generationBackend;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Verifying collaborators...");

        if (!documentStorage.probe()) {
            throw new ConnectivityException("Document storage is not reachable: " + properties.getStorage().getRoot());
        }
        log.info("Document storage reachable");

        if (!probeIndex()) {
            throw new ConnectivityException("Vector index is not reachable");
        }
        log.info("Vector index reachable");

        int configured = properties.getIndex().getDimensions();
        int dimension = configured > 0 ? configured : embeddingBackend.dimensions();
        vectorIndex.ensureCollection(dimension, properties.getIndex().getMetric());
        log.info("Collection '{}' ready (dimension={}, metric={})",
                properties.getIndex().getCollection(), dimension, properties.getIndex().getMetric());

        if (probeGeneration()) {
            log.info("Generation backend reachable");
        } else {
            log.warn("Generation backend is not reachable; answers will fall back until it recovers");
        }
    }

    private boolean probeIndex() {
        try {
            return vectorIndex.probe();
        } catch (RuntimeException e) {
            throw new ConnectivityException("Vector index is not reachable: " + e.getMessage(), e);
        }
    }

    private boolean probeGeneration() {
        try {
            return generationBackend.probe();
        } catch (RuntimeException e) {
            log.warn("Generation backend probe failed: {}", e.getMessage());
            return false;
        }
    }
}
