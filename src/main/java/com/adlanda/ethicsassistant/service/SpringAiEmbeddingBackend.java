package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Embedding backend over Spring AI's EmbeddingModel.
 */
@Service
public class SpringAiEmbeddingBackend implements EmbeddingBackend {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingBackend.class);

    private final EmbeddingModel embeddingModel;

    private volatile int dimensions;

    public SpringAiEmbeddingBackend(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embedOne(String text) {
        try {
            return embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Failed to embed text: " + e.getMessage(), e);
        }
    }

    @Override
    public List<float[]> embedMany(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        log.info("Embedding batch of {} texts", texts.size());
        List<float[]> embeddings;
        try {
            embeddings = embeddingModel.embed(texts);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Failed to embed batch: " + e.getMessage(), e);
        }

        if (embeddings.size() != texts.size()) {
            throw new EmbeddingException("Embedding backend returned " + embeddings.size()
                    + " vectors for " + texts.size() + " texts");
        }
        log.info("Successfully embedded {} texts", texts.size());
        return embeddings;
    }

    @Override
    public int dimensions() {
        if (dimensions == 0) {
            try {
                dimensions = embeddingModel.dimensions();
            } catch (RuntimeException e) {
                throw new EmbeddingException("Failed to determine embedding dimension: " + e.getMessage(), e);
            }
            log.info("Embedding dimension: {}", dimensions);
        }
        return dimensions;
    }
}
