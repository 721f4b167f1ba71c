package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.ValidationException;
import com.adlanda.ethicsassistant.model.RetrievedChunk;
import com.adlanda.ethicsassistant.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Retrieves the chunks most similar to a query.
 *
 * 1. Embed the query
 * 2. Search the index in the collection's metric space
 * 3. Return hits ranked by similarity
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final EmbeddingBackend embeddingBackend;
    private final VectorIndex vectorIndex;
    private final int maxTopK;

    public RetrievalService(EmbeddingBackend embeddingBackend, VectorIndex vectorIndex, AssistantProperties properties) {
        this.embeddingBackend = embeddingBackend;
        this.vectorIndex = vectorIndex;
        this.maxTopK = properties.getRetrieval().getMaxTopK();
    }

    /**
     * @param query text to search for (normally the reformulated query)
     * @param topK  maximum number of hits, 1..max-top-k
     * @return at most topK hits, most similar first
     */
    public List<RetrievedChunk> retrieve(String query, int topK) {
        validateTopK(topK);
        long startTime = System.currentTimeMillis();

        float[] queryEmbedding = embeddingBackend.embedOne(query);

        List<RetrievedChunk> results = vectorIndex.search(queryEmbedding, topK).stream()
                .map(RetrievedChunk::from)
                .limit(topK)
                .toList();

        log.debug("Query '{}' returned {} results in {}ms",
                truncate(query, 50), results.size(), System.currentTimeMillis() - startTime);
        return results;
    }

    public void validateTopK(int topK) {
        if (topK < 1 || topK > maxTopK) {
            throw new ValidationException("top_k must be between 1 and " + maxTopK + ", got " + topK);
        }
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
