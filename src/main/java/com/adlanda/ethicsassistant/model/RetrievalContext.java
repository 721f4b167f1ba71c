package com.adlanda.ethicsassistant.model;

import java.util.List;

/**
 * Everything gathered for one query before generation. Built fresh per request.
 *
 * @param originalQuery     The user's question as asked
 * @param reformulatedQuery The query actually embedded and searched
 * @param documents         Retrieved chunks, most similar first
 * @param context           Formatted context block fed to the prompt
 */
public record RetrievalContext(
        String originalQuery,
        String reformulatedQuery,
        List<RetrievedChunk> documents,
        String context
) {
    public RetrievalContext {
        documents = List.copyOf(documents);
    }

    public int documentCount() {
        return documents.size();
    }
}
