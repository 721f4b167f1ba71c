package com.adlanda.ethicsassistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response from the non-streaming chat endpoint.
 *
 * @param answer            Generated answer (or the fallback apology)
 * @param query             Original query
 * @param reformulatedQuery Query after reformulation
 * @param numDocuments      Number of documents used for context
 * @param timestamp         When the response was produced
 */
public record ChatResponse(
        String answer,
        String query,
        @JsonProperty("reformulated_query") String reformulatedQuery,
        @JsonProperty("num_documents") int numDocuments,
        Instant timestamp
) {
    public static ChatResponse from(AnswerResult result) {
        return new ChatResponse(result.answer(), result.query(), result.reformulatedQuery(),
                result.documentCount(), Instant.now());
    }
}
