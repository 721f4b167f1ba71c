package com.adlanda.ethicsassistant.model;

/**
 * A complete answer together with the retrieval metadata from the same pass.
 */
public record AnswerResult(
        String answer,
        String query,
        String reformulatedQuery,
        int documentCount
) {}
