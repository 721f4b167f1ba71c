package com.adlanda.ethicsassistant.repository;

import java.util.Map;

/**
 * A search hit: point ID, similarity score and stored payload.
 */
public record ScoredPoint(String id, double score, Map<String, Object> payload) {}
