package com.adlanda.ethicsassistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Health of the answer pipeline's dependencies.
 *
 * Overall is healthy iff every dependency is healthy, degraded iff some are,
 * unhealthy iff none are.
 *
 * @param ragService  The pipeline itself (healthy whenever it can answer this call)
 * @param llmService  Generation backend
 * @param vectorStore Vector index
 * @param overall     Aggregated status
 * @param error       Set only when the aggregation itself failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthStatus(
        @JsonProperty("rag_service") ComponentStatus ragService,
        @JsonProperty("llm_service") ComponentStatus llmService,
        @JsonProperty("vector_store") ComponentStatus vectorStore,
        OverallStatus overall,
        String error
) {
    public static HealthStatus of(ComponentStatus llmService, ComponentStatus vectorStore) {
        return new HealthStatus(ComponentStatus.HEALTHY, llmService, vectorStore,
                aggregate(llmService, vectorStore), null);
    }

    public static HealthStatus failed(String error) {
        return new HealthStatus(ComponentStatus.UNHEALTHY, ComponentStatus.UNKNOWN,
                ComponentStatus.UNKNOWN, OverallStatus.UNHEALTHY, error);
    }

    /**
     * Combines dependency statuses. UNKNOWN counts as not healthy.
     */
    public static OverallStatus aggregate(ComponentStatus... dependencies) {
        long healthy = Arrays.stream(dependencies)
                .filter(s -> s == ComponentStatus.HEALTHY)
                .count();
        if (healthy == dependencies.length) {
            return OverallStatus.HEALTHY;
        }
        return healthy > 0 ? OverallStatus.DEGRADED : OverallStatus.UNHEALTHY;
    }
}
