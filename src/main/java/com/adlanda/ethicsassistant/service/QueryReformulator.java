package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rewrites a user question into a form better suited to vector search.
 *
 * Never fails: on a backend error or a blank result the original query is used.
 */
@Service
public class QueryReformulator {

    private static final Logger log = LoggerFactory.getLogger(QueryReformulator.class);

    private final GenerationBackend generationBackend;
    private final int maxTokens;
    private final double temperature;

    public QueryReformulator(GenerationBackend generationBackend, AssistantProperties properties) {
        this.generationBackend = generationBackend;
        this.maxTokens = properties.getGeneration().getReformulationMaxTokens();
        this.temperature = properties.getGeneration().getReformulationTemperature();
    }

    public String reformulate(String userQuery) {
        String reformulated;
        try {
            reformulated = generationBackend.complete("", Prompts.reformulation(userQuery), maxTokens, temperature);
        } catch (RuntimeException e) {
            log.warn("Query reformulation failed: {}. Using original query.", e.getMessage());
            return userQuery;
        }

        if (reformulated == null || reformulated.isBlank()) {
            log.warn("Query reformulation returned empty result, using original query");
            return userQuery;
        }

        reformulated = reformulated.strip();
        log.info("Query reformulated: '{}' -> '{}'", userQuery, reformulated);
        return reformulated;
    }
}
